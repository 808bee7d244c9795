/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.hgc.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.hgc.common.exceptions.HGCFatal;
import exm.hgc.common.exceptions.InvalidSyntaxException;
import exm.hgc.common.exceptions.UserException;
import exm.hgc.common.util.Misc;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.opt.PassOptions;
import exm.hgc.ir.opt.PassResults;
import exm.hgc.ir.opt.StandardPipeline;
import exm.hgc.ir.tree.Program;

public class HGCompiler {

  private final Logger logger;

  public HGCompiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Read IR from the input file, run the pass pipeline over it and write
   * the resulting IR to the output file.
   *
   * @param irOutput where to log IR between passes, or null
   * @throws HGCFatal with the exit code if compilation fails
   */
  public void compile(File inputFile, File outputFile, PrintStream irOutput) {
    try {
      logger.info("HGC starting: " + Misc.timestamp());

      String text = readInput(inputFile);
      Program program = IRParser.parse(inputFile.getPath(), text);
      PassResults results = new PassResults();
      boolean changed = StandardPipeline.run(logger, irOutput, program,
                                    PassOptions.fromSettings(), results);
      logger.debug("Pass results: " + results + " changed: " + changed);
      writeOutput(outputFile, program.toString());

      if (irOutput != null) {
        irOutput.close();
      }
      logger.debug("HGC done: " + Misc.timestamp());
    }
    catch (HGCFatal e) {
      // Rethrow
      throw e;
    }
    catch (InvalidSyntaxException e) {
      System.err.println("hgc syntax error:");
      System.err.println(e.getMessage());
      throw new HGCFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      System.err.println("hgc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new HGCFatal(ExitCode.ERROR_USER.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new HGCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private String readInput(File inputFile) {
    try {
      return FileUtils.readFileToString(inputFile, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("I/O error while reading " + inputFile);
      System.err.println(e.getMessage());
      throw new HGCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private void writeOutput(File outputFile, String text) {
    try {
      FileUtils.writeStringToFile(outputFile, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("I/O error while writing to output");
      System.err.println(e.getMessage());
      throw new HGCFatal(ExitCode.ERROR_IO.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("HGC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
