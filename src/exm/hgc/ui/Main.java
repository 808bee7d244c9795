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
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.hgc.common.Logging;
import exm.hgc.common.Settings;
import exm.hgc.common.exceptions.HGCFatal;
import exm.hgc.common.exceptions.InvalidOptionException;

public class Main {
  private static final String INLINE_PROCS_FLAG = "i";
  private static final String LEGALIZE_ONLY_FLAG = "l";
  private static final String IR_OUTPUT_FLAG = "C";

  public static void main(String[] args) {

    Args hgcArgs = processArgs(args);

    try {
      Settings.initHGCProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    recordArgValues(hgcArgs);

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File inputFile = new File(hgcArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.out.println("Input file \"" + inputFile + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }
    PrintStream irOutput = setupIROutput();
    File outputFile = selectOutputFile(hgcArgs);

    try {
      HGCompiler hgc = new HGCompiler(logger);
      hgc.compile(inputFile, outputFile, irOutput);
    } catch (HGCFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(INLINE_PROCS_FLAG, "inline-procs", false,
        "Check that output is ready for proc inlining and code generation");
    opts.addOption(LEGALIZE_ONLY_FLAG, "legalize-only", false,
        "Only run channel legalization");
    opts.addOption(IR_OUTPUT_FLAG, "ir-output", true,
        "Log IR between passes to file");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.out.println("Expected input file and optional output file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    return new Args(input, output, cmd.hasOption(INLINE_PROCS_FLAG),
                    cmd.hasOption(LEGALIZE_ONLY_FLAG),
                    cmd.getOptionValue(IR_OUTPUT_FLAG));
  }

  /**
   * Command line flags override settings from system properties
   */
  private static void recordArgValues(Args args) {
    if (args.inlineProcs) {
      Settings.set(Settings.INLINE_PROCS, "true");
    }
    if (args.legalizeOnly) {
      Settings.set(Settings.LEGALIZE_ONLY, "true");
    }
    if (args.irOutputFilename != null) {
      Settings.set(Settings.IR_OUTPUT_FILE, args.irOutputFilename);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("hgc", opts, true);
    System.out.println("requires arguments: <input> [<output>]");
  }

  private static File selectOutputFile(Args args) {
    if (args.outputFilename != null) {
      return new File(args.outputFilename);
    }
    String prefix = FilenameUtils.removeExtension(args.inputFilename);
    return new File(prefix + ".legal.ir");
  }

  private static PrintStream setupIROutput() {
    String irFileName = Settings.get(Settings.IR_OUTPUT_FILE);
    if (irFileName == null || irFileName.length() == 0) {
      return null;
    }
    try {
      return new PrintStream(new FileOutputStream(irFileName));
    } catch (FileNotFoundException e) {
      System.out.println("Error opening IR output file " + irFileName
                          + ": " + e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean inlineProcs;
    public final boolean legalizeOnly;
    public final String irOutputFilename;

    public Args(String inputFilename, String outputFilename,
                boolean inlineProcs, boolean legalizeOnly,
                String irOutputFilename) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.inlineProcs = inlineProcs;
      this.legalizeOnly = legalizeOnly;
      this.irOutputFilename = irOutputFilename;
    }
  }
}
