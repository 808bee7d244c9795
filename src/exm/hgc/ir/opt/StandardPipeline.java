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
package exm.hgc.ir.opt;

import java.io.PrintStream;

import org.apache.log4j.Logger;

import exm.hgc.common.Settings;
import exm.hgc.common.exceptions.UserException;
import exm.hgc.ir.legalize.ChannelLegalizationPass;
import exm.hgc.ir.tree.Program;

/**
 * Builds and runs the standard pass pipelines
 */
public class StandardPipeline {

  /**
   * Run the pipeline selected by settings over the program, in place
   * @param irOutput where to log IR between passes.  Null for no output
   * @return true if the program changed
   */
  public static boolean run(Logger logger, PrintStream irOutput,
      Program program, PassOptions options, PassResults results)
          throws UserException {
    boolean legalizeOnly = Settings.getBooleanUnchecked(Settings.LEGALIZE_ONLY);
    boolean debug = Settings.getBooleanUnchecked(Settings.COMPILER_DEBUG);
    PassPipeline pipeline = legalizeOnly ?
            legalizationPipeline(irOutput, options.inlineProcs()) :
            optimizingPipeline(irOutput, debug, options.inlineProcs());

    if (irOutput != null) {
      program.log(irOutput, "Initial IR");
    }
    boolean changed = pipeline.runPipeline(logger, program, options,
                                           results);
    if (irOutput != null) {
      program.log(irOutput, "Final IR");
    }
    return changed;
  }

  /**
   * Channel legalization alone, followed by validation
   * @param inlineProcs if true, the final validation also checks
   *                    readiness for code generation
   */
  public static PassPipeline legalizationPipeline(PrintStream irOutput,
                                                  boolean inlineProcs) {
    PassPipeline pipe = new PassPipeline(irOutput);
    pipe.addPass(new ChannelLegalizationPass());
    pipe.addPass(finalValidator(inlineProcs));
    return pipe;
  }

  /**
   * Simplification, legalization, then cleanup of what legalization
   * left behind
   */
  public static PassPipeline optimizingPipeline(PrintStream irOutput,
                                        boolean debug, boolean inlineProcs) {
    PassPipeline pipe = new PassPipeline(irOutput);
    pipe.addPass(new TupleSimplification());
    pipe.addPass(new DeadCodeEliminator());
    if (debug)
      pipe.addPass(Validate.standardValidator());

    pipe.addPass(new ChannelLegalizationPass());
    if (debug)
      pipe.addPass(Validate.standardValidator());

    pipe.addPass(new DeadCodeEliminator());
    pipe.addPass(finalValidator(inlineProcs));
    return pipe;
  }

  private static Validate finalValidator(boolean inlineProcs) {
    return inlineProcs ? Validate.codegenValidator()
                       : Validate.standardValidator();
  }
}
