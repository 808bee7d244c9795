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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.hgc.common.Settings;
import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.exceptions.InvalidOptionException;
import exm.hgc.common.exceptions.UserException;
import exm.hgc.ir.tree.Program;

/**
 * An explicit ordered list of passes
 */
public class PassPipeline {

  public PassPipeline(PrintStream irOutput) {
    this.irOutput = irOutput;
  }

  private final List<Pass> passes = new ArrayList<Pass>();
  private final PrintStream irOutput;

  public void addPass(Pass pass) {
    passes.add(pass);
  }

  public List<Pass> passes() {
    return Collections.unmodifiableList(passes);
  }

  /**
   * Run passes in order.  The first error aborts the pipeline.
   * @return true if any pass changed the program
   */
  public boolean runPipeline(Logger logger, Program program,
      PassOptions options, PassResults results) throws UserException {
    boolean changed = false;
    for (Pass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        boolean passChanged = pass.run(logger, program, options, results);
        results.recordInvocation(pass.getPassName(), passChanged);
        changed |= passChanged;
        if (irOutput != null) {
          program.log(irOutput, "IR after " + pass.getPassName());
        }
      } else {
        logger.debug("Pass disabled: " + pass.getPassName());
      }
    }
    return changed;
  }

  public boolean passEnabled(Pass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new HGCRuntimeError("Expected config key " +
                    pass.getConfigEnabledKey() + " to exist");
    }
  }
}
