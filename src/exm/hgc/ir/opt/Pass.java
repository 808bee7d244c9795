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

import org.apache.log4j.Logger;

import exm.hgc.common.exceptions.UserException;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;

public interface Pass {
  /**
   * @return short name used in logs and pass results
   */
  public abstract String getPassName();

  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public abstract String getConfigEnabledKey();

  /**
   * Run pass over program, modifying it in place
   * @return true if the program was changed
   * @throws UserException if the program cannot be transformed as declared
   */
  public abstract boolean run(Logger logger, Program program,
          PassOptions options, PassResults results) throws UserException;

  public static abstract class ProcPass implements Pass {

    @Override
    public boolean run(Logger logger, Program program, PassOptions options,
                       PassResults results) throws UserException {
      boolean changed = false;
      for (Proc p: program.procs()) {
        changed |= runOnProc(logger, program, p, options);
      }
      return changed;
    }

    public abstract boolean runOnProc(Logger logger, Program program,
            Proc proc, PassOptions options) throws UserException;
  }
}
