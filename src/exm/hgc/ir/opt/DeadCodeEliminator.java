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

import java.util.List;

import org.apache.log4j.Logger;

import exm.hgc.common.Settings;
import exm.hgc.ir.opt.Pass.ProcPass;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;

/**
 * Remove nodes without side effects whose values are never used.
 */
public class DeadCodeEliminator extends ProcPass {

  @Override
  public String getPassName() {
    return "Dead code elimination";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_DEAD_CODE_ELIM;
  }

  @Override
  public boolean runOnProc(Logger logger, Program program, Proc proc,
                           PassOptions options) {
    return eliminate(logger, proc);
  }

  /**
   * Remove dead nodes until none are left
   * @return true if any were removed
   */
  public static boolean eliminate(Logger logger, Proc proc) {
    boolean changed = false;
    boolean removedAny;
    do {
      removedAny = false;
      // Reverse order so chains of dead nodes go in one sweep
      List<Node> nodes = proc.nodes();
      for (int i = nodes.size() - 1; i >= 0; i--) {
        Node n = nodes.get(i);
        if (!n.op().hasSideEffect() && !proc.hasUses(n.id())) {
          if (logger.isTraceEnabled()) {
            logger.trace("Removing dead node " + n.name() + " from " +
                         proc.name());
          }
          proc.removeNode(n.id());
          removedAny = true;
        }
      }
      changed |= removedAny;
    } while (removedAny);
    return changed;
  }
}
