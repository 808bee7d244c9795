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
import exm.hgc.ir.tree.Opcode;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;

/**
 * Simplify tuple construction and deconstruction:
 * <ul>
 * <li>tuple_index(tuple(a, b, ...), i) is replaced by the ith element</li>
 * <li>tuple(tuple_index(x, 0), ..., tuple_index(x, n-1)) is replaced by x
 *     where x has n elements</li>
 * </ul>
 * The nodes that are bypassed are left for dead code elimination.
 */
public class TupleSimplification extends ProcPass {

  @Override
  public String getPassName() {
    return "Tuple simplification";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_TUPLE_SIMP;
  }

  @Override
  public boolean runOnProc(Logger logger, Program program, Proc proc,
                           PassOptions options) {
    boolean changed = false;
    for (Node n: proc.nodes()) {
      if (!proc.hasUses(n.id())) {
        continue;
      }
      Integer replacement = null;
      if (n.op() == Opcode.TUPLE_INDEX) {
        Node tuple = proc.node(n.operand(0));
        if (tuple.op() == Opcode.TUPLE) {
          replacement = tuple.operand(n.index());
        }
      } else if (n.op() == Opcode.TUPLE) {
        replacement = reassembledTuple(proc, n);
      }

      if (replacement != null) {
        logger.trace("Replacing " + n.name() + " with " +
                     proc.node(replacement).name() + " in " + proc.name());
        changed |= proc.replaceAllUses(n.id(), replacement);
      }
    }
    return changed;
  }

  /**
   * @return handle of x if node is tuple(tuple_index(x, 0), ...), else null
   */
  private static Integer reassembledTuple(Proc proc, Node tuple) {
    List<Integer> elems = tuple.operands();
    if (elems.isEmpty()) {
      return null;
    }
    Integer source = null;
    for (int i = 0; i < elems.size(); i++) {
      Node elem = proc.node(elems.get(i));
      if (elem.op() != Opcode.TUPLE_INDEX || elem.index() != i) {
        return null;
      }
      if (source == null) {
        source = elem.operand(0);
      } else if (source != elem.operand(0)) {
        return null;
      }
    }
    if (!proc.node(source).type().equals(tuple.type())) {
      return null;
    }
    return source;
  }
}
