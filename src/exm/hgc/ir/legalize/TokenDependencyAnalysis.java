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
package exm.hgc.ir.legalize;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Proc;

/**
 * Partial order of the side-effecting operations of a proc, as implied
 * by token threading.
 *
 * Operation a happens before b if a token produced by a reaches b through
 * a chain of operand edges whose values carry a token: token values,
 * tuples containing a token, and so through tuple_index and after_all.
 * Data operands do not order operations.
 */
public class TokenDependencyAnalysis {
  private final Proc proc;

  /** Token ancestors of each live node */
  private final Map<Integer, Set<Integer>> ancestors =
                                    new HashMap<Integer, Set<Integer>>();

  public TokenDependencyAnalysis(Proc proc) {
    this.proc = proc;
    // Nodes are in topological order so operands are always done first
    for (Node n: proc.nodes()) {
      Set<Integer> anc = new HashSet<Integer>();
      for (int operand: n.operands()) {
        if (proc.node(operand).type().containsToken()) {
          anc.add(operand);
          anc.addAll(ancestors.get(operand));
        }
      }
      ancestors.put(n.id(), anc);
    }
  }

  public Proc proc() {
    return proc;
  }

  /**
   * @return nodes whose token flows into the node
   */
  public Set<Integer> tokenAncestors(int handle) {
    Set<Integer> anc = ancestors.get(handle);
    return anc == null ? Collections.<Integer>emptySet()
                       : Collections.unmodifiableSet(anc);
  }

  public boolean happensBefore(int a, int b) {
    return tokenAncestors(b).contains(a);
  }

  public boolean ordered(int a, int b) {
    return happensBefore(a, b) || happensBefore(b, a);
  }

  /**
   * @return true if every pair of the nodes is ordered
   */
  public boolean isTotallyOrdered(List<Integer> handles) {
    for (int i = 0; i < handles.size(); i++) {
      for (int j = i + 1; j < handles.size(); j++) {
        if (!ordered(handles.get(i), handles.get(j))) {
          return false;
        }
      }
    }
    return true;
  }
}
