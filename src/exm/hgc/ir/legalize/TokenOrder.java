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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.hgc.ir.tree.Proc;

/**
 * Token order across a program.  Operations in different procs are never
 * ordered.  Per-proc analyses are computed on first use.
 */
public class TokenOrder {
  private final Map<Proc, TokenDependencyAnalysis> analyses =
                              new HashMap<Proc, TokenDependencyAnalysis>();

  public TokenDependencyAnalysis analysis(Proc proc) {
    TokenDependencyAnalysis a = analyses.get(proc);
    if (a == null) {
      a = new TokenDependencyAnalysis(proc);
      analyses.put(proc, a);
    }
    return a;
  }

  /**
   * Forget the analysis of a proc whose token edges were rewritten
   */
  public void invalidate(Proc proc) {
    analyses.remove(proc);
  }

  public boolean happensBefore(ChannelOpRef a, ChannelOpRef b) {
    if (a.proc() != b.proc()) {
      return false;
    }
    return analysis(a.proc()).happensBefore(a.handle(), b.handle());
  }

  public boolean ordered(ChannelOpRef a, ChannelOpRef b) {
    return happensBefore(a, b) || happensBefore(b, a);
  }

  /**
   * @return true if all operations are in one proc and every pair is
   *         ordered by tokens
   */
  public boolean isTotallyOrdered(List<ChannelOpRef> ops) {
    if (ops.isEmpty()) {
      return true;
    }
    Proc proc = ops.get(0).proc();
    List<Integer> handles = new ArrayList<Integer>(ops.size());
    for (ChannelOpRef op: ops) {
      if (op.proc() != proc) {
        return false;
      }
      handles.add(op.handle());
    }
    return analysis(proc).isTotallyOrdered(handles);
  }
}
