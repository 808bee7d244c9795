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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Record of the pass invocations in a pipeline run
 */
public class PassResults {

  public static class Invocation {
    public final String passName;
    public final boolean changed;

    public Invocation(String passName, boolean changed) {
      this.passName = passName;
      this.changed = changed;
    }

    @Override
    public String toString() {
      return passName + (changed ? " (changed)" : " (unchanged)");
    }
  }

  private final List<Invocation> invocations = new ArrayList<Invocation>();

  public void recordInvocation(String passName, boolean changed) {
    invocations.add(new Invocation(passName, changed));
  }

  public List<Invocation> invocations() {
    return Collections.unmodifiableList(invocations);
  }

  public int invocationCount() {
    return invocations.size();
  }

  /**
   * @return true if any invocation of the named pass changed the program
   */
  public boolean changedBy(String passName) {
    for (Invocation i: invocations) {
      if (i.passName.equals(passName) && i.changed) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return invocations.toString();
  }
}
