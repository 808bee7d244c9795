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

import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Proc;

/**
 * A send or receive node, identified by its proc and stable handle
 */
public class ChannelOpRef {
  private final Proc proc;
  private final int handle;

  public ChannelOpRef(Proc proc, int handle) {
    this.proc = proc;
    this.handle = handle;
  }

  public Proc proc() {
    return proc;
  }

  public int handle() {
    return handle;
  }

  public Node node() {
    return proc.node(handle);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(proc) + handle;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ChannelOpRef)) {
      return false;
    }
    ChannelOpRef other = (ChannelOpRef) obj;
    return proc == other.proc && handle == other.handle;
  }

  @Override
  public String toString() {
    return node().name() + " in " + proc.name();
  }
}
