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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.hgc.ir.tree.Channel;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;

/**
 * All operations on one side of one channel, in reference order:
 * procs in program declaration order, then node order within each proc.
 */
public class ChannelOpGroup {
  private final Channel channel;
  private final ChannelSide side;
  private final List<ChannelOpRef> ops;

  public ChannelOpGroup(Channel channel, ChannelSide side,
                        List<ChannelOpRef> ops) {
    this.channel = channel;
    this.side = side;
    this.ops = Collections.unmodifiableList(new ArrayList<ChannelOpRef>(ops));
  }

  /**
   * Collect the channel sides that have more than one operation.
   * Channels are visited in declaration order, send side before receive.
   */
  public static List<ChannelOpGroup> collectMultiOpSides(Program program) {
    ListMultimap<Integer, ChannelOpRef> sends = ArrayListMultimap.create();
    ListMultimap<Integer, ChannelOpRef> receives = ArrayListMultimap.create();
    for (Proc p: program.procs()) {
      for (Node n: p.nodes()) {
        if (n.op() == ChannelSide.SEND.opcode()) {
          sends.put(n.channelId(), new ChannelOpRef(p, n.id()));
        } else if (n.op() == ChannelSide.RECEIVE.opcode()) {
          receives.put(n.channelId(), new ChannelOpRef(p, n.id()));
        }
      }
    }

    List<ChannelOpGroup> groups = new ArrayList<ChannelOpGroup>();
    for (Channel c: program.channels()) {
      List<ChannelOpRef> s = sends.get(c.id());
      if (s.size() > 1) {
        groups.add(new ChannelOpGroup(c, ChannelSide.SEND, s));
      }
      List<ChannelOpRef> r = receives.get(c.id());
      if (r.size() > 1) {
        groups.add(new ChannelOpGroup(c, ChannelSide.RECEIVE, r));
      }
    }
    return groups;
  }

  public Channel channel() {
    return channel;
  }

  public ChannelSide side() {
    return side;
  }

  public List<ChannelOpRef> ops() {
    return ops;
  }

  public int size() {
    return ops.size();
  }

  public ChannelOpRef op(int i) {
    return ops.get(i);
  }

  public Set<Proc> procs() {
    Set<Proc> result = new LinkedHashSet<Proc>();
    for (ChannelOpRef op: ops) {
      result.add(op.proc());
    }
    return result;
  }

  public boolean isSingleProc() {
    return procs().size() == 1;
  }

  /**
   * @return e.g. "channel in receive side [recv0 in p, recv1 in p]"
   */
  public String describe() {
    return "channel " + channel.name() + " " + side + " side " + ops;
  }

  @Override
  public String toString() {
    return describe();
  }
}
