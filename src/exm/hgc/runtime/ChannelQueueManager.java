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
package exm.hgc.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.ir.tree.Channel;
import exm.hgc.ir.tree.Program;

/**
 * One queue per channel declared in a program
 */
public class ChannelQueueManager {
  private final List<ChannelQueue> queues = new ArrayList<ChannelQueue>();
  private final Map<Integer, ChannelQueue> byId =
                                    new HashMap<Integer, ChannelQueue>();
  private final Map<String, ChannelQueue> byName =
                                    new HashMap<String, ChannelQueue>();

  public ChannelQueueManager(Program program) {
    for (Channel c: program.channels()) {
      ChannelQueue q = new ChannelQueue(c);
      queues.add(q);
      byId.put(c.id(), q);
      byName.put(c.name(), q);
    }
  }

  public ChannelQueue getQueueByName(String name) {
    ChannelQueue q = byName.get(name);
    if (q == null) {
      throw new HGCRuntimeError("No channel named " + name);
    }
    return q;
  }

  public ChannelQueue getQueue(int channelId) {
    ChannelQueue q = byId.get(channelId);
    if (q == null) {
      throw new HGCRuntimeError("No channel with id " + channelId);
    }
    return q;
  }

  public List<ChannelQueue> queues() {
    return Collections.unmodifiableList(queues);
  }
}
