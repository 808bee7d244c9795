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

import java.util.ArrayDeque;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.lang.Value;
import exm.hgc.ir.tree.Channel;

/**
 * Unbounded FIFO of values in flight on a channel
 */
public class ChannelQueue {
  private final Channel channel;
  private final ArrayDeque<Value> values = new ArrayDeque<Value>();

  /** Total values ever written */
  private long writeCount = 0;

  public ChannelQueue(Channel channel) {
    this.channel = channel;
  }

  public Channel channel() {
    return channel;
  }

  public String name() {
    return channel.name();
  }

  public void write(Value value) {
    if (!value.type().equals(channel.payloadType())) {
      throw new HGCRuntimeError("Cannot write " + value + " to channel " +
                  channel.name() + " of type " + channel.payloadType());
    }
    values.addLast(value);
    writeCount++;
  }

  /**
   * @return the oldest value, or null if queue is empty
   */
  public Value read() {
    return values.pollFirst();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int getSize() {
    return values.size();
  }

  public long writeCount() {
    return writeCount;
  }

  @Override
  public String toString() {
    return channel.name() + values;
  }
}
