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
package exm.hgc.ir.tree;

import exm.hgc.common.lang.ChannelOps;
import exm.hgc.common.lang.ChannelStrictness;
import exm.hgc.common.lang.FlowControl;
import exm.hgc.common.lang.Types.Type;

/**
 * A streaming channel declaration.  Channels are immutable: legalization
 * rewires operations onto new channels rather than altering existing ones.
 */
public class Channel {
  private final String name;
  private final int id;
  private final Type payloadType;
  private final ChannelOps ops;
  private final FlowControl flowControl;
  private final ChannelStrictness strictness;
  private final String metadata;

  public Channel(String name, int id, Type payloadType, ChannelOps ops,
                 FlowControl flowControl, ChannelStrictness strictness,
                 String metadata) {
    this.name = name;
    this.id = id;
    this.payloadType = payloadType;
    this.ops = ops;
    this.flowControl = flowControl;
    this.strictness = strictness;
    this.metadata = metadata == null ? "" : metadata;
  }

  public String name() {
    return name;
  }

  public int id() {
    return id;
  }

  public Type payloadType() {
    return payloadType;
  }

  public ChannelOps ops() {
    return ops;
  }

  public FlowControl flowControl() {
    return flowControl;
  }

  public ChannelStrictness strictness() {
    return strictness;
  }

  public String metadata() {
    return metadata;
  }

  public void prettyPrint(StringBuilder out) {
    out.append("chan ").append(name).append("(")
       .append(payloadType).append(", id=").append(id)
       .append(", kind=streaming, ops=").append(ops)
       .append(", flow_control=").append(flowControl)
       .append(", strictness=").append(strictness)
       .append(", metadata=\"\"\"").append(metadata).append("\"\"\")");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }
}
