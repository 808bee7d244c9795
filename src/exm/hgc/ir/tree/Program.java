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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.lang.ChannelOps;
import exm.hgc.common.lang.ChannelStrictness;
import exm.hgc.common.lang.FlowControl;
import exm.hgc.common.lang.Types.Type;

/**
 * Top level of the IR: a package of channels and procs.
 */
public class Program {
  private final String name;

  private final List<Channel> channels = new ArrayList<Channel>();
  private final Map<Integer, Channel> channelsById =
                                      new HashMap<Integer, Channel>();
  private final Map<String, Channel> channelsByName =
                                      new HashMap<String, Channel>();

  private final List<Proc> procs = new ArrayList<Proc>();
  private final Map<String, Proc> procsByName = new HashMap<String, Proc>();

  private String topProc = null;

  public Program(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }

  public void addChannel(Channel channel) {
    if (channelsById.containsKey(channel.id())) {
      throw new HGCRuntimeError("Duplicate channel id " + channel.id());
    }
    if (channelsByName.containsKey(channel.name())) {
      throw new HGCRuntimeError("Duplicate channel name " + channel.name());
    }
    channels.add(channel);
    channelsById.put(channel.id(), channel);
    channelsByName.put(channel.name(), channel);
  }

  /**
   * Declare a new channel with a fresh id and a unique name derived
   * from the base name
   */
  public Channel createChannel(String baseName, Type payloadType,
          ChannelOps ops, FlowControl flowControl,
          ChannelStrictness strictness) {
    int id = 0;
    for (Channel c: channels) {
      id = Math.max(id, c.id() + 1);
    }
    Channel c = new Channel(uniqueChannelName(baseName), id, payloadType,
                            ops, flowControl, strictness, "");
    addChannel(c);
    return c;
  }

  public String uniqueChannelName(String base) {
    if (!channelsByName.containsKey(base)) {
      return base;
    }
    int suffix = 1;
    while (channelsByName.containsKey(base + "_" + suffix)) {
      suffix++;
    }
    return base + "_" + suffix;
  }

  public List<Channel> channels() {
    return Collections.unmodifiableList(channels);
  }

  /**
   * @return channel, or null if no channel with id
   */
  public Channel lookupChannel(int id) {
    return channelsById.get(id);
  }

  public Channel channel(int id) {
    Channel c = channelsById.get(id);
    if (c == null) {
      throw new HGCRuntimeError("No channel with id " + id);
    }
    return c;
  }

  public Channel channelByName(String channelName) {
    return channelsByName.get(channelName);
  }

  public void addProc(Proc proc) {
    if (procsByName.containsKey(proc.name())) {
      throw new HGCRuntimeError("Duplicate proc name " + proc.name());
    }
    procs.add(proc);
    procsByName.put(proc.name(), proc);
  }

  public String uniqueProcName(String base) {
    if (!procsByName.containsKey(base)) {
      return base;
    }
    int suffix = 1;
    while (procsByName.containsKey(base + "_" + suffix)) {
      suffix++;
    }
    return base + "_" + suffix;
  }

  public List<Proc> procs() {
    return Collections.unmodifiableList(procs);
  }

  /**
   * @return proc, or null if not present
   */
  public Proc proc(String procName) {
    return procsByName.get(procName);
  }

  public String topProc() {
    return topProc;
  }

  public void setTopProc(String topProc) {
    this.topProc = topProc;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }

  public void prettyPrint(StringBuilder out) {
    out.append("package ").append(name).append("\n\n");
    for (Channel c: channels) {
      c.prettyPrint(out);
      out.append("\n");
    }
    for (Proc p: procs) {
      out.append("\n");
      p.prettyPrint(out, p.name().equals(topProc));
    }
  }

  public void log(PrintStream irOutput, String codeTitle) {
    StringBuilder ir = new StringBuilder();
    irOutput.append("\n\n" + codeTitle + ": \n" +
        "============================================\n");
    prettyPrint(ir);
    irOutput.append(ir.toString());
    irOutput.flush();
  }
}
