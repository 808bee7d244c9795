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
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.hgc.common.Logging;
import exm.hgc.common.lang.Value;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Proc;

/**
 * Executes activations of a single proc.  An activation may be suspended
 * on a receive from an empty channel and resumed later from the same node.
 */
public class ProcInterpreter {

  public static enum RunStatus {
    /** Activation finished and state was updated */
    COMPLETED,
    /** Executed some nodes, then blocked */
    BLOCKED_AFTER_PROGRESS,
    /** Blocked without executing anything */
    BLOCKED_NO_PROGRESS,
  }

  private static final Logger logger = Logging.getHGCLogger();

  private final Proc proc;
  private final ChannelQueueManager queues;
  private final List<Node> nodes;

  private List<Value> state;
  private long activations = 0;

  /** Values computed so far in current activation */
  private final Map<Integer, Value> values = new HashMap<Integer, Value>();

  /** Index of the next node to execute */
  private int pc = 0;

  /** Queue the current activation is waiting on, if any */
  private ChannelQueue blockedOn = null;

  public ProcInterpreter(Proc proc, ChannelQueueManager queues) {
    this.proc = proc;
    this.queues = queues;
    this.nodes = proc.nodes();
    this.state = new ArrayList<Value>(proc.initValues());
  }

  public Proc proc() {
    return proc;
  }

  public long activations() {
    return activations;
  }

  public List<Value> state() {
    return state;
  }

  /**
   * @return queue that the proc is blocked on, or null if not blocked
   */
  public ChannelQueue blockedOn() {
    return blockedOn;
  }

  /**
   * Run from where the last run left off until the activation completes
   * or a receive blocks
   * @throws AssertionFailureException if an assert fails
   */
  public RunStatus run() throws AssertionFailureException {
    boolean progressed = false;
    while (pc < nodes.size()) {
      Node n = nodes.get(pc);
      Value result = execute(n);
      if (result == null) {
        return progressed ? RunStatus.BLOCKED_AFTER_PROGRESS
                          : RunStatus.BLOCKED_NO_PROGRESS;
      }
      values.put(n.id(), result);
      pc++;
      progressed = true;
    }
    finishActivation();
    return RunStatus.COMPLETED;
  }

  /**
   * @return value of node, or null if blocked
   */
  private Value execute(Node n) throws AssertionFailureException {
    switch (n.op()) {
      case PARAM:
        return n.index() == 0 ? Value.token() : state.get(n.index() - 1);
      case RECEIVE:
        return receive(n);
      case SEND:
        if (predicateTrue(n)) {
          queues.getQueue(n.channelId()).write(value(n.dataOperand()));
        }
        return Value.token();
      case ASSERT:
        if (!value(n.condition()).isTrue()) {
          throw new AssertionFailureException(proc.name(), n.label(),
                                              n.message());
        }
        return Value.token();
      default: {
        List<Value> args = new ArrayList<Value>(n.operandCount());
        for (int operand: n.operands()) {
          args.add(value(operand));
        }
        return NodeEvaluator.evaluate(n, args);
      }
    }
  }

  private Value receive(Node n) {
    ChannelQueue q = queues.getQueue(n.channelId());
    Value data;
    if (!predicateTrue(n)) {
      data = Value.zero(q.channel().payloadType());
    } else if (q.isEmpty()) {
      blockedOn = q;
      return null;
    } else {
      data = q.read();
    }
    blockedOn = null;
    return Value.tuple(Arrays.asList(Value.token(), data));
  }

  private boolean predicateTrue(Node n) {
    Integer pred = n.predicate();
    return pred == null || value(pred).isTrue();
  }

  private Value value(int handle) {
    return values.get(handle);
  }

  private void finishActivation() {
    List<Value> next = new ArrayList<Value>(state.size());
    for (int h: proc.nextState()) {
      next.add(value(h));
    }
    state = next;
    values.clear();
    pc = 0;
    activations++;
    if (logger.isTraceEnabled()) {
      logger.trace("Proc " + proc.name() + " completed activation " +
                   activations + ", state: " + state);
    }
  }
}
