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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.lang.Value;

/**
 * A proc: a process that repeatedly activates, threading a token and
 * its state through one pass over its nodes per activation.
 *
 * Nodes live in an arena indexed by stable handles.  A separate list
 * holds the live nodes in topological order; parameters always come
 * first in that list.
 */
public class Proc {
  private final String name;

  /** Arena: index is node handle, null if node was removed */
  private final ArrayList<Node> arena = new ArrayList<Node>();

  /** Live node handles in topological order */
  private final ArrayList<Integer> order = new ArrayList<Integer>();

  private final Map<String, Integer> byName = new HashMap<String, Integer>();

  private int tokenParam = -1;
  private final List<Integer> stateParams = new ArrayList<Integer>();
  private final List<Value> initValues = new ArrayList<Value>();

  private int nextToken = -1;
  private final List<Integer> nextState = new ArrayList<Integer>();

  /** True if created by the compiler rather than read from input */
  private final boolean synthetic;

  public Proc(String name) {
    this(name, false);
  }

  public Proc(String name, boolean synthetic) {
    this.name = name;
    this.synthetic = synthetic;
  }

  public String name() {
    return name;
  }

  public boolean isSynthetic() {
    return synthetic;
  }

  public Node node(int handle) {
    Node n = handle >= 0 && handle < arena.size() ? arena.get(handle) : null;
    if (n == null) {
      throw new HGCRuntimeError("No live node with handle " + handle
                                + " in proc " + name);
    }
    return n;
  }

  public boolean isLive(int handle) {
    return handle >= 0 && handle < arena.size() && arena.get(handle) != null;
  }

  /**
   * @return node with name, or null if not present
   */
  public Node nodeByName(String nodeName) {
    Integer h = byName.get(nodeName);
    return h == null ? null : arena.get(h);
  }

  /**
   * @return live nodes in topological order
   */
  public List<Node> nodes() {
    List<Node> result = new ArrayList<Node>(order.size());
    for (int h: order) {
      result.add(arena.get(h));
    }
    return result;
  }

  public int nodeCount() {
    return order.size();
  }

  /**
   * @return position of node in topological order
   */
  public int position(int handle) {
    int pos = order.indexOf(handle);
    if (pos < 0) {
      throw new HGCRuntimeError("Node " + handle + " not live in " + name);
    }
    return pos;
  }

  /**
   * Send, receive and assert nodes in node order
   */
  public List<Node> effectNodes() {
    List<Node> result = new ArrayList<Node>();
    for (Node n: nodes()) {
      if (n.op().isChannelOp() || n.op() == Opcode.ASSERT) {
        result.add(n);
      }
    }
    return result;
  }

  public String uniqueNodeName(String base) {
    if (!byName.containsKey(base)) {
      return base;
    }
    int suffix = 1;
    while (byName.containsKey(base + "_" + suffix)) {
      suffix++;
    }
    return base + "_" + suffix;
  }

  /**
   * Assign a handle to a detached node and insert it into the order.
   * @param before handle of node to insert before, or null to append
   */
  void place(Node node, Integer before) {
    if (node.id() >= 0) {
      throw new HGCRuntimeError("Node already placed: " + node);
    }
    int handle = arena.size();
    node.setId(handle);
    if (node.name() == null) {
      node.setName(uniqueNodeName(node.op().irName() + "." + handle));
    } else if (byName.containsKey(node.name())) {
      throw new HGCRuntimeError("Duplicate node name " + node.name()
                                + " in proc " + name);
    }
    arena.add(node);
    byName.put(node.name(), handle);
    if (before == null) {
      order.add(handle);
    } else {
      order.add(position(before), handle);
    }
  }

  /**
   * Place a parameter node after existing parameters
   */
  void placeParam(Node param, Value init) {
    int insertPos = (tokenParam >= 0 ? 1 : 0) + stateParams.size();
    Integer before = insertPos < order.size() ? order.get(insertPos) : null;
    place(param, before);
    if (init == null) {
      if (tokenParam >= 0) {
        throw new HGCRuntimeError("Proc " + name + " already has a token "
                                  + "parameter");
      }
      tokenParam = param.id();
    } else {
      stateParams.add(param.id());
      initValues.add(init);
    }
  }

  /**
   * @return live nodes that use the handle as an operand
   */
  public List<Node> users(int handle) {
    List<Node> result = new ArrayList<Node>();
    for (Node n: nodes()) {
      if (n.operands().contains(handle)) {
        result.add(n);
      }
    }
    return result;
  }

  /**
   * @return true if the node is the next-state token or a next-state value
   */
  public boolean isNextOperand(int handle) {
    return nextToken == handle || nextState.contains(handle);
  }

  public boolean hasUses(int handle) {
    return isNextOperand(handle) || !users(handle).isEmpty();
  }

  /**
   * Redirect all uses, including next-state uses, to another node
   * @return true if anything was changed
   */
  public boolean replaceAllUses(int oldHandle, int newHandle) {
    boolean changed = false;
    for (Node n: nodes()) {
      changed |= n.replaceOperand(oldHandle, newHandle);
    }
    if (nextToken == oldHandle) {
      nextToken = newHandle;
      changed = true;
    }
    for (int i = 0; i < nextState.size(); i++) {
      if (nextState.get(i) == oldHandle) {
        nextState.set(i, newHandle);
        changed = true;
      }
    }
    return changed;
  }

  /**
   * Replace a single operand slot of a node
   */
  public void setOperand(int user, int operandIndex, int newHandle) {
    Node n = node(user);
    if (position(newHandle) >= position(user)) {
      throw new HGCRuntimeError("Operand " + node(newHandle).name() +
                      " does not precede user " + n.name());
    }
    n.setOperand(operandIndex, newHandle);
  }

  /**
   * Remove a node with no remaining uses
   */
  public void removeNode(int handle) {
    Node n = node(handle);
    if (n.op() == Opcode.PARAM) {
      throw new HGCRuntimeError("Cannot remove parameter " + n.name());
    }
    if (hasUses(handle)) {
      throw new HGCRuntimeError("Cannot remove node " + n.name()
                                + " with uses");
    }
    order.remove(Integer.valueOf(handle));
    byName.remove(n.name());
    arena.set(handle, null);
  }

  public int tokenParam() {
    return tokenParam;
  }

  public List<Integer> stateParams() {
    return Collections.unmodifiableList(stateParams);
  }

  public List<Value> initValues() {
    return Collections.unmodifiableList(initValues);
  }

  public int nextToken() {
    return nextToken;
  }

  public List<Integer> nextState() {
    return Collections.unmodifiableList(nextState);
  }

  public void setNext(int token, List<Integer> state) {
    this.nextToken = token;
    this.nextState.clear();
    this.nextState.addAll(state);
  }

  public void setNextToken(int token) {
    this.nextToken = token;
  }

  public void prettyPrint(StringBuilder out, boolean top) {
    if (top) {
      out.append("top ");
    }
    out.append("proc ").append(name).append("(");
    boolean first = true;
    if (tokenParam >= 0) {
      Node tp = node(tokenParam);
      out.append(tp.name()).append(": ").append(tp.type());
      first = false;
    }
    for (int sp: stateParams) {
      if (!first) {
        out.append(", ");
      }
      Node p = node(sp);
      out.append(p.name()).append(": ").append(p.type());
      first = false;
    }
    if (!first) {
      out.append(", ");
    }
    out.append("init={");
    for (int i = 0; i < initValues.size(); i++) {
      if (i > 0) {
        out.append(", ");
      }
      out.append(initValues.get(i).text());
    }
    out.append("}) {\n");

    for (Node n: nodes()) {
      if (n.op() != Opcode.PARAM) {
        out.append("  ");
        printNode(out, n);
        out.append("\n");
      }
    }

    out.append("  next(");
    out.append(nextToken >= 0 ? node(nextToken).name() : "<undefined>");
    for (int s: nextState) {
      out.append(", ").append(node(s).name());
    }
    out.append(")\n}\n");
  }

  private void printNode(StringBuilder out, Node n) {
    out.append(n.name()).append(": ").append(n.type()).append(" = ")
       .append(n.op().irName()).append("(");
    List<String> args = new ArrayList<String>();
    switch (n.op()) {
      case LITERAL:
        args.add("value=" + n.literal().text());
        break;
      case TUPLE_INDEX:
        args.add(operandName(n, 0));
        args.add("index=" + n.index());
        break;
      case BIT_SLICE:
        args.add(operandName(n, 0));
        args.add("start=" + n.sliceStart());
        args.add("width=" + n.sliceWidth());
        break;
      case SEL:
        args.add(operandName(n, 0));
        args.add("cases=[" + operandName(n, 1) + ", "
                 + operandName(n, 2) + "]");
        break;
      case RECEIVE:
        args.add(operandName(n, 0));
        if (n.hasPredicate()) {
          args.add("predicate=" + node(n.predicate()).name());
        }
        args.add("channel_id=" + n.channelId());
        break;
      case SEND:
        args.add(operandName(n, 0));
        args.add(operandName(n, 1));
        if (n.hasPredicate()) {
          args.add("predicate=" + node(n.predicate()).name());
        }
        args.add("channel_id=" + n.channelId());
        break;
      case ASSERT:
        args.add(operandName(n, 0));
        args.add(operandName(n, 1));
        args.add("message=\"" + escape(n.message()) + "\"");
        args.add("label=\"" + escape(n.label()) + "\"");
        break;
      default:
        for (int i = 0; i < n.operandCount(); i++) {
          args.add(operandName(n, i));
        }
        break;
    }
    out.append(String.join(", ", args)).append(")");
  }

  private String operandName(Node n, int i) {
    return node(n.operand(i)).name();
  }

  static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, false);
    return sb.toString();
  }
}
