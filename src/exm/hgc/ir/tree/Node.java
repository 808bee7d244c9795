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
import java.util.List;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.lang.Types.Type;
import exm.hgc.common.lang.Value;

/**
 * One operation record in a proc's node arena.
 *
 * Nodes are a tagged variant: the opcode determines the operand layout
 * (see {@link Opcode}) and which of the kind-specific attributes are
 * meaningful.  Operands are stable handles into the same proc's arena.
 */
public class Node {
  /** Handle in the owning proc, -1 until placed */
  private int id = -1;
  private String name;
  private final Opcode op;
  private Type type;
  private final List<Integer> operands;

  // Kind-specific attributes
  private Value literal;          // LITERAL
  private int index = -1;         // TUPLE_INDEX, PARAM
  private int sliceStart = -1;    // BIT_SLICE
  private int sliceWidth = -1;    // BIT_SLICE
  private int channelId = -1;     // SEND, RECEIVE
  private boolean predicated;     // SEND, RECEIVE
  private String message;         // ASSERT
  private String label;           // ASSERT

  Node(String name, Opcode op, List<Integer> operands) {
    this.name = name;
    this.op = op;
    this.operands = new ArrayList<Integer>(operands);
  }

  public int id() {
    return id;
  }

  void setId(int id) {
    this.id = id;
  }

  public String name() {
    return name;
  }

  void setName(String name) {
    this.name = name;
  }

  public Opcode op() {
    return op;
  }

  public Type type() {
    return type;
  }

  void setType(Type type) {
    this.type = type;
  }

  public List<Integer> operands() {
    return Collections.unmodifiableList(operands);
  }

  public int operand(int i) {
    return operands.get(i);
  }

  public int operandCount() {
    return operands.size();
  }

  void setOperand(int i, int handle) {
    operands.set(i, handle);
  }

  /**
   * Replace all occurrences of an operand
   * @return true if any were replaced
   */
  boolean replaceOperand(int oldHandle, int newHandle) {
    boolean replaced = false;
    for (int i = 0; i < operands.size(); i++) {
      if (operands.get(i) == oldHandle) {
        operands.set(i, newHandle);
        replaced = true;
      }
    }
    return replaced;
  }

  public Value literal() {
    checkOp(Opcode.LITERAL);
    return literal;
  }

  void setLiteral(Value literal) {
    this.literal = literal;
  }

  /**
   * @return element index of TUPLE_INDEX, or parameter index of PARAM
   *         (0 is the token parameter, i + 1 is state element i)
   */
  public int index() {
    if (op != Opcode.TUPLE_INDEX && op != Opcode.PARAM) {
      throw new HGCRuntimeError("No index on " + op + " node " + name);
    }
    return index;
  }

  void setIndex(int index) {
    this.index = index;
  }

  public int sliceStart() {
    checkOp(Opcode.BIT_SLICE);
    return sliceStart;
  }

  public int sliceWidth() {
    checkOp(Opcode.BIT_SLICE);
    return sliceWidth;
  }

  void setSlice(int start, int width) {
    this.sliceStart = start;
    this.sliceWidth = width;
  }

  public int channelId() {
    checkChannelOp();
    return channelId;
  }

  /**
   * Point a send or receive at a different channel.  Token, data and
   * predicate operands are unchanged.
   */
  public void setChannelId(int channelId) {
    checkChannelOp();
    this.channelId = channelId;
  }

  void setChannel(int channelId, boolean predicated) {
    this.channelId = channelId;
    this.predicated = predicated;
  }

  public boolean hasPredicate() {
    checkChannelOp();
    return predicated;
  }

  /**
   * @return handle of the predicate, or null if the operation
   *         always attempts to fire
   */
  public Integer predicate() {
    checkChannelOp();
    if (!predicated) {
      return null;
    }
    return operands.get(op == Opcode.SEND ? 2 : 1);
  }

  /**
   * @return handle of the token consumed by a send, receive or assert
   */
  public int tokenOperand() {
    if (!op.isChannelOp() && op != Opcode.ASSERT) {
      throw new HGCRuntimeError("No token operand on " + op + " node "
                                + name);
    }
    return operands.get(0);
  }

  void setTokenOperand(int handle) {
    operands.set(0, handle);
  }

  /**
   * @return handle of the data sent by a send
   */
  public int dataOperand() {
    checkOp(Opcode.SEND);
    return operands.get(1);
  }

  public int condition() {
    checkOp(Opcode.ASSERT);
    return operands.get(1);
  }

  public String message() {
    checkOp(Opcode.ASSERT);
    return message;
  }

  public String label() {
    checkOp(Opcode.ASSERT);
    return label;
  }

  void setAssertInfo(String message, String label) {
    this.message = message;
    this.label = label;
  }

  private void checkOp(Opcode expected) {
    if (op != expected) {
      throw new HGCRuntimeError("Expected " + expected + " node but "
                              + name + " is " + op);
    }
  }

  private void checkChannelOp() {
    if (!op.isChannelOp()) {
      throw new HGCRuntimeError("Not a channel operation: " + name);
    }
  }

  @Override
  public String toString() {
    return name + ": " + type + " = " + op.irName() + operands;
  }
}
