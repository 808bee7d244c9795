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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.hgc.common.exceptions.TypeMismatchException;
import exm.hgc.common.lang.Types;
import exm.hgc.common.lang.Types.Type;
import exm.hgc.common.lang.Value;

/**
 * Creates type-checked nodes in a proc, either appended at the end or
 * inserted before a cursor node.
 *
 * A null name requests an automatically generated one.
 */
public class ProcBuilder {
  private final Program program;
  private final Proc proc;

  /** Node to insert before, or null to append */
  private Integer insertBefore = null;

  public ProcBuilder(Program program, Proc proc) {
    this.program = program;
    this.proc = proc;
  }

  public Program program() {
    return program;
  }

  public Proc proc() {
    return proc;
  }

  public void setInsertionPoint(int before) {
    proc.node(before);
    this.insertBefore = before;
  }

  public void appendAtEnd() {
    this.insertBefore = null;
  }

  /**
   * @return a node name based on base that is not yet used in the proc
   */
  public String fresh(String base) {
    return proc.uniqueNodeName(base);
  }

  public Node tokenParam(String name) {
    Node n = new Node(name, Opcode.PARAM, Collections.<Integer>emptyList());
    n.setIndex(0);
    n.setType(Types.TOKEN);
    proc.placeParam(n, null);
    return n;
  }

  public Node stateParam(String name, Type type, Value init)
      throws TypeMismatchException {
    if (!init.type().equals(type)) {
      throw new TypeMismatchException("Initial value " + init.text() +
          " of state " + name + " does not have type " + type);
    }
    Node n = new Node(name, Opcode.PARAM, Collections.<Integer>emptyList());
    n.setIndex(proc.stateParams().size() + 1);
    n.setType(type);
    proc.placeParam(n, init);
    return n;
  }

  public Node literal(String name, Value value)
      throws TypeMismatchException {
    Node n = new Node(name, Opcode.LITERAL, Collections.<Integer>emptyList());
    n.setLiteral(value);
    return add(n);
  }

  public Node literal(Value value) throws TypeMismatchException {
    return literal(null, value);
  }

  public Node tuple(String name, List<Integer> elems)
      throws TypeMismatchException {
    return add(new Node(name, Opcode.TUPLE, elems));
  }

  public Node tupleIndex(String name, int tuple, int index)
      throws TypeMismatchException {
    Node n = new Node(name, Opcode.TUPLE_INDEX, Arrays.asList(tuple));
    n.setIndex(index);
    return add(n);
  }

  public Node bitSlice(String name, int arg, int start, int width)
      throws TypeMismatchException {
    Node n = new Node(name, Opcode.BIT_SLICE, Arrays.asList(arg));
    n.setSlice(start, width);
    return add(n);
  }

  public Node not(String name, int arg) throws TypeMismatchException {
    return add(new Node(name, Opcode.NOT, Arrays.asList(arg)));
  }

  public Node nary(String name, Opcode op, List<Integer> args)
      throws TypeMismatchException {
    return add(new Node(name, op, args));
  }

  public Node binary(String name, Opcode op, int x, int y)
      throws TypeMismatchException {
    return add(new Node(name, op, Arrays.asList(x, y)));
  }

  /**
   * @param selector bits[1]: 0 selects case0, 1 selects case1
   */
  public Node sel(String name, int selector, int case0, int case1)
      throws TypeMismatchException {
    return add(new Node(name, Opcode.SEL,
                        Arrays.asList(selector, case0, case1)));
  }

  public Node afterAll(String name, List<Integer> tokens)
      throws TypeMismatchException {
    return add(new Node(name, Opcode.AFTER_ALL, tokens));
  }

  /**
   * @param predicate handle of bits[1] predicate, or null if unconditional
   */
  public Node receive(String name, int token, Integer predicate,
                      int channelId) throws TypeMismatchException {
    List<Integer> args = new ArrayList<Integer>();
    args.add(token);
    if (predicate != null) {
      args.add(predicate);
    }
    Node n = new Node(name, Opcode.RECEIVE, args);
    n.setChannel(channelId, predicate != null);
    return add(n);
  }

  public Node send(String name, int token, int data, Integer predicate,
                   int channelId) throws TypeMismatchException {
    List<Integer> args = new ArrayList<Integer>();
    args.add(token);
    args.add(data);
    if (predicate != null) {
      args.add(predicate);
    }
    Node n = new Node(name, Opcode.SEND, args);
    n.setChannel(channelId, predicate != null);
    return add(n);
  }

  /**
   * Assertion that fails the activation if condition is false
   */
  public Node assertion(String name, int token, int condition,
            String message, String label) throws TypeMismatchException {
    Node n = new Node(name, Opcode.ASSERT, Arrays.asList(token, condition));
    n.setAssertInfo(message, label);
    return add(n);
  }

  /**
   * Make a node consume a different token.  The new token must precede
   * the node.
   */
  public void setTokenOperand(int handle, int token)
      throws TypeMismatchException {
    Node n = proc.node(handle);
    n.tokenOperand();
    if (!proc.node(token).type().isToken()) {
      throw new TypeMismatchException("Token operand of " + n.name()
          + " must have type token: " + proc.node(token).name());
    }
    proc.setOperand(handle, 0, token);
  }

  private Node add(Node n) throws TypeMismatchException {
    n.setType(inferType(program, proc, n));
    proc.place(n, insertBefore);
    return n;
  }

  /**
   * Compute the result type of a node from its operands and attributes
   * @throws TypeMismatchException if the node is ill-typed
   */
  public static Type inferType(Program program, Proc proc, Node n)
      throws TypeMismatchException {
    List<Type> argTypes = new ArrayList<Type>(n.operandCount());
    for (int arg: n.operands()) {
      if (!proc.isLive(arg)) {
        throw new TypeMismatchException("Operand " + arg + " of "
                    + describe(n) + " is not a node in " + proc.name());
      }
      argTypes.add(proc.node(arg).type());
    }

    switch (n.op()) {
      case PARAM:
        return n.type();
      case LITERAL:
        return n.literal().type();
      case TUPLE:
        return Types.tuple(argTypes);
      case TUPLE_INDEX: {
        checkArity(n, argTypes, 1);
        Type t = argTypes.get(0);
        if (!t.isTuple() || n.index() < 0 ||
            n.index() >= t.elements().size()) {
          throw new TypeMismatchException("Index " + n.index() +
              " out of range for " + t + " in " + describe(n));
        }
        return t.elements().get(n.index());
      }
      case BIT_SLICE: {
        checkArity(n, argTypes, 1);
        Type t = argTypes.get(0);
        if (!t.isBits() || n.sliceStart() < 0 || n.sliceWidth() < 1 ||
            n.sliceStart() + n.sliceWidth() > t.bitCount()) {
          throw new TypeMismatchException("Slice [" + n.sliceStart() +
              ", +" + n.sliceWidth() + ") out of range for " + t +
              " in " + describe(n));
        }
        return Types.bits(n.sliceWidth());
      }
      case NOT:
        checkArity(n, argTypes, 1);
        checkBits(n, argTypes.get(0));
        return argTypes.get(0);
      case AND:
      case OR:
      case XOR:
        if (argTypes.isEmpty()) {
          throw new TypeMismatchException(describe(n) +
                                          " needs at least one operand");
        }
        return sameBits(n, argTypes);
      case ADD:
      case SUB:
        checkArity(n, argTypes, 2);
        return sameBits(n, argTypes);
      case EQ:
      case NE:
      case ULT:
      case UGT:
      case ULE:
      case UGE:
        checkArity(n, argTypes, 2);
        sameBits(n, argTypes);
        return Types.BOOL;
      case SEL:
        checkArity(n, argTypes, 3);
        checkBool(n, argTypes.get(0), "selector");
        if (!argTypes.get(1).equals(argTypes.get(2))) {
          throw new TypeMismatchException("Cases of " + describe(n) +
              " have different types " + argTypes.get(1) + " and " +
              argTypes.get(2));
        }
        return argTypes.get(1);
      case AFTER_ALL:
        for (Type t: argTypes) {
          if (!t.isToken()) {
            throw new TypeMismatchException("Operand of " + describe(n) +
                                            " has non-token type " + t);
          }
        }
        return Types.TOKEN;
      case RECEIVE: {
        checkArity(n, argTypes, n.hasPredicate() ? 2 : 1);
        checkToken(n, argTypes.get(0));
        if (n.hasPredicate()) {
          checkBool(n, argTypes.get(1), "predicate");
        }
        Channel c = checkChannel(program, n);
        if (!c.ops().supportsReceive()) {
          throw new TypeMismatchException("Cannot receive on " + c.ops()
              + " channel " + c.name() + " in " + describe(n));
        }
        return Types.receiveResult(c.payloadType());
      }
      case SEND: {
        checkArity(n, argTypes, n.hasPredicate() ? 3 : 2);
        checkToken(n, argTypes.get(0));
        if (n.hasPredicate()) {
          checkBool(n, argTypes.get(2), "predicate");
        }
        Channel c = checkChannel(program, n);
        if (!c.ops().supportsSend()) {
          throw new TypeMismatchException("Cannot send on " + c.ops()
              + " channel " + c.name() + " in " + describe(n));
        }
        if (!argTypes.get(1).equals(c.payloadType())) {
          throw new TypeMismatchException("Data of type " + argTypes.get(1)
              + " sent on channel " + c.name() + " of type "
              + c.payloadType() + " in " + describe(n));
        }
        return Types.TOKEN;
      }
      case ASSERT:
        checkArity(n, argTypes, 2);
        checkToken(n, argTypes.get(0));
        checkBool(n, argTypes.get(1), "condition");
        return Types.TOKEN;
      default:
        throw new TypeMismatchException("Unknown operation " + n.op());
    }
  }

  private static String describe(Node n) {
    return n.name() == null ? n.op().irName() : n.name();
  }

  private static void checkArity(Node n, List<Type> argTypes, int expected)
      throws TypeMismatchException {
    if (argTypes.size() != expected) {
      throw new TypeMismatchException(describe(n) + " expects " + expected
                      + " operands but has " + argTypes.size());
    }
  }

  private static void checkBits(Node n, Type t)
      throws TypeMismatchException {
    if (!t.isBits()) {
      throw new TypeMismatchException("Operand of " + describe(n)
                                      + " has non-bits type " + t);
    }
  }

  private static Type sameBits(Node n, List<Type> argTypes)
      throws TypeMismatchException {
    Type first = argTypes.get(0);
    for (Type t: argTypes) {
      checkBits(n, t);
      if (!t.equals(first)) {
        throw new TypeMismatchException("Operands of " + describe(n) +
                                " have different types " + first + " and " + t);
      }
    }
    return first;
  }

  private static void checkBool(Node n, Type t, String what)
      throws TypeMismatchException {
    if (!t.equals(Types.BOOL)) {
      throw new TypeMismatchException("The " + what + " of " + describe(n)
                                      + " must be bits[1] but is " + t);
    }
  }

  private static void checkToken(Node n, Type t)
      throws TypeMismatchException {
    if (!t.isToken()) {
      throw new TypeMismatchException("Token operand of " + describe(n)
                                      + " has type " + t);
    }
  }

  private static Channel checkChannel(Program program, Node n)
      throws TypeMismatchException {
    Channel c = program.lookupChannel(n.channelId());
    if (c == null) {
      throw new TypeMismatchException("Unknown channel id " + n.channelId()
                                      + " in " + describe(n));
    }
    return c;
  }
}
