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

import java.util.List;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.lang.Value;
import exm.hgc.ir.tree.Node;

/**
 * Evaluates nodes without side effects
 */
public class NodeEvaluator {

  /**
   * @param args values of the node's operands, in order
   */
  public static Value evaluate(Node n, List<Value> args) {
    switch (n.op()) {
      case LITERAL:
        return n.literal();
      case TUPLE:
        return Value.tuple(args);
      case TUPLE_INDEX:
        return args.get(0).element(n.index());
      case BIT_SLICE:
        return Value.bits(n.sliceWidth(),
                          args.get(0).asLong() >>> n.sliceStart());
      case NOT:
        return Value.bits(width(n), ~args.get(0).asLong());
      case AND: {
        long v = -1L;
        for (Value arg: args) {
          v &= arg.asLong();
        }
        return Value.bits(width(n), v);
      }
      case OR: {
        long v = 0;
        for (Value arg: args) {
          v |= arg.asLong();
        }
        return Value.bits(width(n), v);
      }
      case XOR: {
        long v = 0;
        for (Value arg: args) {
          v ^= arg.asLong();
        }
        return Value.bits(width(n), v);
      }
      case ADD:
        return Value.bits(width(n), args.get(0).asLong() + args.get(1).asLong());
      case SUB:
        return Value.bits(width(n), args.get(0).asLong() - args.get(1).asLong());
      case EQ:
        return Value.bool(args.get(0).equals(args.get(1)));
      case NE:
        return Value.bool(!args.get(0).equals(args.get(1)));
      case ULT:
        return Value.bool(compare(args) < 0);
      case UGT:
        return Value.bool(compare(args) > 0);
      case ULE:
        return Value.bool(compare(args) <= 0);
      case UGE:
        return Value.bool(compare(args) >= 0);
      case SEL:
        return args.get(0).isTrue() ? args.get(2) : args.get(1);
      case AFTER_ALL:
        return Value.token();
      default:
        throw new HGCRuntimeError("Cannot evaluate " + n.op() +
                                  " node " + n.name() + " without effects");
    }
  }

  private static int width(Node n) {
    return n.type().bitCount();
  }

  private static int compare(List<Value> args) {
    return Long.compareUnsigned(args.get(0).asLong(), args.get(1).asLong());
  }
}
