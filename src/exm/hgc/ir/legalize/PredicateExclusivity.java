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

import java.util.List;

import exm.hgc.common.lang.Value;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Opcode;
import exm.hgc.ir.tree.Proc;

/**
 * Conservative proof that the predicates of a set of channel operations
 * can never be true in the same activation.
 *
 * Only a few syntactic patterns are recognized, so a negative answer
 * means "not proven" rather than "overlapping":
 * <ul>
 * <li>a predicate that is the literal 0 is disjoint from anything;</li>
 * <li>p and not(p), through any number of negations;</li>
 * <li>eq(x, c1) and eq(x, c2) for distinct literals c1 and c2, or
 *     eq(x, c) and ne(x, c);</li>
 * <li>and(...) where one conjunct is disjoint from the other predicate.</li>
 * </ul>
 * Except for the literal 0 case, both predicates must be in the same proc.
 */
public class PredicateExclusivity {

  /** Bound on nesting of and() explored */
  private static final int MAX_DEPTH = 8;

  /**
   * @return true if no two of the operations can fire in one activation
   */
  public static boolean provenMutuallyExclusive(List<ChannelOpRef> ops) {
    if (ops.size() <= 1) {
      return true;
    }
    for (ChannelOpRef op: ops) {
      if (!op.node().hasPredicate()) {
        return false;
      }
    }
    for (int i = 0; i < ops.size(); i++) {
      for (int j = i + 1; j < ops.size(); j++) {
        ChannelOpRef a = ops.get(i);
        ChannelOpRef b = ops.get(j);
        if (!disjoint(a.proc(), a.node().predicate(),
                      b.proc(), b.node().predicate())) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * @return true if the two bits[1] nodes are provably never both true
   */
  public static boolean disjoint(Proc procA, int a, Proc procB, int b) {
    if (alwaysFalse(procA, a) || alwaysFalse(procB, b)) {
      return true;
    }
    if (procA != procB) {
      return false;
    }
    return disjoint(procA, a, b, 0);
  }

  private static boolean disjoint(Proc proc, int a, int b, int depth) {
    if (depth > MAX_DEPTH) {
      return false;
    }
    if (alwaysFalse(proc, a) || alwaysFalse(proc, b)) {
      return true;
    }
    Literal la = strip(proc, a);
    Literal lb = strip(proc, b);
    if (la.base == lb.base) {
      return la.negated != lb.negated;
    }

    Comparison ca = Comparison.match(proc, la);
    Comparison cb = Comparison.match(proc, lb);
    if (ca != null && cb != null && ca.disjointFrom(cb)) {
      return true;
    }

    if (conjunctDisjoint(proc, la, b, depth) ||
        conjunctDisjoint(proc, lb, a, depth)) {
      return true;
    }
    return false;
  }

  /**
   * @return true if lit is a conjunction with a conjunct disjoint from other
   */
  private static boolean conjunctDisjoint(Proc proc, Literal lit, int other,
                                          int depth) {
    Node n = proc.node(lit.base);
    if (lit.negated || n.op() != Opcode.AND) {
      return false;
    }
    for (int conjunct: n.operands()) {
      if (disjoint(proc, conjunct, other, depth + 1)) {
        return true;
      }
    }
    return false;
  }

  private static boolean alwaysFalse(Proc proc, int pred) {
    Literal l = strip(proc, pred);
    Node n = proc.node(l.base);
    if (n.op() != Opcode.LITERAL) {
      return false;
    }
    return n.literal().isTrue() == l.negated;
  }

  /** A node after stripping negations, and whether an odd number was seen */
  private static class Literal {
    final int base;
    final boolean negated;

    Literal(int base, boolean negated) {
      this.base = base;
      this.negated = negated;
    }
  }

  private static Literal strip(Proc proc, int pred) {
    boolean negated = false;
    Node n = proc.node(pred);
    while (n.op() == Opcode.NOT) {
      negated = !negated;
      n = proc.node(n.operand(0));
    }
    return new Literal(n.id(), negated);
  }

  /** x == c or x != c, with x a node and c a literal */
  private static class Comparison {
    final int subject;
    final Value constant;
    final boolean equal;

    Comparison(int subject, Value constant, boolean equal) {
      this.subject = subject;
      this.constant = constant;
      this.equal = equal;
    }

    static Comparison match(Proc proc, Literal lit) {
      Node n = proc.node(lit.base);
      if (n.op() != Opcode.EQ && n.op() != Opcode.NE) {
        return null;
      }
      boolean equal = (n.op() == Opcode.EQ) != lit.negated;
      Node x = proc.node(n.operand(0));
      Node y = proc.node(n.operand(1));
      if (y.op() == Opcode.LITERAL && x.op() != Opcode.LITERAL) {
        return new Comparison(x.id(), y.literal(), equal);
      } else if (x.op() == Opcode.LITERAL && y.op() != Opcode.LITERAL) {
        return new Comparison(y.id(), x.literal(), equal);
      }
      return null;
    }

    boolean disjointFrom(Comparison other) {
      if (subject != other.subject) {
        return false;
      }
      if (equal && other.equal) {
        return !constant.equals(other.constant);
      }
      if (equal != other.equal) {
        return constant.equals(other.constant);
      }
      return false;
    }
  }
}
