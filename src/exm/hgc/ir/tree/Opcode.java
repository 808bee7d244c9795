package exm.hgc.ir.tree;

import exm.hgc.common.exceptions.HGCRuntimeError;

/**
 * Closed set of node kinds.  Each opcode has a fixed operand layout,
 * documented next to it.
 */
public enum Opcode {
  // Proc parameter: token or state element.  No operands
  PARAM("param", Category.PARAM),

  // Value computations
  LITERAL("literal", Category.COMPUTE),         // no operands
  TUPLE("tuple", Category.COMPUTE),             // elements...
  TUPLE_INDEX("tuple_index", Category.COMPUTE), // tuple
  BIT_SLICE("bit_slice", Category.COMPUTE),     // x
  NOT("not", Category.COMPUTE),                 // x
  AND("and", Category.COMPUTE), OR("or", Category.COMPUTE),
  XOR("xor", Category.COMPUTE),                 // x, y, ...
  ADD("add", Category.COMPUTE), SUB("sub", Category.COMPUTE), // x, y
  EQ("eq", Category.COMPUTE), NE("ne", Category.COMPUTE),
  ULT("ult", Category.COMPUTE), UGT("ugt", Category.COMPUTE),
  ULE("ule", Category.COMPUTE), UGE("uge", Category.COMPUTE), // x, y
  SEL("sel", Category.COMPUTE),                 // selector, case0, case1

  // Token join
  AFTER_ALL("after_all", Category.TOKEN_JOIN),  // tokens...

  // Side-effecting operations
  RECEIVE("receive", Category.RECEIVE),         // token, [predicate]
  SEND("send", Category.SEND),                  // token, data, [predicate]
  ASSERT("assert", Category.ASSERT);            // token, condition

  public static enum Category {
    PARAM,
    COMPUTE,
    TOKEN_JOIN,
    RECEIVE,
    SEND,
    ASSERT,
  }

  private final String irName;
  private final Category category;

  private Opcode(String irName, Category category) {
    this.irName = irName;
    this.category = category;
  }

  public String irName() {
    return irName;
  }

  public Category category() {
    return category;
  }

  public boolean isChannelOp() {
    return category == Category.SEND || category == Category.RECEIVE;
  }

  /**
   * @return true if the node must be kept even without users
   */
  public boolean hasSideEffect() {
    switch (category) {
      case PARAM:
      case RECEIVE:
      case SEND:
      case ASSERT:
        return true;
      case COMPUTE:
      case TOKEN_JOIN:
        return false;
      default:
        throw new HGCRuntimeError("Unknown category " + category);
    }
  }

  public boolean isComparison() {
    switch (this) {
      case EQ:
      case NE:
      case ULT:
      case UGT:
      case ULE:
      case UGE:
        return true;
      default:
        return false;
    }
  }

  public boolean isBitwiseNary() {
    return this == AND || this == OR || this == XOR;
  }

  /**
   * @param irName name as written in IR text
   * @return null if not an operation that can appear in IR text
   */
  public static Opcode fromIRName(String irName) {
    for (Opcode op: values()) {
      if (op != PARAM && op.irName.equals(irName)) {
        return op;
      }
    }
    return null;
  }
}
