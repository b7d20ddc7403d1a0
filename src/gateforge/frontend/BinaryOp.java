package gateforge.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Two-operand gates of the source language. AND/NAND bind tighter than the OR level.
 */
public enum BinaryOp {
  AND(Keyword.AND, true, true),
  NAND(Keyword.NAND, true, false),
  OR(Keyword.OR, false, true),
  NOR(Keyword.NOR, false, false),
  XOR(Keyword.XOR, false, false),
  XNOR(Keyword.XNOR, false, false);

  public final Keyword keyword;
  /** true for the AND precedence level, false for the OR level */
  public final boolean andLevel;
  /** true if a physical gate exists for this operation */
  public final boolean primitive;

  private BinaryOp(Keyword keyword, boolean andLevel, boolean primitive) {
    this.keyword = keyword;
    this.andLevel = andLevel;
    this.primitive = primitive;
  }

  public static Optional<BinaryOp> fromToken(Token token) {
    return Stream.of(BinaryOp.values()).filter(op -> token.is(op.keyword)).findAny();
  }

  /** Reference truth table of the gate. */
  public boolean apply(boolean a, boolean b) {
    switch (this) {
    case AND:
      return a && b;
    case NAND:
      return !(a && b);
    case OR:
      return a || b;
    case NOR:
      return !(a || b);
    case XOR:
      return a != b;
    case XNOR:
      return a == b;
    }
    throw new IllegalStateException("Unhandled operation " + this);
  }

  @Override
  public String toString() {
    return keyword.serialName;
  }
}
