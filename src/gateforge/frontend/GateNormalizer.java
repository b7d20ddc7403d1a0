package gateforge.frontend;

/**
 * Rewrites derived gates (nand, nor, xor, xnor) into and/or/not form. Children are rewritten before their parent.
 */
public final class GateNormalizer {
  private GateNormalizer() {}

  public static Expr normalize(Expr expr) {
    if (expr instanceof Expr.Ident)
      return expr;
    if (expr instanceof Expr.Not) {
      return Expr.not(normalize(((Expr.Not)expr).operand()));
    }
    Expr.Binary binary = (Expr.Binary)expr;
    Expr a = normalize(binary.left());
    Expr b = normalize(binary.right());
    switch (binary.op()) {
    case AND:
      return Expr.and(a, b);
    case OR:
      return Expr.or(a, b);
    case NAND:
      return Expr.not(Expr.and(a, b));
    case NOR:
      return Expr.not(Expr.or(a, b));
    case XOR:
      // (a and not b) or (not a and b)
      return Expr.or(Expr.and(a, Expr.not(b)), Expr.and(Expr.not(a), b));
    case XNOR:
      // (a and b) or (not a and not b)
      return Expr.or(Expr.and(a, b), Expr.and(Expr.not(a), Expr.not(b)));
    }
    throw new IllegalStateException("Unhandled operation " + binary.op());
  }

  /** true if the tree only contains and, or, not and identifiers */
  public static boolean isPrimitive(Expr expr) {
    if (expr instanceof Expr.Ident)
      return true;
    if (expr instanceof Expr.Not)
      return isPrimitive(((Expr.Not)expr).operand());
    Expr.Binary binary = (Expr.Binary)expr;
    return binary.op().primitive && isPrimitive(binary.left()) && isPrimitive(binary.right());
  }
}
