package gateforge.frontend;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Boolean expression tree. Immutable once built.
 */
public sealed interface Expr permits Expr.Ident, Expr.Not, Expr.Binary {

  /**
   * Evaluates the expression.
   * @param values value of every identifier occurring in the tree
   * @throws IllegalArgumentException if an identifier has no value
   */
  boolean evaluate(Map<String, Boolean> values);

  /** Returns a copy of the tree with every identifier name passed through {@code renamer}. */
  Expr rename(UnaryOperator<String> renamer);

  /** Number of gate nodes (everything but identifiers). */
  int gateCount();

  record Ident(String name) implements Expr {
    @Override
    public boolean evaluate(Map<String, Boolean> values) {
      Boolean value = values.get(name);
      if (value == null)
        throw new IllegalArgumentException("No value for " + name);
      return value;
    }
    @Override
    public Expr rename(UnaryOperator<String> renamer) {
      return new Ident(renamer.apply(name));
    }
    @Override
    public int gateCount() {
      return 0;
    }
    @Override
    public String toString() {
      return name;
    }
  }

  record Not(Expr operand) implements Expr {
    @Override
    public boolean evaluate(Map<String, Boolean> values) {
      return !operand.evaluate(values);
    }
    @Override
    public Expr rename(UnaryOperator<String> renamer) {
      return new Not(operand.rename(renamer));
    }
    @Override
    public int gateCount() {
      return 1 + operand.gateCount();
    }
    @Override
    public String toString() {
      return "not " + operand;
    }
  }

  record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
    @Override
    public boolean evaluate(Map<String, Boolean> values) {
      return op.apply(left.evaluate(values), right.evaluate(values));
    }
    @Override
    public Expr rename(UnaryOperator<String> renamer) {
      return new Binary(op, left.rename(renamer), right.rename(renamer));
    }
    @Override
    public int gateCount() {
      return 1 + left.gateCount() + right.gateCount();
    }
    @Override
    public String toString() {
      return "(" + left + " " + op + " " + right + ")";
    }
  }

  static Expr ident(String name) { return new Ident(name); }
  static Expr not(Expr operand) { return new Not(operand); }
  static Expr and(Expr left, Expr right) { return new Binary(BinaryOp.AND, left, right); }
  static Expr or(Expr left, Expr right) { return new Binary(BinaryOp.OR, left, right); }
}
