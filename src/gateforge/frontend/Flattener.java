package gateforge.frontend;

import gateforge.AmbiguityException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Turns a normalized expression tree into three-address form: one fresh temporary per gate node, emitted in post-order.
 */
public class Flattener {

  /** One temporary and the single gate computing it. */
  public record TempAssignment(String name, Value.Op op) {
    @Override
    public String toString() {
      return name + " = " + op;
    }
  }

  /**
   * @param result name carrying the value of the whole tree; the identifier itself for a bare leaf
   * @param temps the temporaries in evaluation order
   */
  public record Flattened(String result, List<TempAssignment> temps) {}

  private final Supplier<String> tempNames;

  /** @param tempNames source of fresh temporary names; must never repeat a name */
  public Flattener(Supplier<String> tempNames) { this.tempNames = tempNames; }

  /**
   * @param expr a tree containing only and, or, not and identifiers
   * @throws AmbiguityException if a derived gate is still present
   */
  public Flattened flatten(Expr expr) throws AmbiguityException {
    List<TempAssignment> temps = new ArrayList<>();
    String result = visit(expr, temps);
    return new Flattened(result, temps);
  }

  private String visit(Expr expr, List<TempAssignment> temps) throws AmbiguityException {
    if (expr instanceof Expr.Ident)
      return ((Expr.Ident)expr).name();
    Value.Op op;
    if (expr instanceof Expr.Not) {
      op = Value.Op.not(visit(((Expr.Not)expr).operand(), temps));
    } else {
      Expr.Binary binary = (Expr.Binary)expr;
      Gate gate;
      switch (binary.op()) {
      case AND:
        gate = Gate.AND;
        break;
      case OR:
        gate = Gate.OR;
        break;
      default:
        throw new AmbiguityException(String.format("Operation '%s' has no gate of its own, normalize before flattening", binary.op()));
      }
      String left = visit(binary.left(), temps);
      String right = visit(binary.right(), temps);
      op = Value.Op.of(gate, left, right);
    }
    // Named after the children so numbering follows post-order.
    String temp = tempNames.get();
    temps.add(new TempAssignment(temp, op));
    return temp;
  }
}
