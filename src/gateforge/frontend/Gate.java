package gateforge.frontend;

/** Primitive gates that have a physical counterpart. */
public enum Gate {
  AND(2),
  OR(2),
  NOT(1);

  public final int arity;

  private Gate(int arity) { this.arity = arity; }

  public boolean apply(boolean[] inputs) {
    switch (this) {
    case AND:
      return inputs[0] && inputs[1];
    case OR:
      return inputs[0] || inputs[1];
    case NOT:
      return !inputs[0];
    }
    throw new IllegalStateException("Unhandled gate " + this);
  }
}
