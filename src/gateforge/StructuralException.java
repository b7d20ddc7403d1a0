package gateforge;

/** Capacity or ordering violation in the part graph. */
public class StructuralException extends CircuitCompileException {
  private static final long serialVersionUID = 1L;

  public StructuralException(String message) { super(ErrorKind.STRUCTURAL, message); }
}
