package gateforge;

/** An operation does not map onto exactly one gate shape. */
public class AmbiguityException extends CircuitCompileException {
  private static final long serialVersionUID = 1L;

  public AmbiguityException(String message) { super(ErrorKind.AMBIGUITY, message); }
}
