package gateforge;

/** Malformed statement, parser failure or illegal redefinition. */
public class SyntaxException extends CircuitCompileException {
  private static final long serialVersionUID = 1L;

  public SyntaxException(String message) { super(ErrorKind.SYNTAX, message); }
}
