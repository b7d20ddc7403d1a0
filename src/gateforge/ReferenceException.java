package gateforge;

/** A name has no binding, or no wire by the time the physical compiler needs it. */
public class ReferenceException extends CircuitCompileException {
  private static final long serialVersionUID = 1L;

  public ReferenceException(String message) { super(ErrorKind.REFERENCE, message); }
}
