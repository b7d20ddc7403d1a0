package gateforge;

/** Identifier outside <code>^[A-Z0-9_]+$</code> or a stray character in the source. */
public class LexicalException extends CircuitCompileException {
  private static final long serialVersionUID = 1L;

  public LexicalException(String message) { super(ErrorKind.LEXICAL, message); }
}
