package gateforge;

/**
 * Base class of every error raised while compiling a circuit. Any instance aborts the whole compile invocation.
 */
public class CircuitCompileException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public CircuitCompileException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ErrorKind getKind() { return kind; }

  @Override
  public String toString() {
    return String.format("%s error: %s", kind.name().toLowerCase(), getMessage());
  }
}
