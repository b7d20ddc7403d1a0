package gateforge;

/** Category of a {@link CircuitCompileException}. */
public enum ErrorKind {
  /** Malformed statement shape, parser failure or illegal redefinition. */
  SYNTAX,
  /** Identifier outside the naming pattern, or a character no token can start with. */
  LEXICAL,
  /** A name is used without a resolvable binding. */
  REFERENCE,
  /** Cup or attachment capacity violated, or parts finalized out of dependency order. */
  STRUCTURAL,
  /** An operation matches more than one gate shape. Only reachable through an internal invariant violation. */
  AMBIGUITY
}
