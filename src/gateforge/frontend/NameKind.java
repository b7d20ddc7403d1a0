package gateforge.frontend;

public enum NameKind {
  INPUT,
  TEMP,
  VARIABLE,
  OUTPUT;

  /** Inputs and outputs can never receive a second definition. */
  public boolean isRedefinable() { return this == VARIABLE; }
}
