package gateforge.frontend;

import gateforge.parts.Connectable;
import java.util.Optional;

/**
 * Entry of the {@link NameTable}. The wire is only set by the physical compiler.
 */
public class NameRecord {
  private final String name;
  private final String sourceName;
  private final NameKind kind;
  private final Value value;
  private Connectable wire = null;

  /**
   * @param name key in the name table, possibly a hidden successor name
   * @param sourceName the name as written in the program
   * @param kind kind of the definition
   * @param value null for inputs
   */
  public NameRecord(String name, String sourceName, NameKind kind, Value value) {
    if ((kind == NameKind.INPUT) != (value == null))
      throw new IllegalArgumentException("Exactly the inputs carry no value: " + name);
    this.name = name;
    this.sourceName = sourceName;
    this.kind = kind;
    this.value = value;
  }

  public static NameRecord input(String name) { return new NameRecord(name, name, NameKind.INPUT, null); }

  public String getName() { return name; }
  public String getSourceName() { return sourceName; }
  public NameKind getKind() { return kind; }
  public Value getValue() { return value; }
  public boolean isHidden() { return !name.equals(sourceName); }

  public Optional<Connectable> getWire() { return Optional.ofNullable(wire); }
  public void setWire(Connectable wire) { this.wire = wire; }

  @Override
  public String toString() {
    return String.format("%s %s%s = %s", kind.name().toLowerCase(), name, isHidden() ? " (" + sourceName + ")" : "",
                         value == null ? "<input>" : value.toString());
  }
}
