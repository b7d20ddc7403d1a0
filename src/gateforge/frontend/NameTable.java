package gateforge.frontend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Insertion-ordered table of every name defined by one program, temporaries and hidden successors included.
 */
public class NameTable {
  private final LinkedHashMap<String, NameRecord> records = new LinkedHashMap<>();

  /**
   * Adds a record. Keys are never rebound.
   * @throws IllegalStateException if the key is already present
   */
  public void add(NameRecord record) {
    NameRecord prev = records.putIfAbsent(record.getName(), record);
    if (prev != null)
      throw new IllegalStateException("Name " + record.getName() + " is already bound to " + prev);
  }

  public Optional<NameRecord> lookup(String name) { return Optional.ofNullable(records.get(name)); }
  public boolean contains(String name) { return records.containsKey(name); }
  public int size() { return records.size(); }

  /** All records in declaration order. */
  public Collection<NameRecord> records() { return Collections.unmodifiableCollection(records.values()); }

  public List<NameRecord> ofKind(NameKind kind) {
    return records.values().stream().filter(record -> record.getKind() == kind).collect(Collectors.toCollection(ArrayList::new));
  }

  @Override
  public String toString() {
    return records.values().stream().map(NameRecord::toString).collect(Collectors.joining("\n"));
  }
}
