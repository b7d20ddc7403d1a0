package gateforge.parts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finalized part as written to the output.
 * @param typeName part type
 * @param positions {@code [attachment, cup, referencedId]} triples
 * @param extraData part-specific settings, in insertion order
 */
public record PartRecord(String typeName, List<List<Integer>> positions, Map<String, Object> extraData) {
  public PartRecord {
    positions = List.copyOf(positions);
    extraData = Collections.unmodifiableMap(new LinkedHashMap<>(extraData));
  }
}
