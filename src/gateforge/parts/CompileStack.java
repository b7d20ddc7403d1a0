package gateforge.parts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Append-only list of finalized parts. The position of a record in the list is the identity of its part.
 */
public class CompileStack {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final ObjectMapper mapper = new ObjectMapper();

  private final List<PartRecord> records = new ArrayList<>();

  /**
   * @return the 1-based id of the appended record
   */
  public int append(PartRecord record) {
    records.add(record);
    return records.size();
  }

  public List<PartRecord> records() { return Collections.unmodifiableList(records); }
  public int size() { return records.size(); }

  /** Record of a part id. */
  public PartRecord get(int id) { return records.get(id - 1); }

  public long count(PartKind kind) { return records.stream().filter(record -> record.typeName().equals(kind.typeName)).count(); }

  /**
   * Structured form handed to the encoder: {@code [typeName, positions, extraData]} per record. Empty extra data is written as an
   * empty list, which is what consumers of the format expect.
   */
  public List<Object> toTransportTree() {
    List<Object> tree = new ArrayList<>(records.size());
    for (PartRecord record : records)
      tree.add(List.of(record.typeName(), record.positions(), record.extraData().isEmpty() ? List.of() : record.extraData()));
    return tree;
  }

  /** Compact JSON of {@link #toTransportTree()}. */
  public String toJson() {
    try {
      return mapper.writeValueAsString(toTransportTree());
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Serializes the stack for transport: compact JSON, then standard Base64 of its UTF-8 bytes.
   */
  public String terminate() {
    String json = toJson();
    logger.debug("Terminating compile stack with {} parts ({} bytes of JSON)", records.size(), json.length());
    return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }
}
