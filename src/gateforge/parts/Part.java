package gateforge.parts;

import gateforge.StructuralException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * A single physical part. Attachments and cups are one-shot; the part references other parts only through its positions and
 * receives its identity when finalized.
 */
public final class Part implements Connectable {
  public static final String EXTRA_ACTIVATED = "Activated";
  public static final String EXTRA_ACTIVATION_KEY = "ActivationKey";
  public static final String EXTRA_ORIENTATION_Y = "OrientationY";

  private final PartKind kind;
  // insertion order of these maps is the selection order
  private final LinkedHashMap<Integer, Boolean> attachments = new LinkedHashMap<>();
  private final LinkedHashMap<Integer, Boolean> cups = new LinkedHashMap<>();
  private final List<Position> positions = new ArrayList<>();
  private final LinkedHashMap<String, Object> extraData = new LinkedHashMap<>();
  private int id = -1;

  public Part(PartKind kind) {
    this.kind = kind;
    for (int attachment : kind.attachments())
      attachments.put(attachment, false);
    for (int cup : kind.cups())
      cups.put(cup, false);
    if (kind == PartKind.GYRO)
      extraData.put(EXTRA_ACTIVATED, true);
  }

  /**
   * Creates a sensor/label part.
   * @param activationKey text shown on the label
   * @param orientationY rotation around the Y axis; 0 is not written to the record
   */
  public static Part label(String activationKey, int orientationY) {
    Part label = new Part(PartKind.LABEL);
    label.extraData.put(EXTRA_ACTIVATION_KEY, activationKey);
    if (orientationY != 0)
      label.extraData.put(EXTRA_ORIENTATION_Y, orientationY);
    return label;
  }

  public PartKind getKind() { return kind; }
  public List<Position> getPositions() { return Collections.unmodifiableList(positions); }
  public Map<String, Object> getExtraData() { return Collections.unmodifiableMap(extraData); }

  public boolean isCupFree(int cup) { return Boolean.FALSE.equals(cups.get(cup)); }
  public List<Integer> freeCups() {
    List<Integer> ret = new ArrayList<>();
    cups.forEach((cup, used) -> {
      if (!used)
        ret.add(cup);
    });
    return ret;
  }
  public int freeCupCount() { return freeCups().size(); }

  /** First free attachment in the kind's selection order, or -1. */
  public int freeAttachment() {
    for (Map.Entry<Integer, Boolean> entry : attachments.entrySet())
      if (!entry.getValue())
        return entry.getKey();
    return -1;
  }
  public boolean hasFreeAttachment() { return freeAttachment() != -1; }

  @Override
  public Part sourcePart() {
    return this;
  }

  @Override
  public Part targetPart(int cup) {
    return this;
  }

  /**
   * Uses the next free attachment of this part and {@code cup} of {@code target}.
   * @throws StructuralException if the cup is missing or used, this part has no free attachment, or this part is already finalized
   */
  void plugInto(Part target, int cup) throws StructuralException {
    if (isFinalized())
      throw new StructuralException(String.format("%s is finalized and cannot make new connections", describe()));
    if (!target.cups.containsKey(cup))
      throw new StructuralException(String.format("%s has no cup %d", target.describe(), cup));
    if (target.cups.get(cup))
      throw new StructuralException(String.format("Cup %d of %s is already used", cup, target.describe()));
    int attachment = freeAttachment();
    if (attachment == -1)
      throw new StructuralException(String.format("No empty attachment left on %s", describe()));

    attachments.put(attachment, true);
    target.cups.put(cup, true);
    positions.add(new Position(attachment, cup, target));
  }

  @Override
  public OptionalInt id() {
    return id == -1 ? OptionalInt.empty() : OptionalInt.of(id);
  }

  @Override
  public boolean isFinalized() {
    return id != -1;
  }

  @Override
  public void finalizePart(CompileStack stack) throws StructuralException {
    if (isFinalized())
      throw new StructuralException(String.format("%s is already finalized", describe()));
    List<List<Integer>> resolved = new ArrayList<>(positions.size());
    for (Position position : positions) {
      OptionalInt targetId = position.target().id();
      if (targetId.isEmpty())
        throw new StructuralException(String.format("%s depends on %s, which is not finalized yet", describe(), position.target().describe()));
      resolved.add(List.of(position.attachment(), position.cup(), targetId.getAsInt()));
    }
    this.id = stack.append(new PartRecord(kind.typeName, resolved, extraData));
  }

  public String describe() {
    Object key = extraData.get(EXTRA_ACTIVATION_KEY);
    return kind.typeName + (key != null ? "[" + key + "]" : "") + (isFinalized() ? "#" + id : "");
  }

  @Override
  public String toString() {
    return describe() + positions;
  }
}
