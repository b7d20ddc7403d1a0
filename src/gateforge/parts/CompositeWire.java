package gateforge.parts;

import gateforge.StructuralException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logical wire backed by a growing chain of wire parts. The first part is of the base kind, every link added later is a
 * {@link PartKind#WIRE} plugged into a free cup of the current tail.
 */
public class CompositeWire implements Connectable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final PartKind baseKind;
  private final List<Part> parts = new ArrayList<>();
  private boolean finalized = false;

  public CompositeWire(PartKind baseKind) {
    if (!baseKind.isWireLike())
      throw new IllegalArgumentException(baseKind + " cannot back a composite wire");
    this.baseKind = baseKind;
    this.parts.add(new Part(baseKind));
  }

  public static CompositeWire wire() { return new CompositeWire(PartKind.WIRE); }
  public static CompositeWire switchBased() { return new CompositeWire(PartKind.SWITCH); }
  public static CompositeWire buttonBased() { return new CompositeWire(PartKind.BUTTON); }

  public PartKind getBaseKind() { return baseKind; }
  public List<Part> getParts() { return Collections.unmodifiableList(parts); }

  @Override
  public Part sourcePart() throws StructuralException {
    checkOpen();
    for (Part part : parts)
      if (part.hasFreeAttachment())
        return part;
    return extend();
  }

  @Override
  public Part targetPart(int cup) throws StructuralException {
    checkOpen();
    Part best = null;
    for (Part part : parts)
      if (part.isCupFree(cup) && (best == null || part.freeCupCount() > best.freeCupCount()))
        best = part;
    if (best != null)
      return best;
    if (!PartKind.WIRE.hasCup(cup))
      throw new StructuralException(String.format("Composite wire has no cup %d", cup));
    return extend();
  }

  private Part extend() throws StructuralException {
    Part tail = parts.get(parts.size() - 1);
    List<Integer> freeCups = tail.freeCups();
    if (freeCups.isEmpty())
      throw new StructuralException(String.format("Cannot extend composite wire: no free cups on %s", tail.describe()));
    Part link = new Part(PartKind.WIRE);
    link.plugInto(tail, freeCups.get(0));
    parts.add(link);
    logger.trace("Composite {} wire grew to {} parts", baseKind.typeName, parts.size());
    return link;
  }

  private void checkOpen() throws StructuralException {
    if (finalized)
      throw new StructuralException("Composite wire is finalized and cannot make new connections");
  }

  /** Id of the finalized backing part with the most free cups; the earliest one wins ties. */
  @Override
  public OptionalInt id() {
    Part best = null;
    for (Part part : parts)
      if (part.isFinalized() && (best == null || part.freeCupCount() > best.freeCupCount()))
        best = part;
    return best == null ? OptionalInt.empty() : best.id();
  }

  @Override
  public boolean isFinalized() {
    return finalized;
  }

  @Override
  public void finalizePart(CompileStack stack) throws StructuralException {
    if (finalized)
      throw new StructuralException("Composite wire is already finalized");
    finalized = true;
    for (Part part : parts)
      part.finalizePart(stack);
  }

  @Override
  public String toString() {
    return "Composite" + parts;
  }
}
