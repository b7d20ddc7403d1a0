package gateforge.parts;

/**
 * One outgoing connection: the owner's attachment plugged into a cup of {@code target}.
 */
public record Position(int attachment, int cup, Part target) {
  @Override
  public String toString() {
    return String.format("[%d -> %s.%d]", attachment, target.describe(), cup);
  }
}
