package gateforge.parts;

import static gateforge.parts.ConnectionConstants.*;

/**
 * The fixed part catalogue. Attachments are listed in the order they are handed out; cups in the order they are offered.
 */
public enum PartKind {
  CONNECTOR("Connector", new int[] {CONNECTOR_BOTTOM_ATTACHMENT},
            new int[] {CONNECTOR_TOP_CUP, CONNECTOR_FRONT_CUP, CONNECTOR_BACK_CUP, CONNECTOR_SIDE_CUP1, CONNECTOR_SIDE_CUP2}),
  SHORT_STICK("ShortStick", new int[] {SHORT_STICK_ATTACHMENT}, new int[] {SHORT_STICK_CUP}),
  GYRO("Gyro", new int[] {GYRO_ATTACHMENT}, new int[] {}),
  LABEL("InputSensor", new int[] {LABEL_ATTACHMENT}, new int[] {LABEL_CUP}),
  GATE_AND("Gate-AND", new int[] {GATE_ATTACHMENT}, new int[] {TRI_GATE_OUTPUT, TRI_GATE_INPUT1, TRI_GATE_INPUT2}),
  GATE_OR("Gate-OR", new int[] {GATE_ATTACHMENT}, new int[] {TRI_GATE_OUTPUT, TRI_GATE_INPUT1, TRI_GATE_INPUT2}),
  GATE_NOT("Gate-NOT", new int[] {GATE_ATTACHMENT}, new int[] {TWO_GATE_OUTPUT, TWO_GATE_INPUT}),
  WIRE("Wire", new int[] {WIRE_BALL_ATTACHMENT1, WIRE_BALL_ATTACHMENT2}, new int[] {WIRE_CUP1, WIRE_CUP2}),
  // The switch base sits on its second ball, so that one is used first.
  SWITCH("Switch", new int[] {WIRE_BALL_ATTACHMENT2, WIRE_BALL_ATTACHMENT1}, new int[] {WIRE_CUP2}),
  BUTTON("Button", new int[] {WIRE_BALL_ATTACHMENT2, WIRE_BALL_ATTACHMENT1}, new int[] {WIRE_CUP2});

  /** name written to the compiled record */
  public final String typeName;
  private final int[] attachments;
  private final int[] cups;

  private PartKind(String typeName, int[] attachments, int[] cups) {
    this.typeName = typeName;
    this.attachments = attachments;
    this.cups = cups;
  }

  public int[] attachments() { return attachments.clone(); }
  public int[] cups() { return cups.clone(); }

  public boolean hasCup(int cup) {
    for (int c : cups)
      if (c == cup)
        return true;
    return false;
  }

  /** true for the kinds a {@link CompositeWire} can be built from */
  public boolean isWireLike() { return this == WIRE || this == SWITCH || this == BUTTON; }
}
