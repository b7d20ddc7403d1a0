package gateforge.parts;

/**
 * Attachment and cup numbers of the physical part catalogue.
 */
public final class ConnectionConstants {
  private ConnectionConstants() {}

  public static final int WIRE_BALL_ATTACHMENT1 = 1;
  public static final int WIRE_BALL_ATTACHMENT2 = 3;
  public static final int WIRE_CUP1 = 4;
  public static final int WIRE_CUP2 = 2;

  public static final int GYRO_ATTACHMENT = 1;

  public static final int LABEL_ATTACHMENT = 2;
  public static final int LABEL_CUP = 1;

  public static final int SHORT_STICK_ATTACHMENT = 2;
  public static final int SHORT_STICK_CUP = 1;

  public static final int CONNECTOR_BOTTOM_ATTACHMENT = 5;
  public static final int CONNECTOR_TOP_CUP = 4;
  public static final int CONNECTOR_FRONT_CUP = 6;
  public static final int CONNECTOR_BACK_CUP = 3;
  public static final int CONNECTOR_SIDE_CUP1 = 2;
  public static final int CONNECTOR_SIDE_CUP2 = 1;

  public static final int GATE_ATTACHMENT = 4;
  public static final int TRI_GATE_OUTPUT = 1;
  public static final int TRI_GATE_INPUT1 = 2;
  public static final int TRI_GATE_INPUT2 = 3;
  public static final int TWO_GATE_OUTPUT = 1;
  public static final int TWO_GATE_INPUT = 2;
}
