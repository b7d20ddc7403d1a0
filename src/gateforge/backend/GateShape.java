package gateforge.backend;

import static gateforge.parts.ConnectionConstants.*;

import gateforge.AmbiguityException;
import gateforge.frontend.Gate;
import gateforge.frontend.Value;
import gateforge.parts.PartKind;

/**
 * Physical shape of a primitive gate: the part kind, the cups its operands plug into and the cup its result leaves from.
 */
public enum GateShape {
  AND(Gate.AND, PartKind.GATE_AND, new int[] {TRI_GATE_INPUT1, TRI_GATE_INPUT2}, TRI_GATE_OUTPUT),
  OR(Gate.OR, PartKind.GATE_OR, new int[] {TRI_GATE_INPUT1, TRI_GATE_INPUT2}, TRI_GATE_OUTPUT),
  NOT(Gate.NOT, PartKind.GATE_NOT, new int[] {TWO_GATE_INPUT}, TWO_GATE_OUTPUT);

  public final Gate gate;
  public final PartKind kind;
  private final int[] inputCups;
  public final int outputCup;

  private GateShape(Gate gate, PartKind kind, int[] inputCups, int outputCup) {
    this.gate = gate;
    this.kind = kind;
    this.inputCups = inputCups;
    this.outputCup = outputCup;
  }

  public int inputCup(int operand) { return inputCups[operand]; }
  public int inputCount() { return inputCups.length; }

  /**
   * Picks the single shape an operation fits.
   * @throws AmbiguityException if no shape or more than one shape matches the gate and operand count
   */
  public static GateShape of(Value.Op op) throws AmbiguityException {
    GateShape match = null;
    for (GateShape shape : values()) {
      if (shape.gate != op.gate() || shape.inputCount() != op.operands().size())
        continue;
      if (match != null)
        throw new AmbiguityException(String.format("Operation '%s' matches both %s and %s", op, match, shape));
      match = shape;
    }
    if (match == null)
      throw new AmbiguityException(String.format("Operation '%s' with %d operands matches no gate", op, op.operands().size()));
    return match;
  }
}
