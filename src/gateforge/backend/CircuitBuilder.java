package gateforge.backend;

import static gateforge.parts.ConnectionConstants.*;

import gateforge.CircuitCompileException;
import gateforge.ReferenceException;
import gateforge.StructuralException;
import gateforge.frontend.NameKind;
import gateforge.frontend.NameRecord;
import gateforge.frontend.NameTable;
import gateforge.frontend.Value;
import gateforge.parts.CompileStack;
import gateforge.parts.CompositeWire;
import gateforge.parts.Connectable;
import gateforge.parts.Part;
import gateforge.parts.PartKind;
import gateforge.ui.GateForgeConfig;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Physical compiler. Turns an analyzed name table into finalized parts on a {@link CompileStack}, in an order where every part
 * only references parts finalized before it.
 */
public class CircuitBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final GateForgeConfig config;

  public CircuitBuilder(GateForgeConfig config) { this.config = config; }
  public CircuitBuilder() { this(new GateForgeConfig()); }

  /** Fixed platform the circuit stands on. */
  private static class Scaffold {
    final Part base = new Part(PartKind.CONNECTOR);
    final Part stick1 = new Part(PartKind.SHORT_STICK);
    final Part stick2 = new Part(PartKind.SHORT_STICK);
    final Part connector1 = new Part(PartKind.CONNECTOR);
    final Part connector2 = new Part(PartKind.CONNECTOR);
    final Part stick3 = new Part(PartKind.SHORT_STICK);
    final Part stick4 = new Part(PartKind.SHORT_STICK);
    final Part gyro1 = new Part(PartKind.GYRO);
    final Part gyro2 = new Part(PartKind.GYRO);
    final Part gyro3 = new Part(PartKind.GYRO);
    final Part gyro4 = new Part(PartKind.GYRO);

    void build(CompileStack stack) throws StructuralException {
      stick1.connect(base, CONNECTOR_FRONT_CUP);
      stick2.connect(base, CONNECTOR_BACK_CUP);
      connector1.connect(stick1, SHORT_STICK_CUP);
      connector2.connect(stick2, SHORT_STICK_CUP);
      gyro1.connect(base, CONNECTOR_SIDE_CUP1);
      gyro2.connect(base, CONNECTOR_SIDE_CUP2);
      gyro3.connect(connector1, CONNECTOR_TOP_CUP);
      gyro4.connect(connector2, CONNECTOR_TOP_CUP);
      stick3.connect(connector1, CONNECTOR_FRONT_CUP);
      stick4.connect(connector2, CONNECTOR_FRONT_CUP);
      for (Part part : List.of(base, stick1, stick2, connector1, connector2, stick3, stick4, gyro1, gyro2, gyro3, gyro4))
        part.finalizePart(stack);
    }
  }

  /**
   * Builds the circuit for {@code table} and appends all of its parts to {@code stack}. Sets the wire of every record.
   * @throws ReferenceException if an operand has no wire yet
   * @throws StructuralException if a connection or finalization violates the part model
   * @throws gateforge.AmbiguityException if an operation fits no single gate shape
   */
  public void realize(NameTable table, CompileStack stack) throws CircuitCompileException {
    int stackStart = stack.size();
    Scaffold scaffold = new Scaffold();
    scaffold.build(stack);

    Part gateBase = new Part(PartKind.CONNECTOR);
    gateBase.connect(scaffold.stick3, SHORT_STICK_CUP);
    gateBase.finalizePart(stack);
    MountingChain chain = new MountingChain(gateBase, stack);
    logger.debug("Scaffold done, {} parts", stack.size() - stackStart);

    List<Part> inputLabels = new ArrayList<>();
    List<Part> outputLabels = new ArrayList<>();
    for (NameRecord record : table.records()) {
      if (record.getKind() == NameKind.INPUT) {
        Part label = Part.label(record.getSourceName(), config.input_orientation);
        CompositeWire wire = isInitSignal(record) ? CompositeWire.buttonBased() : CompositeWire.switchBased();
        wire.connect(label, LABEL_CUP);
        record.setWire(wire);
        inputLabels.add(label);
        continue;
      }

      Value value = record.getValue();
      if (value instanceof Value.Ref) {
        record.setWire(wireOf(table, ((Value.Ref)value).name(), record));
      } else {
        record.setWire(buildGate(table, (Value.Op)value, record, chain, stack));
      }

      if (record.getKind() == NameKind.OUTPUT) {
        Part label = Part.label(record.getSourceName(), config.output_orientation);
        record.getWire().get().connect(label, LABEL_CUP);
        outputLabels.add(label);
      }
    }

    chain.grow();
    logger.debug("Sealed mounting chain of {} connectors", chain.getConnectors().size());

    List<Part> column = buildColumn(scaffold.stick4, Math.max(inputLabels.size(), outputLabels.size()));
    for (int i = 0; i < inputLabels.size(); i++)
      inputLabels.get(i).connect(column.get(2 * i), CONNECTOR_FRONT_CUP);
    for (int i = 0; i < outputLabels.size(); i++)
      outputLabels.get(i).connect(column.get(2 * i), CONNECTOR_BACK_CUP);

    for (Part connector : column)
      connector.finalizePart(stack);
    for (Part label : inputLabels)
      label.finalizePart(stack);
    for (Part label : outputLabels)
      label.finalizePart(stack);

    int wires = 0;
    for (NameRecord record : table.records()) {
      Connectable wire = record.getWire().get();
      if (!wire.isFinalized()) {
        wire.finalizePart(stack);
        ++wires;
      }
    }
    logger.debug("Finalized {} wires, {} parts in total", wires, stack.size() - stackStart);
  }

  private boolean isInitSignal(NameRecord record) {
    return config.initSignal().map(record.getName()::equals).orElse(false);
  }

  private Connectable buildGate(NameTable table, Value.Op op, NameRecord record, MountingChain chain, CompileStack stack)
      throws CircuitCompileException {
    GateShape shape = GateShape.of(op);
    Part gate = new Part(shape.kind);
    for (int i = 0; i < shape.inputCount(); i++)
      wireOf(table, op.operands().get(i), record).connect(gate, shape.inputCup(i));
    CompositeWire output = CompositeWire.wire();
    output.connect(gate, shape.outputCup);
    chain.mount(gate);
    gate.finalizePart(stack);
    logger.trace("{} = {} on {}", record.getName(), op, gate.describe());
    return output;
  }

  private static Connectable wireOf(NameTable table, String name, NameRecord user) throws ReferenceException {
    return table.lookup(name)
        .flatMap(NameRecord::getWire)
        .orElseThrow(() -> new ReferenceException(String.format("No wire for '%s' while building '%s'", name, user.getName())));
  }

  /** Root connector on the stick plus {@code 2 * rows} connectors stacked on top cups. Not finalized. */
  private static List<Part> buildColumn(Part stick, int rows) throws StructuralException {
    List<Part> column = new ArrayList<>();
    Part root = new Part(PartKind.CONNECTOR);
    root.connect(stick, SHORT_STICK_CUP);
    column.add(root);
    for (int i = 0; i < 2 * rows; i++) {
      Part next = new Part(PartKind.CONNECTOR);
      next.connect(column.get(column.size() - 1), CONNECTOR_TOP_CUP);
      column.add(next);
    }
    return column;
  }
}
