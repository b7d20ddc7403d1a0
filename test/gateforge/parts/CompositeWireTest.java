package gateforge.parts;

import static gateforge.parts.ConnectionConstants.*;

import gateforge.StructuralException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CompositeWireTest {

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 5, 9})
  void testSourceGrowth(int fanout) throws Exception {
    CompositeWire wire = CompositeWire.switchBased();
    List<Part> gates = new ArrayList<>();
    for (int i = 0; i < fanout; ++i) {
      Part gate = new Part(PartKind.GATE_NOT);
      wire.connect(gate, TWO_GATE_INPUT);
      gates.add(gate);
    }
    // two balls on the switch, one spare ball on every added link
    Assertions.assertEquals(Math.max(1, fanout - 1), wire.getParts().size());
    Assertions.assertEquals(PartKind.SWITCH, wire.getParts().get(0).getKind());
    for (Part link : wire.getParts().subList(1, wire.getParts().size()))
      Assertions.assertEquals(PartKind.WIRE, link.getKind());

    CompileStack stack = new CompileStack();
    for (Part gate : gates)
      gate.finalizePart(stack);
    wire.finalizePart(stack);
    Assertions.assertEquals(fanout + wire.getParts().size(), stack.size());
    for (int id = 1; id <= stack.size(); ++id)
      for (List<Integer> position : stack.get(id).positions())
        Assertions.assertTrue(position.get(2) < id, "part " + id + " references " + position.get(2));
  }

  @Test
  void testIdentity() throws Exception {
    CompositeWire wire = CompositeWire.wire();
    Part gate = new Part(PartKind.GATE_AND);
    wire.connect(gate, TRI_GATE_INPUT1);
    wire.connect(gate, TRI_GATE_INPUT2);
    wire.connect(gate, TRI_GATE_OUTPUT);
    Assertions.assertTrue(wire.id().isEmpty());

    CompileStack stack = new CompileStack();
    gate.finalizePart(stack);
    wire.finalizePart(stack);
    // base wire gave a cup to the link, the link kept both of its cups
    Assertions.assertEquals(2, wire.getParts().size());
    Assertions.assertEquals(wire.getParts().get(1).id(), wire.id());
    Assertions.assertEquals(3, wire.id().getAsInt());
  }

  @Test
  void testIdentityTieGoesToEarliest() throws Exception {
    CompositeWire wire = CompositeWire.wire();
    CompileStack stack = new CompileStack();
    wire.finalizePart(stack);
    Assertions.assertEquals(1, wire.id().getAsInt());
  }

  @Test
  void testTargetGrowth() throws Exception {
    CompositeWire wire = CompositeWire.wire();
    Part first = new Part(PartKind.GYRO);
    Part second = new Part(PartKind.GYRO);
    first.connect(wire, WIRE_CUP1);
    second.connect(wire, WIRE_CUP1);
    Assertions.assertEquals(2, wire.getParts().size());
    Assertions.assertSame(wire.getParts().get(0), first.getPositions().get(0).target());
    Assertions.assertSame(wire.getParts().get(1), second.getPositions().get(0).target());
  }

  @Test
  void testTargetPrefersMostFreeCups() throws Exception {
    CompositeWire wire = CompositeWire.wire();
    Part gate = new Part(PartKind.GATE_OR);
    wire.connect(gate, TRI_GATE_INPUT1);
    wire.connect(gate, TRI_GATE_INPUT2);
    wire.connect(gate, TRI_GATE_OUTPUT);
    // base has only cup 2 left, the link has both
    Part gyro = new Part(PartKind.GYRO);
    gyro.connect(wire, WIRE_CUP2);
    Assertions.assertSame(wire.getParts().get(1), gyro.getPositions().get(0).target());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 5})
  void testUnknownCupDoesNotGrow(int cup) throws Exception {
    CompositeWire wire = CompositeWire.wire();
    Assertions.assertThrows(StructuralException.class, () -> new Part(PartKind.GYRO).connect(wire, cup));
    Assertions.assertEquals(1, wire.getParts().size());
    Assertions.assertEquals(List.of(WIRE_CUP1, WIRE_CUP2), wire.getParts().get(0).freeCups());
  }

  @Test
  void testFinalizedWireIsClosed() throws Exception {
    CompositeWire wire = CompositeWire.switchBased();
    wire.finalizePart(new CompileStack());
    Assertions.assertTrue(wire.isFinalized());
    Assertions.assertThrows(StructuralException.class, () -> wire.connect(new Part(PartKind.GATE_NOT), TWO_GATE_INPUT));
    Assertions.assertThrows(StructuralException.class, () -> wire.finalizePart(new CompileStack()));
  }

  @Test
  void testRejectsNonWireBase() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new CompositeWire(PartKind.CONNECTOR));
  }
}
