package gateforge.frontend;

import gateforge.CircuitCompileException;
import gateforge.ErrorKind;
import gateforge.LexicalException;
import gateforge.ReferenceException;
import gateforge.SyntaxException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AnalyzerTest {

  /** Evaluates every record of the table in order, the way the built circuit would. */
  static Map<String, Boolean> simulate(NameTable table, Map<String, Boolean> inputs) {
    Map<String, Boolean> values = new HashMap<>();
    for (NameRecord record : table.records()) {
      Value value = record.getValue();
      if (value == null) {
        values.put(record.getName(), inputs.get(record.getName()));
      } else if (value instanceof Value.Ref) {
        values.put(record.getName(), values.get(((Value.Ref)value).name()));
      } else {
        Value.Op op = (Value.Op)value;
        boolean[] args = new boolean[op.operands().size()];
        for (int i = 0; i < args.length; ++i)
          args[i] = values.get(op.operands().get(i));
        values.put(record.getName(), op.gate().apply(args));
      }
    }
    return values;
  }

  private static List<String> names(NameTable table) {
    return table.records().stream().map(NameRecord::getName).collect(Collectors.toList());
  }

  @Test
  void testSimpleProgram() throws Exception {
    NameTable table = new Analyzer().analyze("input A; input B; output OUT = A and B;");
    Assertions.assertEquals(List.of("A", "B", "_t0", "OUT"), names(table));
    Assertions.assertEquals(NameKind.INPUT, table.lookup("A").get().getKind());
    Assertions.assertEquals(NameKind.TEMP, table.lookup("_t0").get().getKind());
    Assertions.assertEquals(Value.Op.of(Gate.AND, "A", "B"), table.lookup("_t0").get().getValue());
    NameRecord out = table.lookup("OUT").get();
    Assertions.assertEquals(NameKind.OUTPUT, out.getKind());
    Assertions.assertEquals(new Value.Ref("_t0"), out.getValue());
  }

  @Test
  void testXorOfSameInput() throws Exception {
    NameTable table = new Analyzer().analyze("input A; output OUT = A xor A;");
    var gates = table.ofKind(NameKind.TEMP).stream().map(r -> ((Value.Op)r.getValue()).gate()).collect(Collectors.toList());
    Assertions.assertEquals(2, gates.stream().filter(g -> g == Gate.NOT).count());
    Assertions.assertEquals(2, gates.stream().filter(g -> g == Gate.AND).count());
    Assertions.assertEquals(1, gates.stream().filter(g -> g == Gate.OR).count());
    for (boolean a : new boolean[] {false, true})
      Assertions.assertFalse(simulate(table, Map.of("A", a)).get("OUT"));
  }

  @Test
  void testOutputShorthand() throws Exception {
    NameTable table = new Analyzer().analyze("input A; X = not A; output X;");
    NameRecord out = table.lookup("X_v1").get();
    Assertions.assertEquals(NameKind.OUTPUT, out.getKind());
    Assertions.assertEquals("X", out.getSourceName());
    Assertions.assertTrue(out.isHidden());
    Assertions.assertEquals(new Value.Ref("X"), out.getValue());
  }

  @Test
  void testRedefinitionIsForwardOnly() throws Exception {
    NameTable table = new Analyzer().analyze("input X; input Y; A = X; B = A; A = A and Y; output C = A; output D = B;");
    // B captured the first A and must keep it
    Assertions.assertEquals(new Value.Ref("A"), table.lookup("B").get().getValue());
    NameRecord second = table.lookup("A_v1").get();
    Assertions.assertEquals(NameKind.VARIABLE, second.getKind());
    String temp = ((Value.Ref)second.getValue()).name();
    Assertions.assertEquals(Value.Op.of(Gate.AND, "A", "Y"), table.lookup(temp).get().getValue());
    Assertions.assertEquals(new Value.Ref("A_v1"), table.lookup("C").get().getValue());

    var values = simulate(table, Map.of("X", true, "Y", false));
    Assertions.assertEquals(false, values.get("C"));
    Assertions.assertEquals(true, values.get("D"));
  }

  @Test
  void testAccumulation() throws Exception {
    NameTable table = new Analyzer().analyze("input A; input B; input C; X = A; X = X or B; X = X or C; output OUT = X;");
    Assertions.assertTrue(table.contains("X_v2"));
    Assertions.assertFalse(simulate(table, Map.of("A", false, "B", false, "C", false)).get("OUT"));
    Assertions.assertTrue(simulate(table, Map.of("A", false, "B", false, "C", true)).get("OUT"));
  }

  @Test
  void testDuplicateInput() {
    var e = Assertions.assertThrows(SyntaxException.class, () -> new Analyzer().analyze("input A; input A;"));
    Assertions.assertEquals(ErrorKind.SYNTAX, e.getKind());
    Assertions.assertTrue(e.getMessage().contains("'A'"), e.getMessage());
  }

  @ParameterizedTest
  @ValueSource(strings = {"input A; A = not A;", "input A; output O = A; O = A;", "input A; output O = A; output O = A;",
                          "input A; B = A; input B;"})
  void testRedefinitionOfFixedKind(String source) {
    Assertions.assertThrows(SyntaxException.class, () -> new Analyzer().analyze(source));
  }

  @ParameterizedTest
  @ValueSource(strings = {"output OUT = A;", "input A; output OUT = A and B;", "input A; X = X or A;", "input A; B = C; C = A;"})
  void testUnboundReference(String source) {
    Assertions.assertThrows(ReferenceException.class, () -> new Analyzer().analyze(source));
  }

  @ParameterizedTest
  @ValueSource(strings = {"input;", "input A B;", "X A;", "X;", "= A;", "output = A;", "foo A;", "input A; output B = A A;",
                          "input A; X = (A;"})
  void testSyntaxErrors(String source) {
    Assertions.assertThrows(SyntaxException.class, () -> new Analyzer().analyze(source));
  }

  @ParameterizedTest
  @ValueSource(strings = {"input a;", "input A; output x = A;", "input A; X = A and b;", "input A; X = A & A;"})
  void testLexicalErrors(String source) {
    Assertions.assertThrows(LexicalException.class, () -> new Analyzer().analyze(source));
  }

  @Test
  void testInitSignal() throws Exception {
    NameTable table = new Analyzer(Optional.of("RESET")).analyze("input A; output OUT = not A;");
    Assertions.assertEquals("RESET", names(table).get(0));
    Assertions.assertEquals(NameKind.INPUT, table.lookup("RESET").get().getKind());
    // Inverter stays low while RESET is held
    Assertions.assertFalse(simulate(table, Map.of("RESET", true, "A", false)).get("OUT"));
    Assertions.assertTrue(simulate(table, Map.of("RESET", false, "A", false)).get("OUT"));
    Assertions.assertThrows(SyntaxException.class, () -> new Analyzer(Optional.of("RESET")).analyze("input RESET;"));
  }

  @Test
  void testFreshContextPerCall() throws CircuitCompileException {
    Analyzer analyzer = new Analyzer();
    NameTable first = analyzer.analyze("input A; output O = not A;");
    NameTable second = analyzer.analyze("input A; output O = not A;");
    Assertions.assertEquals(names(first), names(second));
    Assertions.assertTrue(second.contains("_t0"));
  }
}
