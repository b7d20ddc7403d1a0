package gateforge.frontend;

import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class GateNormalizerTest {

  @ParameterizedTest
  @EnumSource(BinaryOp.class)
  void testTruthTable(BinaryOp op) {
    Expr original = new Expr.Binary(op, Expr.ident("A"), Expr.ident("B"));
    Expr normalized = GateNormalizer.normalize(original);
    Assertions.assertTrue(GateNormalizer.isPrimitive(normalized), normalized.toString());
    for (boolean a : new boolean[] {false, true}) {
      for (boolean b : new boolean[] {false, true}) {
        var values = Map.of("A", a, "B", b);
        Assertions.assertEquals(op.apply(a, b), normalized.evaluate(values), op + " with A=" + a + " B=" + b);
        Assertions.assertEquals(original.evaluate(values), normalized.evaluate(values));
      }
    }
  }

  @Test
  void testNested() {
    // (A xor B) nor not (C xnor A)
    Expr original = new Expr.Binary(BinaryOp.NOR, new Expr.Binary(BinaryOp.XOR, Expr.ident("A"), Expr.ident("B")),
                                     Expr.not(new Expr.Binary(BinaryOp.XNOR, Expr.ident("C"), Expr.ident("A"))));
    Expr normalized = GateNormalizer.normalize(original);
    Assertions.assertTrue(GateNormalizer.isPrimitive(normalized));
    for (int bits = 0; bits < 8; ++bits) {
      var values = Map.of("A", (bits & 1) != 0, "B", (bits & 2) != 0, "C", (bits & 4) != 0);
      Assertions.assertEquals(original.evaluate(values), normalized.evaluate(values), values.toString());
    }
  }

  @Test
  void testPrimitivesPassThrough() {
    Expr expr = Expr.or(Expr.and(Expr.ident("A"), Expr.not(Expr.ident("B"))), Expr.ident("C"));
    Assertions.assertEquals(expr, GateNormalizer.normalize(expr));
    Assertions.assertFalse(GateNormalizer.isPrimitive(new Expr.Binary(BinaryOp.NAND, Expr.ident("A"), Expr.ident("B"))));
  }
}
