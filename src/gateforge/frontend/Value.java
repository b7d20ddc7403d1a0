package gateforge.frontend;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flattened definition of a name: either an alias of another name or a single primitive gate over named operands.
 */
public sealed interface Value permits Value.Ref, Value.Op {

  record Ref(String name) implements Value {
    @Override
    public String toString() {
      return name;
    }
  }

  record Op(Gate gate, List<String> operands) implements Value {
    public Op {
      operands = List.copyOf(operands);
    }
    public static Op not(String operand) { return new Op(Gate.NOT, List.of(operand)); }
    public static Op of(Gate gate, String left, String right) { return new Op(gate, List.of(left, right)); }

    @Override
    public String toString() {
      if (gate == Gate.NOT)
        return "not " + operands.get(0);
      return operands.stream().collect(Collectors.joining(" " + gate.name().toLowerCase() + " "));
    }
  }
}
