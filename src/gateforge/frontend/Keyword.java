package gateforge.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/** Reserved words of the source language. */
public enum Keyword {
  AND("and"),
  OR("or"),
  NOT("not"),
  NAND("nand"),
  NOR("nor"),
  XOR("xor"),
  XNOR("xnor"),
  INPUT("input"),
  OUTPUT("output");

  public final String serialName;

  private Keyword(String serialName) { this.serialName = serialName; }

  public static Optional<Keyword> fromSerialName(String serialName) {
    return Stream.of(Keyword.values()).filter(keyword -> keyword.serialName.equals(serialName)).findAny();
  }
  public static boolean isKeyword(String text) { return fromSerialName(text).isPresent(); }
}
