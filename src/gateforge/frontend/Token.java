package gateforge.frontend;

/**
 * Atomic lexical unit. Keywords and identifiers share {@link Kind#WORD}; they are told apart downstream via {@link Keyword}.
 */
public record Token(String text, Kind kind) {
  public enum Kind { WORD, EQUALS, OPEN, CLOSE }

  public static Token of(String text) {
    switch (text) {
    case "=":
      return new Token(text, Kind.EQUALS);
    case "(":
      return new Token(text, Kind.OPEN);
    case ")":
      return new Token(text, Kind.CLOSE);
    default:
      return new Token(text, Kind.WORD);
    }
  }

  public boolean is(String other) { return text.equals(other); }
  public boolean is(Keyword keyword) { return kind == Kind.WORD && text.equals(keyword.serialName); }

  @Override
  public String toString() {
    return text;
  }
}
