package gateforge.frontend;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tokens of one ';'-terminated statement.
 * @param index 1-based position of the statement in the source, counting only non-empty statements
 * @param tokens the statement's tokens, never empty
 */
public record Statement(int index, List<Token> tokens) {
  public Statement {
    tokens = List.copyOf(tokens);
  }

  public int size() { return tokens.size(); }
  public Token get(int i) { return tokens.get(i); }
  public List<Token> tail(int from) { return tokens.subList(Math.min(from, tokens.size()), tokens.size()); }

  @Override
  public String toString() {
    return tokens.stream().map(Token::text).collect(Collectors.joining(" "));
  }
}
