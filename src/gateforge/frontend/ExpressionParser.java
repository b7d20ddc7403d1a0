package gateforge.frontend;

import gateforge.LexicalException;
import gateforge.SyntaxException;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for the right-hand side of an assignment.
 *
 * <pre>
 * expr     := andLevel (('or'|'nor'|'xor'|'xnor') andLevel)*
 * andLevel := primary (('and'|'nand') primary)*
 * primary  := '(' expr ')' | 'not' primary | IDENTIFIER
 * </pre>
 *
 * Both binary levels are left-associative.
 */
public class ExpressionParser {
  private final List<Token> tokens;
  private final Optional<String> initSignal;
  private int pos = 0;

  /**
   * @param tokens the expression tokens
   * @param initSignal if present, every {@code not X} is parsed as {@code not (INIT or X)}
   */
  public ExpressionParser(List<Token> tokens, Optional<String> initSignal) {
    this.tokens = tokens;
    this.initSignal = initSignal;
  }
  public ExpressionParser(List<Token> tokens) { this(tokens, Optional.empty()); }

  public static Expr parse(List<Token> tokens) throws SyntaxException, LexicalException {
    return new ExpressionParser(tokens).parse();
  }

  /**
   * Parses the whole token list as one expression.
   * @throws LexicalException if a word is neither a keyword nor a valid identifier
   * @throws SyntaxException if the tokens do not form exactly one expression
   */
  public Expr parse() throws SyntaxException, LexicalException {
    for (Token token : tokens) {
      if (token.kind() == Token.Kind.WORD && !Keyword.isKeyword(token.text()) && !Lexer.isValidIdentifier(token.text()))
        throw new LexicalException(String.format("Unknown token '%s': names must contain only uppercase letters, digits and underscores",
                                                 token.text()));
    }
    pos = 0;
    Expr expr = parseOrLevel();
    if (pos < tokens.size())
      throw new SyntaxException(String.format("Unexpected token '%s' after complete expression", tokens.get(pos).text()));
    return expr;
  }

  private Expr parseOrLevel() throws SyntaxException {
    Expr left = parseAndLevel();
    Optional<BinaryOp> op;
    while ((op = peekOp(false)).isPresent()) {
      ++pos;
      Expr right = parseAndLevel();
      left = new Expr.Binary(op.get(), left, right);
    }
    return left;
  }

  private Expr parseAndLevel() throws SyntaxException {
    Expr left = parsePrimary();
    Optional<BinaryOp> op;
    while ((op = peekOp(true)).isPresent()) {
      ++pos;
      Expr right = parsePrimary();
      left = new Expr.Binary(op.get(), left, right);
    }
    return left;
  }

  private Optional<BinaryOp> peekOp(boolean andLevel) {
    if (pos >= tokens.size())
      return Optional.empty();
    return BinaryOp.fromToken(tokens.get(pos)).filter(op -> op.andLevel == andLevel);
  }

  private Expr parsePrimary() throws SyntaxException {
    if (pos >= tokens.size())
      throw new SyntaxException("Unexpected end of expression");
    Token token = tokens.get(pos++);

    if (token.kind() == Token.Kind.OPEN) {
      Expr inner = parseOrLevel();
      if (pos >= tokens.size() || tokens.get(pos).kind() != Token.Kind.CLOSE)
        throw new SyntaxException("Expected ')'");
      ++pos;
      return inner;
    }
    if (token.is(Keyword.NOT)) {
      Expr operand = parsePrimary();
      if (initSignal.isPresent())
        operand = Expr.or(Expr.ident(initSignal.get()), operand);
      return Expr.not(operand);
    }
    if (token.kind() == Token.Kind.WORD && !Keyword.isKeyword(token.text()) && Lexer.isValidIdentifier(token.text()))
      return Expr.ident(token.text());
    throw new SyntaxException(String.format("Unexpected token '%s'", token.text()));
  }
}
