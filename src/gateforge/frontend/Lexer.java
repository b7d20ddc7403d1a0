package gateforge.frontend;

import gateforge.LexicalException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Strips comments, splits the source into statements and tokenizes each statement.
 */
public class Lexer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Non-nesting block comments; the first closing delimiter ends the comment. */
  static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
  static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_]+|[=()]");
  static final Pattern IDENTIFIER = Pattern.compile("[A-Z0-9_]+");

  public static final char TERMINATOR = ';';

  public static boolean isValidIdentifier(String text) { return IDENTIFIER.matcher(text).matches(); }

  public static String stripComments(String source) { return COMMENT.matcher(source).replaceAll(""); }

  /**
   * Splits the (comment-free) source on the statement terminator and tokenizes every non-blank piece.
   * @param source the program text
   * @return the statements in source order
   * @throws LexicalException if a statement contains a character that cannot start a token
   */
  public List<Statement> split(String source) throws LexicalException {
    String stripped = stripComments(source);
    List<Statement> statements = new ArrayList<>();
    int index = 0;
    for (String segment : stripped.split(Pattern.quote(String.valueOf(TERMINATOR)), -1)) {
      String trimmed = segment.trim();
      if (trimmed.isEmpty())
        continue;
      ++index;
      statements.add(new Statement(index, tokenize(trimmed, index)));
    }
    logger.debug("Split source into {} statements", statements.size());
    return statements;
  }

  List<Token> tokenize(String segment, int index) throws LexicalException {
    List<Token> tokens = new ArrayList<>();
    Matcher matcher = TOKEN.matcher(segment);
    int pos = 0;
    while (matcher.find()) {
      checkGap(segment, pos, matcher.start(), index);
      tokens.add(Token.of(matcher.group()));
      pos = matcher.end();
    }
    checkGap(segment, pos, segment.length(), index);
    return tokens;
  }

  // Only whitespace may separate tokens.
  private static void checkGap(String segment, int from, int to, int index) throws LexicalException {
    for (int i = from; i < to; i++) {
      char c = segment.charAt(i);
      if (!Character.isWhitespace(c))
        throw new LexicalException(String.format("Unexpected character '%c' in statement %d: %s", c, index, segment));
    }
  }
}
