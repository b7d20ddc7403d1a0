package gateforge.frontend;

import gateforge.CircuitCompileException;
import gateforge.LexicalException;
import gateforge.ReferenceException;
import gateforge.SyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Front half of the compiler: classifies statements and runs every assignment through parse, normalize, flatten and name
 * resolution, producing the {@link NameTable} the physical compiler consumes.
 */
public class Analyzer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Lexer lexer = new Lexer();
  private final Optional<String> initSignal;

  /**
   * @param initSignal name of the implicit init input; if present, the input is declared first and every inverter is gated on it
   */
  public Analyzer(Optional<String> initSignal) { this.initSignal = initSignal; }
  public Analyzer() { this(Optional.empty()); }

  /**
   * Analyzes a whole program. Every call starts from an empty context.
   * @param source program text
   * @return the name table in declaration order
   * @throws CircuitCompileException on the first lexical, syntax or reference error
   */
  public NameTable analyze(String source) throws CircuitCompileException {
    AnalysisContext ctx = new AnalysisContext();
    if (initSignal.isPresent()) {
      ctx.table.add(NameRecord.input(initSignal.get()));
      logger.debug("Declared init signal {}", initSignal.get());
    }
    for (Statement statement : lexer.split(source)) {
      Token leading = statement.get(0);
      if (leading.is(Keyword.INPUT)) {
        declareInput(ctx, statement);
      } else if (leading.is(Keyword.OUTPUT)) {
        List<Token> rest = statement.tail(1);
        if (rest.size() == 1) {
          // output X; -> output X = X;
          rest = List.of(rest.get(0), Token.of("="), rest.get(0));
        }
        define(ctx, statement, rest, NameKind.OUTPUT);
      } else if (leading.kind() == Token.Kind.WORD && !Keyword.isKeyword(leading.text()) && Lexer.isValidIdentifier(leading.text())) {
        define(ctx, statement, statement.tokens(), NameKind.VARIABLE);
      } else {
        throw new SyntaxException(String.format("Unknown token '%s' at start of statement %d: %s", leading.text(), statement.index(),
                                                statement));
      }
    }
    logger.debug("Analysis produced {} names ({} temporaries)", ctx.table.size(), ctx.tempCount());
    return ctx.table;
  }

  private void declareInput(AnalysisContext ctx, Statement statement) throws CircuitCompileException {
    if (statement.size() != 2)
      throw new SyntaxException(String.format("Input must be exactly one value in statement %d: %s", statement.index(), statement));
    String name = checkTargetName(statement.get(1), statement);
    if (ctx.table.contains(ctx.resolver.resolve(name)))
      throw new SyntaxException(String.format("'%s' is already defined, cannot declare it as input (statement %d)", name,
                                              statement.index()));
    ctx.table.add(NameRecord.input(name));
    logger.debug("input {}", name);
  }

  /**
   * Handles {@code NAME = EXPR} for variables and outputs.
   * @param line the statement tokens starting at the target name
   */
  private void define(AnalysisContext ctx, Statement statement, List<Token> line, NameKind kind) throws CircuitCompileException {
    if (line.isEmpty())
      throw new SyntaxException(String.format("Missing name in statement %d: %s", statement.index(), statement));
    String name = checkTargetName(line.get(0), statement);
    if (line.size() < 2 || line.get(1).kind() != Token.Kind.EQUALS)
      throw new SyntaxException(String.format("Definition of '%s' must start with '=' (statement %d: %s)", name, statement.index(),
                                              statement));

    Expr raw = new ExpressionParser(line.subList(2, line.size()), initSignal).parse();

    // Right-hand side sees the bindings live before this statement, its own target name included.
    Expr resolved = raw.rename(ctx.resolver::resolve);
    List<String> unbound = new ArrayList<>();
    collectUnbound(resolved, ctx.table, unbound);
    if (!unbound.isEmpty())
      throw new ReferenceException(String.format("'%s' used before definition in statement %d: %s", unbound.get(0), statement.index(),
                                                 statement));

    String target = name;
    Optional<NameRecord> live = ctx.table.lookup(ctx.resolver.resolve(name));
    if (live.isPresent()) {
      if (!live.get().getKind().isRedefinable())
        throw new SyntaxException(String.format("Cannot redefine %s '%s' (statement %d)", live.get().getKind().name().toLowerCase(), name,
                                                statement.index()));
      target = ctx.resolver.redefine(name);
      logger.debug("Redefinition of {} bound as {}", name, target);
    }

    Expr normalized = GateNormalizer.normalize(resolved);
    Flattener.Flattened flat = new Flattener(ctx::nextTempName).flatten(normalized);
    for (Flattener.TempAssignment temp : flat.temps()) {
      ctx.table.add(new NameRecord(temp.name(), temp.name(), NameKind.TEMP, temp.op()));
      logger.trace("temp {}", temp);
    }
    ctx.table.add(new NameRecord(target, name, kind, new Value.Ref(flat.result())));
    logger.debug("{} {} = {}", kind.name().toLowerCase(), target, resolved);
  }

  private String checkTargetName(Token token, Statement statement) throws CircuitCompileException {
    String name = token.text();
    if (token.kind() != Token.Kind.WORD || Keyword.isKeyword(name))
      throw new SyntaxException(String.format("Expected a name but found '%s' in statement %d: %s", name, statement.index(), statement));
    if (!Lexer.isValidIdentifier(name))
      throw new LexicalException(String.format("Invalid name '%s' in statement %d: names must contain only uppercase letters, digits and "
                                                   + "underscores",
                                               name, statement.index()));
    if (initSignal.isPresent() && initSignal.get().equals(name))
      throw new SyntaxException(String.format("'%s' is reserved for the init signal (statement %d)", name, statement.index()));
    return name;
  }

  private static void collectUnbound(Expr expr, NameTable table, List<String> unbound) {
    if (expr instanceof Expr.Ident) {
      String name = ((Expr.Ident)expr).name();
      if (!table.contains(name))
        unbound.add(name);
    } else if (expr instanceof Expr.Not) {
      collectUnbound(((Expr.Not)expr).operand(), table, unbound);
    } else {
      Expr.Binary binary = (Expr.Binary)expr;
      collectUnbound(binary.left(), table, unbound);
      collectUnbound(binary.right(), table, unbound);
    }
  }
}
