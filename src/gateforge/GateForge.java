package gateforge;

import gateforge.backend.CircuitBuilder;
import gateforge.frontend.Analyzer;
import gateforge.frontend.NameKind;
import gateforge.frontend.NameTable;
import gateforge.parts.CompileStack;
import gateforge.parts.PartKind;
import gateforge.ui.GateForgeConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiler entry point. Calls share no state; a stack handed to a failed {@link #realize} holds a partial circuit and should be dropped.
 */
public class GateForge {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final GateForgeConfig config;
  private final Analyzer analyzer;
  private final CircuitBuilder builder;

  public GateForge(GateForgeConfig config) {
    this.config = config;
    this.analyzer = new Analyzer(config.initSignal());
    this.builder = new CircuitBuilder(config);
  }
  public GateForge() { this(GateForgeConfig.loadDefault()); }

  public GateForgeConfig getConfig() { return config; }

  /**
   * Runs the front end only. Creates no parts.
   */
  public NameTable analyze(String source) throws CircuitCompileException {
    try {
      NameTable table = analyzer.analyze(source);
      logger.info("Analyzed {} inputs, {} outputs, {} temporaries", table.ofKind(NameKind.INPUT).size(), table.ofKind(NameKind.OUTPUT).size(),
                  table.ofKind(NameKind.TEMP).size());
      return table;
    } catch (CircuitCompileException e) {
      logger.debug("Analysis failed: {}", e.toString());
      throw e;
    }
  }

  /**
   * Builds the circuit of an analyzed table onto {@code stack}.
   */
  public void realize(NameTable table, CompileStack stack) throws CircuitCompileException {
    try {
      builder.realize(table, stack);
      logger.info("Realized circuit with {} parts ({} gates)", stack.size(),
                  stack.count(PartKind.GATE_AND) + stack.count(PartKind.GATE_OR) +
                      stack.count(PartKind.GATE_NOT));
    } catch (CircuitCompileException e) {
      logger.debug("Realization failed: {}", e.toString());
      throw e;
    }
  }

  /**
   * Analyzes, realizes into a fresh stack and serializes.
   * @return the encoded part list
   */
  public String compile(String source) throws CircuitCompileException {
    NameTable table = analyze(source);
    CompileStack stack = new CompileStack();
    realize(table, stack);
    return stack.terminate();
  }
}
