package gateforge.backend;

import gateforge.StructuralException;
import gateforge.parts.CompileStack;
import gateforge.parts.ConnectionConstants;
import gateforge.parts.Part;
import gateforge.parts.PartKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Vertical stack of connectors the gates are mounted on. The top cup of every connector is kept for the next connector.
 */
class MountingChain {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompileStack stack;
  private final List<Part> connectors = new ArrayList<>();

  /** @param base the first connector, already finalized */
  MountingChain(Part base, CompileStack stack) {
    this.stack = stack;
    this.connectors.add(base);
  }

  List<Part> getConnectors() { return Collections.unmodifiableList(connectors); }

  Part last() { return connectors.get(connectors.size() - 1); }

  /**
   * Plugs {@code gate} into the first free mounting cup, growing the chain if the current connector is full.
   */
  void mount(Part gate) throws StructuralException {
    int cup = freeMountingCup(last());
    if (cup == -1) {
      grow();
      cup = freeMountingCup(last());
    }
    gate.connect(last(), cup);
  }

  /** Appends a finalized connector on the reserved cup of the current one. */
  Part grow() throws StructuralException {
    Part next = new Part(PartKind.CONNECTOR);
    next.connect(last(), ConnectionConstants.CONNECTOR_TOP_CUP);
    next.finalizePart(stack);
    connectors.add(next);
    logger.debug("Mounting chain grew to {} connectors", connectors.size());
    return next;
  }

  private static int freeMountingCup(Part connector) {
    for (int cup : connector.freeCups())
      if (cup != ConnectionConstants.CONNECTOR_TOP_CUP)
        return cup;
    return -1;
  }
}
