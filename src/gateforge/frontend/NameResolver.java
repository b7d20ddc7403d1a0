package gateforge.frontend;

import java.util.HashMap;

/**
 * Versioned-name resolver: maps a source name to its current generation, and a generation to the identifier it is bound under.
 * Generation 0 is the source name itself; later generations are hidden names no source identifier can spell.
 */
public class NameResolver {
  private final HashMap<String, Integer> generations = new HashMap<>();

  public static String hiddenName(String sourceName, int generation) {
    return generation == 0 ? sourceName : sourceName + "_v" + generation;
  }

  public int generation(String sourceName) { return generations.getOrDefault(sourceName, 0); }

  /** Identifier the newest binding of {@code sourceName} lives under. */
  public String resolve(String sourceName) { return hiddenName(sourceName, generation(sourceName)); }

  /**
   * Starts a new generation of {@code sourceName}. Uses resolved before this call are unaffected.
   * @return the hidden name of the new generation
   */
  public String redefine(String sourceName) {
    int next = generation(sourceName) + 1;
    generations.put(sourceName, next);
    return hiddenName(sourceName, next);
  }
}
