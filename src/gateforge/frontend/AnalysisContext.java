package gateforge.frontend;

/**
 * State owned by a single {@link Analyzer#analyze(String)} invocation.
 */
public class AnalysisContext {
  public static final String TEMP_PREFIX = "_t";

  final NameTable table = new NameTable();
  final NameResolver resolver = new NameResolver();
  private int tempCounter = 0;

  public String nextTempName() { return TEMP_PREFIX + (tempCounter++); }
  public int tempCount() { return tempCounter; }
}
