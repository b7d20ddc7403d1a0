package gateforge.ui;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Data-Class to hold compiler options.
 */
public class GateForgeConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String DEFAULT_RESOURCE = "gateforge.yaml";

  /** OrientationY of input labels */
  public int input_orientation = -90;
  /** OrientationY of output labels */
  public int output_orientation = 90;

  /** Gate every inverter on a button-backed init input */
  public boolean init_signal = false;
  public String init_signal_name = "_INIT";

  public Optional<String> initSignal() { return init_signal ? Optional.of(init_signal_name) : Optional.empty(); }

  /**
   * Reads a config from a YAML mapping. Missing keys keep their defaults, unknown keys are ignored with a warning.
   * @throws IllegalArgumentException if a value has the wrong type
   */
  public static GateForgeConfig load(InputStream in) {
    GateForgeConfig config = new GateForgeConfig();
    Object readData = new Yaml().load(in);
    if (readData == null)
      return config;
    if (!(readData instanceof Map))
      throw new IllegalArgumentException("Config must be a YAML mapping");
    Map<?, ?> settings = (Map<?, ?>)readData;
    for (Map.Entry<?, ?> setting : settings.entrySet()) {
      String key = setting.getKey().toString();
      Object value = setting.getValue();
      if (value == null)
        throw new IllegalArgumentException(String.format("Config key %s has no value", key));
      try {
        switch (key) {
        case "input_orientation":
          config.input_orientation = (Integer)value;
          break;
        case "output_orientation":
          config.output_orientation = (Integer)value;
          break;
        case "init_signal":
          config.init_signal = (Boolean)value;
          break;
        case "init_signal_name":
          config.init_signal_name = (String)value;
          break;
        default:
          logger.warn("Ignoring unknown config key {}", key);
        }
      } catch (ClassCastException e) {
        throw new IllegalArgumentException(String.format("Config key %s has a value of the wrong type: %s", key, value), e);
      }
    }
    return config;
  }

  /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if there is none. */
  public static GateForgeConfig loadDefault() {
    InputStream in = GateForgeConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
      return new GateForgeConfig();
    }
    GateForgeConfig config = load(in);
    try {
      in.close();
    } catch (IOException e) {
      logger.warn("Could not close {}: {}", DEFAULT_RESOURCE, e.getMessage());
    }
    return config;
  }
}
