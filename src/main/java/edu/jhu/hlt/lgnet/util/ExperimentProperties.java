package edu.jhu.hlt.lgnet.util;

/**
 * Settings for a reduction run, usually built from alternating key/value
 * command line arguments.
 *
 * Methods with defaults will return the default if the key is not in this map,
 * and also add the (key, defaultValue) pair to this map, so that after a run
 * this holds every setting that was actually used.
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  public ExperimentProperties() {
    super();
  }

  /** e.g. {"reduce.maxSteps", "500", "reduce.interactions", "false"} */
  public ExperimentProperties(String... keyValues) {
    super();
    putAll(keyValues);
  }

  public void putAll(String[] keyValues) {
    putAll(keyValues, false);
  }

  public void putAll(String[] keyValues, boolean allowOverwrites) {
    if (keyValues.length % 2 != 0)
      throw new IllegalArgumentException("need key/value pairs, got " + keyValues.length + " strings");
    for (int i = 0; i < keyValues.length; i += 2) {
      Object old = put(keyValues[i], keyValues[i + 1]);
      if (!allowOverwrites && old != null) {
        throw new IllegalArgumentException(keyValues[i] + " has two values: "
            + keyValues[i + 1] + " and " + old);
      }
    }
  }

  public int getInt(String key, int defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Integer.parseInt(value.trim());
  }

  public int getInt(String key) {
    return Integer.parseInt(getString(key).trim());
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(getString(key).trim());
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  /** @throws IllegalArgumentException if key has no value */
  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new IllegalArgumentException("no value for " + key);
    return value;
  }
}
