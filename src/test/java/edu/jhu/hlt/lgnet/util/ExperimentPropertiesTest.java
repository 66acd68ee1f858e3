package edu.jhu.hlt.lgnet.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class ExperimentPropertiesTest {

  @Test
  public void defaultsAreRecorded() {
    ExperimentProperties config = new ExperimentProperties();
    assertEquals(7, config.getInt("a", 7));
    assertEquals("7", config.getProperty("a"));
    assertTrue(config.getBoolean("b", true));
    assertEquals("true", config.getProperty("b"));
    assertEquals("x", config.getString("c", "x"));
    assertEquals(3, config.size());
  }

  @Test
  public void valuesWin() {
    ExperimentProperties config = new ExperimentProperties("a", "3", "b", "false");
    assertEquals(3, config.getInt("a", 7));
    assertEquals(3, config.getInt("a"));
    assertFalse(config.getBoolean("b", true));
    assertFalse(config.getBoolean("b"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void oddArguments() {
    new ExperimentProperties("a", "3", "b");
  }

  @Test(expected = IllegalArgumentException.class)
  public void twoValues() {
    new ExperimentProperties("a", "3", "a", "4");
  }

  @Test
  public void overwrite() {
    ExperimentProperties config = new ExperimentProperties("a", "3");
    config.putAll(new String[] {"a", "4"}, true);
    assertEquals(4, config.getInt("a"));
  }

  @Test
  public void booleanWithoutDefault() {
    ExperimentProperties config = new ExperimentProperties("b", " true ");
    assertTrue(config.getBoolean("b"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void missingBoolean() {
    new ExperimentProperties().getBoolean("nope");
  }

  @Test(expected = IllegalArgumentException.class)
  public void missing() {
    new ExperimentProperties().getString("nope");
  }
}
