package exm.splc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.splc.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void cleanup() {
    for (String key: Settings.getKeys()) {
      System.clearProperty(key);
      Settings.reset(key);
    }
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(10, Settings.getInt(Settings.FINALIZE_START_LINE));
    assertEquals(10, Settings.getInt(Settings.FINALIZE_STEP));
    assertTrue(Settings.getBoolean(Settings.CODEGEN_INLINE_CALLS));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertEquals(5, Settings.getKeys().size());
  }

  @Test
  public void testSetAndReset() throws InvalidOptionException {
    Settings.set(Settings.FINALIZE_STEP, "5");
    assertEquals(5, Settings.getInt(Settings.FINALIZE_STEP));
    Settings.reset(Settings.FINALIZE_STEP);
    assertEquals("Back to default",
                 10, Settings.getInt(Settings.FINALIZE_STEP));
  }

  @Test
  public void testSystemProperties() throws InvalidOptionException {
    System.setProperty(Settings.CODEGEN_INLINE_CALLS, "false");
    System.setProperty(Settings.FINALIZE_START_LINE, "100");
    Settings.initSPLProperties();
    assertFalse(Settings.getBoolean(Settings.CODEGEN_INLINE_CALLS));
    assertEquals(100, Settings.getInt(Settings.FINALIZE_START_LINE));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.CODEGEN_INLINE_CALLS, "sometimes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.CODEGEN_INLINE_CALLS);
  }

  @Test
  public void testBadInt() throws InvalidOptionException {
    Settings.set(Settings.FINALIZE_START_LINE, "ten");
    exception.expect(InvalidOptionException.class);
    Settings.getInt(Settings.FINALIZE_START_LINE);
  }

  @Test
  public void testStepValidated() throws InvalidOptionException {
    System.setProperty(Settings.FINALIZE_STEP, "0");
    exception.expect(InvalidOptionException.class);
    Settings.initSPLProperties();
  }
}
