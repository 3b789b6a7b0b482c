package exm.idg.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void reset() {
    System.clearProperty(Settings.MAX_PROPAGATION_STEPS);
    Settings.reset(Settings.MAX_PROPAGATION_STEPS);
    Settings.reset(Settings.ALLOW_SELF_MAPPING);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(1000000L, Settings.getLong(Settings.MAX_PROPAGATION_STEPS));
    assertFalse(Settings.getBoolean(Settings.ALLOW_SELF_MAPPING));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testSetAndReset() throws InvalidOptionException {
    Settings.set(Settings.ALLOW_SELF_MAPPING, " TRUE ");
    assertTrue(Settings.getBoolean(Settings.ALLOW_SELF_MAPPING));
    Settings.reset(Settings.ALLOW_SELF_MAPPING);
    assertFalse(Settings.getBoolean(Settings.ALLOW_SELF_MAPPING));
  }

  @Test
  public void testSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.MAX_PROPAGATION_STEPS, "42");
    Settings.initProperties();
    assertEquals(42, Settings.getInt(Settings.MAX_PROPAGATION_STEPS));
  }

  @Test
  public void testInvalidSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.MAX_PROPAGATION_STEPS, "-1");
    exception.expect(InvalidOptionException.class);
    Settings.initProperties();
  }

  @Test
  public void testInvalidBoolean() throws InvalidOptionException {
    Settings.set(Settings.ALLOW_SELF_MAPPING, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.ALLOW_SELF_MAPPING);
  }

  @Test
  public void testUncheckedLookup() {
    Settings.set(Settings.MAX_PROPAGATION_STEPS, "lots");
    exception.expect(IDGRuntimeError.class);
    Settings.getLongUnchecked(Settings.MAX_PROPAGATION_STEPS);
  }
}
