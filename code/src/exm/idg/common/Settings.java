/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.idg.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.exceptions.InvalidOptionException;

/**
 * General settings for iteration domain graph construction.
 *
 * Values come from built-in defaults, overridden by Java system
 * properties of the same name when {@link #initProperties()} is called.
 */
public class Settings
{
  /** Upper bound on unions performed by one propagation run */
  public static final String MAX_PROPAGATION_STEPS =
                                  "idg.graph.max-propagation-steps";

  /** Whether self mappings are tolerated when no flag is given */
  public static final String ALLOW_SELF_MAPPING =
                                  "idg.graph.allow-self-mapping";

  public static final String LOG_FILE = "idg.log.file";
  public static final String LOG_TRACE = "idg.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(MAX_PROPAGATION_STEPS, "1000000");
    defaults.setProperty(ALLOW_SELF_MAPPING, "false");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Restore the built-in default for a key
   * @param key
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(ALLOW_SELF_MAPPING);
    getBoolean(LOG_TRACE);
    long maxSteps = getLong(MAX_PROPAGATION_STEPS);
    if (maxSteps <= 0) {
      throw new InvalidOptionException("Expected property " +
          MAX_PROPAGATION_STEPS + " to be positive but was " + maxSteps);
    }
  }

  /**
   * Look up a boolean setting that must be valid at this point, e.g.
   * because it was validated at startup.
   * @param key
   * @return
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new IDGRuntimeError("Expected config key " + key +
                                " to be valid: " + e.getMessage());
    }
  }

  /**
   * Same as {@link #getBooleanUnchecked(String)} for integral settings
   * @param key
   * @return
   */
  public static long getLongUnchecked(String key) {
    try {
      return getLong(key);
    } catch (InvalidOptionException e) {
      throw new IDGRuntimeError("Expected config key " + key +
                                " to be valid: " + e.getMessage());
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
