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

package exm.splc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.splc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.  Defaults are set here and can be overridden
 * with Java system properties of the same name.
 * */
public class Settings
{
  /** Line number given to the first instruction of the final program */
  public static final String FINALIZE_START_LINE = "splc.finalize.start-line";
  /** Increment between consecutive line numbers */
  public static final String FINALIZE_STEP = "splc.finalize.step";

  /** If false, calls are emitted as CALL instructions instead of inlined */
  public static final String CODEGEN_INLINE_CALLS = "splc.codegen.inline-calls";

  public static final String LOG_FILE = "splc.log.file";
  public static final String LOG_TRACE = "splc.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(FINALIZE_START_LINE, "10");
    defaults.setProperty(FINALIZE_STEP, "10");
    defaults.setProperty(CODEGEN_INLINE_CALLS, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initSPLProperties() throws InvalidOptionException {
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
   * Drop any value set with set() or from system properties
   * @param key
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getInt(FINALIZE_START_LINE);
    if (getInt(FINALIZE_STEP) <= 0) {
      throw new InvalidOptionException("option " + FINALIZE_STEP +
          " must be positive, but was " + get(FINALIZE_STEP));
    }
    getBoolean(CODEGEN_INLINE_CALLS);
    getBoolean(LOG_TRACE);
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
