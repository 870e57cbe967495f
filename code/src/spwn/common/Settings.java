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
package spwn.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import spwn.common.exceptions.InvalidOptionException;

/**
 * Global compiler settings.  Each setting is a Java property with a
 * default value here, which can be overridden by a system property
 * of the same name or by the command line.
 */
public class Settings
{
  public static final String INPUT_FILENAME = "spwn.input_filename";

  public static final String LOG_FILE = "spwn.log.file";
  public static final String LOG_TRACE = "spwn.log.trace";

  /** Maximum nesting of blocks and expressions */
  public static final String PARSE_MAX_DEPTH = "spwn.parse.max-depth";
  /** Treat constructs the tree builder can't handle as errors */
  public static final String PARSE_STRICT = "spwn.parse.strict";

  public static final int DEFAULT_MAX_DEPTH = 200;

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(PARSE_MAX_DEPTH, String.valueOf(DEFAULT_MAX_DEPTH));
    defaults.setProperty(PARSE_STRICT, "false");
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
   * Revert a setting to its default value
   */
  public static void reset(String key) {
    properties.remove(key);
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
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(PARSE_STRICT);
    int maxDepth = getInt(PARSE_MAX_DEPTH);
    if (maxDepth < 1) {
      throw new InvalidOptionException("option " + PARSE_MAX_DEPTH +
          " must be a positive integer, but was " + maxDepth);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
