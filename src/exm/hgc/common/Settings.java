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

package exm.hgc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.  Defaults are set here and may be
 * overridden with Java system properties of the same name.
 * */
public class Settings
{
  public static final String IR_OUTPUT_FILE = "hgc.ir.output-file";
  public static final String OPT_TUPLE_SIMP = "hgc.opt.tuple-simp";
  public static final String OPT_DEAD_CODE_ELIM = "hgc.opt.dead-code-elim";

  /* Whether a downstream pass will inline procs.  Doesn't change
   * legalization decisions, only what the final validator checks */
  public static final String INLINE_PROCS = "hgc.inline-procs";
  /* Run channel legalization without the rest of the pipeline */
  public static final String LEGALIZE_ONLY = "hgc.legalize-only";

  public static final String LOG_FILE = "hgc.log.file";
  public static final String LOG_TRACE = "hgc.log.trace";
  /* Validate IR after every pass */
  public static final String COMPILER_DEBUG = "hgc.compiler-debug";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(IR_OUTPUT_FILE, "");
    defaults.setProperty(OPT_TUPLE_SIMP, "true");
    defaults.setProperty(OPT_DEAD_CODE_ELIM, "true");
    defaults.setProperty(INLINE_PROCS, "false");
    defaults.setProperty(LEGALIZE_ONLY, "false");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(COMPILER_DEBUG, "true");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initHGCProperties() throws InvalidOptionException {
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
    // Check that boolean values are correct
    getBoolean(OPT_TUPLE_SIMP);
    getBoolean(OPT_DEAD_CODE_ELIM);
    getBoolean(INLINE_PROCS);
    getBoolean(LEGALIZE_ONLY);
    getBoolean(LOG_TRACE);
    getBoolean(COMPILER_DEBUG);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
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

  /**
   * For options already checked by validateProperties()
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new HGCRuntimeError("Option " + key + " should have been "
                              + "validated: " + e.getMessage());
    }
  }
}
