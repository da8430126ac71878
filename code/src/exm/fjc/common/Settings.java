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
package exm.fjc.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.fjc.common.exceptions.InvalidOptionException;

/**
 * General FJC settings.  Values come from defaults, then from Java system
 * properties of the same name, then from command line overrides.
 *
 * List of Java properties not processed here:
 * fjc.log.file and fjc.log.trace: used to set up logging in Main
 * */
public class Settings
{
  public static final String INDENT = "fjc.indent";
  public static final String FIELD_INIT = "fjc.field-init";
  public static final String ACCESSORS = "fjc.accessors";
  public static final String HEADER_COMMENT = "fjc.header-comment";

  public static final String ENTRY_FUNCTION = "fjc.entry-function";
  public static final String BOOTSTRAP_CALL = "fjc.bootstrap-call";
  public static final String STATE_MUTATION_CALL = "fjc.state-mutation-call";

  /** Colon-separated list of directories for bare import specifiers */
  public static final String SEARCH_ROOTS = "fjc.search-roots";
  public static final String PROJECT_ROOT = "fjc.project-root";
  public static final String IMPORT_CACHE = "fjc.import-cache";
  public static final String PACKAGE_CACHE_DIR = "fjc.package-cache-dir";

  public static final String INPUT_FILENAME = "fjc.input_filename";
  public static final String OUTPUT_FILENAME = "fjc.output_filename";

  public static final String LOG_FILE = "fjc.log.file";
  public static final String LOG_TRACE = "fjc.log.trace";

  public static final String FIELD_INIT_CLASS_BODY = "class-body";
  public static final String FIELD_INIT_CONSTRUCTOR = "constructor";
  public static final String ACCESSORS_NATIVE = "native";
  public static final String ACCESSORS_METHODS = "methods";

  private static final Properties properties;

  /** Extra search roots added on command line, searched first */
  private static final List<String> extraSearchRoots = new ArrayList<String>();

  static {
    Properties defaults = new Properties();
    defaults.setProperty(INDENT, "  ");
    defaults.setProperty(FIELD_INIT, FIELD_INIT_CLASS_BODY);
    defaults.setProperty(ACCESSORS, ACCESSORS_NATIVE);
    defaults.setProperty(HEADER_COMMENT, "true");
    defaults.setProperty(ENTRY_FUNCTION, "main");
    defaults.setProperty(BOOTSTRAP_CALL, "runApp");
    defaults.setProperty(STATE_MUTATION_CALL, "setState");
    defaults.setProperty(SEARCH_ROOTS, "src:lib:packages:modules:.");
    defaults.setProperty(PROJECT_ROOT, ".");
    defaults.setProperty(IMPORT_CACHE, "true");
    defaults.setProperty(PACKAGE_CACHE_DIR, "");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initFJCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validate();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static void addSearchRoot(String dir) {
    extraSearchRoots.add(dir);
  }

  /**
   * @return list of directory paths to search, from first to last
   */
  public static List<String> getSearchRoots() {
    List<String> roots = new ArrayList<String>(extraSearchRoots);
    for (String root: StringUtils.split(get(SEARCH_ROOTS), ':')) {
      if (!roots.contains(root)) {
        roots.add(root);
      }
    }
    return Collections.unmodifiableList(roots);
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
  public static void validate() throws InvalidOptionException {
    getBoolean(IMPORT_CACHE);
    getBoolean(HEADER_COMMENT);
    getBoolean(LOG_TRACE);
    checkOneOf(FIELD_INIT,
        Arrays.asList(FIELD_INIT_CLASS_BODY, FIELD_INIT_CONSTRUCTOR));
    checkOneOf(ACCESSORS, Arrays.asList(ACCESSORS_NATIVE, ACCESSORS_METHODS));
    for (String key: Arrays.asList(ENTRY_FUNCTION, BOOTSTRAP_CALL,
                                   STATE_MUTATION_CALL)) {
      if (StringUtils.isBlank(get(key))) {
        throw new InvalidOptionException("option " + key + " must be set");
      }
    }
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  public static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: '" + StringUtils.join(validVals, "', '") +
        "' but was '" + val + "'");
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
}
