// This file is part of TSReads.
// Copyright (C) 2021  The TSReads Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsreads.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

/**
 * Read path configuration.
 * <p>
 * Defaults are set for every key the read path consults. A properties file
 * may be loaded from an explicit path or searched for in the default
 * locations, after which individual keys can be overridden in code.
 * <p>
 * The numeric getters throw a {@link NumberFormatException} if the value
 * is missing or can't be parsed.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Retention policy every bucket's database maps to. Reads fail if the
   * database lacks it. */
  public static final String DEFAULT_RETENTION_POLICY_KEY = 
      "tsreads.store.default_retention_policy";
  
  /** Max wait on meta lookups in milliseconds, 0 for unbounded. */
  public static final String META_TIMEOUT_KEY = "tsreads.store.meta.timeout_ms";
  
  /** How many series the tag values scan reads between cancel checks. */
  public static final String CANCEL_CHECK_INTERVAL_KEY = 
      "tsreads.store.scan.cancel_check_interval";
  
  /** The properties set to their defaults or modified by users. */
  protected final Properties properties = new Properties();

  /** Tracks the location of the file that was actually loaded */
  private String config_location;

  /**
   * Ctor that sets the defaults and optionally searches for a config file.
   * @param auto_load_config When true, search the default locations.
   * @throws IOException If a file was found but could not be read.
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Ctor that loads the given properties file then sets missing defaults.
   * @param file Path to the file to load
   * @throws FileNotFoundException Thrown if the file wasn't found
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws FileNotFoundException, IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Copy ctor. Changes to the copy don't affect the parent.
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Overrides or sets a property after loading.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * @param property The property to load
   * @return The property value or null if it didn't exist.
   */
  public final String getString(final String property) {
    return properties.getProperty(property);
  }

  /**
   * @param property The property to load
   * @return A parsed integer.
   * @throws NumberFormatException if the property was missing or could not 
   * be parsed.
   */
  public final int getInt(final String property) {
    return Integer.parseInt(properties.getProperty(property));
  }

  /**
   * @param property The property to load
   * @return A parsed long.
   * @throws NumberFormatException if the property was missing or could not 
   * be parsed.
   */
  public final long getLong(final String property) {
    return Long.parseLong(properties.getProperty(property));
  }

  /**
   * Returns the given property as a boolean. "1", "true" and "yes" are true
   * regardless of case, anything else is false.
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String raw = properties.getProperty(property);
    if (raw == null) {
      throw new NullPointerException("No such property: " + property);
    }
    final String val = raw.trim().toUpperCase();
    return val.equals("1") || val.equals("TRUE") || val.equals("YES");
  }

  /**
   * @param property The property to search for
   * @return True if the property exists and is not an empty string.
   */
  public final boolean hasProperty(final String property) {
    return !Strings.isNullOrEmpty(properties.getProperty(property));
  }

  /** @return The path of the file that was loaded, null if none. */
  public final String configLocation() {
    return config_location;
  }
  
  /**
   * @return A simple string with the configured properties for debugging
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }

    final StringBuilder buf = new StringBuilder()
        .append("TSReads Configuration:\n")
        .append("File [")
        .append(config_location)
        .append("]\n");
    for (final String key : new TreeSet<String>(properties.stringPropertyNames())) {
      buf.append("Key [")
         .append(key)
         .append("]  Value [")
         .append(properties.getProperty(key))
         .append("]\n");
    }
    return buf.toString();
  }

  /**
   * Loads default entries that were not provided by a file or override.
   */
  protected void setDefaults() {
    final Map<String, String> map = new HashMap<String, String>();
    map.put(DEFAULT_RETENTION_POLICY_KEY, "autogen");
    map.put(META_TIMEOUT_KEY, "0");
    map.put(CANCEL_CHECK_INTERVAL_KEY, "1");

    for (final Map.Entry<String, String> entry : map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Searches a list of locations for a tsreads.conf file in the standard
   * Java properties format. If none is found the defaults are used.
   * <p>
   * The locations are ./tsreads.conf, /etc/tsreads.conf, 
   * /etc/tsreads/tsreads.conf and /opt/tsreads/tsreads.conf
   * 
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (!Strings.isNullOrEmpty(config_location)) {
      loadConfig(config_location);
      return;
    }

    final List<String> file_locations = new ArrayList<String>();
    file_locations.add("tsreads.conf");
    file_locations.add("/etc/tsreads.conf");
    file_locations.add("/etc/tsreads/tsreads.conf");
    file_locations.add("/opt/tsreads/tsreads.conf");

    for (final String file : file_locations) {
      try {
        loadConfig(file);
        return;
      } catch (FileNotFoundException e) {
        LOG.debug("Unable to find " + file);
      }
    }

    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    final InputStream file_stream = new FileInputStream(file);
    try {
      properties.clear();
      properties.load(file_stream);
    } finally {
      file_stream.close();
    }

    LOG.info("Successfully loaded configuration file: " + file);
    config_location = file;
  }

}
