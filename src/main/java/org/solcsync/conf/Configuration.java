/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.conf;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Initialize configuration with defaults from solcsync.properties,
 * unless a configuration properties file is available.
 *
 * <p>An instance is built once at startup and handed to the components that
 * need it; nothing reads configuration values from global state.</p>
 */
public class Configuration {

  public static final String DEFAULTS = "solcsync.properties";

  private final Properties props = new Properties();

  /**
   * Create a configuration populated with the defaults shipped on the
   * class path.
   */
  public static Configuration withDefaults() throws ConfigurationException {
    Configuration conf = new Configuration();
    try (InputStream is = Configuration.class.getClassLoader()
        .getResourceAsStream(DEFAULTS)) {
      if (null == is) {
        throw new ConfigurationException("Cannot find " + DEFAULTS
            + " in class path.");
      }
      conf.load(is);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load default configuration. "
          + "Reason: " + e.getMessage(), e);
    }
    return conf;
  }

  /**
   * Load the configuration from the given path, on top of already loaded
   * values, and check it.
   */
  public void loadAndCheckConfiguration(Path confPath) throws
      ConfigurationException {
    this.loadConfiguration(confPath);
    this.check();
  }

  /**
   * Load the configuration from the given path, on top of already loaded
   * values, without checking it.
   */
  public void loadConfiguration(Path confPath) throws ConfigurationException {
    try (FileInputStream fis
             = new FileInputStream(confPath.toFile())) {
      this.props.load(fis);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load configuration file. "
          + "Reason: " + e.getMessage(), e);
    }
  }

  /**
   * Verify that the values needed by every run are present and sane.
   */
  public void check() throws ConfigurationException {
    if (this.getInt(Key.Workers) < 1) {
      throw new ConfigurationException("Workers must be at least 1, but is "
          + this.getProperty(Key.Workers.name()) + ".");
    }
    if (this.getInt(Key.DownloadAttempts) < 1) {
      throw new ConfigurationException("DownloadAttempts must be at least 1, "
          + "but is " + this.getProperty(Key.DownloadAttempts.name()) + ".");
    }
    switch (this.getStoreType(Key.DestinationType)) {
      case S3:
        if (!this.has(Key.Bucket)) {
          throw new ConfigurationException("No Bucket configured for the S3 "
              + "destination.");
        }
        break;
      case FileSystem:
        if (!this.has(Key.StorePath)) {
          throw new ConfigurationException("No StorePath configured for the "
              + "FileSystem destination.");
        }
        break;
      default:
        break;
    }
  }

  /** Return a copy of all properties. */
  public Properties getPropertiesCopy() {
    return (Properties) props.clone();
  }

  /**
   * Loads properties from the given stream.
   */
  public void load(InputStream fis) throws IOException {
    props.load(fis);
  }

  /** Retrieves the value for key. */
  public String getProperty(String key) {
    return props.getProperty(key);
  }

  /** Sets the value for key. */
  public void setProperty(String key, String value) {
    props.setProperty(key, value);
  }

  /** Returns {@code true}, if key has a non-blank value. */
  public boolean has(Key key) {
    String value = props.getProperty(key.name());
    return null != value && !value.trim().isEmpty();
  }

  /** clears all properties. */
  public void clear() {
    props.clear();
  }

  /** Count of properties. */
  public int size() {
    return props.size();
  }

  private void checkClass(Key key, Class clazz) {
    if (!key.keyClass().getSimpleName().equals(clazz.getSimpleName())) {
      throw new RuntimeException("Wrong type wanted! My class is "
          + key.keyClass().getSimpleName());
    }
  }

  /**
   * Returns a {@code String} property with surrounding whitespace removed.
   */
  public String getString(Key key) throws ConfigurationException {
    try {
      checkClass(key, String.class);
      return props.getProperty(key.name()).trim();
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code boolean} property (case insensitiv), e.g.
   * {@code propertyOne = True}.
   */
  public boolean getBool(Key key) throws ConfigurationException {
    try {
      checkClass(key, Boolean.class);
      return Boolean.parseBoolean(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse an integer property and translate the String
   * {@code "inf"} into Integer.MAX_VALUE.
   * Verifies that this enum is a Key for an integer value.
   */
  public int getInt(Key key) throws ConfigurationException {
    try {
      checkClass(key, Integer.class);
      String prop = props.getProperty(key.name()).trim();
      if ("inf".equals(prop)) {
        return Integer.MAX_VALUE;
      } else {
        return Integer.parseInt(prop);
      }
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse a long property.
   * Verifies that this enum is a Key for a Long value.
   */
  public long getLong(Key key) throws ConfigurationException {
    try {
      checkClass(key, Long.class);
      String prop = props.getProperty(key.name()).trim();
      return Long.parseLong(prop);
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code Path} property, e.g.
   * {@code pathProperty = /my/path/file}.
   */
  public Path getPath(Key key) throws ConfigurationException {
    try {
      checkClass(key, Path.class);
      return Paths.get(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code StoreType} property, e.g.
   * {@code DestinationType = FileSystem}.
   */
  public StoreType getStoreType(Key key) throws ConfigurationException {
    try {
      checkClass(key, StoreType.class);
      return StoreType.valueOf(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code URL} property, e.g.
   * {@code urlProperty = https://my.url.here}.
   */
  public URL getUrl(Key key) throws ConfigurationException {
    try {
      checkClass(key, URL.class);
      return new URL(props.getProperty(key.name()).trim());
    } catch (MalformedURLException | RuntimeException mue) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + mue.getMessage(), mue);
    }
  }

}
