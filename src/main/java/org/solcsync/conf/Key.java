/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.conf;

import java.net.URL;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  BaseUrl(URL.class),
  ListingDocument(String.class),
  Platform(String.class),
  BinaryName(String.class),
  Limit(Integer.class),
  Workers(Integer.class),
  Bucket(String.class),
  Region(String.class),
  DestinationType(StoreType.class),
  StorePath(Path.class),
  LocalDir(Path.class),
  RequireHashFile(Boolean.class),
  DownloadAttempts(Integer.class),
  RetryDelayMillis(Long.class),
  ConnectTimeoutMillis(Integer.class),
  ReadTimeoutMillis(Integer.class),
  VersionQueryTimeoutSeconds(Long.class),
  SummaryPath(Path.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
