/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.store;

import org.solcsync.conf.Configuration;
import org.solcsync.conf.ConfigurationException;
import org.solcsync.conf.Key;
import org.solcsync.conf.StoreType;

/** Creates the configured destination store. */
public final class ObjectStores {

  private ObjectStores() {
  }

  /**
   * Create the store selected by {@link Key#DestinationType}.
   *
   * @throws ConfigurationException Thrown if the store settings are missing or
   *     corrupt.
   */
  public static ObjectStore fromConfiguration(Configuration config)
      throws ConfigurationException {
    StoreType type = config.getStoreType(Key.DestinationType);
    switch (type) {
      case S3:
        return S3ObjectStore.create(config.getString(Key.Region),
            config.getString(Key.Bucket));
      case FileSystem:
        return new FileSystemObjectStore(config.getPath(Key.StorePath));
      default:
        throw new ConfigurationException("Unsupported destination type: "
            + type);
    }
  }
}
