/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import org.solcsync.conf.Configuration;
import org.solcsync.conf.ConfigurationException;
import org.solcsync.conf.Key;
import org.solcsync.downloader.Downloader;

/** Creates the configured version source. */
public final class VersionSources {

  private VersionSources() {
  }

  /**
   * Create a local scan source if {@link Key#LocalDir} is set, or a remote
   * listing source otherwise.
   *
   * @throws ConfigurationException Thrown if a needed setting is missing or
   *     corrupt.
   */
  public static VersionSource fromConfiguration(Configuration config,
      Downloader downloader) throws ConfigurationException {
    int limit = config.getInt(Key.Limit);
    if (Integer.MAX_VALUE == limit) {
      limit = 0;
    }
    String binaryName = config.getString(Key.BinaryName);
    String platform = config.getString(Key.Platform);
    if (config.has(Key.LocalDir)) {
      return new LocalScanSource(config.getPath(Key.LocalDir), binaryName,
          platform, new ProcessVersionQuery(
              config.getLong(Key.VersionQueryTimeoutSeconds)), limit);
    }
    return new RemoteListingSource(config.getUrl(Key.BaseUrl),
        config.getString(Key.ListingDocument), binaryName, platform,
        downloader, limit);
  }
}
