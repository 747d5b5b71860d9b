/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.store;

import org.solcsync.artifact.DestinationKey;

import java.io.IOException;

/**
 * Decides whether an artifact is already present in the destination store,
 * using metadata-only probes.
 *
 * <p>A positive answer is final: the artifact is skipped even if the source
 * binary has changed since it was uploaded.</p>
 */
public class ExistenceChecker {

  private final ObjectStore store;

  private final boolean requireHashFile;

  /**
   * Create a checker.
   *
   * @param store Destination store.
   * @param requireHashFile Whether the hash file must exist, too, for an
   *     artifact to count as present; if {@code false}, only the binary is
   *     probed.
   */
  public ExistenceChecker(ObjectStore store, boolean requireHashFile) {
    this.store = store;
    this.requireHashFile = requireHashFile;
  }

  /**
   * Return whether the artifact with the given keys is already present.
   *
   * @throws IOException Thrown if the store cannot be queried.
   */
  public boolean isPresent(DestinationKey key) throws IOException {
    if (!this.store.exists(key.getBinaryKey())) {
      return false;
    }
    return !this.requireHashFile || this.store.exists(key.getHashKey());
  }
}
