/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import org.solcsync.artifact.CompilerArtifact;

import java.util.List;

/**
 * Source of compiler artifacts to be synchronized.
 */
public interface VersionSource {

  /**
   * Enumerate all artifacts of this source, truncated to the configured
   * limit.
   *
   * @return Well-formed artifacts in source order.
   * @throws ListingUnavailableException Thrown if the source cannot be
   *     enumerated at all.
   */
  List<CompilerArtifact> listArtifacts() throws ListingUnavailableException;

  /** Returns a short description for log messages. */
  String describe();
}
