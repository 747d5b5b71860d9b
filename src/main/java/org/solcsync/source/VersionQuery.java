/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Capability of asking a compiler binary for its version.
 */
public interface VersionQuery {

  /**
   * Ask the given binary for its version.
   *
   * @param binary Compiler binary.
   * @return Canonical version token, or empty if the binary ran but did not
   *     report a recognizable version.
   * @throws IOException Thrown if the binary could not be run or failed.
   */
  Optional<String> queryVersion(Path binary) throws IOException;
}
