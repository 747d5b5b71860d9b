/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import org.solcsync.artifact.CompilerArtifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class of version sources that applies the result limit after the
 * complete enumeration, so that the first N artifacts are the same no matter
 * which limit is chosen.
 */
public abstract class AbstractVersionSource implements VersionSource {

  private static final Logger logger = LoggerFactory.getLogger(
      AbstractVersionSource.class);

  /** Maximum number of artifacts to return, or non-positive for all. */
  private final int limit;

  protected AbstractVersionSource(int limit) {
    this.limit = limit;
  }

  @Override
  public final List<CompilerArtifact> listArtifacts()
      throws ListingUnavailableException {
    List<CompilerArtifact> artifacts = this.enumerate();
    logger.info("Found {} artifact(s) in {}.", artifacts.size(),
        this.describe());
    if (this.limit > 0 && artifacts.size() > this.limit) {
      logger.info("Limiting processing to {} artifact(s).", this.limit);
      return new ArrayList<>(artifacts.subList(0, this.limit));
    }
    return artifacts;
  }

  /**
   * Enumerate all artifacts of this source.
   *
   * @throws ListingUnavailableException Thrown if the source cannot be
   *     enumerated at all.
   */
  protected abstract List<CompilerArtifact> enumerate()
      throws ListingUnavailableException;
}
