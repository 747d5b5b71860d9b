/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.artifact;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * One candidate compiler binary to be reconciled with the destination store.
 */
public final class CompilerArtifact {

  private final String version;

  private final String platform;

  private final ArtifactOrigin origin;

  private final OptionalLong sizeHint;

  /**
   * Create a new artifact.
   *
   * @param version Canonical version token.
   * @param platform Platform identifier, e.g. {@code linux-amd64}.
   * @param origin Where to obtain the binary from.
   * @param sizeHint Size in bytes if known, informational only.
   * @throws IllegalArgumentException Thrown if the version is not a canonical
   *     version token.
   */
  public CompilerArtifact(String version, String platform,
      ArtifactOrigin origin, OptionalLong sizeHint) {
    if (!VersionToken.isWellFormed(version)) {
      throw new IllegalArgumentException("Malformed version: " + version);
    }
    this.version = version;
    this.platform = Objects.requireNonNull(platform, "platform");
    this.origin = Objects.requireNonNull(origin, "origin");
    this.sizeHint = null == sizeHint ? OptionalLong.empty() : sizeHint;
  }

  public CompilerArtifact(String version, String platform,
      ArtifactOrigin origin) {
    this(version, platform, origin, OptionalLong.empty());
  }

  public String getVersion() {
    return this.version;
  }

  public String getPlatform() {
    return this.platform;
  }

  public ArtifactOrigin getOrigin() {
    return this.origin;
  }

  public OptionalLong getSizeHint() {
    return this.sizeHint;
  }

  @Override
  public String toString() {
    return this.version + " (" + this.origin + ")";
  }
}
