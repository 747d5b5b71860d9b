/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.artifact;

import java.util.Objects;

/**
 * Object keys of a compiler binary and its hash file in the destination
 * store.
 *
 * <p>Keys follow the layout {@code <platform>/<version>/<binary-name>} and
 * {@code <platform>/<version>/sha256.hash}. The version is a complete key
 * segment, so distinct versions never share a key.</p>
 */
public final class DestinationKey {

  public static final String HASH_FILE_NAME = "sha256.hash";

  private static final String SLASH = "/";

  private final String binaryKey;

  private final String hashKey;

  private DestinationKey(String binaryKey, String hashKey) {
    this.binaryKey = binaryKey;
    this.hashKey = hashKey;
  }

  /**
   * Compute the destination keys of the given artifact.
   *
   * @param artifact Artifact to place.
   * @param binaryName File name of the binary object, e.g. {@code solc}.
   * @return Destination keys.
   */
  public static DestinationKey of(CompilerArtifact artifact,
      String binaryName) {
    return of(artifact.getPlatform(), artifact.getVersion(), binaryName);
  }

  /**
   * Compute the destination keys of the given platform and version.
   *
   * @throws IllegalArgumentException Thrown if the version is not a canonical
   *     version token or if the platform is empty or contains a slash.
   */
  public static DestinationKey of(String platform, String version,
      String binaryName) {
    if (!VersionToken.isWellFormed(version)) {
      throw new IllegalArgumentException("Malformed version: " + version);
    }
    if (null == platform || platform.isEmpty() || platform.contains(SLASH)) {
      throw new IllegalArgumentException("Invalid platform: " + platform);
    }
    String prefix = platform + SLASH + version + SLASH;
    return new DestinationKey(prefix + binaryName, prefix + HASH_FILE_NAME);
  }

  public String getBinaryKey() {
    return this.binaryKey;
  }

  public String getHashKey() {
    return this.hashKey;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DestinationKey)) {
      return false;
    }
    DestinationKey that = (DestinationKey) other;
    return this.binaryKey.equals(that.binaryKey)
        && this.hashKey.equals(that.hashKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.binaryKey, this.hashKey);
  }

  @Override
  public String toString() {
    return this.binaryKey;
  }
}
