/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.artifact;

import java.net.URL;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Place a compiler binary is obtained from: either a remote URL or a local
 * file, never both.
 */
public final class ArtifactOrigin {

  /** Kind of origin. */
  public enum Kind {
    REMOTE_URL,
    LOCAL_PATH
  }

  private final Kind kind;

  private final URL url;

  private final Path path;

  private ArtifactOrigin(Kind kind, URL url, Path path) {
    this.kind = kind;
    this.url = url;
    this.path = path;
  }

  /** Create an origin for a binary to be downloaded from the given URL. */
  public static ArtifactOrigin remote(URL url) {
    return new ArtifactOrigin(Kind.REMOTE_URL,
        Objects.requireNonNull(url, "url"), null);
  }

  /** Create an origin for a binary to be read from the given file. */
  public static ArtifactOrigin local(Path path) {
    return new ArtifactOrigin(Kind.LOCAL_PATH, null,
        Objects.requireNonNull(path, "path"));
  }

  public Kind getKind() {
    return this.kind;
  }

  /**
   * Return the remote URL.
   *
   * @throws IllegalStateException Thrown if this is a local origin.
   */
  public URL getUrl() {
    if (Kind.REMOTE_URL != this.kind) {
      throw new IllegalStateException("Not a remote origin: " + this);
    }
    return this.url;
  }

  /**
   * Return the local path.
   *
   * @throws IllegalStateException Thrown if this is a remote origin.
   */
  public Path getPath() {
    if (Kind.LOCAL_PATH != this.kind) {
      throw new IllegalStateException("Not a local origin: " + this);
    }
    return this.path;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ArtifactOrigin)) {
      return false;
    }
    ArtifactOrigin that = (ArtifactOrigin) other;
    return this.kind == that.kind
        && Objects.equals(String.valueOf(this.url), String.valueOf(that.url))
        && Objects.equals(this.path, that.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.kind, String.valueOf(this.url), this.path);
  }

  @Override
  public String toString() {
    return Kind.REMOTE_URL == this.kind ? this.url.toString()
        : this.path.toString();
  }
}
