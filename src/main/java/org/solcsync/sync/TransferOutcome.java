/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import java.util.Objects;

/**
 * Result of synchronizing a single artifact.
 */
public final class TransferOutcome {

  /** Possible results. */
  public enum Status {
    UPLOADED,
    SKIPPED_EXISTING,
    FAILED
  }

  private final String version;

  private final Status status;

  private final String reason;

  private final String digest;

  private final long size;

  private TransferOutcome(String version, Status status, String reason,
      String digest, long size) {
    this.version = Objects.requireNonNull(version, "version");
    this.status = status;
    this.reason = reason;
    this.digest = digest;
    this.size = size;
  }

  /** Binary and hash file were both uploaded. */
  public static TransferOutcome uploaded(String version, String digest,
      long size) {
    return new TransferOutcome(version, Status.UPLOADED, null, digest, size);
  }

  /** The artifact was already present in the destination store. */
  public static TransferOutcome skippedExisting(String version) {
    return new TransferOutcome(version, Status.SKIPPED_EXISTING, null, null,
        -1L);
  }

  /** The artifact could not be synchronized for the given reason. */
  public static TransferOutcome failed(String version, String reason) {
    return new TransferOutcome(version, Status.FAILED,
        Objects.requireNonNull(reason, "reason"), null, -1L);
  }

  public String getVersion() {
    return this.version;
  }

  public Status getStatus() {
    return this.status;
  }

  /** Failure reason, or {@code null} unless failed. */
  public String getReason() {
    return this.reason;
  }

  /** Hex SHA-256 digest of the uploaded binary, or {@code null}. */
  public String getDigest() {
    return this.digest;
  }

  /** Size of the uploaded binary in bytes, or -1. */
  public long getSize() {
    return this.size;
  }

  @Override
  public String toString() {
    return Status.FAILED == this.status
        ? this.version + " " + this.status + " (" + this.reason + ")"
        : this.version + " " + this.status;
  }
}
