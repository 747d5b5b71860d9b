/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import org.solcsync.artifact.ArtifactOrigin;
import org.solcsync.artifact.CompilerArtifact;
import org.solcsync.artifact.DestinationKey;
import org.solcsync.digest.HashComputer;
import org.solcsync.downloader.Downloader;
import org.solcsync.store.ExistenceChecker;
import org.solcsync.store.ObjectStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Callable task that synchronizes a single artifact with the destination
 * store: existence check, fetch or read, hash, and upload of binary and hash
 * file.
 *
 * <p>The task never throws; every problem is reported as a
 * {@link TransferOutcome.Status#FAILED} outcome. Re-running a failed task is
 * safe, because both objects are simply written again.</p>
 */
class TransferTask implements Callable<TransferOutcome> {

  private static final Logger logger = LoggerFactory.getLogger(
      TransferTask.class);

  private final CompilerArtifact artifact;

  private final DestinationKey key;

  private final ObjectStore store;

  private final ExistenceChecker existenceChecker;

  private final Downloader downloader;

  TransferTask(CompilerArtifact artifact, String binaryName,
      ObjectStore store, ExistenceChecker existenceChecker,
      Downloader downloader) {
    this.artifact = artifact;
    this.key = DestinationKey.of(artifact, binaryName);
    this.store = store;
    this.existenceChecker = existenceChecker;
    this.downloader = downloader;
  }

  CompilerArtifact getArtifact() {
    return this.artifact;
  }

  @Override
  public TransferOutcome call() {
    String version = this.artifact.getVersion();
    try {
      return this.transfer(version);
    } catch (RuntimeException e) {
      logger.error("Unexpected failure while processing {}.", version, e);
      return TransferOutcome.failed(version, "Unexpected error: " + e);
    }
  }

  private TransferOutcome transfer(String version) {
    try {
      if (this.existenceChecker.isPresent(this.key)) {
        logger.info("Skipping existing version {}.", version);
        return TransferOutcome.skippedExisting(version);
      }
    } catch (IOException e) {
      logger.warn("Existence check of {} failed.", this.key, e);
      return TransferOutcome.failed(version, "Existence check failed: "
          + e.getMessage());
    }
    byte[] data;
    try {
      data = this.obtainBytes();
    } catch (IOException e) {
      logger.warn("Failed to obtain {} from {}: {}", version,
          this.artifact.getOrigin(), e.getMessage());
      return TransferOutcome.failed(version, "Cannot obtain binary from "
          + this.artifact.getOrigin() + ": " + e.getMessage());
    }
    String digest = HashComputer.sha256Hex(data);
    logger.info("Obtained {} ({} bytes, sha256 {}...).", version,
        data.length, digest.substring(0, 16));
    try {
      this.store.put(this.key.getBinaryKey(), data,
          ObjectStore.BINARY_CONTENT_TYPE);
    } catch (IOException e) {
      logger.warn("Upload of {} failed.", this.key.getBinaryKey(), e);
      return TransferOutcome.failed(version, "Upload of binary failed: "
          + e.getMessage());
    }
    try {
      this.store.put(this.key.getHashKey(),
          digest.getBytes(StandardCharsets.UTF_8),
          ObjectStore.TEXT_CONTENT_TYPE);
    } catch (IOException e) {
      logger.warn("Upload of {} failed after storing {}.",
          this.key.getHashKey(), this.key.getBinaryKey(), e);
      return TransferOutcome.failed(version, "Partial upload, binary stored "
          + "but upload of hash file failed: " + e.getMessage());
    }
    logger.info("Upload completed for {}.", version);
    return TransferOutcome.uploaded(version, digest, data.length);
  }

  private byte[] obtainBytes() throws IOException {
    ArtifactOrigin origin = this.artifact.getOrigin();
    switch (origin.getKind()) {
      case REMOTE_URL:
        logger.info("Downloading {} from {}.", this.artifact.getVersion(),
            origin.getUrl());
        byte[] downloadedBytes = this.downloader.download(origin.getUrl());
        if (null == downloadedBytes) {
          throw new IOException("Server responded with a client error");
        }
        return downloadedBytes;
      case LOCAL_PATH:
        logger.info("Reading {} from {}.", this.artifact.getVersion(),
            origin.getPath());
        return Files.readAllBytes(origin.getPath());
      default:
        throw new IllegalStateException("Unknown origin kind "
            + origin.getKind());
    }
  }
}
