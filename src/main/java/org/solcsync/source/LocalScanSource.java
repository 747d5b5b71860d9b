/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import org.solcsync.artifact.ArtifactOrigin;
import org.solcsync.artifact.CompilerArtifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Version source scanning a local directory for compiler binaries and asking
 * each of them for its version.
 *
 * <p>A file is a candidate if its name starts with the binary name (which
 * includes being equal to it) and if it is located directly in the root
 * directory or in one of its immediate subdirectories. Candidates that cannot
 * be run or that do not report a recognizable version are logged and
 * skipped.</p>
 */
public class LocalScanSource extends AbstractVersionSource {

  private static final Logger logger = LoggerFactory.getLogger(
      LocalScanSource.class);

  private final Path root;

  private final String binaryName;

  private final String platform;

  private final VersionQuery versionQuery;

  /**
   * Create a local scan source.
   *
   * @param root Directory to scan.
   * @param binaryName Candidate file name prefix, e.g. "solc".
   * @param platform Platform identifier to assign to found artifacts.
   * @param versionQuery Capability to ask a binary for its version.
   * @param limit Maximum number of artifacts, or non-positive for all.
   */
  public LocalScanSource(Path root, String binaryName, String platform,
      VersionQuery versionQuery, int limit) {
    super(limit);
    this.root = root;
    this.binaryName = binaryName;
    this.platform = platform;
    this.versionQuery = versionQuery;
  }

  @Override
  public String describe() {
    return this.root.toString();
  }

  @Override
  protected List<CompilerArtifact> enumerate()
      throws ListingUnavailableException {
    logger.info("Scanning local compiler directory {}.", this.root);
    SortedSet<Path> candidates;
    try {
      candidates = this.findCandidates();
    } catch (IOException e) {
      throw new ListingUnavailableException("Cannot scan " + this.root + ": "
          + e.getMessage(), e);
    }
    List<CompilerArtifact> artifacts = new ArrayList<>();
    Map<String, Path> versionPaths = new HashMap<>();
    for (Path candidate : candidates) {
      Optional<String> version = this.queryVersion(candidate);
      if (!version.isPresent()) {
        continue;
      }
      Path previous = versionPaths.putIfAbsent(version.get(), candidate);
      if (null != previous) {
        logger.warn("Skipping {}, which reports the same version {} as {}.",
            candidate, version.get(), previous);
        continue;
      }
      logger.info("Found compiler {} at {}.", version.get(), candidate);
      artifacts.add(new CompilerArtifact(version.get(), this.platform,
          ArtifactOrigin.local(candidate), sizeOf(candidate)));
    }
    return artifacts;
  }

  /**
   * Find candidate files directly in the root directory and in its immediate
   * subdirectories.
   *
   * @return Candidate files in path order.
   * @throws IOException Thrown if the root directory does not exist or cannot
   *     be read.
   */
  SortedSet<Path> findCandidates() throws IOException {
    if (!Files.isDirectory(this.root)) {
      throw new IOException("Local directory does not exist: " + this.root);
    }
    SortedSet<Path> candidates = new TreeSet<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(this.root)) {
      for (Path entry : entries) {
        if (Files.isDirectory(entry)) {
          this.addCandidates(entry, candidates);
        } else if (this.isCandidate(entry)) {
          candidates.add(entry);
        }
      }
    }
    return candidates;
  }

  private void addCandidates(Path directory, SortedSet<Path> candidates) {
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        if (this.isCandidate(entry)) {
          candidates.add(entry);
        }
      }
    } catch (IOException e) {
      logger.warn("Cannot read subdirectory {}. Skipping.", directory, e);
    }
  }

  private boolean isCandidate(Path path) {
    return Files.isRegularFile(path)
        && path.getFileName().toString().startsWith(this.binaryName);
  }

  private Optional<String> queryVersion(Path candidate) {
    if (!Files.isExecutable(candidate)
        && !candidate.toFile().setExecutable(true, true)) {
      logger.debug("Could not make {} executable.", candidate);
    }
    try {
      Optional<String> version = this.versionQuery.queryVersion(candidate);
      if (!version.isPresent()) {
        logger.warn("Unable to find a version in the output of {}. "
            + "Skipping.", candidate);
      }
      return version;
    } catch (IOException e) {
      logger.warn("Failed to get version of {}: {}. Skipping.", candidate,
          e.getMessage());
      return Optional.empty();
    }
  }

  private static OptionalLong sizeOf(Path file) {
    try {
      return OptionalLong.of(Files.size(file));
    } catch (IOException e) {
      return OptionalLong.empty();
    }
  }
}
