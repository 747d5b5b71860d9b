/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import org.solcsync.artifact.VersionToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code <binary> --version} in a subprocess and extracts the version
 * token from its combined output.
 */
public class ProcessVersionQuery implements VersionQuery {

  private static final Logger logger = LoggerFactory.getLogger(
      ProcessVersionQuery.class);

  public static final String VERSION_FLAG = "--version";

  private final long timeoutSeconds;

  public ProcessVersionQuery(long timeoutSeconds) {
    this.timeoutSeconds = timeoutSeconds;
  }

  @Override
  public Optional<String> queryVersion(Path binary) throws IOException {
    /* Output goes to a file rather than a pipe, so that a hanging binary
     * cannot block us beyond the timeout. */
    Path outputFile = Files.createTempFile("solc-version-", ".out");
    try {
      Process process = new ProcessBuilder(binary.toString(), VERSION_FLAG)
          .redirectErrorStream(true)
          .redirectOutput(outputFile.toFile())
          .start();
      boolean finished;
      try {
        finished = process.waitFor(this.timeoutSeconds, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while running "
            + binary + " " + VERSION_FLAG);
      }
      if (!finished) {
        process.destroyForcibly();
        throw new IOException("Execution of " + binary + " " + VERSION_FLAG
            + " timed out after " + this.timeoutSeconds + " seconds.");
      }
      String output = new String(Files.readAllBytes(outputFile),
          StandardCharsets.UTF_8);
      if (0 != process.exitValue()) {
        throw new IOException("Execution of " + binary + " " + VERSION_FLAG
            + " exited with " + process.exitValue() + ": " + output.trim());
      }
      logger.debug("Output of {} {}: {}", binary, VERSION_FLAG, output);
      return VersionToken.fromCompilerOutput(output);
    } finally {
      Files.deleteIfExists(outputFile);
    }
  }
}
