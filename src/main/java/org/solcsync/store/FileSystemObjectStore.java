/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Object store rooted at a local directory, with keys mapped to relative
 * file paths.
 *
 * <p>Objects are first written to a temporary file next to their final
 * location and then moved into place, so that readers never see partially
 * written objects.</p>
 */
public class FileSystemObjectStore implements ObjectStore {

  private static final Logger logger = LoggerFactory.getLogger(
      FileSystemObjectStore.class);

  public static final String TEMPFIX = ".tmp";

  private final Path root;

  public FileSystemObjectStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  private Path resolve(String key) throws IOException {
    Path path = this.root.resolve(key).normalize();
    if (!path.startsWith(this.root) || path.equals(this.root)) {
      throw new IOException("Key " + key + " points outside of " + this.root);
    }
    return path;
  }

  @Override
  public boolean exists(String key) throws IOException {
    return Files.isRegularFile(this.resolve(key));
  }

  @Override
  public byte[] get(String key) throws IOException {
    return Files.readAllBytes(this.resolve(key));
  }

  @Override
  public void put(String key, byte[] data, String contentType)
      throws IOException {
    Path outputPath = this.resolve(key);
    Path tmpPath = outputPath.resolveSibling(outputPath.getFileName()
        + TEMPFIX);
    Files.createDirectories(outputPath.getParent());
    Files.write(tmpPath, data);
    try {
      Files.move(tmpPath, outputPath, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      Files.deleteIfExists(tmpPath);
      throw e;
    }
    logger.debug("Stored {} bytes at {}.", data.length, outputPath);
  }

  @Override
  public String describe() {
    return this.root.toString();
  }
}
