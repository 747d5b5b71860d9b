/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.store;

import java.io.IOException;

/**
 * Destination store holding compiler binaries and hash files under string
 * keys.
 *
 * <p>Implementations must be safe for concurrent use by multiple transfer
 * threads operating on disjoint keys.</p>
 */
public interface ObjectStore extends AutoCloseable {

  String BINARY_CONTENT_TYPE = "application/octet-stream";

  String TEXT_CONTENT_TYPE = "text/plain";

  /**
   * Check whether an object exists at the given key without downloading it.
   *
   * @throws IOException Thrown if the store cannot answer.
   */
  boolean exists(String key) throws IOException;

  /**
   * Return the contents of the object at the given key.
   *
   * @throws IOException Thrown if the object does not exist or cannot be read.
   */
  byte[] get(String key) throws IOException;

  /**
   * Store the given bytes at the given key, replacing any existing object.
   *
   * @throws IOException Thrown if the object cannot be written.
   */
  void put(String key, byte[] data, String contentType) throws IOException;

  /** Human readable description for log messages. */
  String describe();

  @Override
  default void close() {
  }
}
