/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.digest;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Computes the content digest stored next to each compiler binary.
 */
public final class HashComputer {

  private HashComputer() {
  }

  /**
   * Compute the SHA-256 digest of the given bytes.
   *
   * @param data Bytes to digest.
   * @return Lower-case hex encoded digest, 64 characters long.
   */
  public static String sha256Hex(byte[] data) {
    return DigestUtils.sha256Hex(data);
  }
}
