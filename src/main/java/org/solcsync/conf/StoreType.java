/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.conf;

/** Kinds of destination store a run can write to. */
public enum StoreType {
  S3,
  FileSystem
}
