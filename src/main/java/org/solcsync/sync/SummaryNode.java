/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import java.util.List;

/**
 * Root node of the JSON run summary.
 */
class SummaryNode {

  /**
   * Timestamp when the run started.
   */
  String runStarted;

  /**
   * Timestamp when the run finished.
   */
  String runFinished;

  /**
   * Version source the artifacts came from.
   */
  String source;

  /**
   * Destination store.
   */
  String destination;

  int uploaded;

  int skippedExisting;

  int failed;

  /**
   * Failed artifacts, sorted by version.
   */
  List<FailureNode> failures;

  /**
   * One failed artifact.
   */
  static class FailureNode {

    String version;

    String reason;
  }
}
