/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Aggregate of all transfer outcomes of a run.
 *
 * <p>Outcomes may be recorded concurrently and in any order; all accessors
 * return the same values for the same set of recorded outcomes.</p>
 */
public class SyncSummary {

  private final Map<TransferOutcome.Status, Integer> counts
      = new EnumMap<>(TransferOutcome.Status.class);

  /** Failure reasons by version, sorted by version. */
  private final SortedMap<String, List<String>> failures = new TreeMap<>();

  /** Record the given outcome. */
  public synchronized void record(TransferOutcome outcome) {
    this.counts.merge(outcome.getStatus(), 1, Integer::sum);
    if (TransferOutcome.Status.FAILED == outcome.getStatus()) {
      List<String> reasons = this.failures.computeIfAbsent(
          outcome.getVersion(), v -> new ArrayList<>());
      reasons.add(outcome.getReason());
      Collections.sort(reasons);
    }
  }

  /** Number of recorded outcomes with the given status. */
  public synchronized int count(TransferOutcome.Status status) {
    return this.counts.getOrDefault(status, 0);
  }

  public int getUploaded() {
    return this.count(TransferOutcome.Status.UPLOADED);
  }

  public int getSkippedExisting() {
    return this.count(TransferOutcome.Status.SKIPPED_EXISTING);
  }

  public int getFailed() {
    return this.count(TransferOutcome.Status.FAILED);
  }

  /** Number of all recorded outcomes. */
  public synchronized int getTotal() {
    int total = 0;
    for (int count : this.counts.values()) {
      total += count;
    }
    return total;
  }

  /**
   * Return failure descriptions of the form {@code <version>: <reason>},
   * sorted by version.
   */
  public synchronized List<String> getFailureReasons() {
    List<String> reasons = new ArrayList<>();
    for (Map.Entry<String, List<String>> e : this.failures.entrySet()) {
      for (String reason : e.getValue()) {
        reasons.add(e.getKey() + ": " + reason);
      }
    }
    return reasons;
  }

  /** Return failure reasons by version, sorted by version. */
  public synchronized SortedMap<String, List<String>> getFailures() {
    SortedMap<String, List<String>> copy = new TreeMap<>();
    for (Map.Entry<String, List<String>> e : this.failures.entrySet()) {
      copy.put(e.getKey(), new ArrayList<>(e.getValue()));
    }
    return copy;
  }

  /** Returns {@code true}, if no artifact failed. */
  public boolean isSuccess() {
    return 0 == this.getFailed();
  }

  @Override
  public synchronized String toString() {
    return "uploaded=" + this.count(TransferOutcome.Status.UPLOADED)
        + ", skipped=" + this.count(TransferOutcome.Status.SKIPPED_EXISTING)
        + ", failed=" + this.count(TransferOutcome.Status.FAILED);
  }
}
