/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import org.solcsync.artifact.CompilerArtifact;
import org.solcsync.downloader.Downloader;
import org.solcsync.store.ExistenceChecker;
import org.solcsync.store.ObjectStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Synchronizes a sequence of artifacts with the destination store using a
 * fixed number of worker threads.
 *
 * <p>Every artifact is handed to exactly one {@link TransferTask}. A failing
 * artifact is recorded in the summary and does not stop the others. After a
 * shutdown request, transfers that have not started yet are recorded as
 * failed without touching source or destination.</p>
 */
public class SyncManager implements ThreadFactory {

  private static final Logger logger
      = LoggerFactory.getLogger(SyncManager.class);

  /** Number of failure reasons listed in the final log message. */
  private static final int MAX_LOGGED_FAILURES = 10;

  static final String NOT_STARTED = "Not started, shutting down";

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private int currentThreadNo = 0;

  private final ObjectStore store;

  private final ExistenceChecker existenceChecker;

  private final Downloader downloader;

  private final String binaryName;

  private final ExecutorService executor;

  private final SyncSummary summary = new SyncSummary();

  /** Set once shutdown is requested; queued transfers do not start then. */
  private volatile boolean shuttingDown = false;

  /**
   * Create a manager.
   *
   * @param store Destination store.
   * @param existenceChecker Checker deciding which artifacts to skip.
   * @param downloader Downloader for remote artifacts.
   * @param binaryName File name of binary objects in the store.
   * @param workers Maximum number of artifacts processed at the same time.
   */
  public SyncManager(ObjectStore store, ExistenceChecker existenceChecker,
      Downloader downloader, String binaryName, int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("At least one worker required.");
    }
    this.store = store;
    this.existenceChecker = existenceChecker;
    this.downloader = downloader;
    this.binaryName = binaryName;
    this.executor = Executors.newFixedThreadPool(workers, this);
  }

  /**
   * Synchronize all given artifacts and return the summary once all of them
   * are done.
   *
   * <p>This manager can only run once; its worker threads are shut down on
   * return.</p>
   *
   * @param artifacts Artifacts to synchronize.
   * @return Summary of all outcomes.
   */
  public SyncSummary sync(List<CompilerArtifact> artifacts) {
    logger.info("Starting to sync {} artifact(s) to {}.", artifacts.size(),
        this.store.describe());
    CompletionService<TransferOutcome> completionService
        = new ExecutorCompletionService<>(this.executor);
    Map<Future<TransferOutcome>, CompilerArtifact> pending = new HashMap<>();
    for (CompilerArtifact artifact : artifacts) {
      if (this.shuttingDown) {
        this.summary.record(TransferOutcome.failed(artifact.getVersion(),
            NOT_STARTED));
        continue;
      }
      TransferTask task = this.createTransferTask(artifact);
      try {
        pending.put(completionService.submit(
            () -> this.runUnlessShuttingDown(task)), artifact);
      } catch (RejectedExecutionException e) {
        this.summary.record(TransferOutcome.failed(artifact.getVersion(),
            NOT_STARTED));
      }
    }
    try {
      while (!pending.isEmpty()) {
        Future<TransferOutcome> future = completionService.take();
        CompilerArtifact artifact = pending.remove(future);
        this.summary.record(this.outcomeOf(future, artifact));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for {} transfer(s).",
          pending.size());
      for (Map.Entry<Future<TransferOutcome>, CompilerArtifact> entry
          : pending.entrySet()) {
        entry.getKey().cancel(true);
        this.summary.record(TransferOutcome.failed(
            entry.getValue().getVersion(), "Interrupted"));
      }
    } finally {
      this.executor.shutdown();
    }
    this.logSummary();
    return this.summary;
  }

  private TransferOutcome outcomeOf(Future<TransferOutcome> future,
      CompilerArtifact artifact) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      logger.error("Processing of {} failed.", artifact, e.getCause());
      return TransferOutcome.failed(artifact.getVersion(),
          "Processing exception: " + e.getCause());
    } catch (CancellationException e) {
      /* Only queued transfers are cancelled, see shutdown. */
      return TransferOutcome.failed(artifact.getVersion(), NOT_STARTED);
    }
  }

  private TransferOutcome runUnlessShuttingDown(TransferTask task) {
    String version = task.getArtifact().getVersion();
    if (this.shuttingDown) {
      logger.info("Not starting transfer of {}, shutting down.", version);
      return TransferOutcome.failed(version, NOT_STARTED);
    }
    return task.call();
  }

  /**
   * Create a transfer task for the given artifact.
   *
   * <p>The reason why this is a separate method is that it can be overridden
   * by tests that want to observe or slow down transfers.</p>
   *
   * @param artifact Artifact to synchronize.
   * @return Transfer task.
   */
  protected TransferTask createTransferTask(CompilerArtifact artifact) {
    return new TransferTask(artifact, this.binaryName, this.store,
        this.existenceChecker, this.downloader);
  }

  private void logSummary() {
    logger.info("Sync completed: {} uploaded, {} skipped as existing, {} "
        + "failed.", this.summary.getUploaded(),
        this.summary.getSkippedExisting(), this.summary.getFailed());
    List<String> reasons = this.summary.getFailureReasons();
    for (int i = 0; i < reasons.size() && i < MAX_LOGGED_FAILURES; i++) {
      logger.warn("Failed: {}", reasons.get(i));
    }
    if (reasons.size() > MAX_LOGGED_FAILURES) {
      logger.warn("... and {} more failure(s).",
          reasons.size() - MAX_LOGGED_FAILURES);
    }
  }

  /** Return the summary of outcomes recorded so far. */
  public SyncSummary getSummary() {
    return this.summary;
  }

  /**
   * Try to shutdown smoothly, i.e., stop starting queued transfers, wait for
   * running transfers to terminate, and interrupt them if they take longer
   * than the given grace period.
   */
  public void shutdown(long gracePeriodMinutes) {
    this.shuttingDown = true;
    try {
      logger.info("Waiting at most {} minutes for termination "
          + "of running transfers ... ", gracePeriodMinutes);
      this.executor.shutdown();
      if (this.executor.awaitTermination(gracePeriodMinutes,
          TimeUnit.MINUTES)) {
        logger.info("All running transfers terminated.");
        return;
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
    List<Runnable> notTerminated = this.executor.shutdownNow();
    for (Runnable queued : notTerminated) {
      if (queued instanceof Future) {
        ((Future<?>) queued).cancel(false);
      }
    }
    logger.error("Regular shutdown failed, abandoned {} queued transfer(s).",
        notTerminated.size());
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public synchronized Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("SolcSync-Transfer-Thread-" + ++currentThreadNo);
    logger.debug("New Thread created: " + newThread.getName());
    return newThread;
  }
}
