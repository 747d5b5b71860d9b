/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets running transfers finish, within a grace period, when the process is
 * asked to terminate.
 *
 * <p>A binary uploaded without its hash file is the worst possible leftover.
 * As long as hash files are required for an artifact to count as present, a
 * later run uploads both objects again.</p>
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private final SyncManager syncManager;

  private final long gracePeriodMinutes;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(SyncManager syncManager, long gracePeriodMinutes) {
    super("SolcSync-ShutdownThread");
    this.syncManager = syncManager;
    this.gracePeriodMinutes = gracePeriodMinutes;
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    this.syncManager.shutdown(this.gracePeriodMinutes);
    logger.info("Shutdown finished with {}. Exiting.",
        this.syncManager.getSummary());
  }
}
