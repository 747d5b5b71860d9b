/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import org.solcsync.artifact.ArtifactOrigin;
import org.solcsync.artifact.CompilerArtifact;
import org.solcsync.artifact.DestinationKey;
import org.solcsync.digest.HashComputer;
import org.solcsync.downloader.Downloader;
import org.solcsync.store.ExistenceChecker;
import org.solcsync.store.InMemoryObjectStore;

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class SyncManagerTest {

  private static final String BASE_URL
      = "https://binaries.soliditylang.org/linux-amd64/";

  private InMemoryObjectStore store;

  private Downloader downloader;

  @Before
  public void createStore() throws Exception {
    this.store = new InMemoryObjectStore();
    this.downloader = mock(Downloader.class);
    /* Each binary's content is its own URL. */
    given(this.downloader.download(any(URL.class))).willAnswer(
        invocation -> contentOf(invocation.getArgument(0)));
  }

  private static byte[] contentOf(URL url) {
    return url.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static List<CompilerArtifact> artifacts(int count)
      throws Exception {
    List<CompilerArtifact> artifacts = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      String version = "v0.8." + i + "+commit.abcdef" + i;
      artifacts.add(new CompilerArtifact(version, "linux-amd64",
          ArtifactOrigin.remote(new URL(BASE_URL + "solc-linux-amd64-"
          + version))));
    }
    return artifacts;
  }

  private SyncManager createManager(int workers) {
    return new SyncManager(this.store,
        new ExistenceChecker(this.store, true), this.downloader, "solc",
        workers);
  }

  @Test()
  public void testUploadsAllWithHashes() throws Exception {
    List<CompilerArtifact> artifacts = artifacts(5);
    SyncSummary summary = createManager(3).sync(artifacts);
    assertEquals(5, summary.getUploaded());
    assertEquals(0, summary.getFailed());
    assertTrue(summary.isSuccess());
    assertEquals(10, this.store.keys().size());
    for (CompilerArtifact artifact : artifacts) {
      DestinationKey key = DestinationKey.of(artifact, "solc");
      byte[] binary = this.store.get(key.getBinaryKey());
      assertEquals(HashComputer.sha256Hex(binary), new String(
          this.store.get(key.getHashKey()), StandardCharsets.UTF_8));
    }
  }

  @Test()
  public void testSecondRunSkipsEverything() throws Exception {
    List<CompilerArtifact> artifacts = artifacts(4);
    createManager(2).sync(artifacts);
    int putsAfterFirstRun = this.store.getPutCount();
    SyncSummary summary = createManager(2).sync(artifacts);
    assertEquals(0, summary.getUploaded());
    assertEquals(4, summary.getSkippedExisting());
    assertEquals(putsAfterFirstRun, this.store.getPutCount());
  }

  @Test()
  public void testOneFailureDoesNotStopOthers() throws Exception {
    List<CompilerArtifact> artifacts = artifacts(10);
    URL broken = artifacts.get(6).getOrigin().getUrl();
    given(this.downloader.download(any(URL.class))).willAnswer(invocation -> {
      URL url = invocation.getArgument(0);
      if (url.toString().equals(broken.toString())) {
        throw new IOException("Server returned 503");
      }
      return contentOf(url);
    });
    SyncSummary summary = createManager(3).sync(artifacts);
    assertEquals(9, summary.getUploaded());
    assertEquals(1, summary.getFailed());
    assertEquals(10, summary.getTotal());
    assertFalse(summary.isSuccess());
    assertTrue(summary.getFailures().containsKey(
        artifacts.get(6).getVersion()));
  }

  @Test()
  public void testPartialUploadIsFailure() throws Exception {
    List<CompilerArtifact> artifacts = artifacts(2);
    DestinationKey key = DestinationKey.of(artifacts.get(0), "solc");
    this.store.failPutsTo(key.getHashKey());
    SyncSummary summary = createManager(1).sync(artifacts);
    assertEquals(1, summary.getUploaded());
    assertEquals(1, summary.getFailed());
    assertTrue(this.store.exists(key.getBinaryKey()));
    assertTrue(summary.getFailureReasons().get(0)
        .contains("Partial upload"));
  }

  @Test()
  public void testConcurrencyIsBounded() throws Exception {
    final int workers = 3;
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    given(this.downloader.download(any(URL.class))).willAnswer(invocation -> {
      int now = inFlight.incrementAndGet();
      maxInFlight.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(20L);
        return contentOf(invocation.getArgument(0));
      } finally {
        inFlight.decrementAndGet();
      }
    });
    SyncSummary summary = createManager(workers).sync(artifacts(12));
    assertEquals(12, summary.getUploaded());
    assertTrue(maxInFlight.get() >= 1);
    assertTrue("Saw " + maxInFlight.get() + " concurrent transfers",
        maxInFlight.get() <= workers);
  }

  @Test()
  public void testEmptyList() {
    SyncSummary summary = createManager(2).sync(new ArrayList<>());
    assertEquals(0, summary.getTotal());
    assertTrue(summary.isSuccess());
  }

  @Test()
  public void testEachArtifactHandledOnce() throws Exception {
    List<CompilerArtifact> seen = new ArrayList<>();
    SyncManager manager = new SyncManager(this.store,
        new ExistenceChecker(this.store, true), this.downloader, "solc", 4) {
          @Override
          protected TransferTask createTransferTask(
              CompilerArtifact artifact) {
            seen.add(artifact);
            return super.createTransferTask(artifact);
          }
        };
    List<CompilerArtifact> artifacts = artifacts(7);
    SyncSummary summary = manager.sync(artifacts);
    assertEquals(artifacts, seen);
    assertEquals(7, summary.getTotal());
  }

  /** Runs the given manager's sync in a separate thread. */
  private static Thread startSync(SyncManager manager,
      List<CompilerArtifact> artifacts,
      AtomicReference<SyncSummary> result) {
    Thread syncThread = new Thread(() -> result.set(manager.sync(artifacts)),
        "sync-under-test");
    syncThread.start();
    return syncThread;
  }

  @Test()
  public void testShutdownSkipsQueuedTransfers() throws Exception {
    AtomicInteger started = new AtomicInteger();
    CountDownLatch firstStarted = new CountDownLatch(1);
    given(this.downloader.download(any(URL.class))).willAnswer(invocation -> {
      started.incrementAndGet();
      firstStarted.countDown();
      Thread.sleep(200L);
      return contentOf(invocation.getArgument(0));
    });
    SyncManager manager = createManager(1);
    AtomicReference<SyncSummary> result = new AtomicReference<>();
    Thread syncThread = startSync(manager, artifacts(6), result);
    assertTrue(firstStarted.await(10L, TimeUnit.SECONDS));
    manager.shutdown(1L);
    syncThread.join(10_000L);
    assertFalse(syncThread.isAlive());
    assertEquals(1, started.get());
    SyncSummary summary = result.get();
    assertEquals(1, summary.getUploaded());
    assertEquals(5, summary.getFailed());
    for (String reason : summary.getFailureReasons()) {
      assertTrue(reason, reason.endsWith(SyncManager.NOT_STARTED));
    }
  }

  @Test()
  public void testShutdownAfterGracePeriodLetsSyncFinish() throws Exception {
    CountDownLatch firstStarted = new CountDownLatch(1);
    given(this.downloader.download(any(URL.class))).willAnswer(invocation -> {
      firstStarted.countDown();
      try {
        Thread.sleep(30_000L);
      } catch (InterruptedException e) {
        throw new InterruptedIOException("Interrupted download");
      }
      return contentOf(invocation.getArgument(0));
    });
    SyncManager manager = createManager(1);
    AtomicReference<SyncSummary> result = new AtomicReference<>();
    Thread syncThread = startSync(manager, artifacts(4), result);
    assertTrue(firstStarted.await(10L, TimeUnit.SECONDS));
    manager.shutdown(0L);
    syncThread.join(10_000L);
    assertFalse(syncThread.isAlive());
    SyncSummary summary = result.get();
    assertEquals(4, summary.getTotal());
    assertEquals(0, summary.getUploaded());
    assertEquals(4, summary.getFailed());
    assertTrue(this.store.keys().isEmpty());
  }

  @Test()
  public void testNothingStartsAfterShutdown() throws Exception {
    SyncManager manager = createManager(2);
    manager.shutdown(0L);
    SyncSummary summary = manager.sync(artifacts(3));
    assertEquals(3, summary.getFailed());
    assertEquals(0, this.store.getPutCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoWorkers() {
    createManager(0);
  }
}
