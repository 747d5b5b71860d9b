/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.downloader;

import org.solcsync.conf.Configuration;
import org.solcsync.conf.ConfigurationException;
import org.solcsync.conf.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.HttpURLConnection;
import java.net.URL;

/**
 * Downloads resources from HTTP servers, retrying a bounded number of times
 * on I/O errors.
 */
public class Downloader {

  private static final Logger logger = LoggerFactory.getLogger(
      Downloader.class);

  private final int connectTimeoutMillis;

  private final int readTimeoutMillis;

  private final int attempts;

  private final long retryDelayMillis;

  /**
   * Create a downloader.
   *
   * @param connectTimeoutMillis Connect timeout per attempt.
   * @param readTimeoutMillis Read timeout per attempt.
   * @param attempts Maximum number of attempts, at least 1.
   * @param retryDelayMillis Delay before the second attempt, doubled before
   *     each further attempt.
   */
  public Downloader(int connectTimeoutMillis, int readTimeoutMillis,
      int attempts, long retryDelayMillis) {
    if (attempts < 1) {
      throw new IllegalArgumentException("At least one attempt required.");
    }
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.readTimeoutMillis = readTimeoutMillis;
    this.attempts = attempts;
    this.retryDelayMillis = retryDelayMillis;
  }

  /** Create a downloader using timeouts and retry settings from config. */
  public static Downloader fromConfiguration(Configuration config)
      throws ConfigurationException {
    return new Downloader(config.getInt(Key.ConnectTimeoutMillis),
        config.getInt(Key.ReadTimeoutMillis),
        config.getInt(Key.DownloadAttempts),
        config.getLong(Key.RetryDelayMillis));
  }

  /**
   * Download the given URL, making up to the configured number of attempts if
   * downloading fails with an I/O error.
   *
   * <p>Server errors (5xx) and 429 responses are retried like I/O errors,
   * any other response except 200 is not.</p>
   *
   * @param url URL to download.
   * @return Downloaded bytes, or {@code null} if the resource was not found.
   * @throws IOException Thrown if the last attempt failed, too.
   */
  public byte[] download(URL url) throws IOException {
    long delayMillis = this.retryDelayMillis;
    for (int attempt = 1; ; attempt++) {
      try {
        return this.downloadFromHttpServer(url);
      } catch (InterruptedIOException e) {
        if (Thread.currentThread().isInterrupted()) {
          throw e;
        }
        this.checkAttemptsLeft(url, attempt, e);
      } catch (IOException e) {
        this.checkAttemptsLeft(url, attempt, e);
      }
      try {
        Thread.sleep(delayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while waiting to retry "
            + url);
      }
      delayMillis *= 2;
    }
  }

  private void checkAttemptsLeft(URL url, int attempt, IOException e)
      throws IOException {
    if (attempt >= this.attempts) {
      throw e;
    }
    logger.warn("Attempt {} of {} to download {} failed: {}. Retrying.",
        attempt, this.attempts, url, e.getMessage());
  }

  /** Server errors and rate limiting are worth another attempt. */
  private static boolean isTransientFailure(int response) {
    return response >= 500 || response == 429;
  }

  /**
   * Download the given URL from an HTTP server and return downloaded bytes.
   *
   * @param url URL to download.
   * @return Downloaded bytes, or {@code null} if the server responded with a
   *     status other than 200 that is not worth retrying, e.g. 404.
   * @throws IOException Thrown if anything goes wrong while downloading,
   *     including server errors and 429 responses.
   */
  public byte[] downloadFromHttpServer(URL url) throws IOException {
    ByteArrayOutputStream downloadedBytes = new ByteArrayOutputStream();
    HttpURLConnection huc = (HttpURLConnection) url.openConnection();
    huc.setRequestMethod("GET");
    huc.setConnectTimeout(this.connectTimeoutMillis);
    huc.setReadTimeout(this.readTimeoutMillis);
    huc.connect();
    int response = huc.getResponseCode();
    if (isTransientFailure(response)) {
      throw new IOException("Server responded " + response + " for " + url);
    }
    if (response != 200) {
      logger.debug("Server responded {} for {}.", response, url);
      return null;
    }
    try (BufferedInputStream in
        = new BufferedInputStream(huc.getInputStream())) {
      int len;
      byte[] data = new byte[8192];
      while ((len = in.read(data, 0, data.length)) >= 0) {
        downloadedBytes.write(data, 0, len);
      }
    }
    return downloadedBytes.toByteArray();
  }
}
