/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.sync;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the summary of a run to a JSON file for later inspection.
 */
public class SummaryWriter {

  private static final Logger logger = LoggerFactory.getLogger(
      SummaryWriter.class);

  /**
   * Formatter for all timestamps found in the summary.
   */
  private static DateTimeFormatter dateTimeFormatter = DateTimeFormatter
      .ofPattern("uuuu-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  /**
   * Object mapper for formatting summary files.
   */
  private static ObjectMapper objectMapper = new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .setSerializationInclusion(JsonInclude.Include.NON_NULL)
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
      .enable(SerializationFeature.INDENT_OUTPUT);

  /**
   * Write the given summary to the given path, replacing an existing file
   * only once the new one is complete.
   *
   * @throws IOException Thrown if an I/O error occurs while writing.
   */
  public void write(Path summaryPath, SyncSummary summary, String source,
      String destination, Instant started, Instant finished)
      throws IOException {
    SummaryNode node = new SummaryNode();
    node.runStarted = dateTimeFormatter.format(started);
    node.runFinished = dateTimeFormatter.format(finished);
    node.source = source;
    node.destination = destination;
    node.uploaded = summary.getUploaded();
    node.skippedExisting = summary.getSkippedExisting();
    node.failed = summary.getFailed();
    List<SummaryNode.FailureNode> failures = new ArrayList<>();
    for (Map.Entry<String, List<String>> e
        : summary.getFailures().entrySet()) {
      for (String reason : e.getValue()) {
        SummaryNode.FailureNode failure = new SummaryNode.FailureNode();
        failure.version = e.getKey();
        failure.reason = reason;
        failures.add(failure);
      }
    }
    node.failures = failures;
    Path absolutePath = summaryPath.toAbsolutePath();
    Files.createDirectories(absolutePath.getParent());
    Path tmpPath = absolutePath.resolveSibling("."
        + absolutePath.getFileName() + ".tmp");
    try (OutputStream os = Files.newOutputStream(tmpPath)) {
      objectMapper.writeValue(os, node);
    }
    Files.move(tmpPath, absolutePath, StandardCopyOption.REPLACE_EXISTING);
    logger.info("Wrote run summary to {}.", absolutePath);
  }

  /** Read a previously written summary. */
  SummaryNode read(Path summaryPath) throws IOException {
    return objectMapper.readValue(summaryPath.toFile(), SummaryNode.class);
  }
}
