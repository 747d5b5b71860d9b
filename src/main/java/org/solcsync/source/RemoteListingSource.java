/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import org.solcsync.artifact.ArtifactOrigin;
import org.solcsync.artifact.CompilerArtifact;
import org.solcsync.artifact.VersionToken;
import org.solcsync.downloader.Downloader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version source reading the directory listing of a remote binaries server.
 *
 * <p>The listing is either a {@code list.json} document with a
 * {@code builds} array whose entries carry the file name in {@code path}, or
 * an HTML or plain-text directory index. Only file names of the form
 * {@code <binary>-<platform>-v<semver>+commit.<hex>} are considered, all other
 * entries are skipped.</p>
 */
public class RemoteListingSource extends AbstractVersionSource {

  private static final Logger logger = LoggerFactory.getLogger(
      RemoteListingSource.class);

  private static final ObjectMapper objectMapper = new ObjectMapper();

  /** Characters that may continue a file name in a directory index. */
  private static final String NAME_CHARS = "0-9A-Za-z._+-";

  private final URL baseUrl;

  private final String listingDocument;

  private final String platform;

  private final Downloader downloader;

  /** Matches a complete binary file name and captures the version token. */
  private final Pattern fileNamePattern;

  /** Finds binary file names inside a directory index. */
  private final Pattern indexPattern;

  /**
   * Create a remote listing source.
   *
   * @param baseUrl Directory containing the binaries and the listing.
   * @param listingDocument Name of the listing document in that directory.
   * @param binaryName Binary name prefix of published files, e.g. "solc".
   * @param platform Platform identifier, e.g. "linux-amd64".
   * @param downloader Downloader used for fetching the listing.
   * @param limit Maximum number of artifacts, or non-positive for all.
   */
  public RemoteListingSource(URL baseUrl, String listingDocument,
      String binaryName, String platform, Downloader downloader, int limit) {
    super(limit);
    this.baseUrl = withTrailingSlash(baseUrl);
    this.listingDocument = listingDocument;
    this.platform = platform;
    this.downloader = downloader;
    String name = Pattern.quote(binaryName + "-" + platform + "-")
        + "(" + VersionToken.TOKEN_REGEX + ")";
    this.fileNamePattern = Pattern.compile(name);
    this.indexPattern = Pattern.compile("(?<![" + NAME_CHARS + "])" + name
        + "(?![" + NAME_CHARS + "])");
  }

  private static URL withTrailingSlash(URL url) {
    if (url.getPath().endsWith("/")) {
      return url;
    }
    try {
      return new URL(url, url.getPath() + "/");
    } catch (MalformedURLException e) {
      throw new IllegalArgumentException("Invalid base URL " + url, e);
    }
  }

  @Override
  public String describe() {
    return this.baseUrl.toString() + this.listingDocument;
  }

  @Override
  protected List<CompilerArtifact> enumerate()
      throws ListingUnavailableException {
    String document = this.fetchListing();
    List<CompilerArtifact> artifacts = new ArrayList<>();
    for (String fileName : this.parseFileNames(document)) {
      Matcher matcher = this.fileNamePattern.matcher(fileName);
      if (!matcher.matches()) {
        logger.debug("Skipping listing entry {}.", fileName);
        continue;
      }
      try {
        artifacts.add(new CompilerArtifact(matcher.group(1), this.platform,
            ArtifactOrigin.remote(new URL(this.baseUrl, fileName))));
      } catch (MalformedURLException e) {
        logger.warn("Skipping listing entry {} with invalid URL.", fileName,
            e);
      }
    }
    return artifacts;
  }

  private String fetchListing() throws ListingUnavailableException {
    URL listingUrl;
    try {
      listingUrl = new URL(this.baseUrl, this.listingDocument);
    } catch (MalformedURLException e) {
      throw new ListingUnavailableException("Invalid listing URL "
          + this.baseUrl + this.listingDocument, e);
    }
    logger.info("Fetching version list from {}.", listingUrl);
    byte[] downloadedBytes;
    try {
      downloadedBytes = this.downloader.download(listingUrl);
    } catch (IOException e) {
      throw new ListingUnavailableException("Failed downloading "
          + listingUrl + ": " + e.getMessage(), e);
    }
    if (null == downloadedBytes) {
      throw new ListingUnavailableException("Could not download "
          + listingUrl + ".");
    }
    return new String(downloadedBytes, StandardCharsets.UTF_8);
  }

  /**
   * Extract candidate file names from the listing document, in document order
   * and without duplicates.
   *
   * @param document Listing document.
   * @return Candidate file names.
   * @throws ListingUnavailableException Thrown if the document looks like JSON
   *     but cannot be parsed as a build list.
   */
  Set<String> parseFileNames(String document)
      throws ListingUnavailableException {
    Set<String> fileNames = new LinkedHashSet<>();
    if (document.trim().startsWith("{")) {
      JsonNode builds;
      try {
        builds = objectMapper.readTree(document).path("builds");
      } catch (IOException e) {
        throw new ListingUnavailableException("Cannot parse version list: "
            + e.getMessage(), e);
      }
      if (!builds.isArray()) {
        throw new ListingUnavailableException("Version list does not contain "
            + "a builds array.");
      }
      for (JsonNode build : builds) {
        String path = build.path("path").asText("");
        if (!path.isEmpty()) {
          fileNames.add(path);
        }
      }
    } else {
      Matcher matcher = this.indexPattern.matcher(
          document.replace("%2B", "+").replace("%2b", "+"));
      while (matcher.find()) {
        fileNames.add(matcher.group());
      }
    }
    return fileNames;
  }
}
