/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.solcsync.artifact.ArtifactOrigin;
import org.solcsync.artifact.CompilerArtifact;
import org.solcsync.downloader.Downloader;

import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class RemoteListingSourceTest {

  private static final String BASE_URL
      = "https://binaries.soliditylang.org/linux-amd64/";

  private static final String LIST_JSON = "{\n"
      + "  \"builds\": [\n"
      + "    {\n"
      + "      \"path\": \"solc-linux-amd64-v0.4.10+commit.9e8cc01b\",\n"
      + "      \"version\": \"0.4.10\",\n"
      + "      \"build\": \"commit.9e8cc01b\",\n"
      + "      \"longVersion\": \"0.4.10+commit.9e8cc01b\"\n"
      + "    },\n"
      + "    {\n"
      + "      \"path\": \"solc-linux-amd64-v0.8.29+commit.ab55807c\",\n"
      + "      \"longVersion\": \"0.8.29+commit.ab55807c\"\n"
      + "    },\n"
      + "    {\n"
      + "      \"path\": \"solc-linux-amd64-v0.8.30+commit.73712a01\",\n"
      + "      \"longVersion\": \"0.8.30+commit.73712a01\"\n"
      + "    },\n"
      + "    {\n"
      + "      \"path\": \"solc-linux-amd64-v0.8.30+commit.73712a01.zip\"\n"
      + "    },\n"
      + "    { \"version\": \"0.1.0\" }\n"
      + "  ],\n"
      + "  \"releases\": {\n"
      + "    \"0.8.30\": \"solc-linux-amd64-v0.8.30+commit.73712a01\"\n"
      + "  },\n"
      + "  \"latestRelease\": \"0.8.30\"\n"
      + "}\n";

  private static final String HTML_INDEX = "<html><head><title>Index of "
      + "/linux-amd64/</title></head><body><pre>\n"
      + "<a href=\"../\">../</a>\n"
      + "<a href=\"list.json\">list.json</a>\n"
      + "<a href=\"solc-linux-amd64-latest\">solc-linux-amd64-latest</a>\n"
      + "<a href=\"solc-linux-amd64-v0.5.0%2Bcommit.1d4f565a\">"
      + "solc-linux-amd64-v0.5.0+commit.1d4f565a</a> 12-Nov-2018 10:00 7M\n"
      + "<a href=\"solc-linux-amd64-v0.6.12+commit.27d51765\">"
      + "solc-linux-amd64-v0.6.12+commit.27d51765</a> 22-Jul-2020 10:00 9M\n"
      + "<a href=\"solc-linux-amd64-v0.6.12+commit.27d51765.sha256\">"
      + "solc-linux-amd64-v0.6.12+commit.27d51765.sha256</a>\n"
      + "<a href=\"solc-macosx-amd64-v0.6.12+commit.27d51765\">"
      + "solc-macosx-amd64-v0.6.12+commit.27d51765</a>\n"
      + "</pre></body></html>\n";

  private RemoteListingSource createSource(String document, int limit)
      throws Exception {
    Downloader downloader = mock(Downloader.class);
    given(downloader.download(any(URL.class))).willReturn(
        null == document ? null : document.getBytes(StandardCharsets.UTF_8));
    return new RemoteListingSource(new URL(BASE_URL), "list.json", "solc",
        "linux-amd64", downloader, limit);
  }

  private static List<String> versionsOf(List<CompilerArtifact> artifacts) {
    List<String> versions = new ArrayList<>();
    for (CompilerArtifact artifact : artifacts) {
      versions.add(artifact.getVersion());
    }
    return versions;
  }

  @Test()
  public void testJsonListing() throws Exception {
    List<CompilerArtifact> artifacts
        = createSource(LIST_JSON, 0).listArtifacts();
    assertEquals(List.of("v0.4.10+commit.9e8cc01b", "v0.8.29+commit.ab55807c",
        "v0.8.30+commit.73712a01"), versionsOf(artifacts));
    CompilerArtifact first = artifacts.get(0);
    assertEquals("linux-amd64", first.getPlatform());
    assertEquals(ArtifactOrigin.Kind.REMOTE_URL, first.getOrigin().getKind());
    assertEquals(BASE_URL + "solc-linux-amd64-v0.4.10+commit.9e8cc01b",
        first.getOrigin().getUrl().toString());
  }

  @Test()
  public void testHtmlIndex() throws Exception {
    List<CompilerArtifact> artifacts
        = createSource(HTML_INDEX, 0).listArtifacts();
    assertEquals(List.of("v0.5.0+commit.1d4f565a", "v0.6.12+commit.27d51765"),
        versionsOf(artifacts));
  }

  @Test()
  public void testLimitKeepsListingOrder() throws Exception {
    List<String> all = versionsOf(createSource(LIST_JSON, 0).listArtifacts());
    for (int limit = 1; limit <= all.size(); limit++) {
      assertEquals(all.subList(0, limit),
          versionsOf(createSource(LIST_JSON, limit).listArtifacts()));
    }
    assertEquals(all, versionsOf(createSource(LIST_JSON, 100)
        .listArtifacts()));
  }

  @Test()
  public void testBaseUrlWithoutTrailingSlash() throws Exception {
    Downloader downloader = mock(Downloader.class);
    given(downloader.download(any(URL.class)))
        .willReturn(LIST_JSON.getBytes(StandardCharsets.UTF_8));
    RemoteListingSource source = new RemoteListingSource(
        new URL("https://binaries.soliditylang.org/linux-amd64"), "list.json",
        "solc", "linux-amd64", downloader, 0);
    List<CompilerArtifact> artifacts = source.listArtifacts();
    assertEquals(3, artifacts.size());
    ArgumentCaptor<URL> listingUrl = ArgumentCaptor.forClass(URL.class);
    verify(downloader).download(listingUrl.capture());
    assertEquals(BASE_URL + "list.json", listingUrl.getValue().toString());
    assertEquals(BASE_URL + "solc-linux-amd64-v0.8.29+commit.ab55807c",
        artifacts.get(1).getOrigin().getUrl().toString());
  }

  @Test(expected = ListingUnavailableException.class)
  public void testListingNotFound() throws Exception {
    createSource(null, 0).listArtifacts();
  }

  @Test()
  public void testListingUnreachable() throws Exception {
    Downloader downloader = mock(Downloader.class);
    given(downloader.download(any(URL.class)))
        .willThrow(new IOException("Connection refused"));
    try {
      new RemoteListingSource(new URL(BASE_URL), "list.json", "solc",
          "linux-amd64", downloader, 0).listArtifacts();
      fail("Should have thrown a ListingUnavailableException.");
    } catch (ListingUnavailableException e) {
      assertTrue(e.getMessage().contains("Connection refused"));
    }
  }

  @Test(expected = ListingUnavailableException.class)
  public void testCorruptJson() throws Exception {
    createSource("{ \"builds\": [ ", 0).listArtifacts();
  }

  @Test(expected = ListingUnavailableException.class)
  public void testJsonWithoutBuilds() throws Exception {
    createSource("{ \"releases\": {} }", 0).listArtifacts();
  }

  @Test()
  public void testEmptyIndex() throws Exception {
    assertTrue(createSource("<html></html>", 0).listArtifacts().isEmpty());
  }
}
