/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.artifact;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.net.URL;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

public class DestinationKeyTest {

  private static final String PLATFORM = "linux-amd64";

  @Test()
  public void testLayout() {
    DestinationKey key = DestinationKey.of(PLATFORM,
        "v0.8.29+commit.ab55807c", "solc");
    assertEquals("linux-amd64/v0.8.29+commit.ab55807c/solc",
        key.getBinaryKey());
    assertEquals("linux-amd64/v0.8.29+commit.ab55807c/sha256.hash",
        key.getHashKey());
  }

  @Test()
  public void testSameVersionSameKeys() throws Exception {
    CompilerArtifact remote = new CompilerArtifact("v0.8.19+commit.7dd6d404",
        PLATFORM, ArtifactOrigin.remote(new URL("https://example.org/solc")));
    CompilerArtifact local = new CompilerArtifact("v0.8.19+commit.7dd6d404",
        PLATFORM, ArtifactOrigin.local(Paths.get("/tmp/solc")));
    assertEquals(DestinationKey.of(remote, "solc"),
        DestinationKey.of(local, "solc"));
    assertEquals(DestinationKey.of(remote, "solc").hashCode(),
        DestinationKey.of(local, "solc").hashCode());
  }

  @Test()
  public void testDistinctVersionsDisjointKeys() {
    String[] versions = new String[] {
        "v0.8.1+commit.df193b15", "v0.8.10+commit.fc410830",
        "v0.8.1+commit.df193b1", "v0.8.11+commit.d7f03943",
        "v0.4.26+commit.4563c3fc" };
    Set<String> keys = new HashSet<>();
    for (String version : versions) {
      DestinationKey key = DestinationKey.of(PLATFORM, version, "solc");
      assertTrue(keys.add(key.getBinaryKey()));
      assertTrue(keys.add(key.getHashKey()));
    }
    assertEquals(2 * versions.length, keys.size());
    assertNotEquals(DestinationKey.of(PLATFORM, versions[0], "solc"),
        DestinationKey.of(PLATFORM, versions[1], "solc"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedVersion() {
    DestinationKey.of(PLATFORM, "0.8.29", "solc");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPlatformWithSlash() {
    DestinationKey.of("linux/amd64", "v0.8.29+commit.ab55807c", "solc");
  }

  @Test()
  public void testWellFormed() {
    assertTrue(VersionToken.isWellFormed("v0.8.29+commit.ab55807c"));
    assertFalse(VersionToken.isWellFormed("0.8.29+commit.ab55807c"));
    assertFalse(VersionToken.isWellFormed("v0.8.29"));
    assertFalse(VersionToken.isWellFormed("v0.8.29+commit.ab55807c.Linux"));
    assertFalse(VersionToken.isWellFormed(null));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testArtifactRejectsMalformedVersion() {
    new CompilerArtifact("latest", PLATFORM,
        ArtifactOrigin.local(Paths.get("solc")));
  }

  @Test(expected = IllegalStateException.class)
  public void testOriginIsEitherRemoteOrLocal() {
    ArtifactOrigin.local(Paths.get("solc")).getUrl();
  }
}
