/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public class SnapshotArchiveTest {

  private static final Instant FETCHED = Instant.parse("2026-03-09T07:05:04Z");

  private static final String SNAPSHOT = "*vpn_servers\n#HostName\nvpn1\n*\n";

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private Path outputPath;

  private Path recentPath;

  private SnapshotArchive archive;

  @Before
  public void setUp() {
    this.outputPath = tmpf.getRoot().toPath().resolve("out");
    this.recentPath = tmpf.getRoot().toPath().resolve("recent");
    this.archive = new SnapshotArchive(this.outputPath, this.recentPath);
  }

  @Test
  public void testPaths() {
    assertEquals(Paths.get(this.outputPath.toString(), "vpngate", "2026",
        "03", "09", "2026-03-09-07-05-04-snapshot.csv.gz"),
        this.archive.getStoragePath(FETCHED));
    assertEquals(Paths.get(this.recentPath.toString(), "vpngate",
        "2026-03-09-07-05-04-snapshot.csv"),
        this.archive.getRecentPath(FETCHED));
  }

  @Test
  public void testStore() throws Exception {
    assertTrue(this.archive.store(SNAPSHOT, FETCHED));
    ByteArrayOutputStream decompressed = new ByteArrayOutputStream();
    try (InputStream in = new GzipCompressorInputStream(
        Files.newInputStream(this.archive.getStoragePath(FETCHED)))) {
      byte[] buffer = new byte[1024];
      int len;
      while ((len = in.read(buffer)) >= 0) {
        decompressed.write(buffer, 0, len);
      }
    }
    assertEquals(SNAPSHOT, new String(decompressed.toByteArray(),
        StandardCharsets.UTF_8));
    assertEquals(SNAPSHOT, new String(Files.readAllBytes(
        this.archive.getRecentPath(FETCHED)), StandardCharsets.UTF_8));
  }

  @Test
  public void testStoreTwiceKeepsFirst() throws Exception {
    assertTrue(this.archive.store(SNAPSHOT, FETCHED));
    assertFalse(this.archive.store("*\n#Other\n", FETCHED));
    assertEquals(SNAPSHOT, new String(Files.readAllBytes(
        this.archive.getRecentPath(FETCHED)), StandardCharsets.UTF_8));
  }

  @Test
  public void testCleanUpRecent() throws Exception {
    Instant now = FETCHED.plus(10, ChronoUnit.DAYS);
    Instant recent = now.minus(1, ChronoUnit.DAYS);
    this.archive.store(SNAPSHOT, FETCHED);
    this.archive.store(SNAPSHOT, recent);
    Files.setLastModifiedTime(this.archive.getRecentPath(FETCHED),
        FileTime.from(FETCHED));
    Files.setLastModifiedTime(this.archive.getRecentPath(recent),
        FileTime.from(recent));
    this.archive.cleanUpRecent(now);
    assertFalse(Files.exists(this.archive.getRecentPath(FETCHED)));
    assertTrue(Files.exists(this.archive.getRecentPath(recent)));
    assertTrue(Files.exists(this.archive.getStoragePath(FETCHED)));
  }
}
