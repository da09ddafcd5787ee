/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Keeps fetched snapshots: gzip-compressed in the output directory for
 * archiving, and uncompressed in the recent directory for a few days.
 */
public class SnapshotArchive {

  private static final Logger logger
      = LoggerFactory.getLogger(SnapshotArchive.class);

  static final String VPNGATE = "vpngate";

  static final String SNAPSHOT_SUFFIX = "-snapshot.csv";

  static final String GZ_SUFFIX = ".gz";

  private final Path outputPath;

  private final Path recentPath;

  public SnapshotArchive(Path outputPath, Path recentPath) {
    this.outputPath = outputPath;
    this.recentPath = recentPath;
  }

  /**
   * Store the given snapshot text fetched at the given time.
   *
   * @return Whether both copies were written.
   */
  public boolean store(String snapshot, Instant fetched) {
    byte[] snapshotBytes = snapshot.getBytes(StandardCharsets.UTF_8);
    byte[] compressedBytes;
    try {
      compressedBytes = gzip(snapshotBytes);
    } catch (IOException e) {
      logger.warn("Could not compress snapshot fetched at {}.", fetched, e);
      return false;
    }
    boolean stored = PersistenceUtils.storeToFileSystem(compressedBytes,
        this.getStoragePath(fetched), StandardOpenOption.CREATE_NEW);
    if (stored) {
      stored = PersistenceUtils.storeToFileSystem(snapshotBytes,
          this.getRecentPath(fetched), StandardOpenOption.CREATE_NEW);
    }
    return stored;
  }

  /** Delete recent snapshots that are older than three days. */
  public void cleanUpRecent(Instant now) {
    PersistenceUtils.cleanDirectory(this.recentPath.resolve(VPNGATE),
        now.minus(3, ChronoUnit.DAYS).toEpochMilli());
  }

  /** Return the archive location of a snapshot fetched at the given time. */
  public Path getStoragePath(Instant fetched) {
    String[] parts = PersistenceUtils.dateTimeParts(fetched);
    return Paths.get(this.outputPath.toString(), VPNGATE, parts[0], parts[1],
        parts[2], PersistenceUtils.dateTime(fetched) + SNAPSHOT_SUFFIX
        + GZ_SUFFIX);
  }

  /** Return the recent location of a snapshot fetched at the given time. */
  public Path getRecentPath(Instant fetched) {
    return Paths.get(this.recentPath.toString(), VPNGATE,
        PersistenceUtils.dateTime(fetched) + SNAPSHOT_SUFFIX);
  }

  private static byte[] gzip(byte[] data) throws IOException {
    ByteArrayOutputStream compressed = new ByteArrayOutputStream();
    try (OutputStream out = new GzipCompressorOutputStream(compressed)) {
      out.write(data);
    }
    return compressed.toByteArray();
  }
}
