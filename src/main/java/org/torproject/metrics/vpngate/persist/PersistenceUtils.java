/* Copyright 2016--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class PersistenceUtils {

  private static final Logger log = LoggerFactory.getLogger(
      PersistenceUtils.class);

  public static final String TEMPFIX = ".tmp";

  private static final DateTimeFormatter dateTimeFormatter = DateTimeFormatter
      .ofPattern("uuuu-MM-dd-HH-mm-ss").withZone(ZoneOffset.UTC);

  private PersistenceUtils() { /* static only */ }

  /**
   * Stores the given bytes with the given option, creating parent directories
   * as needed.
   * Returns {@code true}, if the file was written.
   */
  public static boolean storeToFileSystem(byte[] data, Path outputPath,
      StandardOpenOption option) {
    try {
      Files.createDirectories(outputPath.toAbsolutePath().getParent());
      Files.write(outputPath, data, option, StandardOpenOption.CREATE);
      return true;
    } catch (FileAlreadyExistsException faee) {
      log.debug("Already have file {}. Skipping.", outputPath);
    } catch (IOException | SecurityException
        | UnsupportedOperationException e) {
      log.warn("Could not store file {}.", outputPath, e);
    }
    return false;
  }

  /**
   * Writes the given bytes to a temporary file next to the target and moves
   * it to the target, so that readers never see a partially written file.
   */
  public static void writeAtomically(Path target, byte[] data)
      throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path tmpPath = parent.resolve(target.getFileName().toString() + TEMPFIX);
    Files.write(tmpPath, data);
    try {
      Files.move(tmpPath, target, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}.", target);
      Files.move(tmpPath, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Deletes all files below the given directory that were last modified
   * before the given time; a missing directory is ignored.
   */
  public static void cleanDirectory(Path pathToClean, long cutOffMillis) {
    if (!Files.isDirectory(pathToClean)) {
      return;
    }
    SimpleFileVisitor<Path> sfv = new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
          throws IOException {
        if (attrs.lastModifiedTime().toMillis() < cutOffMillis) {
          Files.delete(file);
        }
        return FileVisitResult.CONTINUE;
      }
    };
    try {
      Files.walkFileTree(pathToClean, sfv);
    } catch (IOException ioe) {
      log.warn("Cleaning of {} failed.", pathToClean, ioe);
    }
  }

  /** Return all date-time parts as array. */
  public static String[] dateTimeParts(Instant dateTime) {
    return dateTime(dateTime).split("-");
  }

  /** Return all date-time as string. */
  public static String dateTime(Instant dateTime) {
    return dateTimeFormatter.format(dateTime);
  }

}
