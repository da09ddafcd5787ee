/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.sync;

import org.torproject.metrics.vpngate.csv.FormatException;
import org.torproject.metrics.vpngate.csv.SnapshotData;
import org.torproject.metrics.vpngate.csv.SnapshotParser;
import org.torproject.metrics.vpngate.model.ConflictingIdException;
import org.torproject.metrics.vpngate.model.ConflictingStatException;
import org.torproject.metrics.vpngate.model.ConflictingTestException;
import org.torproject.metrics.vpngate.model.NameMismatchException;
import org.torproject.metrics.vpngate.model.RedundantStatException;
import org.torproject.metrics.vpngate.model.SchemaMismatchException;
import org.torproject.metrics.vpngate.model.Server;
import org.torproject.metrics.vpngate.model.UserTest;
import org.torproject.metrics.vpngate.persist.ServerGateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Keeps the known servers in memory, merges snapshots into them, and tracks
 * which servers need to be upserted or deleted in the storage.
 *
 * <p>Instances are not thread-safe; callers running syncs and saves from
 * different threads need to serialize access.</p>
 */
public class SyncManager {

  private static final Logger logger
      = LoggerFactory.getLogger(SyncManager.class);

  /** Coarse state of the in-memory servers relative to the storage. */
  public enum State {
    /** Nothing read from storage or saved to it yet. */
    EMPTY,
    /** In-memory servers match the storage. */
    LOADED,
    /** Changes are pending. */
    DIRTY
  }

  private final Clock clock;

  private final SortedMap<String, Server> servers = new TreeMap<>();

  private final SortedSet<String> pendingUpserts = new TreeSet<>();

  private final SortedSet<String> pendingDeletes = new TreeSet<>();

  /** Servers removed from memory whose deletion is not saved yet. */
  private final Map<String, Server> removedServers = new HashMap<>();

  /** Removed servers that were pending upsert when they were removed. */
  private final Set<String> removedUnsaved = new HashSet<>();

  private boolean loaded = false;

  public SyncManager() {
    this(Clock.systemUTC());
  }

  /** Use the given clock for timestamping stats of new snapshots. */
  public SyncManager(Clock clock) {
    this.clock = clock;
  }

  /**
   * Merge the given snapshot into the in-memory servers.
   *
   * <p>New servers are added, changed servers are updated, and servers missing
   * from the snapshot are removed. A server whose update fails is logged and
   * left as it was, without affecting other servers. All stats of one
   * snapshot share the same timestamp.</p>
   *
   * @param rawText Snapshot text.
   * @throws FormatException Thrown if the snapshot cannot be parsed; nothing
   *     is changed in that case.
   * @throws SchemaMismatchException Thrown if snapshot columns differ from
   *     the expected ones; nothing is changed in that case.
   */
  public void syncFromSnapshot(String rawText)
      throws FormatException, SchemaMismatchException {
    SnapshotData snapshot = SnapshotParser.parse(rawText);
    List<String> header = snapshot.getHeader();
    Set<String> requiredColumns = Server.getRequiredColumns();
    if (!new HashSet<>(header).equals(requiredColumns)) {
      throw new SchemaMismatchException("Snapshot columns " + header
          + " do not match the expected columns " + requiredColumns + ".");
    }
    Instant savedAt = this.clock.instant();
    Set<String> freshNames = new HashSet<>();
    int added = 0;
    int updated = 0;
    int skipped = 0;
    int rowNumber = 0;
    for (List<String> row : snapshot.getRows()) {
      rowNumber++;
      Server fresh;
      try {
        fresh = Server.fromRow(header, row, savedAt);
      } catch (IllegalArgumentException e) {
        logger.warn("Skipping snapshot row {}: {}", rowNumber, e.getMessage());
        skipped++;
        continue;
      }
      String name = fresh.getName();
      freshNames.add(name);
      Server existing = this.servers.get(name);
      if (null == existing && this.removedServers.containsKey(name)) {
        existing = this.reviveServer(name);
      }
      if (null == existing) {
        this.servers.put(name, fresh);
        this.markForUpsert(name);
        added++;
        continue;
      }
      try {
        if (existing.mergeFrom(fresh)) {
          this.markForUpsert(name);
          updated++;
        }
      } catch (RedundantStatException e) {
        logger.debug("Not updating server {}: {}", name, e.getMessage());
      } catch (NameMismatchException | ConflictingIdException
          | ConflictingStatException e) {
        logger.warn("Could not update server {}: {}", name, e.getMessage());
        skipped++;
      }
    }
    SortedSet<String> staleNames = new TreeSet<>(this.servers.keySet());
    staleNames.removeAll(freshNames);
    for (String name : staleNames) {
      this.deleteServer(name);
    }
    logger.info("Synchronized snapshot of {} row(s): {} added, {} updated, "
        + "{} skipped, {} removed.", snapshot.getRows().size(), added, updated,
        skipped, staleNames.size());
  }

  /**
   * Remove a server from memory and mark it for deletion from storage.
   *
   * @return Whether a server of that name was known.
   */
  public boolean deleteServer(String name) {
    Server removed = this.servers.remove(name);
    if (null == removed) {
      logger.warn("Attempted to delete non-existent server {}.", name);
      return false;
    }
    if (this.pendingUpserts.remove(name)) {
      this.removedUnsaved.add(name);
    }
    this.pendingDeletes.add(name);
    this.removedServers.put(name, removed);
    logger.info("Server {} marked for deletion.", name);
    return true;
  }

  /**
   * Add the result of a connectivity test to a known server and mark that
   * server for upsert.
   *
   * @return {@code true} if the test was added, {@code false} if the server
   *     is unknown or an equal test exists at the same timestamp.
   * @throws ConflictingTestException Thrown if a different test exists at the
   *     same timestamp.
   */
  public boolean recordUserTest(String name, UserTest test)
      throws ConflictingTestException {
    Server server = this.servers.get(name);
    if (null == server) {
      logger.warn("Cannot record user test of unknown server {}.", name);
      return false;
    }
    if (server.addTest(test)) {
      this.markForUpsert(name);
      return true;
    }
    return false;
  }

  /**
   * Write all pending upserts and deletions to the given storage and forget
   * about them afterwards.
   *
   * <p>If the storage fails, pending changes are kept, so that calling this
   * method again repeats the whole save.</p>
   *
   * @throws IOException Thrown by the storage; not retried here.
   */
  public void saveChanges(ServerGateway gateway) throws IOException {
    logger.info("Saving {} upsert(s) and {} deletion(s) to storage.",
        this.pendingUpserts.size(), this.pendingDeletes.size());
    for (String name : this.pendingUpserts) {
      gateway.upsert(this.servers.get(name));
    }
    for (String name : this.pendingDeletes) {
      gateway.deleteByName(name);
    }
    this.pendingUpserts.clear();
    this.pendingDeletes.clear();
    this.removedServers.clear();
    this.removedUnsaved.clear();
    this.loaded = true;
    logger.info("Save complete.");
  }

  /**
   * Discard all in-memory servers and pending changes and read all servers
   * from the given storage instead.
   *
   * @throws IOException Thrown by the storage; the in-memory state remains
   *     unchanged in that case.
   */
  public void resetFromGateway(ServerGateway gateway) throws IOException {
    List<Server> stored = gateway.readAll();
    this.servers.clear();
    this.pendingUpserts.clear();
    this.pendingDeletes.clear();
    this.removedServers.clear();
    this.removedUnsaved.clear();
    for (Server server : stored) {
      this.servers.put(server.getName(), server);
    }
    this.loaded = true;
    logger.info("Read {} server(s) from storage.", this.servers.size());
  }

  /** Return the server with the given name or {@code null}. */
  public Server getServer(String name) {
    return this.servers.get(name);
  }

  /** Return all servers in memory ordered by name. */
  public Collection<Server> getServers() {
    return Collections.unmodifiableCollection(this.servers.values());
  }

  public SortedSet<String> getPendingUpserts() {
    return Collections.unmodifiableSortedSet(this.pendingUpserts);
  }

  public SortedSet<String> getPendingDeletes() {
    return Collections.unmodifiableSortedSet(this.pendingDeletes);
  }

  /** Return the current state derived from pending changes. */
  public State getState() {
    if (!this.pendingUpserts.isEmpty() || !this.pendingDeletes.isEmpty()) {
      return State.DIRTY;
    }
    return this.loaded ? State.LOADED : State.EMPTY;
  }

  private void markForUpsert(String name) {
    this.pendingDeletes.remove(name);
    this.pendingUpserts.add(name);
  }

  /**
   * Take back a server that disappeared from an earlier snapshot before its
   * deletion was saved, so that it keeps its stored id and history. Unsaved
   * changes it had before its removal are marked for upsert again.
   */
  private Server reviveServer(String name) {
    Server revived = this.removedServers.remove(name);
    boolean unsaved = this.removedUnsaved.remove(name);
    this.pendingDeletes.remove(name);
    this.servers.put(name, revived);
    if (unsaved || null == revived.getConfig().getId()) {
      this.markForUpsert(name);
    }
    logger.info("Server {} reappeared; no longer marked for deletion.", name);
    return revived;
  }
}
