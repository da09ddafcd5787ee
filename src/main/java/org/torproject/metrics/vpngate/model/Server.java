/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A VPN Gate server consisting of its config, the stats it reported over
 * time, and the tests the user ran against it, both series ordered by
 * timestamp.
 */
public class Server {

  private static final Logger logger = LoggerFactory.getLogger(Server.class);

  private final ServerConfig config;

  private final TreeMap<Instant, PeriodicStat> stats = new TreeMap<>();

  private final TreeMap<Instant, UserTest> tests = new TreeMap<>();

  public Server(ServerConfig config) {
    this.config = config;
  }

  /** Return all snapshot columns required to build servers. */
  public static Set<String> getRequiredColumns() {
    Set<String> columns = new LinkedHashSet<>(ServerConfig.COLUMNS);
    columns.addAll(PeriodicStat.COLUMNS);
    return Collections.unmodifiableSet(columns);
  }

  /**
   * Build a server with a single stat from one snapshot row.
   *
   * @param header Snapshot header.
   * @param row Snapshot row of header width.
   * @param savedAt Timestamp of the stat.
   * @throws SchemaMismatchException Thrown if a required column is missing.
   * @throws IllegalArgumentException Thrown if the host name is blank.
   */
  public static Server fromRow(List<String> header, List<String> row,
      Instant savedAt) throws SchemaMismatchException {
    RowReader reader = new RowReader(header, row);
    Server server = new Server(ServerConfig.fromRow(reader));
    server.stats.put(savedAt, PeriodicStat.fromRow(reader, savedAt));
    return server;
  }

  public String getName() {
    return config.getName();
  }

  public ServerConfig getConfig() {
    return config;
  }

  public SortedMap<Instant, PeriodicStat> getStats() {
    return Collections.unmodifiableSortedMap(stats);
  }

  public SortedMap<Instant, UserTest> getTests() {
    return Collections.unmodifiableSortedMap(tests);
  }

  /** Return the timestamp of the latest stat or {@code null}. */
  public Instant getLastStatTime() {
    return stats.isEmpty() ? null : stats.lastKey();
  }

  /** Return the latest stat or {@code null}. */
  public PeriodicStat getLastStat() {
    return stats.isEmpty() ? null : stats.lastEntry().getValue();
  }

  /** Return the timestamp of the latest user test or {@code null}. */
  public Instant getLastTestTime() {
    return tests.isEmpty() ? null : tests.lastKey();
  }

  /**
   * Add a stat to the series unless an equal stat is already stored at the
   * same timestamp.
   *
   * <p>A stat that carries the same values as its chronological predecessor
   * or successor is rejected, so that unchanged servers do not grow their
   * series with every snapshot.</p>
   *
   * @return {@code true} if the stat was added, {@code false} if an equal stat
   *     exists at its timestamp.
   * @throws ConflictingStatException Thrown if a different stat exists at the
   *     same timestamp.
   * @throws RedundantStatException Thrown if a neighboring stat has the same
   *     values.
   */
  public boolean addStat(PeriodicStat stat)
      throws ConflictingStatException, RedundantStatException {
    Instant savedAt = stat.getSavedAt();
    PeriodicStat existing = stats.get(savedAt);
    if (null != existing) {
      if (!existing.sameValues(stat)) {
        throw new ConflictingStatException("Different stat of server '"
            + getName() + "' exists at " + savedAt + ".");
      }
      return false;
    }
    Map.Entry<Instant, PeriodicStat> previous = stats.lowerEntry(savedAt);
    Map.Entry<Instant, PeriodicStat> next = stats.higherEntry(savedAt);
    if ((null != previous && previous.getValue().sameValues(stat))
        || (null != next && next.getValue().sameValues(stat))) {
      throw new RedundantStatException("Stat of server '" + getName()
          + "' at " + savedAt + " is identical to its neighbor(s).");
    }
    stats.put(savedAt, stat);
    return true;
  }

  /**
   * Add a user test unless an equal test is already stored at the same
   * timestamp.
   *
   * @return {@code true} if the test was added, {@code false} if an equal test
   *     exists at its timestamp.
   * @throws ConflictingTestException Thrown if a different test exists at the
   *     same timestamp.
   */
  public boolean addTest(UserTest test) throws ConflictingTestException {
    UserTest existing = tests.get(test.getSavedAt());
    if (null != existing) {
      if (!existing.sameValues(test)) {
        throw new ConflictingTestException("Different user test of server '"
            + getName() + "' exists at " + test.getSavedAt() + ".");
      }
      return false;
    }
    tests.put(test.getSavedAt(), test);
    return true;
  }

  /**
   * Merge config, stats, and user tests of another instance of this server
   * into this one.
   *
   * <p>Config and stats are merged all-or-nothing: if either fails, this
   * server is restored in place to its state before the merge, so that
   * previously obtained config and series views never show partial merges.
   * Conflicting user tests are logged and skipped.</p>
   *
   * @return Whether config, stats, or tests changed.
   */
  public boolean mergeFrom(Server other) throws NameMismatchException,
      ConflictingIdException, ConflictingStatException,
      RedundantStatException {
    ServerConfig savedConfig = new ServerConfig(this.config);
    TreeMap<Instant, PeriodicStat> savedStats = new TreeMap<>(this.stats);
    TreeMap<Instant, UserTest> savedTests = new TreeMap<>(this.tests);
    boolean changed;
    try {
      changed = this.config.mergeFrom(other.config);
      for (PeriodicStat stat : other.stats.values()) {
        changed |= this.addStat(stat);
      }
    } catch (NameMismatchException | ConflictingIdException
        | ConflictingStatException | RedundantStatException e) {
      this.config.restoreFrom(savedConfig);
      this.stats.clear();
      this.stats.putAll(savedStats);
      this.tests.clear();
      this.tests.putAll(savedTests);
      throw e;
    }
    for (UserTest test : other.tests.values()) {
      try {
        changed |= this.addTest(test);
      } catch (ConflictingTestException e) {
        logger.warn("Skipping user test of server {} at {}: {}", getName(),
            test.getSavedAt(), e.getMessage());
      }
    }
    return changed;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Server)) {
      return false;
    }
    Server other = (Server) obj;
    return this.config.equals(other.config) && this.stats.equals(other.stats)
        && this.tests.equals(other.tests);
  }

  @Override
  public int hashCode() {
    return config.hashCode() * 31 + stats.size();
  }

  @Override
  public String toString() {
    return "Server[" + config + ", " + stats.size() + " stat(s), "
        + tests.size() + " test(s)]";
  }
}
