/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/** Performance figures a server reported about itself at one instant. */
public class PeriodicStat {

  public static final String SCORE = "Score";
  public static final String PING = "Ping";
  public static final String SPEED = "Speed";
  public static final String NUM_VPN_SESSIONS = "NumVpnSessions";
  public static final String UPTIME = "Uptime";
  public static final String TOTAL_USERS = "TotalUsers";
  public static final String TOTAL_TRAFFIC = "TotalTraffic";

  /** Snapshot columns a stat is built from. */
  public static final List<String> COLUMNS = Collections.unmodifiableList(
      Arrays.asList(SCORE, PING, SPEED, NUM_VPN_SESSIONS, UPTIME, TOTAL_USERS,
      TOTAL_TRAFFIC));

  private static final Pattern DIGITS = Pattern.compile("^\\d+$");

  private final long score;

  private final long pingMs;

  private final long speedBps;

  private final long numSessions;

  private final long uptimeMs;

  private final long totalUsers;

  private final long totalTrafficBytes;

  private final Instant savedAt;

  private Long id;

  /** Create a stat that has not been stored yet. */
  public PeriodicStat(long score, long pingMs, long speedBps, long numSessions,
      long uptimeMs, long totalUsers, long totalTrafficBytes,
      Instant savedAt) {
    this.score = score;
    this.pingMs = pingMs;
    this.speedBps = speedBps;
    this.numSessions = numSessions;
    this.uptimeMs = uptimeMs;
    this.totalUsers = totalUsers;
    this.totalTrafficBytes = totalTrafficBytes;
    this.savedAt = Objects.requireNonNull(savedAt);
  }

  static PeriodicStat fromRow(RowReader reader, Instant savedAt)
      throws SchemaMismatchException {
    return new PeriodicStat(toLong(reader.get(SCORE)),
        toLong(reader.get(PING)), toLong(reader.get(SPEED)),
        toLong(reader.get(NUM_VPN_SESSIONS)), toLong(reader.get(UPTIME)),
        toLong(reader.get(TOTAL_USERS)), toLong(reader.get(TOTAL_TRAFFIC)),
        savedAt);
  }

  /**
   * Convert snapshot text to a number, treating anything that is not a plain
   * non-negative decimal, or does not fit into a long, as 0.
   */
  public static long toLong(String text) {
    if (null == text || !DIGITS.matcher(text).matches()) {
      return 0L;
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      return 0L;
    }
  }

  /** Compare all figures, but neither timestamp nor id. */
  public boolean sameValues(PeriodicStat other) {
    return this.score == other.score
        && this.pingMs == other.pingMs
        && this.speedBps == other.speedBps
        && this.numSessions == other.numSessions
        && this.uptimeMs == other.uptimeMs
        && this.totalUsers == other.totalUsers
        && this.totalTrafficBytes == other.totalTrafficBytes;
  }

  public long getScore() {
    return score;
  }

  public long getPingMs() {
    return pingMs;
  }

  public long getSpeedBps() {
    return speedBps;
  }

  public long getNumSessions() {
    return numSessions;
  }

  public long getUptimeMs() {
    return uptimeMs;
  }

  public long getTotalUsers() {
    return totalUsers;
  }

  public long getTotalTrafficBytes() {
    return totalTrafficBytes;
  }

  public Instant getSavedAt() {
    return savedAt;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PeriodicStat)) {
      return false;
    }
    PeriodicStat other = (PeriodicStat) obj;
    return sameValues(other) && this.savedAt.equals(other.savedAt)
        && Objects.equals(this.id, other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(score, pingMs, speedBps, numSessions, uptimeMs,
        totalUsers, totalTrafficBytes, savedAt, id);
  }

  @Override
  public String toString() {
    return "PeriodicStat[" + savedAt + ", score=" + score + ", ping="
        + pingMs + ", speed=" + speedBps + ", sessions=" + numSessions
        + ", uptime=" + uptimeMs + ", users=" + totalUsers + ", traffic="
        + totalTrafficBytes + ", id=" + id + "]";
  }
}
