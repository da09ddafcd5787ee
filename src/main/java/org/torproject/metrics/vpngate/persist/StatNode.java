/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.torproject.metrics.vpngate.model.PeriodicStat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/** Stored stat; {@code saved_at} is an ISO-8601 instant. */
@JsonPropertyOrder({ "id", "saved_at", "score", "ping_ms", "speed_bps",
    "num_vpn_sessions", "uptime_ms", "total_users", "total_traffic_bytes" })
class StatNode {

  @JsonProperty("id")
  long id;

  @JsonProperty("saved_at")
  String savedAt;

  @JsonProperty("score")
  long score;

  @JsonProperty("ping_ms")
  long pingMs;

  @JsonProperty("speed_bps")
  long speedBps;

  @JsonProperty("num_vpn_sessions")
  long numSessions;

  @JsonProperty("uptime_ms")
  long uptimeMs;

  @JsonProperty("total_users")
  long totalUsers;

  @JsonProperty("total_traffic_bytes")
  long totalTrafficBytes;

  static StatNode of(PeriodicStat stat, long id) {
    StatNode statNode = new StatNode();
    statNode.id = id;
    statNode.savedAt = stat.getSavedAt().toString();
    statNode.score = stat.getScore();
    statNode.pingMs = stat.getPingMs();
    statNode.speedBps = stat.getSpeedBps();
    statNode.numSessions = stat.getNumSessions();
    statNode.uptimeMs = stat.getUptimeMs();
    statNode.totalUsers = stat.getTotalUsers();
    statNode.totalTrafficBytes = stat.getTotalTrafficBytes();
    return statNode;
  }

  PeriodicStat toStat() {
    PeriodicStat stat = new PeriodicStat(this.score, this.pingMs,
        this.speedBps, this.numSessions, this.uptimeMs, this.totalUsers,
        this.totalTrafficBytes, Instant.parse(this.savedAt));
    stat.setId(this.id);
    return stat;
  }
}
