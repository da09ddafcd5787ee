/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.torproject.metrics.vpngate.model.UserTest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/** Stored user test. */
@JsonPropertyOrder({ "id", "saved_at", "ping_ms", "speed_bps" })
class TestNode {

  @JsonProperty("id")
  long id;

  @JsonProperty("saved_at")
  String savedAt;

  @JsonProperty("ping_ms")
  long pingMs;

  @JsonProperty("speed_bps")
  long speedBps;

  static TestNode of(UserTest test, long id) {
    TestNode testNode = new TestNode();
    testNode.id = id;
    testNode.savedAt = test.getSavedAt().toString();
    testNode.pingMs = test.getPingMs();
    testNode.speedBps = test.getSpeedBps();
    return testNode;
  }

  UserTest toTest() {
    UserTest test = new UserTest(this.pingMs, this.speedBps,
        Instant.parse(this.savedAt));
    test.setId(this.id);
    return test;
  }
}
