/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Root node of the server store file, holding the last ids handed out for
 * servers, stats, and tests, as well as all stored servers.
 */
@JsonPropertyOrder({ "last_server_id", "last_stat_id", "last_test_id",
    "servers" })
class StoreNode {

  @JsonProperty("last_server_id")
  long lastServerId;

  @JsonProperty("last_stat_id")
  long lastStatId;

  @JsonProperty("last_test_id")
  long lastTestId;

  @JsonProperty("servers")
  List<ServerNode> servers = new ArrayList<>();

}
