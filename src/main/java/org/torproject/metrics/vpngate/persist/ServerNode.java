/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.torproject.metrics.vpngate.model.ServerConfig;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/** Stored server config together with its stats and user tests. */
@JsonPropertyOrder({ "id", "name", "ip", "country_code", "country_name",
    "log_type", "operator_name", "operator_message", "openvpn_config_base64",
    "stats", "tests" })
class ServerNode {

  @JsonProperty("id")
  long id;

  @JsonProperty("name")
  String name;

  /**
   * Textual IP address, or {@code null} if the snapshot did not contain a
   * valid one.
   */
  @JsonProperty("ip")
  String ip;

  @JsonProperty("country_code")
  String countryCode;

  @JsonProperty("country_name")
  String countryName;

  @JsonProperty("log_type")
  String logType;

  @JsonProperty("operator_name")
  String operatorName;

  @JsonProperty("operator_message")
  String operatorMessage;

  @JsonProperty("openvpn_config_base64")
  String configBlob;

  @JsonProperty("stats")
  List<StatNode> stats = new ArrayList<>();

  @JsonProperty("tests")
  List<TestNode> tests = new ArrayList<>();

  /** Overwrite all config attributes except id and name. */
  void setAttributes(ServerConfig config) {
    this.ip = null == config.getIp() ? null : config.getIp().getHostAddress();
    this.countryCode = config.getCountryCode();
    this.countryName = config.getCountryName();
    this.logType = config.getLogType();
    this.operatorName = config.getOperatorName();
    this.operatorMessage = config.getOperatorMessage();
    this.configBlob = config.getConfigBlob();
  }

  ServerConfig toConfig() {
    ServerConfig config = new ServerConfig(this.name,
        ServerConfig.parseAddress(this.ip), this.countryCode, this.countryName,
        this.logType, this.operatorName, this.operatorMessage,
        this.configBlob);
    config.setId(this.id);
    return config;
  }
}
