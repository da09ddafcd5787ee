/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity and descriptive attributes of a VPN Gate server.
 *
 * <p>The host name is the natural key of a server and never changes. The
 * database id is {@code null} until the config has been stored.</p>
 */
public class ServerConfig {

  public static final String HOST_NAME = "HostName";
  public static final String IP = "IP";
  public static final String COUNTRY_SHORT = "CountryShort";
  public static final String COUNTRY_LONG = "CountryLong";
  public static final String LOG_TYPE = "LogType";
  public static final String OPERATOR = "Operator";
  public static final String MESSAGE = "Message";
  public static final String OPENVPN_CONFIG = "OpenVPN_ConfigData_Base64";

  /** Snapshot columns a config is built from. */
  public static final List<String> COLUMNS = Collections.unmodifiableList(
      Arrays.asList(HOST_NAME, IP, COUNTRY_SHORT, COUNTRY_LONG, LOG_TYPE,
      OPERATOR, MESSAGE, OPENVPN_CONFIG));

  private static final Pattern IPV4_LITERAL = Pattern.compile(
      "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}"
      + "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

  private static final Pattern IPV6_LITERAL = Pattern.compile(
      "^(?=.*:)[0-9A-Fa-f:][0-9A-Fa-f:.]*$");

  private final String name;

  private InetAddress ip;

  private String countryCode;

  private String countryName;

  private String logType;

  private String operatorName;

  private String operatorMessage;

  private String configBlob;

  private Long id;

  /**
   * Create a config that has not been stored yet.
   *
   * @throws IllegalArgumentException Thrown if the name is blank.
   */
  public ServerConfig(String name, InetAddress ip, String countryCode,
      String countryName, String logType, String operatorName,
      String operatorMessage, String configBlob) {
    if (null == name || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Server name must not be blank.");
    }
    this.name = name;
    this.ip = ip;
    this.countryCode = countryCode;
    this.countryName = countryName;
    this.logType = logType;
    this.operatorName = operatorName;
    this.operatorMessage = operatorMessage;
    this.configBlob = configBlob;
  }

  /** Copy all attributes including the id. */
  public ServerConfig(ServerConfig other) {
    this(other.name, other.ip, other.countryCode, other.countryName,
        other.logType, other.operatorName, other.operatorMessage,
        other.configBlob);
    this.id = other.id;
  }

  static ServerConfig fromRow(RowReader reader)
      throws SchemaMismatchException {
    return new ServerConfig(reader.get(HOST_NAME),
        parseAddress(reader.get(IP)), reader.get(COUNTRY_SHORT),
        reader.get(COUNTRY_LONG), reader.get(LOG_TYPE), reader.get(OPERATOR),
        reader.get(MESSAGE), reader.get(OPENVPN_CONFIG));
  }

  /**
   * Parse an IPv4 or IPv6 literal without ever resolving host names.
   *
   * @return The address, or {@code null} if the text is no valid literal.
   */
  public static InetAddress parseAddress(String text) {
    if (null == text) {
      return null;
    }
    String literal = text.trim();
    if (!IPV4_LITERAL.matcher(literal).matches()
        && !IPV6_LITERAL.matcher(literal).matches()) {
      return null;
    }
    try {
      return InetAddress.getByName(literal);
    } catch (UnknownHostException e) {
      return null;
    }
  }

  /**
   * Update this config with the attributes of another config of the same
   * server.
   *
   * <p>An id of the other config is adopted if this config has none yet.</p>
   *
   * @return Whether any attribute, including the id, changed.
   * @throws NameMismatchException Thrown if names differ.
   * @throws ConflictingIdException Thrown if both configs carry ids and these
   *     differ.
   */
  public boolean mergeFrom(ServerConfig other)
      throws NameMismatchException, ConflictingIdException {
    if (!this.name.equals(other.name)) {
      throw new NameMismatchException("Expected name '" + this.name
          + "', got '" + other.name + "'.");
    }
    if (null != this.id && null != other.id && !this.id.equals(other.id)) {
      throw new ConflictingIdException("Conflicting ids of server '"
          + this.name + "': " + this.id + " and " + other.id + ".");
    }
    boolean changed = false;
    if (null == this.id && null != other.id) {
      this.id = other.id;
      changed = true;
    }
    if (!Objects.equals(this.ip, other.ip)) {
      this.ip = other.ip;
      changed = true;
    }
    if (!Objects.equals(this.countryCode, other.countryCode)) {
      this.countryCode = other.countryCode;
      changed = true;
    }
    if (!Objects.equals(this.countryName, other.countryName)) {
      this.countryName = other.countryName;
      changed = true;
    }
    if (!Objects.equals(this.logType, other.logType)) {
      this.logType = other.logType;
      changed = true;
    }
    if (!Objects.equals(this.operatorName, other.operatorName)) {
      this.operatorName = other.operatorName;
      changed = true;
    }
    if (!Objects.equals(this.operatorMessage, other.operatorMessage)) {
      this.operatorMessage = other.operatorMessage;
      changed = true;
    }
    if (!Objects.equals(this.configBlob, other.configBlob)) {
      this.configBlob = other.configBlob;
      changed = true;
    }
    return changed;
  }

  /** Reset all attributes including the id to those of a copy of this. */
  void restoreFrom(ServerConfig saved) {
    this.ip = saved.ip;
    this.countryCode = saved.countryCode;
    this.countryName = saved.countryName;
    this.logType = saved.logType;
    this.operatorName = saved.operatorName;
    this.operatorMessage = saved.operatorMessage;
    this.configBlob = saved.configBlob;
    this.id = saved.id;
  }

  public String getName() {
    return name;
  }

  public InetAddress getIp() {
    return ip;
  }

  public String getCountryCode() {
    return countryCode;
  }

  public String getCountryName() {
    return countryName;
  }

  public String getLogType() {
    return logType;
  }

  public String getOperatorName() {
    return operatorName;
  }

  public String getOperatorMessage() {
    return operatorMessage;
  }

  /** Base64 encoded OpenVPN connection profile. */
  public String getConfigBlob() {
    return configBlob;
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
    if (!(obj instanceof ServerConfig)) {
      return false;
    }
    ServerConfig other = (ServerConfig) obj;
    return this.name.equals(other.name)
        && Objects.equals(this.ip, other.ip)
        && Objects.equals(this.countryCode, other.countryCode)
        && Objects.equals(this.countryName, other.countryName)
        && Objects.equals(this.logType, other.logType)
        && Objects.equals(this.operatorName, other.operatorName)
        && Objects.equals(this.operatorMessage, other.operatorMessage)
        && Objects.equals(this.configBlob, other.configBlob)
        && Objects.equals(this.id, other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, ip, countryCode, countryName, logType,
        operatorName, operatorMessage, configBlob, id);
  }

  @Override
  public String toString() {
    return "ServerConfig[" + name + ", id=" + id + ", ip=" + ip + "]";
  }
}
