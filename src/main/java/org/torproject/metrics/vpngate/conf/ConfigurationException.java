/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.conf;

import org.torproject.metrics.vpngate.VpnGateException;

/** Thrown for missing, unreadable, or corrupt configuration values. */
public class ConfigurationException extends VpnGateException {

  public ConfigurationException(String msg) {
    super(msg);
  }

  public ConfigurationException(String msg, Exception ex) {
    super(msg, ex);
  }
}
