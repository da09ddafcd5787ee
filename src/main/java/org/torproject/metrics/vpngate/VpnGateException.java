/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate;

/** Base class of all errors raised while handling VPN Gate data. */
public class VpnGateException extends Exception {

  public VpnGateException(String msg) {
    super(msg);
  }

  public VpnGateException(String msg, Exception ex) {
    super(msg, ex);
  }

}
