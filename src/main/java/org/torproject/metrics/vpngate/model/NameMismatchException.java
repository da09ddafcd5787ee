/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import org.torproject.metrics.vpngate.VpnGateException;

/** Thrown when merging two configs of differently named servers. */
public class NameMismatchException extends VpnGateException {

  public NameMismatchException(String msg) {
    super(msg);
  }

}
