/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.csv;

import org.torproject.metrics.vpngate.VpnGateException;

/** Thrown if snapshot text violates the snapshot format. */
public class FormatException extends VpnGateException {

  public FormatException(String msg) {
    super(msg);
  }

  public FormatException(String msg, Exception ex) {
    super(msg, ex);
  }

}
