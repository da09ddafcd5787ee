/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import org.torproject.metrics.vpngate.VpnGateException;

/**
 * Thrown if a new stat carries the same values as its chronological
 * predecessor or successor.
 */
public class RedundantStatException extends VpnGateException {

  public RedundantStatException(String msg) {
    super(msg);
  }

}
