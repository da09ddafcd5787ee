/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import org.torproject.metrics.vpngate.VpnGateException;

/**
 * Thrown if a stat with different values already exists at the timestamp of
 * a new stat.
 */
public class ConflictingStatException extends VpnGateException {

  public ConflictingStatException(String msg) {
    super(msg);
  }

}
