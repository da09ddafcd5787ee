/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import org.torproject.metrics.vpngate.VpnGateException;

/**
 * Thrown if a user test with different values already exists at the
 * timestamp of a new user test.
 */
public class ConflictingTestException extends VpnGateException {

  public ConflictingTestException(String msg) {
    super(msg);
  }

}
