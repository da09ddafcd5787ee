/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import org.torproject.metrics.vpngate.VpnGateException;

/**
 * Thrown if the columns of a snapshot differ from the columns needed to build
 * servers.
 */
public class SchemaMismatchException extends VpnGateException {

  public SchemaMismatchException(String msg) {
    super(msg);
  }

}
