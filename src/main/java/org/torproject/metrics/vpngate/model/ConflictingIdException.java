/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import org.torproject.metrics.vpngate.VpnGateException;

/** Thrown when merging two configs that carry different database ids. */
public class ConflictingIdException extends VpnGateException {

  public ConflictingIdException(String msg) {
    super(msg);
  }

}
