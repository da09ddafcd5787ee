/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.conf;

/** Where snapshots are read from. */
public enum SourceType {
  Local,
  Remote
}
