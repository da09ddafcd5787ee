/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.sync;

/** This package coordinates merging fetched snapshots into known servers.
 * <p>The central class for this process is <code>SyncManager</code>, which
 * keeps the servers in memory, tracks pending upserts and deletions, and
 * writes them through a <code>ServerGateway</code>.</p>
 */
