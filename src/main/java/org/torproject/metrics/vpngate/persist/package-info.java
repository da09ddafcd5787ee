/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

/** This package contains the storage of servers and the files derived
 * from fetched snapshots.
 * <p>Servers are read and written through <code>ServerGateway</code>, which
 * <code>JsonServerStore</code> implements with a single JSON file.
 * <code>SnapshotArchive</code> keeps the fetched snapshots and
 * <code>OvpnExporter</code> writes the OpenVPN profiles of servers.</p>
 */
