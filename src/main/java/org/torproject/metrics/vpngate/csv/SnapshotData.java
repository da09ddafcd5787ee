/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.csv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Header and data rows of a parsed snapshot; all rows have header width. */
public class SnapshotData {

  private final List<String> header;

  private final List<List<String>> rows;

  SnapshotData(List<String> header, List<List<String>> rows) {
    this.header = Collections.unmodifiableList(new ArrayList<>(header));
    List<List<String>> copies = new ArrayList<>();
    for (List<String> row : rows) {
      copies.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.rows = Collections.unmodifiableList(copies);
  }

  /** Column names in snapshot order, without the leading '#'. */
  public List<String> getHeader() {
    return header;
  }

  public List<List<String>> getRows() {
    return rows;
  }

}
