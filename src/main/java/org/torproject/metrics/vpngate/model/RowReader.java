/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Looks up cells of one snapshot row by column name. */
class RowReader {

  private final Map<String, Integer> columnIndexes = new HashMap<>();

  private final List<String> row;

  RowReader(List<String> header, List<String> row) {
    for (int i = 0; i < header.size(); i++) {
      this.columnIndexes.putIfAbsent(header.get(i), i);
    }
    this.row = row;
  }

  /** Return the cell of the given column, or "" if the row is too short. */
  String get(String column) throws SchemaMismatchException {
    Integer index = this.columnIndexes.get(column);
    if (null == index) {
      throw new SchemaMismatchException("Required column '" + column
          + "' not found in snapshot header.");
    }
    return index < this.row.size() ? this.row.get(index) : "";
  }

}
