/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.csv;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the CSV export of the VPN Gate server list.
 *
 * <p>The export is framed by comment lines starting with {@code *}, its
 * header line starts with {@code #}, and data rows may be shorter than the
 * header, in which case they are padded with empty cells.</p>
 */
public final class SnapshotParser {

  private static final String COMMENT_PREFIX = "*";

  private static final String HEADER_PREFIX = "#";

  private static final char SEPARATOR = ',';

  private static final char QUOTE = '"';

  private SnapshotParser() { /* static only */ }

  /**
   * Parse the given snapshot text into header and rows.
   *
   * @param text Raw snapshot text.
   * @return Parsed header and rows padded to header width.
   * @throws FormatException Thrown if comments appear between data lines, the
   *     header is missing or repeated, a row has more cells than the header,
   *     a quoted field is not terminated, or there is no data at all.
   */
  public static SnapshotData parse(String text) throws FormatException {
    if (null == text) {
      throw new FormatException("No data: snapshot text is missing.");
    }
    List<String> lines = new ArrayList<>();
    for (String line : text.split("\\r\\n|\\n|\\r")) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
      }
    }
    int first = -1;
    int last = -1;
    for (int i = 0; i < lines.size(); i++) {
      if (!lines.get(i).startsWith(COMMENT_PREFIX)) {
        if (first < 0) {
          first = i;
        }
        last = i;
      }
    }
    if (first < 0) {
      throw new FormatException("No data: snapshot contains no lines "
          + "other than comments.");
    }
    List<String> content = lines.subList(first, last + 1);
    for (int i = 0; i < content.size(); i++) {
      if (content.get(i).startsWith(COMMENT_PREFIX)) {
        throw new FormatException("Found comment in the middle of the "
            + "snapshot on line " + (first + i + 1) + ".");
      }
    }
    if (!content.get(0).startsWith(HEADER_PREFIX)) {
      throw new FormatException("Snapshot does not start with a header line "
          + "beginning with '" + HEADER_PREFIX + "'.");
    }
    for (int i = 1; i < content.size(); i++) {
      if (content.get(i).startsWith(HEADER_PREFIX)) {
        throw new FormatException("Unsupported second header line found at "
            + "data row " + i + ".");
      }
    }
    List<String> header = splitLine(
        content.get(0).substring(HEADER_PREFIX.length()), "header");
    int columns = header.size();
    List<List<String>> rows = new ArrayList<>();
    for (int i = 1; i < content.size(); i++) {
      List<String> row = splitLine(content.get(i), "data row " + i);
      if (row.size() > columns) {
        throw new FormatException("Too many columns on row " + i + ": found "
            + row.size() + ", but header has " + columns + ".");
      }
      while (row.size() < columns) {
        row.add("");
      }
      rows.add(row);
    }
    return new SnapshotData(header, rows);
  }

  /** Split one line into cells using common CSV quoting rules. */
  static List<String> splitLine(String line, String where)
      throws FormatException {
    List<String> cells = new ArrayList<>();
    StringBuilder cell = new StringBuilder();
    boolean quoted = false;
    boolean wasQuoted = false;
    for (int i = 0; i < line.length(); i++) {
      char current = line.charAt(i);
      if (quoted) {
        if (current != QUOTE) {
          cell.append(current);
        } else if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
          cell.append(QUOTE);
          i++;
        } else {
          quoted = false;
        }
      } else if (current == SEPARATOR) {
        cells.add(cell.toString());
        cell.setLength(0);
        wasQuoted = false;
      } else if (current == QUOTE && cell.length() == 0 && !wasQuoted) {
        quoted = true;
        wasQuoted = true;
      } else {
        cell.append(current);
      }
    }
    if (quoted) {
      throw new FormatException("Unterminated quoted field in " + where
          + ".");
    }
    cells.add(cell.toString());
    return cells;
  }
}
