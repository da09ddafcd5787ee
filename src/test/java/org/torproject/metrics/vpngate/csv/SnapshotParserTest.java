/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.csv;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;

public class SnapshotParserTest {

  @Rule
  public ExpectedException thrown = ExpectedException.none();

  @Test
  public void testCommentHeaderAndRow() throws Exception {
    SnapshotData data = SnapshotParser.parse("*comment\n#Name,Score\nfoo,10\n");
    assertEquals(Arrays.asList("Name", "Score"), data.getHeader());
    assertEquals(1, data.getRows().size());
    assertEquals(Arrays.asList("foo", "10"), data.getRows().get(0));
  }

  @Test
  public void testShortRowIsPadded() throws Exception {
    SnapshotData data = SnapshotParser.parse("#Name,Score\nfoo\n");
    assertEquals(Arrays.asList("foo", ""), data.getRows().get(0));
  }

  @Test
  public void testTooManyColumns() throws Exception {
    thrown.expect(FormatException.class);
    thrown.expectMessage("Too many columns on row 1");
    SnapshotParser.parse("#Name,Score\nfoo,10,extra\n");
  }

  @Test
  public void testHeaderOnly() throws Exception {
    SnapshotData data = SnapshotParser.parse("*\n#Name,Score\n*\n");
    assertEquals(Arrays.asList("Name", "Score"), data.getHeader());
    assertTrue(data.getRows().isEmpty());
  }

  @Test
  public void testLineEndingsBlankLinesAndTrimming() throws Exception {
    SnapshotData data = SnapshotParser.parse(
        "*vpn_servers\r\n  #Name,Score  \r\n\r\nfoo,1\rbar,2\n\n*\r\n");
    assertEquals(Arrays.asList("Name", "Score"), data.getHeader());
    assertEquals(2, data.getRows().size());
    assertEquals(Arrays.asList("bar", "2"), data.getRows().get(1));
  }

  @Test
  public void testQuotedCells() throws Exception {
    SnapshotData data = SnapshotParser.parse(
        "#Name,Message\nfoo,\"Hello, \"\"world\"\"\"\n");
    assertEquals(Arrays.asList("foo", "Hello, \"world\""),
        data.getRows().get(0));
  }

  @Test
  public void testEmptyQuotedCellAndTrailingSeparator() throws Exception {
    List<String> cells = SnapshotParser.splitLine("\"\",a,", "test");
    assertThat(cells, contains("", "a", ""));
  }

  @Test
  public void testRowsAreImmutable() throws Exception {
    SnapshotData data = SnapshotParser.parse("#Name\nfoo\n");
    thrown.expect(UnsupportedOperationException.class);
    data.getRows().get(0).add("bar");
  }

  @Test
  public void testUnterminatedQuote() throws Exception {
    thrown.expect(FormatException.class);
    thrown.expectMessage(containsString("Unterminated quoted field"));
    SnapshotParser.parse("#Name,Message\nfoo,\"Hello\n");
  }

  @Test
  public void testSampleSnapshot() throws Exception {
    String text;
    try (InputStream in = getClass().getClassLoader()
        .getResourceAsStream("snapshot.csv");
        Scanner scanner = new Scanner(in, StandardCharsets.UTF_8.name())) {
      text = scanner.useDelimiter("\\A").next();
    }
    SnapshotData data = SnapshotParser.parse(text);
    assertEquals(15, data.getHeader().size());
    assertEquals("HostName", data.getHeader().get(0));
    assertEquals(3, data.getRows().size());
    assertEquals("Welcome, stranger", data.getRows().get(1).get(13));
    for (List<String> row : data.getRows()) {
      assertEquals(15, row.size());
    }
  }
}
