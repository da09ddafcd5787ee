/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.csv;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collection;

@RunWith(Parameterized.class)
public class SnapshotParserFormatTest {

  /** Malformed snapshot and the start of the expected error message. */
  @Parameters
  public static Collection<Object[]> malformedSnapshots() {
    return Arrays.asList(new Object[][] {
        {null, "No data"},
        {"", "No data"},
        {"\n\r\n  \n", "No data"},
        {"*only\n*comments\n", "No data"},
        {"#Name\nfoo\n*inside\nbar\n", "Found comment in the middle"},
        {"foo,10\n#Name,Score\n", "Snapshot does not start with a header"},
        {"#Name\nfoo\n#Name\n", "Unsupported second header line"},
        {"#Name\n\"foo\n", "Unterminated quoted field"}
    });
  }

  private String text;

  private String messageStart;

  /** Set all test values. */
  public SnapshotParserFormatTest(String text, String messageStart) {
    this.text = text;
    this.messageStart = messageStart;
  }

  @Test
  public void testParseFails() {
    try {
      SnapshotParser.parse(this.text);
      fail("Parsing should have failed for: " + this.text);
    } catch (FormatException e) {
      assertThat(e.getMessage(), startsWith(this.messageStart));
    }
  }
}
