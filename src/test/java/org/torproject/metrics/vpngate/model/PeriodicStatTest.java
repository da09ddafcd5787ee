/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.model;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collection;

@RunWith(Parameterized.class)
public class PeriodicStatTest {

  /** Snapshot text and the number it stands for. */
  @Parameters
  public static Collection<Object[]> numbers() {
    return Arrays.asList(new Object[][] {
        {"0", 0L},
        {"1396410", 1396410L},
        {"2410893201422", 2410893201422L},
        {"", 0L},
        {null, 0L},
        {"-5", 0L},
        {"12.5", 0L},
        {" 12", 0L},
        {"abc", 0L},
        {"99999999999999999999", 0L}
    });
  }

  private String text;

  private long expected;

  /** Set all test values. */
  public PeriodicStatTest(String text, long expected) {
    this.text = text;
    this.expected = expected;
  }

  @Test
  public void testToLong() {
    assertEquals("Converting '" + this.text + "'", this.expected,
        PeriodicStat.toLong(this.text));
  }
}
