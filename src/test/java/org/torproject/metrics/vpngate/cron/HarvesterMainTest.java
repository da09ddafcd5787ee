/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.cron;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.vpngate.conf.Configuration;
import org.torproject.metrics.vpngate.conf.Key;

import org.junit.Test;

public class HarvesterMainTest {

  @Test()
  public void testFailureIsContained() {
    Broken broken = new Broken(new Configuration());
    int before = Broken.count.get();
    assertNull(broken.call());
    broken.run();
    assertEquals(before + 2, Broken.count.get());
  }

  @Test()
  public void testConfigurationIsCopied() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.RunOnce.name(), "true");
    Dummy dummy = new Dummy(conf);
    conf.setProperty(Key.RunOnce.name(), "false");
    assertTrue(dummy.config.getBool(Key.RunOnce));
    assertEquals(1, dummy.config.getPropertiesCopy().size());
  }
}
