/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.cron;

import org.torproject.metrics.vpngate.conf.Configuration;

import java.util.concurrent.atomic.AtomicInteger;

public class Counter extends HarvesterMain {

  static AtomicInteger count = new AtomicInteger(0);

  public Counter(Configuration conf) {
    super(conf);
  }

  @Override
  public void startProcessing() {
    count.getAndIncrement();
  }

  @Override
  public String module() {
    return "counter";
  }

}
