/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.cron;

import org.torproject.metrics.vpngate.conf.Configuration;
import org.torproject.metrics.vpngate.conf.ConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Base class of modules run by the {@link Scheduler}.
 */
public abstract class HarvesterMain implements Callable<Object>, Runnable {

  private static final Logger logger = LoggerFactory.getLogger(
      HarvesterMain.class);

  protected Configuration config = new Configuration();

  public HarvesterMain(Configuration conf) {
    this.config.putAll(conf.getPropertiesCopy());
  }

  /**
   * Log all errors preventing successful completion of the module.
   */
  @Override
  public final void run() {
    try {
      logger.info("Starting {} module of the harvester.", module());
      startProcessing();
      logger.info("Terminating {} module of the harvester.", module());
    } catch (Throwable th) { // Catching all, so that later runs still happen.
      logger.error("The {} module failed: {}", module(), th.getMessage(), th);
    }
  }

  /**
   * Wrapper for {@code run}.
   */
  @Override
  public final Object call() {
    run();
    return null;
  }

  /**
   * Module specific code goes here.
   */
  protected abstract void startProcessing() throws ConfigurationException;

  /**
   * Returns the module name for logging purposes.
   */
  public abstract String module();

}
