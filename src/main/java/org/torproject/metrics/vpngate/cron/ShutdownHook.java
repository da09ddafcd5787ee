/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops the {@link Scheduler} when the JVM shuts down and keeps the main
 * thread waiting until then.
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private boolean stayAlive = true;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook() {
    super("Harvester-ShutdownThread");
  }

  /**
   * Stay alive until the shutdown thread gets run.
   */
  public void stayAlive() {
    synchronized (this) {
      while (this.stayAlive) {
        try {
          this.wait();
        } catch (InterruptedException e) {
          logger.debug("Interrupted while waiting for shutdown.", e);
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    Scheduler.getInstance().shutdownScheduler();
    synchronized (this) {
      this.stayAlive = false;
      this.notify();
    }
    logger.info("Shutdown finished. Exiting.");
  }
}
