/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.cron;

import org.torproject.metrics.vpngate.conf.Configuration;
import org.torproject.metrics.vpngate.conf.ConfigurationException;
import org.torproject.metrics.vpngate.conf.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler that starts the modules configured in harvester.properties.
 */
public final class Scheduler implements ThreadFactory {

  public static final String ACTIVATED = "Activated";
  public static final String PERIODMIN = "PeriodMinutes";
  public static final String OFFSETMIN = "OffsetMinutes";
  private static final long MILLIS_IN_A_MINUTE = 60_000L;

  private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private int currentThreadNo = 0;
  private long gracePeriodMinutes = 10L;

  private final ScheduledExecutorService scheduler =
      Executors.newScheduledThreadPool(2, this);

  private static Scheduler instance = new Scheduler();

  private Scheduler(){}

  public static Scheduler getInstance() {
    return instance;
  }

  /**
   * Schedule all given modules that are activated in the configuration,
   * or run them once and wait for them if {@code RunOnce} is set.
   */
  public void scheduleModuleRuns(Map<Key,
      Class<? extends HarvesterMain>> harvesterMains, Configuration conf) {
    try {
      gracePeriodMinutes = conf.getLong(Key.ShutdownGraceWaitMinutes);
    } catch (ConfigurationException ce) {
      logger.warn("Cannot read grace period: {}", ce.getMessage());
      gracePeriodMinutes = 10L;
    }
    List<Callable<Object>> runOnceMains = new ArrayList<>();
    for (Map.Entry<Key, Class<? extends HarvesterMain>> hmEntry
        : harvesterMains.entrySet()) {
      try {
        if (conf.getBool(hmEntry.getKey())) {
          String prefix = hmEntry.getKey().name().replace(ACTIVATED, "");
          HarvesterMain hm = hmEntry.getValue()
              .getConstructor(Configuration.class).newInstance(conf);
          if (conf.getBool(Key.RunOnce)) {
            logger.info("Prepare single run for {}.",
                hm.getClass().getName());
            runOnceMains.add(hm);
          } else {
            scheduleExecutions(hm,
                conf.getInt(Key.valueOf(prefix + OFFSETMIN)),
                conf.getInt(Key.valueOf(prefix + PERIODMIN)));
          }
        }
      } catch (ConfigurationException | IllegalAccessException
          | InstantiationException | InvocationTargetException
          | NoSuchMethodException | RejectedExecutionException
          | IllegalArgumentException | NullPointerException ex) {
        logger.error("Cannot schedule {}. Reason: {}",
            hmEntry.getValue().getName(), ex.getMessage(), ex);
      }
    }
    try {
      if (conf.getBool(Key.RunOnce)) {
        scheduler.invokeAll(runOnceMains);
      }
    } catch (ConfigurationException | RejectedExecutionException
        | NullPointerException ex) {
      logger.error("Cannot schedule run-once: {}", ex.getMessage(), ex);
    } catch (InterruptedException ie) {
      logger.error("Interrupted during run-once.", ie);
      Thread.currentThread().interrupt();
    }
  }

  private void scheduleExecutions(HarvesterMain hm, int offset, int period) {
    if (period <= 0) {
      throw new IllegalArgumentException("Period must be positive, but is "
          + period + ".");
    }
    logger.info("Periodic updater started for {}; offset={}, period={}.",
        hm.getClass().getName(), offset, period);
    long periodMillis = period * MILLIS_IN_A_MINUTE;
    long initialDelayMillis = computeInitialDelayMillis(
        System.currentTimeMillis(), offset * MILLIS_IN_A_MINUTE, periodMillis);

    /* Run after initialDelay delay and then every period min. */
    logger.info("Periodic updater will first run in {} and then every {} "
        + "minutes.", initialDelayMillis < MILLIS_IN_A_MINUTE
        ? "under 1 minute"
        : (initialDelayMillis / MILLIS_IN_A_MINUTE) + " minute(s)", period);
    this.scheduler.scheduleAtFixedRate(hm, initialDelayMillis, periodMillis,
        TimeUnit.MILLISECONDS);
  }

  /**
   * Return the delay until the next multiple of the period, shifted by the
   * offset.
   */
  protected static long computeInitialDelayMillis(long currentMillis,
      long offsetMillis, long periodMillis) {
    return (periodMillis - (currentMillis % periodMillis) + offsetMillis)
        % periodMillis;
  }

  /**
   * Try to shutdown smoothly, i.e., wait for running tasks to terminate.
   */
  public void shutdownScheduler() {
    try {
      logger.info("Waiting at most {} minutes for termination "
          + "of running tasks ... ", gracePeriodMinutes);
      scheduler.shutdown();
      if (scheduler.awaitTermination(gracePeriodMinutes, TimeUnit.MINUTES)) {
        logger.info("Shutdown of all scheduled tasks completed "
            + "successfully.");
      } else {
        logger.warn("Running tasks did not terminate within {} minutes.",
            gracePeriodMinutes);
      }
    } catch (InterruptedException ie) {
      List<Runnable> notTerminated = scheduler.shutdownNow();
      logger.error("Regular shutdown failed for: {}", notTerminated);
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("Harvester-Scheduled-Thread-" + ++currentThreadNo);
    logger.info("New Thread created: {}", newThread.getName());
    return newThread;
  }
}
