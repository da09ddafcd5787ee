/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate;

import org.torproject.metrics.vpngate.conf.Configuration;
import org.torproject.metrics.vpngate.conf.ConfigurationException;
import org.torproject.metrics.vpngate.conf.Key;
import org.torproject.metrics.vpngate.cron.HarvesterMain;
import org.torproject.metrics.vpngate.cron.Scheduler;
import org.torproject.metrics.vpngate.cron.ShutdownHook;
import org.torproject.metrics.vpngate.harvest.SnapshotHarvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;

/**
 * Main class for starting a harvester instance.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar vpngate-harvester.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "harvester.properties";

  /** All possible main classes.
   * If a new HarvesterMain class is available, just add it to this map.
   */
  static final Map<Key, Class<? extends HarvesterMain>> harvesterMains =
      new HashMap<>();

  static { // add a new main class here
    harvesterMains.put(Key.HarvestActivated, SnapshotHarvester.class);
  }

  private static Configuration conf = new Configuration();

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) {
    ShutdownHook shutdownHook = null;
    try {
      Path confPath;
      if (args == null || args.length == 0) {
        confPath = Paths.get(CONF_FILE);
      } else if (args.length == 1) {
        confPath = Paths.get(args[0]);
      } else {
        printUsage("The harvester takes at most one argument.");
        return;
      }
      if (!Files.exists(confPath) || Files.size(confPath) < 1L) {
        writeDefaultConfig(confPath);
        return;
      } else {
        conf.loadAndCheckConfiguration(confPath);
      }
      if (!conf.getBool(Key.RunOnce)) {
        shutdownHook = new ShutdownHook();
        Runtime.getRuntime().addShutdownHook(shutdownHook);
      }
      Scheduler.getInstance().scheduleModuleRuns(harvesterMains, conf);
    } catch (ConfigurationException | IOException ce) {
      printUsage(ce.getMessage());
      return;
    }
    if (null != shutdownHook) {
      shutdownHook.stayAlive();
    }
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar vpngate-harvester.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  static void writeDefaultConfig(Path confPath) {
    try (InputStream in = Main.class.getClassLoader()
        .getResourceAsStream(CONF_FILE)) {
      if (null == in) {
        throw new IOException("Default configuration " + CONF_FILE
            + " is missing from the classpath.");
      }
      Files.copy(in, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. A default configuration was "
          + "written to " + confPath + ". In the default configuration, "
          + "the harvester is not activated. You need to change the "
          + "configuration (" + CONF_FILE + ") and activate it.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: {}", e, e);
      throw new RuntimeException(e);
    }
  }

}
