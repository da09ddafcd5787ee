/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.harvest;

import org.torproject.metrics.vpngate.conf.Configuration;
import org.torproject.metrics.vpngate.conf.ConfigurationException;
import org.torproject.metrics.vpngate.conf.Key;
import org.torproject.metrics.vpngate.conf.SourceType;
import org.torproject.metrics.vpngate.cron.HarvesterMain;
import org.torproject.metrics.vpngate.csv.FormatException;
import org.torproject.metrics.vpngate.downloader.Downloader;
import org.torproject.metrics.vpngate.model.SchemaMismatchException;
import org.torproject.metrics.vpngate.model.Server;
import org.torproject.metrics.vpngate.persist.JsonServerStore;
import org.torproject.metrics.vpngate.persist.OvpnExporter;
import org.torproject.metrics.vpngate.persist.ServerGateway;
import org.torproject.metrics.vpngate.persist.SnapshotArchive;
import org.torproject.metrics.vpngate.sync.SyncManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Fetches VPN Gate snapshots, archives them, merges them into the known
 * servers, and saves the changes to the server store.
 *
 * <p>The in-memory servers are read from the store on the first run and kept
 * between runs.</p>
 */
public class SnapshotHarvester extends HarvesterMain {

  private static final Logger logger = LoggerFactory.getLogger(
      SnapshotHarvester.class);

  private final SyncManager manager;

  private final ServerGateway gateway;

  private final Clock clock;

  private boolean initialized = false;

  /** Create a harvester storing servers in the configured store file. */
  public SnapshotHarvester(Configuration conf) throws ConfigurationException {
    this(conf, new SyncManager(),
        new JsonServerStore(conf.getPath(Key.StorePath)), Clock.systemUTC());
  }

  /** Create a harvester using the given manager, store, and clock. */
  public SnapshotHarvester(Configuration conf, SyncManager manager,
      ServerGateway gateway, Clock clock) {
    super(conf);
    this.manager = manager;
    this.gateway = gateway;
    this.clock = clock;
  }

  @Override
  public String module() {
    return "snapshots";
  }

  @Override
  protected void startProcessing() throws ConfigurationException {
    Set<SourceType> sources = this.config.getSourceTypeSet(
        Key.SnapshotSources);
    SnapshotArchive archive = new SnapshotArchive(
        this.config.getPath(Key.OutputPath),
        this.config.getPath(Key.RecentPath));
    OvpnExporter exporter = this.config.getBool(Key.ExportOvpnFiles)
        ? new OvpnExporter(this.config.getPath(Key.OvpnPath)) : null;
    synchronized (this.manager) {
      if (!this.initialized) {
        try {
          this.manager.resetFromGateway(this.gateway);
          this.initialized = true;
        } catch (IOException e) {
          logger.error("Cannot read servers from storage; skipping this "
              + "run.", e);
          return;
        }
      }
      for (SourceType source : sources) {
        String snapshot = this.fetchSnapshot(source);
        if (null == snapshot) {
          continue;
        }
        Instant fetched = this.clock.instant();
        archive.store(snapshot, fetched);
        try {
          this.manager.syncFromSnapshot(snapshot);
        } catch (FormatException | SchemaMismatchException e) {
          logger.warn("Ignoring {} snapshot: {}", source, e.getMessage());
          continue;
        }
        if (null != exporter) {
          this.exportProfiles(exporter);
        }
        try {
          this.manager.saveChanges(this.gateway);
        } catch (IOException e) {
          logger.error("Could not save changes; keeping them for the next "
              + "run.", e);
        }
      }
    }
    archive.cleanUpRecent(this.clock.instant());
  }

  private String fetchSnapshot(SourceType source)
      throws ConfigurationException {
    switch (source) {
      case Remote:
        URL url = this.config.getUrl(Key.SnapshotUrl);
        try {
          String snapshot = Downloader.downloadText(url,
              this.config.getInt(Key.DownloadTimeoutMillis));
          if (null == snapshot) {
            logger.warn("Snapshot not found at {}.", url);
          }
          return snapshot;
        } catch (IOException e) {
          logger.warn("Could not download snapshot from {}.", url, e);
          return null;
        }
      case Local:
        Path path = this.config.getPath(Key.SnapshotLocalOrigins);
        if (!Files.isRegularFile(path)) {
          logger.warn("No local snapshot at {}.", path);
          return null;
        }
        try {
          return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
          logger.warn("Could not read local snapshot {}.", path, e);
          return null;
        }
      default:
        logger.warn("Unsupported snapshot source {}.", source);
        return null;
    }
  }

  /** Write profiles of changed servers and remove those of deleted ones. */
  private void exportProfiles(OvpnExporter exporter) {
    List<Server> changed = new ArrayList<>();
    for (String name : this.manager.getPendingUpserts()) {
      changed.add(this.manager.getServer(name));
    }
    int exported = exporter.exportAll(changed);
    int removed = 0;
    for (String name : this.manager.getPendingDeletes()) {
      if (exporter.remove(name)) {
        removed++;
      }
    }
    logger.info("Exported {} and removed {} OpenVPN profile(s).", exported,
        removed);
  }
}
