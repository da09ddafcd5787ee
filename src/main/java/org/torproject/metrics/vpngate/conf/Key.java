/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.conf;

import java.net.URL;
import java.nio.file.Path;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  RunOnce(Boolean.class),
  HarvestActivated(Boolean.class),
  HarvestOffsetMinutes(Integer.class),
  HarvestPeriodMinutes(Integer.class),
  SnapshotSources(SourceType[].class),
  SnapshotUrl(URL.class),
  SnapshotLocalOrigins(Path.class),
  DownloadTimeoutMillis(Integer.class),
  StorePath(Path.class),
  OutputPath(Path.class),
  RecentPath(Path.class),
  OvpnPath(Path.class),
  ExportOvpnFiles(Boolean.class);

  private Class clazz;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

}
