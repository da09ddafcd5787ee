/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.torproject.metrics.vpngate.model.Server;

import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.regex.Pattern;

/**
 * Writes the OpenVPN profiles contained in server configs to
 * {@code <HostName>.ovpn} files.
 */
public class OvpnExporter {

  private static final Logger logger
      = LoggerFactory.getLogger(OvpnExporter.class);

  public static final String OVPN_SUFFIX = ".ovpn";

  /** Host names end up in file names and must not leave the directory. */
  private static final Pattern SAFE_NAME = Pattern.compile("^[\\w.-]+$");

  private final Path ovpnDirectory;

  public OvpnExporter(Path ovpnDirectory) {
    this.ovpnDirectory = ovpnDirectory;
  }

  /**
   * Decode the profile of the given server and write it, replacing any
   * previous profile of that server.
   *
   * @return Whether the profile was written.
   */
  public boolean export(Server server) {
    String name = server.getName();
    Path ovpnPath = this.resolve(name);
    if (null == ovpnPath) {
      return false;
    }
    String encoded = server.getConfig().getConfigBlob();
    if (null == encoded || encoded.isEmpty() || !Base64.isBase64(encoded)) {
      logger.warn("Skipping {}: no valid Base64 OpenVPN profile.", name);
      return false;
    }
    byte[] profile = Base64.decodeBase64(encoded);
    if (profile.length == 0) {
      logger.warn("Skipping {}: empty OpenVPN profile.", name);
      return false;
    }
    boolean written = PersistenceUtils.storeToFileSystem(profile, ovpnPath,
        StandardOpenOption.TRUNCATE_EXISTING);
    if (written) {
      logger.debug("Written {}.", ovpnPath);
    }
    return written;
  }

  /** Export the profiles of all given servers and return how many. */
  public int exportAll(Iterable<Server> servers) {
    int exported = 0;
    for (Server server : servers) {
      if (this.export(server)) {
        exported++;
      }
    }
    return exported;
  }

  /**
   * Delete the profile of the server with the given name, if there is one.
   *
   * @return Whether a profile was deleted.
   */
  public boolean remove(String name) {
    Path ovpnPath = this.resolve(name);
    if (null == ovpnPath) {
      return false;
    }
    try {
      return Files.deleteIfExists(ovpnPath);
    } catch (IOException e) {
      logger.warn("Could not delete {}.", ovpnPath, e);
      return false;
    }
  }

  private Path resolve(String name) {
    if (!SAFE_NAME.matcher(name).matches() || name.startsWith(".")) {
      logger.warn("Not using host name {} as file name.", name);
      return null;
    }
    return this.ovpnDirectory.resolve(name + OVPN_SUFFIX);
  }
}
