/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.torproject.metrics.vpngate.model.Server;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of servers, their stats, and their user tests.
 *
 * <p>Implementations guarantee uniqueness of server names, uniqueness of
 * stat and test timestamps per server, and that stats and tests never outlive
 * their server.</p>
 */
public interface ServerGateway {

  /**
   * Read all servers including stats and tests, with ids populated.
   *
   * @throws IOException Thrown if the storage cannot be read.
   */
  List<Server> readAll() throws IOException;

  /**
   * Read the server with the given name including stats and tests.
   *
   * @throws IOException Thrown if the storage cannot be read.
   */
  Optional<Server> readByName(String name) throws IOException;

  /**
   * Insert the server if its config has no id yet, or update it otherwise,
   * and insert all stats and tests without id.
   *
   * <p>Ids assigned by the storage are set on the given objects. Stats and
   * tests that already have an id are never modified. Either everything is
   * stored or nothing is.</p>
   *
   * @throws IOException Thrown if the storage cannot be written, or if the
   *     server would violate a uniqueness constraint.
   */
  void upsert(Server server) throws IOException;

  /**
   * Delete the server with the given name together with its stats and
   * tests; unknown names are ignored.
   *
   * @throws IOException Thrown if the storage cannot be written.
   */
  void deleteByName(String name) throws IOException;

}
