/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import org.torproject.metrics.vpngate.model.ConflictingStatException;
import org.torproject.metrics.vpngate.model.ConflictingTestException;
import org.torproject.metrics.vpngate.model.PeriodicStat;
import org.torproject.metrics.vpngate.model.RedundantStatException;
import org.torproject.metrics.vpngate.model.Server;
import org.torproject.metrics.vpngate.model.ServerConfig;
import org.torproject.metrics.vpngate.model.UserTest;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Stores servers in a single JSON file.
 *
 * <p>Every modification reads the file, applies the change, and replaces the
 * file atomically. Ids are set on the given objects only after the file was
 * replaced, so a failed write leaves both the file and the objects as they
 * were.</p>
 */
public class JsonServerStore implements ServerGateway {

  private static final Logger logger
      = LoggerFactory.getLogger(JsonServerStore.class);

  private static final ObjectMapper objectMapper = new ObjectMapper()
      .setSerializationInclusion(JsonInclude.Include.NON_NULL)
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

  private final Path storePath;

  /** Use the given file, which is created on the first modification. */
  public JsonServerStore(Path storePath) {
    this.storePath = storePath;
  }

  @Override
  public List<Server> readAll() throws IOException {
    List<Server> servers = new ArrayList<>();
    for (ServerNode serverNode : this.readStore().servers) {
      servers.add(toServer(serverNode));
    }
    return servers;
  }

  @Override
  public Optional<Server> readByName(String name) throws IOException {
    ServerNode serverNode = findByName(this.readStore(), name);
    return null == serverNode ? Optional.empty()
        : Optional.of(toServer(serverNode));
  }

  @Override
  public void upsert(Server server) throws IOException {
    StoreNode store = this.readStore();
    ServerConfig config = server.getConfig();
    ServerNode serverNode;
    if (null == config.getId()) {
      if (null != findByName(store, config.getName())) {
        throw new IOException("Cannot insert server " + config.getName()
            + ", because a server of that name is already stored.");
      }
      serverNode = new ServerNode();
      serverNode.id = ++store.lastServerId;
      serverNode.name = config.getName();
      store.servers.add(serverNode);
    } else {
      serverNode = findById(store, config.getId());
      if (null == serverNode) {
        throw new IOException("Cannot update server " + config.getName()
            + ", because no server with id " + config.getId()
            + " is stored.");
      } else if (!serverNode.name.equals(config.getName())) {
        throw new IOException("Cannot update server " + config.getName()
            + ", because id " + config.getId() + " belongs to server "
            + serverNode.name + ".");
      }
    }
    serverNode.setAttributes(config);
    Set<String> statTimes = new HashSet<>();
    for (StatNode statNode : serverNode.stats) {
      statTimes.add(statNode.savedAt);
    }
    List<PeriodicStat> newStats = new ArrayList<>();
    List<Long> newStatIds = new ArrayList<>();
    for (PeriodicStat stat : server.getStats().values()) {
      if (null != stat.getId()) {
        continue;
      }
      if (!statTimes.add(stat.getSavedAt().toString())) {
        throw new IOException("Cannot insert stat of server "
            + config.getName() + " at " + stat.getSavedAt()
            + ", because another stat is stored at that time.");
      }
      long statId = ++store.lastStatId;
      serverNode.stats.add(StatNode.of(stat, statId));
      newStats.add(stat);
      newStatIds.add(statId);
    }
    Set<String> testTimes = new HashSet<>();
    for (TestNode testNode : serverNode.tests) {
      testTimes.add(testNode.savedAt);
    }
    List<UserTest> newTests = new ArrayList<>();
    List<Long> newTestIds = new ArrayList<>();
    for (UserTest test : server.getTests().values()) {
      if (null != test.getId()) {
        continue;
      }
      if (!testTimes.add(test.getSavedAt().toString())) {
        throw new IOException("Cannot insert user test of server "
            + config.getName() + " at " + test.getSavedAt()
            + ", because another test is stored at that time.");
      }
      long testId = ++store.lastTestId;
      serverNode.tests.add(TestNode.of(test, testId));
      newTests.add(test);
      newTestIds.add(testId);
    }
    this.writeStore(store);
    config.setId(serverNode.id);
    for (int i = 0; i < newStats.size(); i++) {
      newStats.get(i).setId(newStatIds.get(i));
    }
    for (int i = 0; i < newTests.size(); i++) {
      newTests.get(i).setId(newTestIds.get(i));
    }
    logger.debug("Stored server {} with {} new stat(s) and {} new test(s).",
        config.getName(), newStats.size(), newTests.size());
  }

  @Override
  public void deleteByName(String name) throws IOException {
    StoreNode store = this.readStore();
    if (store.servers.removeIf(serverNode -> serverNode.name.equals(name))) {
      this.writeStore(store);
      logger.debug("Deleted server {}.", name);
    }
  }

  private StoreNode readStore() throws IOException {
    if (!Files.exists(this.storePath)) {
      return new StoreNode();
    }
    StoreNode store;
    try (InputStream in = Files.newInputStream(this.storePath)) {
      store = objectMapper.readValue(in, StoreNode.class);
    }
    if (null == store) {
      return new StoreNode();
    }
    if (null == store.servers) {
      store.servers = new ArrayList<>();
    }
    for (ServerNode serverNode : store.servers) {
      if (null == serverNode.name) {
        throw new IOException("Corrupt entry with id " + serverNode.id
            + " in " + this.storePath + ": name is missing.");
      }
      if (null == serverNode.stats) {
        serverNode.stats = new ArrayList<>();
      }
      if (null == serverNode.tests) {
        serverNode.tests = new ArrayList<>();
      }
    }
    return store;
  }

  private void writeStore(StoreNode store) throws IOException {
    PersistenceUtils.writeAtomically(this.storePath,
        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(store));
  }

  private static ServerNode findByName(StoreNode store, String name) {
    for (ServerNode serverNode : store.servers) {
      if (serverNode.name.equals(name)) {
        return serverNode;
      }
    }
    return null;
  }

  private static ServerNode findById(StoreNode store, long id) {
    for (ServerNode serverNode : store.servers) {
      if (serverNode.id == id) {
        return serverNode;
      }
    }
    return null;
  }

  /** Rebuild a server, adding stats and tests in chronological order. */
  private Server toServer(ServerNode serverNode) throws IOException {
    try {
      Server server = new Server(serverNode.toConfig());
      List<PeriodicStat> stats = new ArrayList<>();
      for (StatNode statNode : serverNode.stats) {
        stats.add(statNode.toStat());
      }
      stats.sort(Comparator.comparing(PeriodicStat::getSavedAt));
      for (PeriodicStat stat : stats) {
        server.addStat(stat);
      }
      List<UserTest> tests = new ArrayList<>();
      for (TestNode testNode : serverNode.tests) {
        tests.add(testNode.toTest());
      }
      tests.sort(Comparator.comparing(UserTest::getSavedAt));
      for (UserTest test : tests) {
        server.addTest(test);
      }
      return server;
    } catch (ConflictingStatException | RedundantStatException
        | ConflictingTestException | DateTimeParseException
        | IllegalArgumentException | NullPointerException e) {
      throw new IOException("Corrupt entry of server " + serverNode.name
          + " in " + this.storePath + ": " + e.getMessage(), e);
    }
  }
}
