// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.github.swarm_rounds.ConfigurationException;
import com.github.swarm_rounds.PeerRoundLoop;
import com.github.swarm_rounds.RewardSubmissionController;
import com.github.swarm_rounds.RoundBarrier;
import com.github.swarm_rounds.SwarmLedger;
import com.github.swarm_rounds.TransportException;
import com.github.swarm_rounds.gossip.AnimalNames;
import com.github.swarm_rounds.gossip.GossipPublisher;
import com.github.swarm_rounds.gossip.GossipSampler;
import com.github.swarm_rounds.gossip.GossipSink;
import org.h2.mvstore.MVStore;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Wires one node from its [NodeConfig]: the HTTP ledger, the durable submission journal, the local peer store
/// and, when a gossip URL is configured, the gossip publisher.
///
/// Training code embeds a node and calls [#peerLoop()]. Run on its own the node is the gossip publishing service.
public class SwarmNode implements AutoCloseable {
  private final NodeConfig config;
  private final SwarmLedger ledger;
  private final MVStore journalStore;
  private final MVStore peerStoreMv;
  private final MVStorePeerStore peerStore;
  private final GossipPublisher publisher;
  private HealthServer health;

  public SwarmNode(NodeConfig config, SwarmLedger ledger, Optional<GossipSink> sink) {
    this.config = config;
    this.ledger = ledger;
    try {
      Files.createDirectories(config.dataDir());
    } catch (IOException e) {
      throw new ConfigurationException("Cannot create data directory " + config.dataDir(), e);
    }
    this.journalStore = MVStore.open(config.journalFile().toString());
    this.peerStoreMv = MVStore.open(config.peerStoreFile().toString());
    this.peerStore = new MVStorePeerStore(peerStoreMv);
    this.publisher = sink.map(s -> new GossipPublisher(ledger, peerStore, s, AnimalNames.instance,
        new GossipSampler(), config.pollInterval(), Clock.systemUTC())).orElse(null);
  }

  public static SwarmNode create(NodeConfig config) {
    final var http = HttpClient.newBuilder().connectTimeout(config.httpTimeout()).build();
    final var ledger = new HttpSwarmLedger(http, config.proxyUrl(), config.orgId(), config.httpTimeout());
    final Optional<GossipSink> sink = config.gossipUrl().map(url -> new HttpGossipSink(http, url, config.httpTimeout()));
    return new SwarmNode(config, ledger, sink);
  }

  /// A loop for this peer whose settled rounds survive restarts.
  public PeerRoundLoop peerLoop() {
    final var controller = new RewardSubmissionController(ledger, new MVStoreSubmissionJournal(journalStore));
    return new PeerRoundLoop(config.peerId(), ledger, new RoundBarrier(ledger, config.barrier()), controller);
  }

  public Optional<GossipPublisher> gossipPublisher() {
    return Optional.ofNullable(publisher);
  }

  public MVStorePeerStore peerStore() {
    return peerStore;
  }

  /// Starts gossip publishing and, when a health port is configured, the health endpoint.
  ///
  /// @return false when gossip publishing is disabled
  /// @throws IOException when the health endpoint cannot bind its port
  public boolean start() throws IOException {
    if (publisher == null) {
      LOGGER.info("Gossip publishing is disabled");
      return false;
    }
    try {
      final var bootnodes = ledger.bootstrapAddresses();
      LOGGER.info(() -> "Ledger lists " + bootnodes.size() + " bootstrap peers: " + bootnodes);
    } catch (TransportException e) {
      LOGGER.log(Level.WARNING, "Could not fetch bootstrap peers: " + e.getMessage(), e);
    }
    publisher.start();
    if (config.healthPort().isPresent()) {
      health = new HealthServer(new InetSocketAddress(config.healthPort().get()), publisher,
          healthWindow(config), Clock.systemUTC());
    }
    return true;
  }

  public Optional<HealthServer> healthServer() {
    return Optional.ofNullable(health);
  }

  @Override
  public void close() {
    if (health != null) {
      health.close();
    }
    if (publisher != null) {
      publisher.stop();
    }
    journalStore.close();
    peerStoreMv.close();
  }

  public static void main(String[] args) throws IOException, InterruptedException {
    final NodeConfig config;
    try {
      config = NodeConfig.load();
    } catch (ConfigurationException e) {
      System.err.println(e.getMessage());
      System.exit(2);
      return;
    }
    LoggerConfig.initialize(AnimalNames.instance.displayName(config.peerId().id()));
    final var finished = new CountDownLatch(1);
    final var node = create(config);
    if (!node.start()) {
      node.close();
      return;
    }
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      node.close();
      finished.countDown();
    }, "swarm-node-shutdown"));
    final var healthWindow = healthWindow(config);
    while (!finished.await(healthWindow.toMillis(), TimeUnit.MILLISECONDS)) {
      node.gossipPublisher().ifPresent(p -> {
        if (!p.isHealthy(healthWindow)) {
          LOGGER.warning(() -> "No successful store read within " + healthWindow.toSeconds() + "s, last was "
              + p.lastPolled().map(Object::toString).orElse("never"));
        }
      });
    }
  }

  /// Five minutes, or two poll intervals when that is longer.
  static Duration healthWindow(NodeConfig config) {
    final var twoPolls = config.pollInterval().multipliedBy(2);
    return twoPolls.compareTo(HealthServer.DEFAULT_WINDOW) > 0 ? twoPolls : HealthServer.DEFAULT_WINDOW;
  }
}
