// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.github.swarm_rounds.BarrierConfig;
import com.github.swarm_rounds.ConfigurationException;
import com.github.swarm_rounds.PeerId;
import lombok.With;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Settings of one node. Loaded from `swarm.properties` on the classpath, then an optional file named by
/// `SWARM_CONFIG`, then `SWARM_*` environment variables: `swarm.proxy-url` is overridden by `SWARM_PROXY_URL`.
///
/// @param peerId        this peer's identifier on the ledger, required
/// @param orgId         the organisation the ledger proxy acts for, required
/// @param proxyUrl      base URL of the ledger proxy
/// @param gossipUrl     where gossip is posted; when absent gossip publishing is disabled
/// @param dataDir       directory of the node's MVStore files
/// @param pollInterval  time between gossip polls
/// @param httpTimeout   timeout of each HTTP request
/// @param healthPort    port of the `/api/healthz` endpoint; when absent the endpoint is not served
/// @param barrier       how the peer waits for rounds
@With
public record NodeConfig(
    PeerId peerId,
    String orgId,
    URI proxyUrl,
    Optional<URI> gossipUrl,
    Path dataDir,
    Duration pollInterval,
    Duration httpTimeout,
    Optional<Integer> healthPort,
    BarrierConfig barrier
) {
  static final String RESOURCE = "swarm.properties";
  static final String CONFIG_ENV = "SWARM_CONFIG";

  public static NodeConfig load() {
    final var properties = new Properties();
    try (InputStream in = NodeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read " + RESOURCE + ": " + e.getMessage());
    }
    final var env = System.getenv();
    Optional.ofNullable(env.get(CONFIG_ENV)).map(Path::of).ifPresent(file -> {
      try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        properties.load(reader);
      } catch (IOException e) {
        throw new ConfigurationException("Failed to read " + file + ": " + e.getMessage());
      }
    });
    return from(properties, env);
  }

  /// @throws ConfigurationException when a required setting is missing or a setting cannot be parsed
  public static NodeConfig from(Properties properties, Map<String, String> env) {
    final var settings = new Settings(properties, env);
    final var peer = settings.required("swarm.peer-id");
    final var org = settings.required("swarm.org-id");
    final var proxy = settings.uri("swarm.proxy-url").orElse(URI.create("http://localhost:3000"));
    final var gossip = settings.uri("swarm.gossip-url");
    if (gossip.isEmpty()) {
      LOGGER.info("No swarm.gossip-url configured so gossip publishing is disabled");
    }
    var barrier = BarrierConfig.defaults();
    final var maxRound = settings.get("swarm.max-round");
    if (maxRound.isPresent()) {
      barrier = barrier.withMaxRound(settings.number("swarm.max-round", maxRound.get()));
    }
    final var timeoutDays = settings.get("swarm.train-timeout-days");
    if (timeoutDays.isPresent()) {
      barrier = barrier.withOverallTimeout(Duration.ofDays(settings.number("swarm.train-timeout-days", timeoutDays.get())));
    }
    return new NodeConfig(
        new PeerId(peer),
        org,
        proxy,
        gossip,
        Path.of(settings.get("swarm.data-dir").orElse("swarm-data")),
        Duration.ofSeconds(settings.number("swarm.gossip-poll-seconds", settings.get("swarm.gossip-poll-seconds").orElse("150"))),
        Duration.ofSeconds(settings.number("swarm.http-timeout-seconds", settings.get("swarm.http-timeout-seconds").orElse("30"))),
        settings.get("swarm.health-port").map(port -> (int) settings.number("swarm.health-port", port)),
        barrier
    );
  }

  public boolean gossipEnabled() {
    return gossipUrl.isPresent();
  }

  public Path journalFile() {
    return dataDir.resolve("submissions.mv.db");
  }

  public Path peerStoreFile() {
    return dataDir.resolve("peer-store.mv.db");
  }

  static String envName(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  private record Settings(Properties properties, Map<String, String> env) {

    Optional<String> get(String key) {
      final var fromEnv = env.get(envName(key));
      final var value = fromEnv != null ? fromEnv : properties.getProperty(key);
      return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    String required(String key) {
      return get(key).orElseThrow(() ->
          new ConfigurationException("Missing required setting " + key + " (or " + envName(key) + ")"));
    }

    Optional<URI> uri(String key) {
      return get(key).map(value -> {
        try {
          final var uri = URI.create(value);
          if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ConfigurationException(key + " is not an absolute URL: " + value);
          }
          return uri;
        } catch (IllegalArgumentException e) {
          throw new ConfigurationException(key + " is not a URL: " + value);
        }
      });
    }

    long number(String key, String value) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        throw new ConfigurationException(key + " is not a number: " + value);
      }
    }
  }
}
