// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.swarm_rounds.gossip.GossipPublisher;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Serves `GET /api/healthz`: 200 while the gossip publisher has read the store within the window, otherwise 500
/// with a `detail` naming what is wrong.
public class HealthServer implements AutoCloseable {
  public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);
  static final String PATH = "/api/healthz";

  private final HttpServer server;
  private final GossipPublisher publisher;
  private final Duration window;
  private final Clock clock;

  public HealthServer(@NotNull InetSocketAddress address,
                      @NotNull GossipPublisher publisher,
                      @NotNull Duration window,
                      @NotNull Clock clock) throws IOException {
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.window = Objects.requireNonNull(window, "window");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.server = HttpServer.create(address, 0);
    server.createContext(PATH, this::handle);
    server.start();
    LOGGER.info(() -> "Health endpoint listening on " + server.getAddress() + PATH);
  }

  public int port() {
    return server.getAddress().getPort();
  }

  private void handle(HttpExchange exchange) throws IOException {
    final int status;
    final ObjectNode body;
    final var last = publisher.lastPolled();
    if (last.isEmpty()) {
      status = 500;
      body = Jsons.object().put("detail", "store never polled");
    } else if (!publisher.isHealthy(window)) {
      status = 500;
      body = Jsons.object().put("detail", "store last poll exceeded " + window.toSeconds() + "s");
    } else {
      status = 200;
      body = Jsons.object()
          .put("message", "OK")
          .put("lastPolled", Duration.between(last.get(), clock.instant()).toSeconds());
    }
    final byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  @Override
  public void close() {
    server.stop(0);
  }
}
