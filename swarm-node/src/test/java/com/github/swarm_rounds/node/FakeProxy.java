// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// An HTTP server that records JSON posts by path and answers from a per-path script, or 200 `{}`.
public class FakeProxy implements AutoCloseable {

  public record Reply(int status, String body) {
  }

  public record Request(String path, JsonNode body) {
  }

  private final HttpServer server;
  private final Map<String, Deque<Reply>> scripts = new ConcurrentHashMap<>();
  private final Map<String, Reply> defaults = new ConcurrentHashMap<>();
  public final List<Request> requests = new CopyOnWriteArrayList<>();
  private boolean stopped = false;

  public FakeProxy() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", exchange -> {
      final var path = exchange.getRequestURI().getPath();
      final var text = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
      requests.add(new Request(path, Jsons.parse(text)));
      final var script = scripts.get(path);
      Reply reply = script == null ? null : script.poll();
      if (reply == null) {
        reply = defaults.getOrDefault(path, new Reply(200, "{}"));
      }
      final var bytes = reply.body().getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
      if (bytes.length > 0) {
        exchange.getResponseBody().write(bytes);
      }
      exchange.close();
    });
    server.start();
  }

  public URI url() {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
  }

  /// Answers the next request to `path` with this reply.
  public FakeProxy then(String path, int status, String body) {
    scripts.computeIfAbsent(path, p -> new ArrayDeque<>()).add(new Reply(status, body));
    return this;
  }

  /// Answers every unscripted request to `path` with this reply.
  public FakeProxy always(String path, int status, String body) {
    defaults.put(path, new Reply(status, body));
    return this;
  }

  public List<Request> requestsTo(String path) {
    return requests.stream().filter(r -> r.path().equals(path)).toList();
  }

  @Override
  public synchronized void close() {
    if (!stopped) {
      stopped = true;
      server.stop(0);
    }
  }
}
