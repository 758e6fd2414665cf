// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.swarm_rounds.TransportException;
import com.github.swarm_rounds.gossip.GossipEvent;
import com.github.swarm_rounds.gossip.GossipMessage;
import com.github.swarm_rounds.gossip.GossipSink;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/// Posts each gossip batch as one JSON document:
///
/// ```
/// {"type":"gossip","data":[{"id":..,"peerId":..,"peerName":..,"message":..,"timestamp":"2025-05-01T12:00:00Z","dataset":..}]}
/// ```
///
/// `dataset` is left out when the payload named none.
public class HttpGossipSink implements GossipSink {
  private final HttpClient http;
  private final URI url;
  private final Duration timeout;

  public HttpGossipSink(HttpClient http, URI url, Duration timeout) {
    this.http = http;
    this.url = url;
    this.timeout = timeout;
  }

  @Override
  public void publish(GossipEvent event) {
    final var request = HttpRequest.newBuilder(url)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(toJson(event)), StandardCharsets.UTF_8))
        .build();
    final HttpResponse<String> response;
    try {
      response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new TransportException("Failed to post gossip to " + url + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted posting gossip to " + url, e);
    }
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new TransportException("Gossip sink " + url + " returned " + response.statusCode() + ": " + response.body());
    }
  }

  static ObjectNode toJson(GossipEvent event) {
    final var root = Jsons.object();
    root.put("type", event.type());
    final var data = root.putArray("data");
    for (GossipMessage message : event.data()) {
      final var item = data.addObject();
      item.put("id", message.id());
      item.put("peerId", message.peerId());
      item.put("peerName", message.peerName());
      item.put("message", message.message());
      item.put("timestamp", message.timestamp().toString());
      message.dataset().ifPresent(dataset -> item.put("dataset", dataset));
    }
    return root;
  }
}
