// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.swarm_rounds.OracleUnavailableException;
import com.github.swarm_rounds.PeerId;
import com.github.swarm_rounds.RoundStage;
import com.github.swarm_rounds.SubmissionConflictException;
import com.github.swarm_rounds.SwarmLedger;
import com.github.swarm_rounds.TransportException;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Talks to the ledger through its HTTP proxy. Every call is a JSON POST to `{proxyUrl}/api/{endpoint}` whose body
/// carries the organisation id.
///
/// The proxy reports a contract revert as a 400 whose body names the revert in `error`. A 400 from `register-peer`
/// naming `PeerIdAlreadyRegistered`, a 400 from a submission naming an `...Already...` revert, and any 409 mean the
/// ledger already applied the action and surface as [SubmissionConflictException]. Any other failure is a
/// [TransportException]. Every failure to read the round and stage is an [OracleUnavailableException].
public class HttpSwarmLedger implements SwarmLedger {
  static final String ALREADY_REGISTERED = "PeerIdAlreadyRegistered";
  /// Duplicate submissions revert with an error name such as `RewardAlreadySubmitted`.
  static final String DUPLICATE_REVERT = "Already";

  private final HttpClient http;
  private final URI proxyUrl;
  private final String orgId;
  private final Duration timeout;

  public HttpSwarmLedger(@NotNull HttpClient http, @NotNull URI proxyUrl, @NotNull String orgId, @NotNull Duration timeout) {
    this.http = Objects.requireNonNull(http, "http");
    this.proxyUrl = Objects.requireNonNull(proxyUrl, "proxyUrl");
    this.orgId = Objects.requireNonNull(orgId, "orgId");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public RoundStage queryRoundAndStage() {
    final JsonNode response;
    try {
      response = post("round-and-stage", body());
    } catch (RuntimeException e) {
      throw new OracleUnavailableException("Failed to query round and stage: " + e.getMessage(), e);
    }
    final var round = response.get("round");
    final var stage = response.get("stage");
    if (round == null || !round.canConvertToLong() || stage == null || !stage.canConvertToLong()) {
      throw new OracleUnavailableException("Unexpected round-and-stage response: " + response);
    }
    return new RoundStage(round.asLong(), stage.asLong());
  }

  @Override
  public void registerPeer(PeerId peer) {
    post("register-peer", body().put("peerId", peer.id()));
  }

  @Override
  public void submitReward(long round, long stage, long amount, PeerId peer) {
    post("submit-reward", body()
        .put("roundNumber", round)
        .put("stageNumber", stage)
        .put("reward", amount)
        .put("peerId", peer.id()));
  }

  @Override
  public void submitWinners(long round, List<PeerId> winners, PeerId peer) {
    final var body = body().put("roundNumber", round);
    final var array = body.putArray("winners");
    winners.forEach(w -> array.add(w.id()));
    body.put("peerId", peer.id());
    post("submit-winner", body);
  }

  @Override
  public List<String> bootstrapAddresses() {
    final var response = post("bootnodes", body());
    final var addresses = new ArrayList<String>();
    response.path("bootnodes").forEach(node -> addresses.add(node.asText()));
    return addresses;
  }

  private ObjectNode body() {
    return Jsons.object().put("orgId", orgId);
  }

  JsonNode post(String endpoint, ObjectNode body) {
    final var uri = endpoint(proxyUrl, "api/" + endpoint);
    final var request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(body), StandardCharsets.UTF_8))
        .build();
    final HttpResponse<String> response;
    try {
      response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new TransportException("POST " + uri + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted during POST " + uri, e);
    }
    final int status = response.statusCode();
    LOGGER.finer(() -> "POST " + uri + " -> " + status);
    if (status >= 200 && status < 300) {
      return parse(uri, response.body());
    }
    if (status == 409) {
      throw new SubmissionConflictException(endpoint + ": " + errorName(response.body()));
    }
    if (status == 400) {
      final var error = errorName(response.body());
      if ("register-peer".equals(endpoint) && ALREADY_REGISTERED.equals(error)) {
        throw new SubmissionConflictException(error);
      }
      if (isSubmission(endpoint) && error.contains(DUPLICATE_REVERT)) {
        throw new SubmissionConflictException(endpoint + ": " + error);
      }
      LOGGER.info(() -> "POST " + endpoint + " was rejected with: " + error);
    }
    throw new TransportException("POST " + uri + " returned " + status + ": " + response.body());
  }

  private static boolean isSubmission(String endpoint) {
    return "submit-reward".equals(endpoint) || "submit-winner".equals(endpoint);
  }

  static URI endpoint(URI base, String path) {
    final var text = base.toString();
    return URI.create(text.endsWith("/") ? text + path : text + "/" + path);
  }

  private static JsonNode parse(URI uri, String text) {
    try {
      return Jsons.parse(text);
    } catch (JsonProcessingException e) {
      throw new TransportException("POST " + uri + " returned a body that is not JSON", e);
    }
  }

  private static String errorName(String text) {
    try {
      return Jsons.parse(text).path("error").asText("");
    } catch (JsonProcessingException e) {
      LOGGER.fine(() -> "Error body is not JSON: " + text);
      return "";
    }
  }
}
