// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

import com.github.f4b6a3.uuid.UuidCreator;
import com.github.swarm_rounds.RoundOracle;
import com.github.swarm_rounds.RoundStage;
import com.github.swarm_rounds.TransportException;
import com.github.swarm_rounds.codec.Payload;
import com.github.swarm_rounds.codec.Value;
import com.github.swarm_rounds.codec.Values;
import com.github.swarm_rounds.codec.WireCodec;
import com.github.swarm_rounds.codec.WireFormatException;
import com.github.swarm_rounds.codec.WorldState;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Polls the ledger for the current round, reads that round's record from the peer-to-peer store and publishes a
/// bounded random sample of human readable gossip to a [GossipSink].
///
/// It runs on its own daemon thread with its own round cursor and never touches the state of the peer's main loop.
/// Every failure is confined to the cycle or the store entry it happened in.
public class GossipPublisher {
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(150);
  static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

  private final RoundOracle oracle;
  private final PeerStore store;
  private final GossipSink sink;
  private final PeerDirectory directory;
  private final GossipSampler sampler;
  private final Duration pollInterval;
  private final Clock clock;

  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private Thread pollThread;
  private boolean stopped;

  // written by the poll thread
  private RoundStage cursor = RoundStage.UNKNOWN;
  private volatile Instant lastPolled;
  private volatile UUID pollId;

  public GossipPublisher(@NotNull RoundOracle oracle,
                         @NotNull PeerStore store,
                         @NotNull GossipSink sink,
                         @NotNull PeerDirectory directory,
                         @NotNull GossipSampler sampler,
                         @NotNull Duration pollInterval,
                         @NotNull Clock clock) {
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.store = Objects.requireNonNull(store, "store");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.directory = Objects.requireNonNull(directory, "directory");
    this.sampler = Objects.requireNonNull(sampler, "sampler");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public GossipPublisher(RoundOracle oracle, PeerStore store, GossipSink sink) {
    this(oracle, store, sink, AnimalNames.instance, new GossipSampler(), DEFAULT_POLL_INTERVAL, Clock.systemUTC());
  }

  /// Starts the poll thread. A publisher runs at most once: after [#stop()] it cannot be started again.
  public synchronized void start() {
    if (stopped) {
      LOGGER.warning("GossipPublisher was stopped and cannot be restarted");
      return;
    }
    if (pollThread != null) {
      LOGGER.warning("GossipPublisher is already running");
      return;
    }
    pollThread = new Thread(this::pollLoop, "gossip-publisher");
    pollThread.setDaemon(true);
    pollThread.start();
    LOGGER.info(() -> "GossipPublisher started polling every " + pollInterval.toSeconds() + "s");
  }

  /// Signals the loop and waits a bounded time for it to exit. A cycle in progress is allowed to finish.
  public synchronized void stop() {
    if (pollThread == null) {
      LOGGER.warning("GossipPublisher is not running");
      return;
    }
    stopSignal.countDown();
    try {
      pollThread.join(STOP_TIMEOUT.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (pollThread.isAlive()) {
      LOGGER.warning(() -> "GossipPublisher did not stop within " + STOP_TIMEOUT.toSeconds() + "s");
    } else {
      LOGGER.info("GossipPublisher stopped");
    }
    pollThread = null;
    stopped = true;
  }

  public synchronized boolean isRunning() {
    return pollThread != null && pollThread.isAlive();
  }

  /// When the store was last read successfully, empty before the first read.
  public Optional<Instant> lastPolled() {
    return Optional.ofNullable(lastPolled);
  }

  /// Healthy when the store has been read within `maxAge`.
  public boolean isHealthy(Duration maxAge) {
    final Instant last = lastPolled;
    return last != null && Duration.between(last, clock.instant()).compareTo(maxAge) <= 0;
  }

  private void pollLoop() {
    try {
      while (stopSignal.getCount() > 0) {
        try {
          pollOnce();
        } catch (RuntimeException e) {
          LOGGER.log(Level.SEVERE, "Unexpected error in gossip poll_id=" + pollId + ": " + e, e);
        }
        if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /// Runs one cycle and returns what was published, empty when nothing was.
  public List<GossipMessage> pollOnce() {
    final UUID id = UuidCreator.getTimeOrderedEpoch();
    pollId = id;
    LOGGER.fine(() -> "Polling for round/stage after " + cursor + " poll_id=" + id);

    final RoundStage polled;
    try {
      polled = oracle.queryRoundAndStage();
    } catch (TransportException e) {
      LOGGER.log(Level.WARNING, "Error polling for round/stage in gossip poll_id=" + id + ": " + e.getMessage(), e);
      return List.of();
    }
    if (!polled.equals(cursor)) {
      final RoundStage previous = cursor;
      LOGGER.info(() -> "Round/stage changed " + previous + " -> " + polled + " poll_id=" + id);
    }
    cursor = polled;

    final Map<String, byte[]> record;
    try {
      record = store.get(PeerStore.roundKey(polled.round()));
    } catch (TransportException e) {
      LOGGER.log(Level.WARNING, "Error reading round " + polled.round() + " from the store poll_id=" + id
          + ": " + e.getMessage(), e);
      return List.of();
    }
    if (record == null || record.isEmpty()) {
      LOGGER.info(() -> "No gossip found for round " + polled.round() + " poll_id=" + id);
      return List.of();
    }
    lastPolled = clock.instant();

    final var candidates = new ArrayList<GossipMessage>();
    record.forEach((peer, bytes) -> candidates.addAll(messagesOf(polled, id, peer, bytes)));
    LOGGER.info(() -> "Got " + candidates.size() + " gossip messages for " + polled + " poll_id=" + id);

    final var batch = sampler.sample(candidates);
    publish(batch, id);
    return batch;
  }

  private List<GossipMessage> messagesOf(RoundStage at, UUID id, String peer, byte[] bytes) {
    final Value decoded;
    try {
      decoded = WireCodec.decode(bytes);
    } catch (WireFormatException e) {
      LOGGER.warning(() -> "Skipping undecodable entry from peer " + peer + " round " + at.round() + " stage "
          + at.stage() + " poll_id=" + id + ": " + e.getMessage());
      return List.of();
    }
    final var payloads = new ArrayList<Payload>();
    collectPayloads(decoded, payloads);
    final var messages = new ArrayList<GossipMessage>(payloads.size());
    for (Payload payload : payloads) {
      toMessage(at.round(), peer, payload).ifPresent(messages::add);
    }
    return messages;
  }

  /// A peer may have written one payload, a list of them or a mapping of work unit to lists.
  static void collectPayloads(Value value, List<Payload> into) {
    if (value instanceof Payload payload) {
      into.add(payload);
    } else if (value instanceof Value.Sequence sequence) {
      sequence.items().forEach(item -> collectPayloads(item, into));
    } else if (value instanceof Value.Mapping mapping) {
      mapping.entries().values().forEach(item -> collectPayloads(item, into));
    }
  }

  Optional<GossipMessage> toMessage(long round, String peer, Payload payload) {
    final Value environment = payload.world().map(WorldState::environmentStates).orElse(Value.none());
    final Optional<String> question = Values.path(environment, "question").map(Values::display);
    if (question.isEmpty()) {
      LOGGER.fine(() -> "Skipping payload without a question from peer " + peer + " round " + round);
      return Optional.empty();
    }
    final String action = sampler.choose(payload.actionList()).map(Values::display).orElse("");
    final Optional<String> dataset = Values.path(environment, "metadata", "source_dataset").map(Values::display);
    final String gossipId = md5Hex(question.get() + "-" + peer + "-" + round + "-" + action + "-"
        + dataset.orElse("None"));
    return Optional.of(new GossipMessage(
        gossipId,
        peer,
        directory.displayName(peer),
        question.get() + "..." + action,
        clock.instant().truncatedTo(ChronoUnit.SECONDS),
        dataset));
  }

  private void publish(List<GossipMessage> batch, UUID id) {
    if (batch.isEmpty()) {
      LOGGER.info(() -> "No gossip data to publish poll_id=" + id);
      return;
    }
    try {
      sink.publish(GossipEvent.gossip(batch));
      LOGGER.info(() -> "Published " + batch.size() + " gossip messages poll_id=" + id);
    } catch (TransportException e) {
      LOGGER.log(Level.WARNING, "Error publishing gossip poll_id=" + id + ": " + e.getMessage(), e);
    }
  }

  static String md5Hex(String text) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 is a required JDK algorithm", e);
    }
  }

  @TestOnly
  RoundStage cursor() {
    return cursor;
  }

  @TestOnly
  Optional<UUID> pollId() {
    return Optional.ofNullable(pollId);
  }
}
