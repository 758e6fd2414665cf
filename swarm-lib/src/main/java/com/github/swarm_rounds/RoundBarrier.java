// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Blocks the calling thread until the ledger reports a round at least as new as the caller's local round.
///
/// Oracle failures are retried every `checkInterval` without growing the backoff. A round that has not advanced is
/// re-checked with exponential backoff from `checkInterval` up to `maxCheckInterval`. The backoff is local to each
/// call. Running out of `overallTimeout` is reported as a [BarrierResult] rather than thrown.
public class RoundBarrier {
  private final RoundOracle oracle;
  private final BarrierConfig config;
  private final Pacer pacer;

  public RoundBarrier(@NotNull RoundOracle oracle, @NotNull BarrierConfig config, @NotNull Pacer pacer) {
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.config = Objects.requireNonNull(config, "config");
    this.pacer = Objects.requireNonNull(pacer, "pacer");
  }

  public RoundBarrier(@NotNull RoundOracle oracle, @NotNull BarrierConfig config) {
    this(oracle, config, Pacer.SYSTEM);
  }

  public BarrierConfig config() {
    return config;
  }

  /// Waits for the round after `completedRound`.
  public BarrierResult awaitNext(long completedRound) {
    return await(completedRound + 1);
  }

  /// Waits until the oracle reports a round `>= localRound` or the final round of the schedule.
  public BarrierResult await(long localRound) {
    final long start = pacer.nanoTime();
    final long timeoutNanos = config.overallTimeout().toNanos();
    final long logTimeoutNanos = config.logTimeout().toNanos();
    long lastLog = start;
    Duration backoff = config.checkInterval();
    try {
      while (pacer.nanoTime() - start < timeoutNanos) {
        final long now = pacer.nanoTime();
        final RoundStage remote;
        try {
          remote = oracle.queryRoundAndStage();
        } catch (TransportException e) {
          if (now - lastLog > logTimeoutNanos) {
            LOGGER.log(Level.WARNING, "Could not fetch round and stage while waiting for round " + localRound
                + ": " + e.getMessage(), e);
            lastLog = now;
          }
          pacer.sleep(config.checkInterval());
          continue;
        }

        if (remote.round() >= localRound) {
          final boolean finalRound = config.isFinalRound(remote.round());
          LOGGER.info(() -> "Joining round " + remote.round() + " stage " + remote.stage()
              + (finalRound ? " (final round)" : ""));
          return BarrierResult.advanced(remote.round(), finalRound);
        }
        if (config.isFinalRound(remote.round())) {
          LOGGER.info(() -> "Reached the final round " + remote.round());
          return BarrierResult.advanced(localRound, true);
        }

        final Duration sleep = backoff;
        LOGGER.info(() -> "Already finished round " + remote.round() + ". Next check in " + sleep.toSeconds() + "s.");
        pacer.sleep(sleep);
        backoff = min(backoff.multipliedBy(2), config.maxCheckInterval());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.info(() -> "Interrupted while waiting for round " + localRound);
      return BarrierResult.interrupted(localRound);
    }
    LOGGER.warning(() -> "Timed out after " + config.overallTimeout() + " waiting for round " + localRound);
    return BarrierResult.timedOut(localRound);
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}
