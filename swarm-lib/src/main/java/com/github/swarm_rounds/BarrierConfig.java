// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import lombok.With;

import java.time.Duration;
import java.util.Objects;

/// Immutable settings for a [RoundBarrier].
///
/// @param checkInterval    sleep after an oracle failure and the first backoff while the round has not advanced
/// @param logTimeout       minimum time between diagnostics about a failing oracle
/// @param maxCheckInterval cap on the exponential backoff
/// @param overallTimeout   give up waiting after this long
/// @param maxRound         number of rounds in the schedule; reaching `maxRound - 1` ends the wait
@With
public record BarrierConfig(
    Duration checkInterval,
    Duration logTimeout,
    Duration maxCheckInterval,
    Duration overallTimeout,
    long maxRound
) {
  public static final long UNBOUNDED = Long.MAX_VALUE;

  public BarrierConfig {
    Objects.requireNonNull(checkInterval, "checkInterval");
    Objects.requireNonNull(logTimeout, "logTimeout");
    Objects.requireNonNull(maxCheckInterval, "maxCheckInterval");
    Objects.requireNonNull(overallTimeout, "overallTimeout");
    if (checkInterval.isNegative() || checkInterval.isZero()) {
      throw new IllegalArgumentException("checkInterval must be positive but was " + checkInterval);
    }
    if (maxCheckInterval.compareTo(checkInterval) < 0) {
      throw new IllegalArgumentException("maxCheckInterval " + maxCheckInterval + " is less than checkInterval " + checkInterval);
    }
    if (maxRound < 1) {
      throw new IllegalArgumentException("maxRound must be at least 1 but was " + maxRound);
    }
  }

  /// Poll every 5s, back off to 15 minutes, give up after 31 days.
  public static BarrierConfig defaults() {
    return new BarrierConfig(
        Duration.ofSeconds(5),
        Duration.ofSeconds(10),
        Duration.ofMinutes(15),
        Duration.ofDays(31),
        UNBOUNDED
    );
  }

  public boolean isFinalRound(long round) {
    return maxRound != UNBOUNDED && round == maxRound - 1;
  }

  /// True for rounds after the final round, which exist only as the local round of a peer that finished.
  public boolean isBeyondSchedule(long round) {
    return maxRound != UNBOUNDED && round >= maxRound;
  }
}
