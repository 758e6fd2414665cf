// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// How a wait at the [RoundBarrier] ended. Only `ADVANCED` means the caller may start work on `round`.
///
/// @param outcome    the terminal state of the wait
/// @param round      the caller's local round after the wait
/// @param finalRound the oracle reported the last round of the schedule so no further rounds should be requested
public record BarrierResult(Outcome outcome, long round, boolean finalRound) {

  public enum Outcome {
    ADVANCED,
    TIMED_OUT,
    INTERRUPTED
  }

  public static BarrierResult advanced(long round, boolean finalRound) {
    return new BarrierResult(Outcome.ADVANCED, round, finalRound);
  }

  public static BarrierResult timedOut(long round) {
    return new BarrierResult(Outcome.TIMED_OUT, round, false);
  }

  public static BarrierResult interrupted(long round) {
    return new BarrierResult(Outcome.INTERRUPTED, round, false);
  }

  public boolean advanced() {
    return outcome == Outcome.ADVANCED;
  }
}
