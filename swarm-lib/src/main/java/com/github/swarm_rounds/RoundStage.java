// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// The ledger's coarse `round` and fine `stage` progress counters. Each execution context keeps its own copy and
/// only ever reconciles it through the oracle.
public record RoundStage(long round, long stage) implements Comparable<RoundStage> {

  /// The cursor of a context that has not polled yet.
  public static final RoundStage UNKNOWN = new RoundStage(-1, -1);

  @Override
  public int compareTo(RoundStage other) {
    final int byRound = Long.compare(round, other.round);
    return byRound != 0 ? byRound : Long.compare(stage, other.stage);
  }

  @Override
  public String toString() {
    return "R" + round + "S" + stage;
  }
}
