// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Drives a peer through the rounds of the schedule on the calling thread:
///
/// 1. register the peer with the ledger, an existing registration is fine
/// 2. join the ledger's current round
/// 3. per round do the work, settle the reward, then wait at the barrier for the next round
///
/// A round whose reward still fails after the end-of-round retry is left unsettled. Its signal stays in the
/// accumulator and is carried into the next round's reward.
///
/// It returns the barrier result that ended it: the final round (after doing that round's work), the end of the
/// schedule, a timeout or an interruption.
public class PeerRoundLoop {
  private final PeerId self;
  private final SwarmLedger ledger;
  private final RoundBarrier barrier;
  private final RewardSubmissionController controller;

  public PeerRoundLoop(@NotNull PeerId self,
                       @NotNull SwarmLedger ledger,
                       @NotNull RoundBarrier barrier,
                       @NotNull RewardSubmissionController controller) {
    this.self = Objects.requireNonNull(self, "self");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.barrier = Objects.requireNonNull(barrier, "barrier");
    this.controller = Objects.requireNonNull(controller, "controller");
  }

  public BarrierResult run(@NotNull RoundWork work) {
    register();
    BarrierResult joined = barrier.await(0);
    while (joined.advanced()) {
      final long round = joined.round();
      if (barrier.config().isBeyondSchedule(round)) {
        LOGGER.info(() -> self + " has no rounds left after round " + (round - 1));
        return joined;
      }
      LOGGER.info(() -> self + " starting round " + round);
      final WorkReport report = work.perform(round);
      controller.observe(self, report.totalsByPeer());
      controller.maybeSubmit(round, self);
      if (!controller.isSubmitted(round)) {
        LOGGER.info(() -> "Retrying submission at the end of round " + round);
        controller.maybeSubmit(round, self);
      }
      if (joined.finalRound()) {
        LOGGER.info(() -> self + " finished the final round " + round);
        return joined;
      }
      joined = barrier.awaitNext(round);
    }
    return joined;
  }

  void register() {
    try {
      ledger.registerPeer(self);
      LOGGER.info(() -> "Registered peer " + self);
    } catch (SubmissionConflictException e) {
      LOGGER.info(() -> "Peer " + self + " is already registered");
    }
  }
}
