// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;

import static com.github.swarm_rounds.SwarmLogger.LOGGER;

/// Accumulates this peer's reward signal over a round and settles it with the ledger at most once per round.
///
/// A settlement is a reward submission followed by a winners submission. The accumulator is cleared as soon as the
/// reward is accepted, or rejected as a duplicate, and that is recorded in the [SubmissionJournal]. The round is
/// marked settled once the winners are accepted too. A transport failure on the reward leaves the accumulator as it
/// was, so the next call for the same round retries with the same amount.
///
/// Not thread safe. It belongs to the thread that runs the peer's rounds.
public class RewardSubmissionController {
  /// Submissions always target the first stage of a round.
  public static final long SUBMIT_STAGE = 0L;

  private final SwarmLedger ledger;
  private final SubmissionJournal journal;

  private double accumulator = 0.0;
  private final Map<PeerId, Double> observedTotals = new LinkedHashMap<>();

  public RewardSubmissionController(@NotNull SwarmLedger ledger, @NotNull SubmissionJournal journal) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.journal = Objects.requireNonNull(journal, "journal");
  }

  public void accumulate(double signal) {
    accumulator += signal;
  }

  /// Takes the per-peer totals of the latest stage. This peer's own total is turned into a signal and accumulated;
  /// the totals are kept to pick the round's winner.
  public void observe(@NotNull PeerId self, @NotNull Map<PeerId, Double> totalsByPeer) {
    observedTotals.clear();
    observedTotals.putAll(totalsByPeer);
    final Double own = totalsByPeer.get(self);
    if (own != null) {
      accumulate(signalOf(own));
    }
  }

  /// A positive total earns a bonus of one.
  static double signalOf(double total) {
    return total > 0 ? total + 1 : total;
  }

  /// The peer with the greatest observed total, or `self` when nothing was observed.
  public PeerId winner(@NotNull PeerId self) {
    return observedTotals.entrySet().stream()
        .max(Map.Entry.comparingByValue())
        .map(Map.Entry::getKey)
        .orElse(self);
  }

  /// Settles `round` unless it is already settled. A reward the ledger accepted on an earlier call is not sent
  /// again; only the winners are.
  ///
  /// @return true only when this call settled the round
  public boolean maybeSubmit(long round, @NotNull PeerId self) {
    if (journal.isSubmitted(round)) {
      LOGGER.fine(() -> "Round " + round + " already submitted");
      return false;
    }
    final PeerId winner = winner(self);
    try {
      if (journal.isRewardAccepted(round)) {
        LOGGER.fine(() -> "Reward for round " + round + " already accepted, submitting winners only");
      } else {
        final long amount = (long) accumulator;
        settle(() -> ledger.submitReward(round, SUBMIT_STAGE, amount, self), "reward", round);
        journal.markRewardAccepted(round);
        accumulator = 0.0;
        LOGGER.info(() -> "Submitted round " + round + " reward " + amount);
      }
      settle(() -> ledger.submitWinners(round, List.of(winner), self), "winners", round);
    } catch (TransportException e) {
      LOGGER.log(Level.WARNING, "Failed to submit round " + round + ": " + e.getMessage()
          + ". Will retry at the end of the round.", e);
      return false;
    }
    journal.markSubmitted(round);
    LOGGER.info(() -> "Submitted round " + round + " winner " + winner);
    return true;
  }

  /// Gives up on `round`: the accumulator is cleared and the round is never attempted.
  public void abandon(long round) {
    LOGGER.info(() -> "Abandoning round " + round + " with unsubmitted reward " + accumulator);
    accumulator = 0.0;
    journal.markSubmitted(round);
  }

  public boolean isSubmitted(long round) {
    return journal.isSubmitted(round);
  }

  public double accumulator() {
    return accumulator;
  }

  private static void settle(Runnable call, String what, long round) {
    try {
      call.run();
    } catch (SubmissionConflictException e) {
      LOGGER.info(() -> "Ledger already has the " + what + " for round " + round + ": " + e.reason());
    }
  }
}
