// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// Remembers which rounds this peer has already settled with the ledger. A round is marked once its reward and
/// winners were accepted, or once it was abandoned, and is never attempted again.
///
/// An implementation that survives restarts stops a restarted peer from re-submitting a round it settled before it
/// went down. [InMemorySubmissionJournal] does not survive restarts.
public interface SubmissionJournal {

  boolean isSubmitted(long round);

  /// Must only return once the mark is as durable as the implementation promises.
  void markSubmitted(long round);

  /// True once the ledger accepted the reward for `round`, even when its winners are still outstanding.
  boolean isRewardAccepted(long round);

  void markRewardAccepted(long round);
}
