// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.github.swarm_rounds.SubmissionJournal;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.time.Instant;
import java.util.Optional;

/// Keeps the settled rounds, and the rounds whose reward was accepted, in an MVStore so that a restarted peer does
/// not submit either twice. Each mark is committed before [#markSubmitted(long)] or [#markRewardAccepted(long)]
/// returns.
public class MVStoreSubmissionJournal implements SubmissionJournal {
  private final MVStore store;
  private final MVMap<Long, Long> submitted;
  private final MVMap<Long, Long> rewarded;

  public MVStoreSubmissionJournal(MVStore store) {
    this.store = store;
    this.submitted = store.openMap("com.github.swarm_rounds.node#submitted");
    this.rewarded = store.openMap("com.github.swarm_rounds.node#rewarded");
  }

  @Override
  public boolean isSubmitted(long round) {
    return submitted.containsKey(round);
  }

  @Override
  public void markSubmitted(long round) {
    submitted.putIfAbsent(round, Instant.now().toEpochMilli());
    store.commit();
  }

  @Override
  public boolean isRewardAccepted(long round) {
    return rewarded.containsKey(round);
  }

  @Override
  public void markRewardAccepted(long round) {
    rewarded.putIfAbsent(round, Instant.now().toEpochMilli());
    store.commit();
  }

  /// When the round was marked.
  public Optional<Instant> submittedAt(long round) {
    return Optional.ofNullable(submitted.get(round)).map(Instant::ofEpochMilli);
  }

  public Optional<Long> lastSubmittedRound() {
    return submitted.isEmpty() ? Optional.empty() : Optional.of(submitted.lastKey());
  }
}
