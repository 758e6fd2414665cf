// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.TreeSet;

public class InMemorySubmissionJournal implements SubmissionJournal {
  private final NavigableSet<Long> submitted = new TreeSet<>();
  private final NavigableSet<Long> rewarded = new TreeSet<>();

  @Override
  public boolean isSubmitted(long round) {
    return submitted.contains(round);
  }

  @Override
  public void markSubmitted(long round) {
    submitted.add(round);
  }

  @Override
  public boolean isRewardAccepted(long round) {
    return rewarded.contains(round);
  }

  @Override
  public void markRewardAccepted(long round) {
    rewarded.add(round);
  }

  public NavigableSet<Long> submittedRounds() {
    return Collections.unmodifiableNavigableSet(submitted);
  }
}
