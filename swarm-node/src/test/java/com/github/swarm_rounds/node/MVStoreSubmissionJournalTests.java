// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MVStoreSubmissionJournalTests {

  @TempDir
  Path dir;

  @Test
  void marksSurviveReopening() {
    final var file = dir.resolve("journal.mv.db").toString();
    try (MVStore store = MVStore.open(file)) {
      final var journal = new MVStoreSubmissionJournal(store);
      assertFalse(journal.isSubmitted(3));
      journal.markSubmitted(3);
      journal.markSubmitted(9);
      assertTrue(journal.isSubmitted(3));
    }
    try (MVStore store = MVStore.open(file)) {
      final var journal = new MVStoreSubmissionJournal(store);
      assertTrue(journal.isSubmitted(3));
      assertTrue(journal.isSubmitted(9));
      assertFalse(journal.isSubmitted(4));
      assertEquals(Optional.of(9L), journal.lastSubmittedRound());
      assertTrue(journal.submittedAt(3).isPresent());
    }
  }

  @Test
  void markingTwiceKeepsTheFirstTime() {
    try (MVStore store = MVStore.open(null)) {
      final var journal = new MVStoreSubmissionJournal(store);
      journal.markSubmitted(1);
      final var first = journal.submittedAt(1).orElseThrow();
      journal.markSubmitted(1);
      assertEquals(first, journal.submittedAt(1).orElseThrow());
      assertEquals(Optional.empty(), journal.submittedAt(2));
    }
  }

  @Test
  void anAcceptedRewardIsRememberedSeparatelyFromTheSettledRound() {
    final var file = dir.resolve("journal.mv.db").toString();
    try (MVStore store = MVStore.open(file)) {
      final var journal = new MVStoreSubmissionJournal(store);
      journal.markRewardAccepted(4);
      assertTrue(journal.isRewardAccepted(4));
      assertFalse(journal.isSubmitted(4));
    }
    try (MVStore store = MVStore.open(file)) {
      final var journal = new MVStoreSubmissionJournal(store);
      assertTrue(journal.isRewardAccepted(4));
      assertFalse(journal.isRewardAccepted(5));
      assertEquals(Optional.empty(), journal.lastSubmittedRound());
    }
  }
}
