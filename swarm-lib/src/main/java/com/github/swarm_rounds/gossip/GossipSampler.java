// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/// The random choices of the gossip pipeline. Shuffling before truncating keeps one peer's ordering from
/// dominating the published batch. Pass a seeded [Random] to make the choices reproducible.
public class GossipSampler {
  public static final int MAX_BATCH = 200;

  private final Random random;
  private final int maxBatch;

  public GossipSampler(Random random, int maxBatch) {
    if (maxBatch < 0) {
      throw new IllegalArgumentException("maxBatch must not be negative but was " + maxBatch);
    }
    this.random = random;
    this.maxBatch = maxBatch;
  }

  public GossipSampler(Random random) {
    this(random, MAX_BATCH);
  }

  public GossipSampler() {
    this(new Random());
  }

  /// A uniformly shuffled copy truncated to at most `maxBatch` entries.
  public <T> List<T> sample(List<T> candidates) {
    final var shuffled = new ArrayList<>(candidates);
    Collections.shuffle(shuffled, random);
    return shuffled.size() <= maxBatch ? shuffled : new ArrayList<>(shuffled.subList(0, maxBatch));
  }

  /// A uniformly random element, empty when there are none.
  public <T> Optional<T> choose(List<T> options) {
    if (options.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(options.get(random.nextInt(options.size())));
  }
}
