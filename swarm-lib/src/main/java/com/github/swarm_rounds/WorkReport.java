// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import java.util.Map;

/// What a round of local work produced: the reward totals of every peer this peer evaluated, itself included.
public record WorkReport(Map<PeerId, Double> totalsByPeer) {
  public WorkReport {
    totalsByPeer = Map.copyOf(totalsByPeer);
  }
}
