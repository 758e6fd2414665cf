// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

/// Downstream consumer of sampled gossip. Delivery is fire and forget: a failure surfaces as a
/// [com.github.swarm_rounds.TransportException] which the publisher logs without retrying.
@FunctionalInterface
public interface GossipSink {
  void publish(GossipEvent event);
}
