// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

import java.util.List;

/// One batch handed to the [GossipSink].
public record GossipEvent(String type, List<GossipMessage> data) {
  public static final String GOSSIP = "gossip";

  public GossipEvent {
    data = List.copyOf(data);
  }

  public static GossipEvent gossip(List<GossipMessage> messages) {
    return new GossipEvent(GOSSIP, messages);
  }
}
