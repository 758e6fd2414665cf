// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// One human readable line derived from a peer's payload.
///
/// @param id        stable digest of question, peer, round, action and dataset so that the sink can de-duplicate
/// @param peerId    the raw peer identifier
/// @param peerName  the display name of the peer
/// @param message   `question...action`
/// @param timestamp when the message was derived, to the second
/// @param dataset   the source dataset when the payload named one
public record GossipMessage(
    String id,
    String peerId,
    String peerName,
    String message,
    Instant timestamp,
    Optional<String> dataset
) {
  public GossipMessage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(peerId, "peerId");
    Objects.requireNonNull(peerName, "peerName");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(timestamp, "timestamp");
    dataset = dataset == null ? Optional.empty() : dataset;
  }
}
