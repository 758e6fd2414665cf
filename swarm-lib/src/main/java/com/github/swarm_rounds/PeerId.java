// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// The identifier a peer is known by on the ledger and in the peer-to-peer store.
public record PeerId(String id) implements Comparable<PeerId> {
  public PeerId {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Peer ID must not be blank");
  }

  @Override
  public int compareTo(PeerId other) {
    return id.compareTo(other.id);
  }

  @Override
  public String toString() {
    return id;
  }
}
