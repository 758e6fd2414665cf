// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

/// Maps a peer identifier to the name shown to people. Must be pure and total: an identifier it cannot name is
/// returned as is.
@FunctionalInterface
public interface PeerDirectory {
  String displayName(String peerId);

  PeerDirectory RAW = peerId -> peerId;
}
