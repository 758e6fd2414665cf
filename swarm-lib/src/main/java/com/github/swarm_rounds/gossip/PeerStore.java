// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

import java.util.Map;

/// Read access to the peer-to-peer store. A round record is stored under the decimal round number and maps each
/// contributing peer to the bytes it wrote.
@FunctionalInterface
public interface PeerStore {

  /// @return the entries under `key` by peer identifier, empty when the key is absent
  /// @throws com.github.swarm_rounds.TransportException when the store cannot be read
  Map<String, byte[]> get(String key);

  static String roundKey(long round) {
    return Long.toString(round);
  }
}
