// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import java.util.List;

/// The full ledger contract as seen by a peer. Every call may throw [TransportException]. Actions the ledger has
/// already applied throw [SubmissionConflictException] which callers treat as success.
public interface SwarmLedger extends RoundOracle {

  void registerPeer(PeerId peer);

  void submitReward(long round, long stage, long amount, PeerId peer);

  void submitWinners(long round, List<PeerId> winners, PeerId peer);

  /// Addresses of the peers that new peers use to join the peer-to-peer store.
  List<String> bootstrapAddresses();
}
