// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// A thin synchronous view of the ledger's schedule. It is stateless so it can be called from any thread without
/// locking. Implementations do not cache and do not retry; retry policy belongs to the callers.
@FunctionalInterface
public interface RoundOracle {

  /// @return the ledger's current round and stage
  /// @throws OracleUnavailableException on any transport or contract-call failure
  RoundStage queryRoundAndStage();
}
