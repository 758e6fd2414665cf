// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// The ledger rejected an action because it has already been applied, such as registering a registered peer or
/// submitting a reward twice for one round. Callers treat it as success.
public class SubmissionConflictException extends RuntimeException {
  private final String reason;

  public SubmissionConflictException(String reason) {
    super("Ledger reports already applied: " + reason);
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
