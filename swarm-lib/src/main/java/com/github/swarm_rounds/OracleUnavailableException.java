// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// The round oracle could not answer. Callers must treat this as "unknown", never as "round unchanged".
public class OracleUnavailableException extends TransportException {
  public OracleUnavailableException(String message) {
    super(message);
  }

  public OracleUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
