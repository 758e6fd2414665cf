// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import java.util.logging.Logger;

/// The single JUL logger shared by the library. Configure it with the `com.github.swarm_rounds` logger name.
public final class SwarmLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.swarm_rounds");

  private SwarmLogger() {
  }
}
