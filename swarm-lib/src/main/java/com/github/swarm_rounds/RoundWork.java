// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

/// The training and evaluation a peer performs once it has joined a round. Exceptions thrown here abort the loop.
@FunctionalInterface
public interface RoundWork {
  WorkReport perform(long round);
}
