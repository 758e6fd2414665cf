// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import java.time.Duration;

/// Monotonic time and sleeping for the polling loops. Tests substitute a virtual clock that advances when slept.
public interface Pacer {

  long nanoTime();

  void sleep(Duration duration) throws InterruptedException;

  Pacer SYSTEM = new Pacer() {
    @Override
    public long nanoTime() {
      return System.nanoTime();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
      Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
  };
}
