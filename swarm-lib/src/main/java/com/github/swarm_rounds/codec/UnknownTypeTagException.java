// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

public class UnknownTypeTagException extends WireFormatException {
  private final long tag;

  public UnknownTypeTagException(long tag) {
    super("Unknown type tag " + Long.toUnsignedString(tag) + "; supported tags are 1 to 9");
    this.tag = tag;
  }

  public long tag() {
    return tag;
  }
}
