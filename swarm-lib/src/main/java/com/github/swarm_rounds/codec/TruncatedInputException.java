// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

/// A tag or length prefix claims more bytes than remain in the input.
public class TruncatedInputException extends WireFormatException {
  public TruncatedInputException(int position, long needed, int remaining) {
    super("Truncated input at offset " + position + ": needed " + Long.toUnsignedString(needed)
        + " bytes but only " + remaining + " remain");
  }
}
