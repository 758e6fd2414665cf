// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

import java.nio.ByteBuffer;

/// Whole-buffer entry points to the wire format. There is no streaming: a store entry is always decoded from one
/// in-memory array and must contain exactly one value.
public final class WireCodec {
  private WireCodec() {
  }

  public static byte[] encode(Value value) {
    return ValuePickler.instance.toBytes(value);
  }

  /// Converts a plain Java object tree with [Value#from(Object)] and encodes it.
  ///
  /// @throws UnsupportedTypeException if the tree holds anything outside the closed value set
  public static byte[] encodeObject(Object object) {
    return encode(Value.from(object));
  }

  /// Decodes one value. The input array is never modified.
  ///
  /// @throws TruncatedInputException if a length prefix claims more bytes than remain
  /// @throws UnknownTypeTagException if a tag is not one of the nine known tags
  /// @throws WireFormatException for any other malformation including trailing bytes
  public static Value decode(byte[] bytes) {
    final var buffer = ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    final var value = ValuePickler.instance.deserialize(buffer);
    if (buffer.hasRemaining()) {
      throw new WireFormatException(buffer.remaining() + " trailing bytes after value ending at offset " + buffer.position());
    }
    return value;
  }
}
