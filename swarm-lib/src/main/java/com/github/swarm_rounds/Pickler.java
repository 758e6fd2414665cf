// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds;

import java.nio.ByteBuffer;

/// Writes and reads one type to and from a ByteBuffer. Anything a peer puts into the shared store, or reads back
/// out of it, goes through a pickler.
public interface Pickler<T> {
  /// Writes the object at the buffer's position. The buffer must have at least [#sizeOf(Object)] bytes remaining.
  void serialize(T object, ByteBuffer buffer);

  /// Reads one object starting at the buffer's position, leaving the position just after it.
  T deserialize(ByteBuffer buffer);

  /// The exact number of bytes [#serialize(Object, ByteBuffer)] will write so that callers can allocate once.
  int sizeOf(T value);

  /// Serializes into a freshly allocated array of exactly the right size.
  default byte[] toBytes(T value) {
    final var buffer = ByteBuffer.allocate(sizeOf(value));
    serialize(value, buffer);
    return buffer.array();
  }
}
