// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

import com.github.swarm_rounds.Pickler;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/// Pickles the closed [Value] set into the self-describing format shared by every peer.
///
/// ```
/// node    := tag:u64 body
/// LIST    := count:u64 node*count
/// DICT    := count:u64 (key:node value:node)*count
/// STRING  := length:u64 utf8*length
/// INTEGER := length:u64 twos-complement-big-endian*length   (minimum width)
/// FLOAT   := length:u64 ieee754-big-endian*length           (length is always 8)
/// BOOLEAN := '1' | '0'
/// PAYLOAD := world_state:node actions:node metadata:node
/// WORLD_STATE := environment:node opponent:node personal:node
/// NONE    := (empty)
/// ```
///
/// All u64 numbers are unsigned big-endian. The reader checks every length against the bytes that remain before
/// allocating anything so a hostile store entry cannot make it allocate more than its own size.
public class ValuePickler implements Pickler<Value> {
  public static final ValuePickler instance = new ValuePickler();

  static final int TAG_SIZE = Long.BYTES;
  static final int LENGTH_SIZE = Long.BYTES;
  static final int MAX_DEPTH = 512;

  private static final byte TRUE_BYTE = '1';
  private static final byte FALSE_BYTE = '0';

  protected ValuePickler() {
  }

  @Override
  public int sizeOf(Value value) {
    return Math.toIntExact(calculateSize(value));
  }

  private static long calculateSize(Value value) {
    long size = TAG_SIZE;
    if (value instanceof Value.None) {
      return size;
    } else if (value instanceof Value.Bool) {
      return size + 1;
    } else if (value instanceof Value.Int i) {
      return size + LENGTH_SIZE + i.value().toByteArray().length;
    } else if (value instanceof Value.Real) {
      return size + LENGTH_SIZE + Double.BYTES;
    } else if (value instanceof Value.Text t) {
      return size + LENGTH_SIZE + t.value().getBytes(StandardCharsets.UTF_8).length;
    } else if (value instanceof Value.Sequence s) {
      size += LENGTH_SIZE;
      for (Value item : s.items()) {
        size += calculateSize(item);
      }
      return size;
    } else if (value instanceof Value.Mapping m) {
      size += LENGTH_SIZE;
      for (var entry : m.entries().entrySet()) {
        size += calculateSize(entry.getKey()) + calculateSize(entry.getValue());
      }
      return size;
    } else if (value instanceof Payload p) {
      return size + calculateSize(p.worldState()) + calculateSize(p.actions()) + calculateSize(p.metadata());
    } else if (value instanceof WorldState w) {
      return size + calculateSize(w.environmentStates()) + calculateSize(w.opponentStates())
          + calculateSize(w.personalStates());
    }
    throw new UnsupportedTypeException(value == null ? Void.class : value.getClass());
  }

  @Override
  public void serialize(Value value, ByteBuffer buffer) {
    if (value == null) {
      value = Value.None.INSTANCE;
    }
    buffer.putLong(value.type().tag());
    switch (value.type()) {
      case NONE -> {
      }
      case BOOLEAN -> buffer.put(((Value.Bool) value).value() ? TRUE_BYTE : FALSE_BYTE);
      case INTEGER -> {
        final byte[] bytes = ((Value.Int) value).value().toByteArray();
        buffer.putLong(bytes.length);
        buffer.put(bytes);
      }
      case FLOAT -> {
        buffer.putLong(Double.BYTES);
        buffer.putDouble(((Value.Real) value).value());
      }
      case STRING -> {
        final byte[] bytes = ((Value.Text) value).value().getBytes(StandardCharsets.UTF_8);
        buffer.putLong(bytes.length);
        buffer.put(bytes);
      }
      case LIST -> {
        final var items = ((Value.Sequence) value).items();
        buffer.putLong(items.size());
        items.forEach(item -> serialize(item, buffer));
      }
      case DICT -> {
        final var entries = ((Value.Mapping) value).entries();
        buffer.putLong(entries.size());
        entries.forEach((k, v) -> {
          serialize(k, buffer);
          serialize(v, buffer);
        });
      }
      case PAYLOAD -> {
        final var payload = (Payload) value;
        serialize(payload.worldState(), buffer);
        serialize(payload.actions(), buffer);
        serialize(payload.metadata(), buffer);
      }
      case WORLD_STATE -> {
        final var worldState = (WorldState) value;
        serialize(worldState.environmentStates(), buffer);
        serialize(worldState.opponentStates(), buffer);
        serialize(worldState.personalStates(), buffer);
      }
    }
  }

  @Override
  public Value deserialize(ByteBuffer buffer) {
    return read(buffer, 0);
  }

  private static Value read(ByteBuffer buffer, int depth) {
    if (depth > MAX_DEPTH) {
      throw new WireFormatException("Values nested deeper than " + MAX_DEPTH + " at offset " + buffer.position());
    }
    final var type = ObjType.fromTag(readU64(buffer));
    return switch (type) {
      case NONE -> Value.None.INSTANCE;
      case BOOLEAN -> readBoolean(buffer);
      case INTEGER -> readInteger(buffer);
      case FLOAT -> readFloat(buffer);
      case STRING -> new Value.Text(readUtf8(buffer, readLength(buffer)));
      case LIST -> readList(buffer, depth);
      case DICT -> readDict(buffer, depth);
      case PAYLOAD -> new Payload(read(buffer, depth + 1), read(buffer, depth + 1), read(buffer, depth + 1));
      case WORLD_STATE -> new WorldState(read(buffer, depth + 1), read(buffer, depth + 1), read(buffer, depth + 1));
    };
  }

  private static long readU64(ByteBuffer buffer) {
    require(buffer, Long.BYTES);
    return buffer.getLong();
  }

  /// Reads a byte length and checks that many bytes remain.
  private static int readLength(ByteBuffer buffer) {
    final long length = readU64(buffer);
    require(buffer, length);
    return (int) length;
  }

  /// Reads an element count where every element occupies at least `minElementSize` bytes.
  private static int readCount(ByteBuffer buffer, int minElementSize) {
    final int position = buffer.position();
    final long count = readU64(buffer);
    if (Long.compareUnsigned(count, buffer.remaining() / minElementSize) > 0) {
      throw new TruncatedInputException(position, count, buffer.remaining());
    }
    return (int) count;
  }

  private static void require(ByteBuffer buffer, long needed) {
    if (Long.compareUnsigned(needed, buffer.remaining()) > 0) {
      throw new TruncatedInputException(buffer.position(), needed, buffer.remaining());
    }
  }

  private static Value readBoolean(ByteBuffer buffer) {
    require(buffer, 1);
    final byte b = buffer.get();
    // '0' is false; older writers used a zero byte
    return Value.of(b != FALSE_BYTE && b != 0);
  }

  private static Value readInteger(ByteBuffer buffer) {
    final int length = readLength(buffer);
    if (length == 0) {
      return new Value.Int(BigInteger.ZERO);
    }
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return new Value.Int(new BigInteger(bytes));
  }

  private static Value readFloat(ByteBuffer buffer) {
    final int position = buffer.position();
    final int length = readLength(buffer);
    if (length != Double.BYTES) {
      throw new WireFormatException("Float at offset " + position + " has width " + length + " but must be 8");
    }
    return new Value.Real(buffer.getDouble());
  }

  private static String readUtf8(ByteBuffer buffer, int length) {
    final var slice = buffer.slice();
    slice.limit(length);
    try {
      final CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(slice);
      buffer.position(buffer.position() + length);
      return chars.toString();
    } catch (CharacterCodingException e) {
      throw new WireFormatException("Invalid UTF-8 string at offset " + buffer.position(), e);
    }
  }

  private static Value readList(ByteBuffer buffer, int depth) {
    final int count = readCount(buffer, TAG_SIZE);
    final var items = new ArrayList<Value>(count);
    for (int i = 0; i < count; i++) {
      items.add(read(buffer, depth + 1));
    }
    return new Value.Sequence(items);
  }

  private static Value readDict(ByteBuffer buffer, int depth) {
    final int count = readCount(buffer, 2 * TAG_SIZE);
    final var entries = new LinkedHashMap<Value, Value>();
    for (int i = 0; i < count; i++) {
      final var key = read(buffer, depth + 1);
      final var value = read(buffer, depth + 1);
      entries.put(key, value);
    }
    return new Value.Mapping(entries);
  }
}
