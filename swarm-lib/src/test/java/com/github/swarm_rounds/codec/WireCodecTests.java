// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class WireCodecTests {

  static Payload questionPayload(String question, String dataset, String... actions) {
    final var environment = Value.mapping(
        "question", question,
        "metadata", Value.mapping("source_dataset", dataset));
    return new Payload(
        new WorldState(environment, Value.none(), Value.none()),
        Value.from(List.of((Object[]) actions)),
        Value.none());
  }

  static byte[] hex(String hex) {
    return HexFormat.of().parseHex(hex.replace(" ", ""));
  }

  @Test
  void questionPayloadRoundTrips() {
    final var payload = questionPayload("2+2?", "math", "4");

    final var decoded = WireCodec.decode(WireCodec.encode(payload));

    assertEquals(payload, decoded);
    final var world = ((Payload) decoded).world().orElseThrow();
    assertEquals("2+2?", Values.path(world.environmentStates(), "question").flatMap(Values::text).orElseThrow());
    assertEquals("math", Values.path(world.environmentStates(), "metadata", "source_dataset")
        .flatMap(Values::text).orElseThrow());
    assertEquals(List.of(Value.of("4")), ((Payload) decoded).actionList());
  }

  @Test
  void scalarLayouts() {
    assertArrayEquals(hex("0000000000000009"), WireCodec.encode(Value.none()));
    assertArrayEquals(hex("0000000000000006 31"), WireCodec.encode(Value.of(true)));
    assertArrayEquals(hex("0000000000000006 30"), WireCodec.encode(Value.of(false)));
    assertArrayEquals(hex("0000000000000004 0000000000000001 ff"), WireCodec.encode(Value.of(-1)));
    assertArrayEquals(hex("0000000000000004 0000000000000002 00ff"), WireCodec.encode(Value.of(255)));
    assertArrayEquals(hex("0000000000000005 0000000000000008 3ff8000000000000"), WireCodec.encode(Value.of(1.5)));
    assertArrayEquals(hex("0000000000000003 0000000000000002 6869"), WireCodec.encode(Value.of("hi")));
    assertArrayEquals(hex("0000000000000001 0000000000000000"), WireCodec.encode(Value.list()));
    assertArrayEquals(hex("0000000000000002 0000000000000000"), WireCodec.encode(Value.mapping()));
  }

  @Test
  void sizeOfMatchesTheEncodedLength() {
    final var value = Value.mapping(
        "nested", List.of(1L, -2L, "ü", 3.0, true),
        "payload", questionPayload("q", "d", "a", "b"),
        "big", new BigInteger("123456789012345678901234567890"));
    assertEquals(ValuePickler.instance.sizeOf(value), WireCodec.encode(value).length);
  }

  @Test
  void largeAndNegativeIntegersRoundTrip() {
    for (var n : List.of(BigInteger.ZERO, BigInteger.valueOf(Long.MIN_VALUE), BigInteger.valueOf(Long.MAX_VALUE),
        BigInteger.TWO.pow(100).negate(), BigInteger.TWO.pow(64))) {
      assertEquals(Value.of(n), WireCodec.decode(WireCodec.encode(Value.of(n))), n.toString());
    }
  }

  @Test
  void zeroWidthIntegerIsZero() {
    assertEquals(Value.of(0), WireCodec.decode(hex("0000000000000004 0000000000000000")));
  }

  @Test
  void acceptsZeroByteAsFalse() {
    assertEquals(Value.of(false), WireCodec.decode(hex("0000000000000006 00")));
    assertEquals(Value.of(false), WireCodec.decode(hex("0000000000000006 30")));
    assertEquals(Value.of(true), WireCodec.decode(hex("0000000000000006 31")));
  }

  @Test
  void mappingEqualityIgnoresOrderButEncodingKeepsIt() {
    final var ab = new LinkedHashMap<String, Object>();
    ab.put("a", 1L);
    ab.put("b", 2L);
    final var ba = new LinkedHashMap<String, Object>();
    ba.put("b", 2L);
    ba.put("a", 1L);
    final var first = Value.from(ab);
    final var second = Value.from(ba);

    assertEquals(first, second);
    assertFalse(Arrays.equals(WireCodec.encode(first), WireCodec.encode(second)));
    final var bytes = WireCodec.encode(second);
    assertArrayEquals(bytes, WireCodec.encode(WireCodec.decode(bytes)));
  }

  @Test
  void unknownTagIsRejected() {
    final var ex = assertThrows(UnknownTypeTagException.class, () -> WireCodec.decode(hex("000000000000000a")));
    assertEquals(10L, ex.tag());
    assertThrows(UnknownTypeTagException.class, () -> WireCodec.decode(hex("0000000000000000")));
    assertThrows(UnknownTypeTagException.class, () -> WireCodec.decode(hex("ffffffffffffffff")));
  }

  @Test
  void truncatedInputIsRejected() {
    assertThrows(TruncatedInputException.class, () -> WireCodec.decode(new byte[0]));
    assertThrows(TruncatedInputException.class, () -> WireCodec.decode(hex("00000000000000")));
    assertThrows(TruncatedInputException.class, () -> WireCodec.decode(hex("0000000000000006")));
    assertThrows(TruncatedInputException.class,
        () -> WireCodec.decode(hex("0000000000000003 0000000000000064 616263")));

    final var encoded = WireCodec.encode(questionPayload("2+2?", "math", "4"));
    for (int cut = 0; cut < encoded.length; cut++) {
      final var prefix = Arrays.copyOf(encoded, cut);
      assertThrows(WireFormatException.class, () -> WireCodec.decode(prefix), "cut at " + cut);
    }
  }

  @Test
  void hugeCountsFailBeforeAllocating() {
    assertThrows(TruncatedInputException.class,
        () -> WireCodec.decode(hex("0000000000000001 7fffffffffffffff 0000000000000009")));
    assertThrows(TruncatedInputException.class,
        () -> WireCodec.decode(hex("0000000000000002 ffffffffffffffff")));
    assertThrows(TruncatedInputException.class,
        () -> WireCodec.decode(hex("0000000000000003 ffffffffffffffff")));
  }

  @Test
  void trailingBytesAreRejected() {
    final var ex = assertThrows(WireFormatException.class, () -> WireCodec.decode(hex("0000000000000009 00")));
    assertEquals(WireFormatException.class, ex.getClass());
  }

  @Test
  void floatsMustBeEightBytes() {
    assertThrows(WireFormatException.class,
        () -> WireCodec.decode(hex("0000000000000005 0000000000000004 3fc00000")));
  }

  @Test
  void invalidUtf8IsRejected() {
    assertThrows(WireFormatException.class,
        () -> WireCodec.decode(hex("0000000000000003 0000000000000002 c328")));
  }

  @Test
  void deepNestingIsRejected() {
    final var buffer = ByteBuffer.allocate((ValuePickler.MAX_DEPTH + 2) * 16 + 8);
    for (int i = 0; i <= ValuePickler.MAX_DEPTH + 1; i++) {
      buffer.putLong(ObjType.LIST.tag());
      buffer.putLong(1);
    }
    buffer.putLong(ObjType.NONE.tag());
    assertThrows(WireFormatException.class, () -> WireCodec.decode(buffer.array()));
  }

  @Test
  void decodingLeavesTheInputUntouched() {
    final var bytes = WireCodec.encode(questionPayload("q", "d", "x"));
    final var copy = bytes.clone();
    WireCodec.decode(bytes);
    assertArrayEquals(copy, bytes);
  }

  @Test
  void unsupportedObjectsAreRejected() {
    assertThrows(UnsupportedTypeException.class, () -> WireCodec.encodeObject(new Object()));
    assertThrows(UnsupportedTypeException.class, () -> WireCodec.encodeObject(List.of(1L, new int[0])));
    assertThrows(UnsupportedTypeException.class, () -> WireCodec.encodeObject(Map.of("k", new StringBuilder[0])));
  }

  @Test
  void plainObjectsEncodeLikeTheirValues() {
    assertArrayEquals(WireCodec.encode(Value.list(Value.of(1), Value.of("x"), Value.none())),
        WireCodec.encodeObject(Arrays.asList(1, "x", null)));
  }
}
