// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

import java.math.BigInteger;
import java.util.*;

/// The closed set of values that can be written to, and read back from, the peer-to-peer store. Peers may run
/// different code versions, so the payload slots are fully dynamic and the only contract between a producer and a
/// consumer is the nine [ObjType] tags.
///
/// Composite values take defensive copies so that a decoded tree can be shared between threads.
public sealed interface Value permits Value.None, Value.Bool, Value.Int, Value.Real, Value.Text, Value.Sequence,
    Value.Mapping, Payload, WorldState {

  /// The wire tag that starts the encoding of this value.
  ObjType type();

  enum None implements Value {
    INSTANCE;

    @Override
    public ObjType type() {
      return ObjType.NONE;
    }

    @Override
    public String toString() {
      return "None";
    }
  }

  record Bool(boolean value) implements Value {
    public static final Bool TRUE = new Bool(true);
    public static final Bool FALSE = new Bool(false);

    @Override
    public ObjType type() {
      return ObjType.BOOLEAN;
    }
  }

  /// Integers are arbitrary precision as the wire format is variable width.
  record Int(BigInteger value) implements Value {
    public Int {
      Objects.requireNonNull(value, "value");
    }

    public long longValue() {
      return value.longValueExact();
    }

    @Override
    public ObjType type() {
      return ObjType.INTEGER;
    }
  }

  record Real(double value) implements Value {
    @Override
    public ObjType type() {
      return ObjType.FLOAT;
    }
  }

  record Text(String value) implements Value {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public ObjType type() {
      return ObjType.STRING;
    }
  }

  record Sequence(List<Value> items) implements Value {
    public Sequence {
      items = List.copyOf(items);
    }

    public int size() {
      return items.size();
    }

    @Override
    public ObjType type() {
      return ObjType.LIST;
    }
  }

  /// Equality ignores insertion order. Encoding writes the entries in insertion order so that a decoded mapping
  /// re-encodes to identical bytes.
  record Mapping(Map<Value, Value> entries) implements Value {
    public Mapping {
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Optional<Value> get(Value key) {
      return Optional.ofNullable(entries.get(key));
    }

    public Optional<Value> get(String key) {
      return get(new Text(key));
    }

    public int size() {
      return entries.size();
    }

    @Override
    public ObjType type() {
      return ObjType.DICT;
    }
  }

  static Value none() {
    return None.INSTANCE;
  }

  static Value of(boolean value) {
    return value ? Bool.TRUE : Bool.FALSE;
  }

  static Value of(long value) {
    return new Int(BigInteger.valueOf(value));
  }

  static Value of(BigInteger value) {
    return new Int(value);
  }

  static Value of(double value) {
    return new Real(value);
  }

  static Value of(String value) {
    return value == null ? None.INSTANCE : new Text(value);
  }

  static Value list(Value... items) {
    return new Sequence(Arrays.asList(items));
  }

  /// Builds a mapping from alternating keys and values. Keys and values are converted with [#from(Object)].
  static Value mapping(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected an even number of keys and values but got " + keysAndValues.length);
    }
    final var entries = new LinkedHashMap<Value, Value>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      entries.put(from(keysAndValues[i]), from(keysAndValues[i + 1]));
    }
    return new Mapping(entries);
  }

  /// Converts plain Java objects into a value tree.
  ///
  /// @throws UnsupportedTypeException if the object, or anything nested within it, is outside the closed set
  static Value from(Object object) {
    if (object == null) {
      return None.INSTANCE;
    }
    if (object instanceof Value value) {
      return value;
    }
    if (object instanceof Boolean b) {
      return of(b);
    }
    if (object instanceof BigInteger big) {
      return new Int(big);
    }
    if (object instanceof Long || object instanceof Integer || object instanceof Short || object instanceof Byte) {
      return of(((Number) object).longValue());
    }
    if (object instanceof Double || object instanceof Float) {
      return of(((Number) object).doubleValue());
    }
    if (object instanceof CharSequence text) {
      return new Text(text.toString());
    }
    if (object instanceof List<?> list) {
      final var items = new ArrayList<Value>(list.size());
      for (Object item : list) {
        items.add(from(item));
      }
      return new Sequence(items);
    }
    if (object instanceof Map<?, ?> map) {
      final var entries = new LinkedHashMap<Value, Value>();
      map.forEach((k, v) -> entries.put(from(k), from(v)));
      return new Mapping(entries);
    }
    throw new UnsupportedTypeException(object.getClass());
  }
}
