// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

/// Raised when asked to encode a Java object that has no counterpart in the closed [Value] set.
public class UnsupportedTypeException extends IllegalArgumentException {
  public UnsupportedTypeException(Class<?> type) {
    super("Unsupported type: " + type.getName() + "; supported types are " + java.util.Arrays.toString(ObjType.values()));
  }
}
