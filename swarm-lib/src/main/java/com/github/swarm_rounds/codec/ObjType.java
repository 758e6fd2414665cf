// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

/// The type tags of the wire format. Each encoded node begins with its tag as an 8-byte unsigned big-endian number.
/// The numbers are shared with peers running other code versions and must never change.
public enum ObjType {
  LIST(1),
  DICT(2),
  STRING(3),
  INTEGER(4),
  FLOAT(5),
  BOOLEAN(6),
  PAYLOAD(7),
  WORLD_STATE(8),
  NONE(9);

  private static final ObjType[] BY_TAG = new ObjType[10];

  static {
    for (ObjType type : values()) {
      BY_TAG[(int) type.tag] = type;
    }
  }

  final long tag;

  ObjType(long tag) {
    this.tag = tag;
  }

  public long tag() {
    return tag;
  }

  /// @throws UnknownTypeTagException if the tag is not one of the nine known constants
  public static ObjType fromTag(long tag) {
    if (tag < 1 || tag >= BY_TAG.length) {
      throw new UnknownTypeTagException(tag);
    }
    return BY_TAG[(int) tag];
  }
}
