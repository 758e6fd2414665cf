// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

/// Context accompanying a [Payload]. By convention `environmentStates` is a mapping with a `question` entry and a
/// `metadata` sub-mapping holding `source_dataset`. Nothing here enforces that shape.
public record WorldState(Value environmentStates, Value opponentStates, Value personalStates) implements Value {

  public WorldState {
    environmentStates = environmentStates == null ? None.INSTANCE : environmentStates;
    opponentStates = opponentStates == null ? None.INSTANCE : opponentStates;
    personalStates = personalStates == null ? None.INSTANCE : personalStates;
  }

  @Override
  public ObjType type() {
    return ObjType.WORLD_STATE;
  }
}
