// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

import java.util.List;
import java.util.Optional;

/// The unit one peer writes to the store to report what it produced in a round. The three slots are opaque to the
/// codec; `actions` is usually a list of candidate outputs and `metadata` carries provenance.
public record Payload(Value worldState, Value actions, Value metadata) implements Value {

  public Payload {
    worldState = worldState == null ? None.INSTANCE : worldState;
    actions = actions == null ? None.INSTANCE : actions;
    metadata = metadata == null ? None.INSTANCE : metadata;
  }

  @Override
  public ObjType type() {
    return ObjType.PAYLOAD;
  }

  /// The world state when the slot holds one.
  public Optional<WorldState> world() {
    return worldState instanceof WorldState ws ? Optional.of(ws) : Optional.empty();
  }

  /// The candidate actions. A single non-list value counts as one action, `None` as no actions.
  public List<Value> actionList() {
    if (actions instanceof Sequence sequence) {
      return sequence.items();
    }
    if (actions == None.INSTANCE) {
      return List.of();
    }
    return List.of(actions);
  }
}
