// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.codec;

import java.util.Optional;
import java.util.stream.Collectors;

/// Read-only navigation over untrusted value trees. Nothing here throws on an unexpected shape; a missing or
/// differently typed entry is simply absent.
public final class Values {
  private Values() {
  }

  /// Follows a path of string keys through nested mappings.
  public static Optional<Value> path(Value root, String... keys) {
    Value current = root;
    for (String key : keys) {
      if (!(current instanceof Value.Mapping mapping)) {
        return Optional.empty();
      }
      final var next = mapping.get(key);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      current = next.get();
    }
    return Optional.of(current);
  }

  /// The string held by a text value.
  public static Optional<String> text(Value value) {
    return value instanceof Value.Text text ? Optional.of(text.value()) : Optional.empty();
  }

  /// A short human readable rendering. Text is rendered bare, everything else in a Python-like literal syntax.
  public static String display(Value value) {
    if (value instanceof Value.Text text) {
      return text.value();
    }
    return literal(value);
  }

  private static String literal(Value value) {
    if (value instanceof Value.None) {
      return "None";
    } else if (value instanceof Value.Bool b) {
      return b.value() ? "True" : "False";
    } else if (value instanceof Value.Int i) {
      return i.value().toString();
    } else if (value instanceof Value.Real r) {
      return Double.toString(r.value());
    } else if (value instanceof Value.Text t) {
      return "'" + t.value() + "'";
    } else if (value instanceof Value.Sequence s) {
      return s.items().stream().map(Values::literal).collect(Collectors.joining(", ", "[", "]"));
    } else if (value instanceof Value.Mapping m) {
      return m.entries().entrySet().stream()
          .map(e -> literal(e.getKey()) + ": " + literal(e.getValue()))
          .collect(Collectors.joining(", ", "{", "}"));
    } else if (value instanceof Payload p) {
      return "Payload(world_state=" + literal(p.worldState()) + ", actions=" + literal(p.actions())
          + ", metadata=" + literal(p.metadata()) + ")";
    } else if (value instanceof WorldState w) {
      return "WorldState(environment_states=" + literal(w.environmentStates()) + ", opponent_states="
          + literal(w.opponentStates()) + ", personal_states=" + literal(w.personalStates()) + ")";
    }
    return String.valueOf(value);
  }
}
