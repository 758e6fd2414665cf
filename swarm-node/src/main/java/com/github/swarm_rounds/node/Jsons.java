// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class Jsons {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private Jsons() {
  }

  public static ObjectNode object() {
    return MAPPER.createObjectNode();
  }

  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new RuntimeException("Failed to serialize JSON", e);
    }
  }

  /// @throws JsonProcessingException when the text is not JSON
  public static JsonNode parse(String text) throws JsonProcessingException {
    return MAPPER.readTree(text == null || text.isBlank() ? "{}" : text);
  }
}
