package com.polytick.collector.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.core.book.PriceLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

final class JsonNodes {

  /**
   * Decimals whose scale magnitude exceeds this are treated as unparsable.
   */
  static final int MAX_SCALE = 18;

  private JsonNodes() {
  }

  static String textOrNull(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    String v = node.asText(null);
    if (v == null || v.isBlank()) {
      return null;
    }
    return v.trim();
  }

  static BigDecimal decimalOrNull(JsonNode node) {
    String raw = textOrNull(node);
    if (raw == null) {
      return null;
    }
    BigDecimal value;
    try {
      value = new BigDecimal(raw);
    } catch (NumberFormatException e) {
      return null;
    }
    return Math.abs(value.scale()) > MAX_SCALE ? null : value;
  }

  /**
   * Parses a node that is either a JSON array ({@code ["a","b"]}) or a string holding one ({@code "[\"a\",\"b\"]"}).
   */
  static List<String> parseStringArray(ObjectMapper objectMapper, JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return List.of();
    }
    if (node.isArray()) {
      List<String> out = new ArrayList<>(node.size());
      for (JsonNode n : node) {
        String v = textOrNull(n);
        if (v != null) {
          out.add(v);
        }
      }
      return out;
    }
    if (node.isTextual()) {
      String raw = node.asText("").trim();
      if (raw.isEmpty()) {
        return List.of();
      }
      try {
        JsonNode parsed = objectMapper.readTree(raw);
        if (parsed != null && parsed.isArray()) {
          return parseStringArray(objectMapper, parsed);
        }
      } catch (Exception ignored) {
        // not an encoded array
      }
    }
    return List.of();
  }

  /**
   * Reads {@code [{"price":"0.5","size":"10"}, ...]}; levels without a parsable price and size are skipped.
   */
  static List<PriceLevel> levels(JsonNode array) {
    if (array == null || !array.isArray() || array.isEmpty()) {
      return List.of();
    }
    List<PriceLevel> out = new ArrayList<>(array.size());
    for (JsonNode level : array) {
      BigDecimal price = decimalOrNull(level.path("price"));
      BigDecimal size = decimalOrNull(level.path("size"));
      if (price == null || size == null) {
        continue;
      }
      out.add(new PriceLevel(price, size));
    }
    return out;
  }

  /**
   * First array-valued field among {@code names} ("bids" before "buys", "asks" before "sells").
   */
  static JsonNode firstArray(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode candidate = node.path(name);
      if (candidate.isArray()) {
        return candidate;
      }
    }
    return null;
  }
}
