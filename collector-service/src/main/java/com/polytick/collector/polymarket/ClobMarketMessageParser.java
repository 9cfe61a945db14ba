package com.polytick.collector.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.collector.feed.SideDelta;
import com.polytick.core.book.PriceLevel;
import com.polytick.core.feed.FeedException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns market channel messages into per-side-handle deltas.
 *
 * A message is one update or an array of them. Book-shaped updates carry {@code asset_id} with {@code bids}/{@code asks}
 * (or {@code buys}/{@code sells}); {@code price_change} events carry a {@code price_changes} list whose entries name
 * the level side as {@code BUY} (bid) or {@code SELL} (ask).
 */
@Component
@RequiredArgsConstructor
public class ClobMarketMessageParser {

  private final @NonNull ObjectMapper objectMapper;

  public List<SideDelta> parse(String message) {
    if (message == null || message.isBlank()) {
      return List.of();
    }
    String trimmed = message.trim();
    if ("PONG".equalsIgnoreCase(trimmed) || "PING".equalsIgnoreCase(trimmed)) {
      return List.of();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(trimmed);
    } catch (Exception e) {
      throw new FeedException("malformed market ws message", e);
    }

    Map<String, Accumulator> byHandle = new LinkedHashMap<>();
    if (root.isArray()) {
      for (JsonNode update : root) {
        collect(update, byHandle);
      }
    } else {
      collect(root, byHandle);
    }

    List<SideDelta> out = new ArrayList<>(byHandle.size());
    for (Map.Entry<String, Accumulator> e : byHandle.entrySet()) {
      SideDelta delta = new SideDelta(e.getKey(), e.getValue().bids, e.getValue().asks);
      if (!delta.isEmpty()) {
        out.add(delta);
      }
    }
    return out;
  }

  private void collect(JsonNode update, Map<String, Accumulator> byHandle) {
    if (update == null || !update.isObject()) {
      return;
    }
    String assetId = JsonNodes.textOrNull(update.path("asset_id"));

    JsonNode changes = JsonNodes.firstArray(update, "price_changes", "changes");
    if (changes != null) {
      for (JsonNode change : changes) {
        String handle = JsonNodes.textOrNull(change.path("asset_id"));
        if (handle == null) {
          handle = assetId;
        }
        BigDecimal price = JsonNodes.decimalOrNull(change.path("price"));
        BigDecimal size = JsonNodes.decimalOrNull(change.path("size"));
        String side = JsonNodes.textOrNull(change.path("side"));
        if (handle == null || price == null || size == null || side == null) {
          continue;
        }
        Accumulator acc = byHandle.computeIfAbsent(handle, k -> new Accumulator());
        switch (side.toUpperCase(Locale.ROOT)) {
          case "BUY" -> acc.bids.add(new PriceLevel(price, size));
          case "SELL" -> acc.asks.add(new PriceLevel(price, size));
          default -> {
          }
        }
      }
      return;
    }

    if (assetId == null) {
      return;
    }
    List<PriceLevel> bids = JsonNodes.levels(JsonNodes.firstArray(update, "bids", "buys"));
    List<PriceLevel> asks = JsonNodes.levels(JsonNodes.firstArray(update, "asks", "sells"));
    if (bids.isEmpty() && asks.isEmpty()) {
      return;
    }
    Accumulator acc = byHandle.computeIfAbsent(assetId, k -> new Accumulator());
    acc.bids.addAll(bids);
    acc.asks.addAll(asks);
  }

  private static final class Accumulator {
    private final List<PriceLevel> bids = new ArrayList<>();
    private final List<PriceLevel> asks = new ArrayList<>();
  }
}
