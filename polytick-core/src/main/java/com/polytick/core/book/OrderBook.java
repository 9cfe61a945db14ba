package com.polytick.core.book;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Bid and ask levels of one side handle. Every stored size is strictly positive.
 * All access goes through this object's monitor.
 */
final class OrderBook {

  private NavigableMap<BigDecimal, BigDecimal> bids = new TreeMap<>();
  private NavigableMap<BigDecimal, BigDecimal> asks = new TreeMap<>();

  synchronized void replace(Collection<PriceLevel> bidLevels, Collection<PriceLevel> askLevels) {
    NavigableMap<BigDecimal, BigDecimal> nextBids = new TreeMap<>();
    NavigableMap<BigDecimal, BigDecimal> nextAsks = new TreeMap<>();
    putPositive(nextBids, bidLevels);
    putPositive(nextAsks, askLevels);
    bids = nextBids;
    asks = nextAsks;
  }

  synchronized void apply(Collection<PriceLevel> bidDeltas, Collection<PriceLevel> askDeltas) {
    applyLevels(bids, bidDeltas);
    applyLevels(asks, askDeltas);
  }

  synchronized BestPrices bestPrices() {
    BigDecimal bestBid = bids.isEmpty() ? null : bids.lastKey();
    BigDecimal bestAsk = asks.isEmpty() ? null : asks.firstKey();
    return bestBid == null && bestAsk == null ? BestPrices.empty() : new BestPrices(bestBid, bestAsk);
  }

  synchronized Map<BigDecimal, BigDecimal> bidsView() {
    return Map.copyOf(bids);
  }

  synchronized Map<BigDecimal, BigDecimal> asksView() {
    return Map.copyOf(asks);
  }

  private static void putPositive(Map<BigDecimal, BigDecimal> target, Collection<PriceLevel> levels) {
    if (levels == null) {
      return;
    }
    for (PriceLevel level : levels) {
      if (level != null && level.size().signum() > 0) {
        target.put(level.price(), level.size());
      }
    }
  }

  private static void applyLevels(Map<BigDecimal, BigDecimal> target, Collection<PriceLevel> deltas) {
    if (deltas == null) {
      return;
    }
    for (PriceLevel delta : deltas) {
      if (delta == null) {
        continue;
      }
      if (delta.size().signum() > 0) {
        target.put(delta.price(), delta.size());
      } else {
        // zero (or a malformed negative) size removes the level
        target.remove(delta.price());
      }
    }
  }
}
