package com.polytick.core.book;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory order books keyed by side handle.
 *
 * Snapshots replace a book wholesale; deltas upsert or remove single levels. There is no ordering between the two
 * sources beyond "last applied update wins" for a given level until the next snapshot replaces the book.
 * Locking is per side handle.
 */
public final class BookStore {

  private final Map<String, OrderBook> books = new ConcurrentHashMap<>();

  public void replaceSnapshot(String sideHandle, Collection<PriceLevel> bidLevels, Collection<PriceLevel> askLevels) {
    books.computeIfAbsent(sideHandle, k -> new OrderBook()).replace(bidLevels, askLevels);
  }

  public void applyDelta(String sideHandle, Collection<PriceLevel> bidDeltas, Collection<PriceLevel> askDeltas) {
    books.computeIfAbsent(sideHandle, k -> new OrderBook()).apply(bidDeltas, askDeltas);
  }

  public BestPrices bestPrices(String sideHandle) {
    OrderBook book = books.get(sideHandle);
    return book == null ? BestPrices.empty() : book.bestPrices();
  }

  public void forget(String sideHandle) {
    books.remove(sideHandle);
  }

  public boolean contains(String sideHandle) {
    return books.containsKey(sideHandle);
  }

  public int size() {
    return books.size();
  }

  public Map<BigDecimal, BigDecimal> bids(String sideHandle) {
    OrderBook book = books.get(sideHandle);
    return book == null ? Map.of() : book.bidsView();
  }

  public Map<BigDecimal, BigDecimal> asks(String sideHandle) {
    OrderBook book = books.get(sideHandle);
    return book == null ? Map.of() : book.asksView();
  }
}
