package com.polytick.core.feed;

import com.polytick.core.book.PriceLevel;

import java.util.List;

public record BookSnapshot(List<PriceLevel> bids, List<PriceLevel> asks) {

  public BookSnapshot {
    bids = bids == null ? List.of() : List.copyOf(bids);
    asks = asks == null ? List.of() : List.copyOf(asks);
  }
}
