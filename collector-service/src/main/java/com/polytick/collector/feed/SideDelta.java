package com.polytick.collector.feed;

import com.polytick.core.book.PriceLevel;

import java.util.List;
import java.util.Objects;

public record SideDelta(String sideHandle, List<PriceLevel> bids, List<PriceLevel> asks) {

  public SideDelta {
    Objects.requireNonNull(sideHandle, "sideHandle");
    bids = bids == null ? List.of() : List.copyOf(bids);
    asks = asks == null ? List.of() : List.copyOf(asks);
  }

  public boolean isEmpty() {
    return bids.isEmpty() && asks.isEmpty();
  }
}
