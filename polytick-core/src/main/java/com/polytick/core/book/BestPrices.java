package com.polytick.core.book;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record BestPrices(BigDecimal bestBid, BigDecimal bestAsk) {

  public static final int MID_SCALE = 6;

  private static final BestPrices EMPTY = new BestPrices(null, null);

  public static BestPrices empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return bestBid == null && bestAsk == null;
  }

  /**
   * Average of bid and ask at {@value #MID_SCALE} fractional digits, or {@code null} unless both are present.
   */
  public BigDecimal mid() {
    if (bestBid == null || bestAsk == null) {
      return null;
    }
    return bestBid.add(bestAsk).divide(BigDecimal.valueOf(2), MID_SCALE, RoundingMode.HALF_UP);
  }
}
