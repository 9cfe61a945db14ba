package com.polytick.core.tick;

import com.polytick.core.book.BestPrices;

import java.math.BigDecimal;

/**
 * Dedup key: the four best prices of an instrument at one instant.
 */
public record PriceKey(
    BigDecimal yesBid,
    BigDecimal yesAsk,
    BigDecimal noBid,
    BigDecimal noAsk
) {
  public static PriceKey of(BestPrices yes, BestPrices no) {
    return new PriceKey(yes.bestBid(), yes.bestAsk(), no.bestBid(), no.bestAsk());
  }
}
