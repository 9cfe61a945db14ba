package com.polytick.core.book;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriceLevelTest {

  @Test
  void equivalentPricesKeyTheSameLevel() {
    assertEquals(PriceLevel.of("100", "1").price(), PriceLevel.of("100.00", "1").price());
    assertEquals(PriceLevel.of("0.5", "1"), PriceLevel.of("0.50", "1"));
  }

  @Test
  void extremeExponentsDoNotOverflow() {
    PriceLevel level = new PriceLevel(new BigDecimal("1E+2147483647"), BigDecimal.ONE);

    assertEquals(-2147483647, level.price().scale());
  }

  @Test
  void zeroSizeIsARemoval() {
    assertTrue(PriceLevel.of("0.4", "0").isRemoval());
  }
}
