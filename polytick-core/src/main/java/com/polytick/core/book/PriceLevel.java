package com.polytick.core.book;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One price level. Prices are normalized (trailing zeros stripped) so "0.50" and "0.5" key the same level.
 */
public record PriceLevel(BigDecimal price, BigDecimal size) {

  public PriceLevel {
    Objects.requireNonNull(price, "price");
    Objects.requireNonNull(size, "size");
    price = normalize(price);
  }

  public static PriceLevel of(String price, String size) {
    return new PriceLevel(new BigDecimal(price.trim()), new BigDecimal(size.trim()));
  }

  public boolean isRemoval() {
    return size.signum() == 0;
  }

  static BigDecimal normalize(BigDecimal value) {
    return value.stripTrailingZeros();
  }
}
