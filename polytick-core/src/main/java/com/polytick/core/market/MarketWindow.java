package com.polytick.core.market;

import java.time.Instant;
import java.util.Objects;

public record MarketWindow(
    String id,
    WindowClass windowClass,
    Instant start,
    Instant end
) {
  public MarketWindow {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(windowClass, "windowClass");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  /**
   * Slug-style id, e.g. {@code btc-updown-5m-1734364800}.
   */
  public static MarketWindow of(String assetPrefix, WindowClass windowClass, Instant now) {
    Instant start = windowClass.windowStart(now);
    String id = "%s-updown-%s-%d".formatted(assetPrefix, windowClass.code(), start.getEpochSecond());
    return new MarketWindow(id, windowClass, start, start.plus(windowClass.length()));
  }
}
