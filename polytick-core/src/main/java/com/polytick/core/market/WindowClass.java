package com.polytick.core.market;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public enum WindowClass {
  FIVE_MINUTES("5m", Duration.ofMinutes(5)),
  FIFTEEN_MINUTES("15m", Duration.ofMinutes(15));

  private final String code;
  private final Duration length;

  WindowClass(String code, Duration length) {
    this.code = code;
    this.length = length;
  }

  public String code() {
    return code;
  }

  public Duration length() {
    return length;
  }

  /**
   * Start of the window containing {@code now}: {@code floor(now / length) * length}.
   */
  public Instant windowStart(Instant now) {
    long lengthSeconds = length.toSeconds();
    long start = Math.floorDiv(now.getEpochSecond(), lengthSeconds) * lengthSeconds;
    return Instant.ofEpochSecond(start);
  }

  public static WindowClass fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("window class code must not be blank");
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (WindowClass wc : values()) {
      if (wc.code.equals(normalized)) {
        return wc;
      }
    }
    throw new IllegalArgumentException("unknown window class: " + code);
  }
}
