package com.polytick.core.market;

import java.time.Instant;
import java.util.Objects;

public record Instrument(
    String id,
    SideHandles handles,
    Instant openAt,
    Instant closeAt,
    WindowClass windowClass,
    boolean resolved
) {
  public Instrument {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(handles, "handles");
    Objects.requireNonNull(openAt, "openAt");
    Objects.requireNonNull(closeAt, "closeAt");
    Objects.requireNonNull(windowClass, "windowClass");
  }

  public static Instrument open(MarketWindow window, SideHandles handles) {
    return new Instrument(window.id(), handles, window.start(), window.end(), window.windowClass(), false);
  }

  public Instrument asResolved() {
    return resolved ? this : new Instrument(id, handles, openAt, closeAt, windowClass, true);
  }
}
