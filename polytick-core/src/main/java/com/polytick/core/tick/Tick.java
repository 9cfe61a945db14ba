package com.polytick.core.tick;

import com.polytick.core.book.BestPrices;
import com.polytick.core.market.Instrument;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record Tick(
    String instrumentId,
    Instant timestamp,
    BigDecimal secondsElapsed,
    BigDecimal yesBestBid,
    BigDecimal yesBestAsk,
    BigDecimal noBestBid,
    BigDecimal noBestAsk,
    BigDecimal yesMid,
    BigDecimal noMid,
    TickSource source
) {
  public Tick {
    Objects.requireNonNull(instrumentId, "instrumentId");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(secondsElapsed, "secondsElapsed");
    Objects.requireNonNull(source, "source");
  }

  public static Tick observe(Instrument instrument, Instant now, BestPrices yes, BestPrices no, TickSource source) {
    BigDecimal elapsed = BigDecimal.valueOf(Duration.between(instrument.openAt(), now).toMillis())
        .movePointLeft(3)
        .setScale(2, RoundingMode.HALF_UP);
    return new Tick(
        instrument.id(),
        now,
        elapsed,
        yes.bestBid(),
        yes.bestAsk(),
        no.bestBid(),
        no.bestAsk(),
        yes.mid(),
        no.mid(),
        source
    );
  }
}
