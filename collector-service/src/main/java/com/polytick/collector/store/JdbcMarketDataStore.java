package com.polytick.collector.store;

import com.polytick.core.market.Instrument;
import com.polytick.core.market.WindowClass;
import com.polytick.core.store.MarketDataStore;
import com.polytick.core.store.MarketStats;
import com.polytick.core.store.StoreWriteException;
import com.polytick.core.tick.Tick;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;

/**
 * {@code markets} / {@code price_ticks} tables over JDBC. Each write is its own auto-committed statement, except
 * {@link #deleteInstrument(String)} which removes ticks and market in one transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcMarketDataStore implements MarketDataStore {

  private static final String INSERT_MARKET = """
      INSERT OR IGNORE INTO markets
        (slug, yes_token_id, no_token_id, open_timestamp, close_timestamp, resolved, market_type)
      VALUES (?, ?, ?, ?, ?, 0, ?)
      """;

  private static final String INSERT_TICK = """
      INSERT INTO price_ticks
        (market_slug, timestamp, epoch_ms, seconds_elapsed,
         yes_best_bid, yes_best_ask, no_best_bid, no_best_ask, yes_mid, no_mid, source)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """;

  private final @NonNull JdbcTemplate jdbc;
  private final @NonNull TransactionTemplate tx;

  @Override
  public void saveInstrument(Instrument instrument) {
    try {
      jdbc.update(INSERT_MARKET,
          instrument.id(),
          instrument.handles().yesHandle(),
          instrument.handles().noHandle(),
          instrument.openAt().getEpochSecond(),
          instrument.closeAt().getEpochSecond(),
          instrument.windowClass().code());
    } catch (DataAccessException e) {
      throw new StoreWriteException("save market failed slug=%s".formatted(instrument.id()), e);
    }
  }

  @Override
  public void appendTick(Tick tick) {
    try {
      jdbc.update(INSERT_TICK,
          tick.instrumentId(),
          tick.timestamp().toString(),
          tick.timestamp().toEpochMilli(),
          tick.secondsElapsed().doubleValue(),
          toDouble(tick.yesBestBid()),
          toDouble(tick.yesBestAsk()),
          toDouble(tick.noBestBid()),
          toDouble(tick.noBestAsk()),
          toDouble(tick.yesMid()),
          toDouble(tick.noMid()),
          tick.source().tag());
    } catch (DataAccessException e) {
      throw new StoreWriteException("append tick failed slug=%s".formatted(tick.instrumentId()), e);
    }
  }

  @Override
  public void markResolved(String instrumentId) {
    try {
      jdbc.update("UPDATE markets SET resolved = 1 WHERE slug = ?", instrumentId);
    } catch (DataAccessException e) {
      throw new StoreWriteException("mark resolved failed slug=%s".formatted(instrumentId), e);
    }
  }

  @Override
  public MarketStats stats(WindowClass windowClass) {
    String type = windowClass.code();
    long total = count("SELECT COUNT(*) FROM markets WHERE market_type = ?", type);
    long resolved = count("SELECT COUNT(*) FROM markets WHERE resolved = 1 AND market_type = ?", type);
    long ticks = count("""
        SELECT COUNT(*) FROM price_ticks pt
        JOIN markets m ON m.slug = pt.market_slug
        WHERE m.market_type = ?
        """, type);
    return new MarketStats(total, resolved, total - resolved, ticks);
  }

  @Override
  public boolean deleteInstrument(String instrumentId) {
    try {
      Integer deleted = tx.execute(status -> {
        int ticks = jdbc.update("DELETE FROM price_ticks WHERE market_slug = ?", instrumentId);
        int markets = jdbc.update("DELETE FROM markets WHERE slug = ?", instrumentId);
        log.info("deleted market slug={} ticks={}", instrumentId, ticks);
        return markets;
      });
      return deleted != null && deleted > 0;
    } catch (DataAccessException e) {
      throw new StoreWriteException("delete market failed slug=%s".formatted(instrumentId), e);
    }
  }

  @Override
  public long countTicks(String instrumentId) {
    return count("SELECT COUNT(*) FROM price_ticks WHERE market_slug = ?", instrumentId);
  }

  public boolean isResolved(String instrumentId) {
    Integer resolved = jdbc.query("SELECT resolved FROM markets WHERE slug = ?",
        rs -> rs.next() ? rs.getInt(1) : null, instrumentId);
    return resolved != null && resolved == 1;
  }

  private long count(String sql, Object... args) {
    Long n = jdbc.queryForObject(sql, Long.class, args);
    return n == null ? 0L : n;
  }

  private static Double toDouble(BigDecimal value) {
    return value == null ? null : value.doubleValue();
  }
}
