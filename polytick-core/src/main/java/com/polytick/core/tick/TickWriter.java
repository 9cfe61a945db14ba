package com.polytick.core.tick;

import com.polytick.core.book.BestPrices;
import com.polytick.core.book.BookStore;
import com.polytick.core.market.Instrument;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.store.MarketDataStore;
import com.polytick.core.store.StoreWriteException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persists best-price observations, skipping unforced writes whose four prices equal the last written ones.
 *
 * The dedup key only advances after the store confirmed the append, so a failed write is retried by the next
 * unforced call with the same prices. Writes for one instrument are serialized on its dedup state.
 */
@Slf4j
@RequiredArgsConstructor
public final class TickWriter {

  private final @NonNull InstrumentRegistry registry;
  private final @NonNull BookStore books;
  private final @NonNull MarketDataStore store;
  private final @NonNull Clock clock;

  private final Map<String, DedupState> dedup = new ConcurrentHashMap<>();

  private final Map<TickSource, AtomicLong> written = newCounters();
  private final AtomicLong skippedDuplicates = new AtomicLong(0);
  private final AtomicLong writeFailures = new AtomicLong(0);

  public boolean writeTick(String instrumentId, TickSource source) {
    return writeTick(instrumentId, source, false);
  }

  public boolean writeTick(String instrumentId, TickSource source, boolean force) {
    Optional<Instrument> found = registry.lookup(instrumentId);
    if (found.isEmpty()) {
      return false;
    }
    Instrument instrument = found.get();
    DedupState state = dedup.computeIfAbsent(instrumentId, k -> new DedupState());

    boolean persisted;
    synchronized (state) {
      BestPrices yes = books.bestPrices(instrument.handles().yesHandle());
      BestPrices no = books.bestPrices(instrument.handles().noHandle());
      if (yes.isEmpty() && no.isEmpty()) {
        return false;
      }

      PriceKey key = PriceKey.of(yes, no);
      if (!force && key.equals(state.lastWritten)) {
        skippedDuplicates.incrementAndGet();
        return false;
      }

      Tick tick = Tick.observe(instrument, Instant.now(clock), yes, no, source);
      try {
        store.appendTick(tick);
        state.lastWritten = key;
        written.get(source).incrementAndGet();
        persisted = true;
      } catch (StoreWriteException e) {
        writeFailures.incrementAndGet();
        log.warn("tick write failed id={} source={} error={}", instrumentId, source.tag(), e.toString());
        persisted = false;
      }
    }

    // expired while we were writing: drop the state recreated above
    if (registry.lookup(instrumentId).isEmpty()) {
      dedup.remove(instrumentId);
    }
    return persisted;
  }

  public void forget(String instrumentId) {
    dedup.remove(instrumentId);
  }

  public Optional<PriceKey> lastWritten(String instrumentId) {
    DedupState state = dedup.get(instrumentId);
    if (state == null) {
      return Optional.empty();
    }
    synchronized (state) {
      return Optional.ofNullable(state.lastWritten);
    }
  }

  public long ticksWritten(TickSource source) {
    return written.get(source).get();
  }

  public long skippedDuplicates() {
    return skippedDuplicates.get();
  }

  public long writeFailures() {
    return writeFailures.get();
  }

  public int trackedInstruments() {
    return dedup.size();
  }

  private static Map<TickSource, AtomicLong> newCounters() {
    Map<TickSource, AtomicLong> counters = new EnumMap<>(TickSource.class);
    for (TickSource source : TickSource.values()) {
      counters.put(source, new AtomicLong(0));
    }
    return counters;
  }

  private static final class DedupState {
    private PriceKey lastWritten;
  }
}
