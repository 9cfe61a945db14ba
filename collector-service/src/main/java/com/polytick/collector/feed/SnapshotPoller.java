package com.polytick.collector.feed;

import com.polytick.collector.config.CollectorProperties;
import com.polytick.core.book.BookStore;
import com.polytick.core.feed.BookSnapshot;
import com.polytick.core.feed.BookSnapshotSource;
import com.polytick.core.feed.FeedException;
import com.polytick.core.market.Instrument;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.tick.TickSource;
import com.polytick.core.tick.TickWriter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Authoritative refresh: every cycle replaces both books of each active instrument with a REST snapshot and asks the
 * tick writer for a (deduplicated) snapshot tick.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotPoller {

  private final @NonNull CollectorProperties properties;
  private final @NonNull InstrumentRegistry registry;
  private final @NonNull BookStore books;
  private final @NonNull BookSnapshotSource snapshots;
  private final @NonNull TickWriter tickWriter;
  private final @NonNull Clock clock;

  private final AtomicLong cycles = new AtomicLong(0);
  private final AtomicLong fetchFailures = new AtomicLong(0);
  private final AtomicLong ticksWritten = new AtomicLong(0);
  private volatile long lastCycleAtMillis;

  private volatile ExecutorService fetchPool;

  @PostConstruct
  public void init() {
    int workers = Math.max(2, properties.snapshot().fetchWorkers());
    fetchPool = Executors.newFixedThreadPool(workers, r -> {
      Thread t = new Thread(r, "clob-book-fetch");
      t.setDaemon(true);
      return t;
    });
  }

  @PreDestroy
  public void shutdown() {
    ExecutorService pool = fetchPool;
    if (pool != null) {
      pool.shutdownNow();
    }
  }

  public void pollOnce() {
    List<Instrument> active = registry.activeInstruments();
    int written = 0;
    for (Instrument instrument : active) {
      refresh(instrument);
      if (tickWriter.writeTick(instrument.id(), TickSource.SNAPSHOT)) {
        written++;
      }
    }
    ticksWritten.addAndGet(written);
    cycles.incrementAndGet();
    lastCycleAtMillis = Instant.now(clock).toEpochMilli();
    if (written > 0 && log.isDebugEnabled()) {
      log.debug("snapshot poll instruments={} ticksWritten={}", active.size(), written);
    }
  }

  /**
   * Fetches and installs both sides' books concurrently.
   *
   * @return number of sides refreshed (0..2)
   */
  public int refresh(Instrument instrument) {
    CompletableFuture<Boolean> yes = CompletableFuture.supplyAsync(() -> refreshSide(instrument.handles().yesHandle()), fetchPool);
    CompletableFuture<Boolean> no = CompletableFuture.supplyAsync(() -> refreshSide(instrument.handles().noHandle()), fetchPool);
    int refreshed = 0;
    if (yes.join()) {
      refreshed++;
    }
    if (no.join()) {
      refreshed++;
    }
    return refreshed;
  }

  private boolean refreshSide(String sideHandle) {
    BookSnapshot snapshot;
    try {
      snapshot = snapshots.fetchBook(sideHandle);
    } catch (FeedException e) {
      fetchFailures.incrementAndGet();
      log.debug("snapshot fetch failed tokenId={} error={}", suffix(sideHandle), e.toString());
      return false;
    } catch (RuntimeException e) {
      fetchFailures.incrementAndGet();
      log.warn("snapshot fetch error tokenId={} error={}", suffix(sideHandle), e.toString());
      return false;
    }
    books.replaceSnapshot(sideHandle, snapshot.bids(), snapshot.asks());
    if (registry.resolveSide(sideHandle).isEmpty()) {
      // instrument expired during the fetch
      books.forget(sideHandle);
      return false;
    }
    return true;
  }

  static String suffix(String tokenId) {
    if (tokenId == null) {
      return "null";
    }
    String t = tokenId.trim();
    if (t.length() <= 6) {
      return t;
    }
    return "..." + t.substring(t.length() - 6);
  }

  public long cycles() {
    return cycles.get();
  }

  public long fetchFailures() {
    return fetchFailures.get();
  }

  public long ticksWritten() {
    return ticksWritten.get();
  }

  public long lastCycleAtMillis() {
    return lastCycleAtMillis;
  }
}
