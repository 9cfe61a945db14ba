package com.polytick.collector.discovery;

import com.polytick.collector.feed.SnapshotPoller;
import com.polytick.core.book.BestPrices;
import com.polytick.core.book.BookStore;
import com.polytick.core.feed.MarketLookup;
import com.polytick.core.market.Instrument;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.market.MarketWindow;
import com.polytick.core.market.SideHandles;
import com.polytick.core.market.WindowClass;
import com.polytick.core.tick.TickSource;
import com.polytick.core.tick.TickWriter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registers each new up/down window as it opens and retires instruments once their grace period has passed.
 *
 * The window already running when the collector starts is never registered: only windows observed from their
 * opening are recorded. That startup window is captured once per class by {@link #initialize(Instant)}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WindowDiscovery {

  private final @NonNull InstrumentRegistry registry;
  private final @NonNull MarketLookup lookup;
  private final @NonNull SnapshotPoller snapshotPoller;
  private final @NonNull BookStore books;
  private final @NonNull TickWriter tickWriter;
  private final @NonNull Clock clock;

  private final Map<WindowClass, String> startupWindowIds = new ConcurrentHashMap<>();

  private final AtomicLong cycles = new AtomicLong(0);
  private final AtomicLong registered = new AtomicLong(0);
  private final AtomicLong expired = new AtomicLong(0);
  private final AtomicLong lookupMisses = new AtomicLong(0);
  private final AtomicLong failures = new AtomicLong(0);

  public void initialize(Instant now) {
    for (WindowClass windowClass : WindowClass.values()) {
      MarketWindow current = registry.currentWindow(windowClass, now);
      if (startupWindowIds.putIfAbsent(windowClass, current.id()) == null) {
        long remaining = Duration.between(now, current.end()).toSeconds();
        log.info("[{}] current market {} already in progress, skipping; next starts in ~{}s",
            windowClass.code(), current.id(), remaining);
      }
    }
  }

  public Optional<String> startupWindowId(WindowClass windowClass) {
    return Optional.ofNullable(startupWindowIds.get(windowClass));
  }

  public void runCycle(WindowClass windowClass) {
    cycles.incrementAndGet();
    Instant now = Instant.now(clock);
    try {
      discover(windowClass, now);
    } catch (RuntimeException e) {
      failures.incrementAndGet();
      log.error("[{}] discovery error: {}", windowClass.code(), e.toString());
    }
    try {
      expireDue(windowClass, now);
    } catch (RuntimeException e) {
      failures.incrementAndGet();
      log.error("[{}] expiry error: {}", windowClass.code(), e.toString());
    }
  }

  private void discover(WindowClass windowClass, Instant now) {
    MarketWindow window = registry.currentWindow(windowClass, now);
    if (window.id().equals(startupWindowIds.get(windowClass))) {
      return;
    }
    if (registry.lookup(window.id()).isPresent()) {
      return;
    }

    Optional<SideHandles> handles = lookup.resolve(window.id());
    if (handles.isEmpty()) {
      lookupMisses.incrementAndGet();
      log.debug("[{}] market {} not listed yet", windowClass.code(), window.id());
      return;
    }

    Instrument instrument = Instrument.open(window, handles.get());
    if (!registry.register(instrument)) {
      return;
    }
    registered.incrementAndGet();

    snapshotPoller.refresh(instrument);
    tickWriter.writeTick(instrument.id(), TickSource.SNAPSHOT, true);

    BestPrices yes = books.bestPrices(instrument.handles().yesHandle());
    BestPrices no = books.bestPrices(instrument.handles().noHandle());
    log.info("=== NEW {} MARKET: {} === yes bid={} ask={} no bid={} ask={}",
        windowClass.code(), instrument.id(), yes.bestBid(), yes.bestAsk(), no.bestBid(), no.bestAsk());
  }

  private void expireDue(WindowClass windowClass, Instant now) {
    List<Instrument> retired = registry.expireDue(windowClass, now);
    for (Instrument instrument : retired) {
      for (String handle : instrument.handles().both()) {
        books.forget(handle);
      }
      tickWriter.forget(instrument.id());
      expired.incrementAndGet();
      log.info("=== RESOLVED [{}]: {} ===", windowClass.code(), instrument.id());
    }
  }

  public long cycles() {
    return cycles.get();
  }

  public long registered() {
    return registered.get();
  }

  public long expired() {
    return expired.get();
  }

  public long lookupMisses() {
    return lookupMisses.get();
  }

  public long failures() {
    return failures.get();
  }
}
