package com.polytick.collector.feed;

import com.polytick.collector.config.CollectorProperties;
import com.polytick.core.book.BookStore;
import com.polytick.core.book.PriceLevel;
import com.polytick.core.feed.BookSnapshot;
import com.polytick.core.feed.FeedException;
import com.polytick.core.market.Instrument;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.market.MarketWindow;
import com.polytick.core.market.SideHandles;
import com.polytick.core.market.WindowClass;
import com.polytick.core.store.MarketDataStore;
import com.polytick.core.tick.TickWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SnapshotPollerTest {

  private static final Instant OPEN = Instant.ofEpochSecond(1_734_364_800L);

  @Mock
  private MarketDataStore store;

  private final Map<String, BookSnapshot> published = new ConcurrentHashMap<>();
  private final Set<String> broken = ConcurrentHashMap.newKeySet();
  private final BookStore books = new BookStore();
  private InstrumentRegistry registry;
  private Instrument instrument;
  private SnapshotPoller poller;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(OPEN.plusSeconds(20), ZoneOffset.UTC);
    CollectorProperties properties = new CollectorProperties(true, null, null, null, null,
        new CollectorProperties.Snapshot(1_000L, 4), null);
    registry = new InstrumentRegistry("btc", Duration.ofSeconds(30), store);
    instrument = Instrument.open(MarketWindow.of("btc", WindowClass.FIVE_MINUTES, OPEN), new SideHandles("111", "222"));
    registry.register(instrument);
    TickWriter tickWriter = new TickWriter(registry, books, store, clock);
    poller = new SnapshotPoller(properties, registry, books, this::fetch, tickWriter, clock);
    poller.init();
  }

  @AfterEach
  void tearDown() {
    poller.shutdown();
  }

  @Test
  void pollInstallsBothBooksAndWritesOneTick() {
    publish("111", "0.50", "0.52");
    publish("222", "0.46", "0.48");

    poller.pollOnce();

    assertEquals(0, new BigDecimal("0.50").compareTo(books.bestPrices("111").bestBid()));
    assertEquals(0, new BigDecimal("0.48").compareTo(books.bestPrices("222").bestAsk()));
    verify(store).appendTick(any());
    assertEquals(1, poller.ticksWritten());
    assertEquals(1, poller.cycles());
    assertEquals(OPEN.plusSeconds(20).toEpochMilli(), poller.lastCycleAtMillis());
  }

  @Test
  void identicalSnapshotsAreDeduplicated() {
    publish("111", "0.50", "0.52");
    publish("222", "0.46", "0.48");

    poller.pollOnce();
    poller.pollOnce();
    verify(store, times(1)).appendTick(any());

    publish("111", "0.49", "0.52");
    poller.pollOnce();
    verify(store, times(2)).appendTick(any());
  }

  @Test
  void failedSideLeavesItsBookAndRefreshesTheOther() {
    publish("111", "0.50", "0.52");
    publish("222", "0.46", "0.48");
    poller.pollOnce();

    published.remove("222");
    publish("111", "0.40", "0.60");

    assertEquals(1, poller.refresh(instrument));
    assertEquals(1, poller.fetchFailures());
    assertEquals(0, new BigDecimal("0.40").compareTo(books.bestPrices("111").bestBid()));
    assertEquals(0, new BigDecimal("0.46").compareTo(books.bestPrices("222").bestBid()));
  }

  @Test
  void unexpectedFetchErrorOnOneInstrumentDoesNotAbortTheCycle() {
    Instrument other = Instrument.open(MarketWindow.of("btc", WindowClass.FIFTEEN_MINUTES, OPEN), new SideHandles("333", "444"));
    registry.register(other);
    broken.add("333");
    publish("444", "0.46", "0.48");
    publish("111", "0.50", "0.52");
    publish("222", "0.46", "0.48");

    poller.pollOnce();

    assertEquals(1, poller.cycles());
    assertEquals(1, poller.fetchFailures());
    assertEquals(0, new BigDecimal("0.50").compareTo(books.bestPrices("111").bestBid()));
    assertEquals(0, new BigDecimal("0.48").compareTo(books.bestPrices("222").bestAsk()));
    assertFalse(books.contains("333"));
  }

  @Test
  void refreshOfRetiredInstrumentLeavesNoBooks() {
    publish("111", "0.50", "0.52");
    publish("222", "0.46", "0.48");
    registry.expire(instrument.id());

    assertEquals(0, poller.refresh(instrument));
    assertFalse(books.contains("111"));
    assertFalse(books.contains("222"));
  }

  @Test
  void tokenSuffixKeepsTheLastSixCharacters() {
    assertEquals("...456789", SnapshotPoller.suffix("123456789"));
    assertEquals("12345", SnapshotPoller.suffix("12345"));
    assertTrue(SnapshotPoller.suffix(null).equals("null"));
  }

  private BookSnapshot fetch(String handle) {
    BookSnapshot snapshot = published.get(handle);
    if (broken.contains(handle)) {
      throw new IllegalStateException("unreadable book for " + handle);
    }
    if (snapshot == null) {
      throw new FeedException("no book for " + handle);
    }
    return snapshot;
  }

  private void publish(String handle, String bid, String ask) {
    published.put(handle, new BookSnapshot(List.of(PriceLevel.of(bid, "10")), List.of(PriceLevel.of(ask, "10"))));
  }
}
