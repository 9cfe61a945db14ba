package com.polytick.collector.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.collector.config.CollectorProperties;
import com.polytick.collector.polymarket.ClobMarketMessageParser;
import com.polytick.collector.support.FakeDeltaFeed;
import com.polytick.core.book.BookStore;
import com.polytick.core.market.Instrument;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.market.MarketWindow;
import com.polytick.core.market.SideHandles;
import com.polytick.core.market.WindowClass;
import com.polytick.core.store.MarketDataStore;
import com.polytick.core.tick.Tick;
import com.polytick.core.tick.TickSource;
import com.polytick.core.tick.TickWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeltaStreamTest {

  private static final Instant OPEN = Instant.ofEpochSecond(1_734_364_800L);

  @Mock
  private MarketDataStore store;

  @Mock
  private ClobMarketMessageParser mockParser;

  private CollectorProperties properties;

  private final FakeDeltaFeed feed = new FakeDeltaFeed();
  private final BookStore books = new BookStore();
  private InstrumentRegistry registry;
  private TickWriter tickWriter;
  private Instrument instrument;
  private DeltaStream stream;

  @BeforeEach
  void setUp() {
    properties = new CollectorProperties(true, null, null, null, null, null,
        new CollectorProperties.DeltaStream(true, 10L, 20L, 30));
    registry = new InstrumentRegistry("btc", Duration.ofSeconds(30), store);
    instrument = Instrument.open(MarketWindow.of("btc", WindowClass.FIVE_MINUTES, OPEN), new SideHandles("222", "111"));
    registry.register(instrument);
    tickWriter = new TickWriter(registry, books, store, Clock.fixed(OPEN.plusSeconds(5), ZoneOffset.UTC));
    stream = new DeltaStream(properties, feed, new ClobMarketMessageParser(new ObjectMapper()), registry, books, tickWriter);
  }

  @Test
  void connectsThenSubscribesEveryActiveSideInOrder() {
    assertEquals(DeltaStream.State.STOPPED, stream.state());

    stream.step(() -> true);
    assertEquals(DeltaStream.State.ACTIVE, stream.state());
    assertEquals(1, stream.connects());

    stream.step(() -> true);
    assertEquals(List.of("111", "222"), feed.current().subscriptions());
    assertEquals(2, stream.subscribedCount());

    stream.step(() -> true);
    assertEquals(2, feed.current().subscriptions().size());
  }

  @Test
  void deltaForTrackedSideUpdatesBookAndWritesTick() {
    connectAndSubscribe();
    feed.push("""
        {"event_type":"price_change","price_changes":[{"asset_id":"222","price":"0.51","size":"5","side":"BUY"}]}
        """);

    stream.step(() -> true);

    assertEquals(0, new BigDecimal("0.51").compareTo(books.bestPrices("222").bestBid()));
    assertEquals(1, stream.deltasApplied());
    assertEquals(1, stream.ticksWritten());
    ArgumentCaptor<Tick> captor = ArgumentCaptor.forClass(Tick.class);
    verify(store).appendTick(captor.capture());
    assertEquals(TickSource.DELTA, captor.getValue().source());
  }

  @Test
  void unknownHandlesAreDropped() {
    connectAndSubscribe();
    feed.push("""
        {"price_changes":[{"asset_id":"999","price":"0.51","size":"5","side":"BUY"}]}
        """);

    stream.step(() -> true);

    assertEquals(1, stream.unknownHandleDrops());
    assertFalse(books.contains("999"));
    verify(store, never()).appendTick(any());
  }

  @Test
  void malformedMessageIsSkipped() {
    connectAndSubscribe();
    feed.push("{not json");

    stream.step(() -> true);

    assertEquals(1, stream.malformedMessages());
    assertEquals(DeltaStream.State.ACTIVE, stream.state());
  }

  @Test
  void outOfRangePriceIsIgnoredAndLaterDeltasStillApply() {
    connectAndSubscribe();
    feed.push("""
        {"price_changes":[{"asset_id":"222","price":"1E+2147483647","size":"5","side":"BUY"}]}
        """);
    feed.push("""
        {"price_changes":[{"asset_id":"222","price":"0.51","size":"5","side":"BUY"}]}
        """);

    stream.step(() -> true);
    stream.step(() -> true);

    assertEquals(DeltaStream.State.ACTIVE, stream.state());
    assertEquals(1, stream.deltasApplied());
    assertEquals(0, new BigDecimal("0.51").compareTo(books.bestPrices("222").bestBid()));
    assertNull(books.bestPrices("222").bestAsk());
  }

  @Test
  void unexpectedErrorWhileHandlingAMessageSkipsOnlyThatMessage() {
    stream = new DeltaStream(properties, feed, mockParser, registry, books, tickWriter);
    when(mockParser.parse("boom")).thenThrow(new ArithmeticException("Overflow"));
    connectAndSubscribe();
    feed.push("boom");

    stream.step(() -> true);

    assertEquals(1, stream.malformedMessages());
    assertEquals(DeltaStream.State.ACTIVE, stream.state());
    verify(store, never()).appendTick(any());
  }

  @Test
  void unexpectedReceiveErrorBacksOffInsteadOfEndingTheLoop() {
    connectAndSubscribe();
    FakeDeltaFeed.Session first = feed.current();
    feed.failNextReceive(new IllegalStateException("socket state"));

    stream.step(() -> true);
    assertEquals(DeltaStream.State.BACKOFF, stream.state());

    stream.step(() -> true);
    stream.step(() -> true);
    assertTrue(first.isClosed());
    assertEquals(DeltaStream.State.ACTIVE, stream.state());
    assertEquals(2, stream.connects());
  }

  @Test
  void disconnectBacksOffAndResubscribesFromScratch() {
    connectAndSubscribe();
    FakeDeltaFeed.Session first = feed.current();
    feed.disconnect();

    stream.step(() -> true);
    assertEquals(DeltaStream.State.BACKOFF, stream.state());
    assertEquals(1, stream.disconnects());

    stream.step(() -> true);
    assertEquals(DeltaStream.State.CONNECTING, stream.state());
    assertTrue(first.isClosed());
    assertEquals(0, stream.subscribedCount());

    stream.step(() -> true);
    stream.step(() -> true);
    assertEquals(2, feed.sessions().size());
    assertEquals(List.of("111", "222"), feed.current().subscriptions());
    assertEquals(2, stream.connects());
  }

  @Test
  void connectFailureBacksOff() {
    feed.failNextConnects(1);

    stream.step(() -> true);

    assertEquals(DeltaStream.State.BACKOFF, stream.state());
    assertEquals(0, stream.connects());
  }

  @Test
  void expiredInstrumentsDropOutOfTheSubscriptionSet() {
    connectAndSubscribe();
    registry.expire(instrument.id());

    stream.step(() -> true);

    assertEquals(0, stream.subscribedCount());
  }

  @Test
  void runStopsWhenTheFlagClears() {
    AtomicInteger checks = new AtomicInteger();

    stream.run(() -> checks.incrementAndGet() < 5);

    assertEquals(DeltaStream.State.STOPPED, stream.state());
    assertTrue(feed.current().isClosed());
  }

  private void connectAndSubscribe() {
    stream.step(() -> true);
    stream.step(() -> true);
  }
}
