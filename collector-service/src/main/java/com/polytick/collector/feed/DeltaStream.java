package com.polytick.collector.feed;

import com.polytick.collector.config.CollectorProperties;
import com.polytick.collector.polymarket.ClobMarketMessageParser;
import com.polytick.core.book.BookStore;
import com.polytick.core.feed.FeedDisconnectedException;
import com.polytick.core.feed.FeedException;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.market.SideRef;
import com.polytick.core.tick.TickSource;
import com.polytick.core.tick.TickWriter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Best-effort incremental book updates from the market websocket.
 *
 * Runs as a small state machine on one thread: CONNECTING opens a session, ACTIVE keeps the subscription set in line
 * with the registry and drains messages with a short receive timeout, BACKOFF drops the session and waits a fixed
 * delay before reconnecting. Subscriptions never survive a reconnect.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeltaStream {

  public enum State {
    STOPPED,
    CONNECTING,
    ACTIVE,
    BACKOFF
  }

  private final @NonNull CollectorProperties properties;
  private final @NonNull DeltaFeed feed;
  private final @NonNull ClobMarketMessageParser parser;
  private final @NonNull InstrumentRegistry registry;
  private final @NonNull BookStore books;
  private final @NonNull TickWriter tickWriter;

  private final Set<String> subscribed = new HashSet<>();

  private final AtomicLong connects = new AtomicLong(0);
  private final AtomicLong disconnects = new AtomicLong(0);
  private final AtomicLong messages = new AtomicLong(0);
  private final AtomicLong malformedMessages = new AtomicLong(0);
  private final AtomicLong deltasApplied = new AtomicLong(0);
  private final AtomicLong unknownHandleDrops = new AtomicLong(0);
  private final AtomicLong ticksWritten = new AtomicLong(0);

  private volatile State state = State.STOPPED;
  private volatile int subscribedCount;
  private DeltaFeedSession session;

  public void run(BooleanSupplier running) {
    log.info("delta stream started (receiveTimeoutMillis={}, reconnectBackoffMillis={})",
        properties.deltaStream().receiveTimeoutMillis(), properties.deltaStream().reconnectBackoffMillis());
    state = State.CONNECTING;
    try {
      while (running.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
        step(running);
      }
    } finally {
      dropSession();
      state = State.STOPPED;
      log.info("delta stream stopped");
    }
  }

  /**
   * Runs one transition of the state machine. {@link #run(BooleanSupplier)} calls this until the flag clears.
   */
  public void step(BooleanSupplier running) {
    switch (state) {
      case STOPPED, CONNECTING -> connect();
      case ACTIVE -> receiveOnce();
      case BACKOFF -> backoff(running);
    }
  }

  private void connect() {
    state = State.CONNECTING;
    try {
      session = feed.open();
    } catch (RuntimeException e) {
      log.warn("delta stream connect failed: {}", e.toString());
      state = State.BACKOFF;
      return;
    }
    subscribed.clear();
    subscribedCount = 0;
    connects.incrementAndGet();
    state = State.ACTIVE;
  }

  private void receiveOnce() {
    try {
      syncSubscriptions();
      String message = session.receive(Duration.ofMillis(properties.deltaStream().receiveTimeoutMillis()));
      if (message != null) {
        handleMessage(message);
      }
    } catch (FeedDisconnectedException e) {
      disconnects.incrementAndGet();
      log.warn("delta stream disconnected: {}", e.getMessage());
      state = State.BACKOFF;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      disconnects.incrementAndGet();
      log.error("delta stream session failed, reconnecting: {}", e.toString(), e);
      state = State.BACKOFF;
    }
  }

  private void syncSubscriptions() {
    Set<String> current = registry.activeSideHandles();
    subscribed.retainAll(current);
    List<String> fresh = current.stream().filter(h -> !subscribed.contains(h)).sorted().toList();
    for (String handle : fresh) {
      session.subscribe(handle);
      subscribed.add(handle);
      Optional<SideRef> ref = registry.resolveSide(handle);
      log.info("WS subscribed side={} id={} tokenId={}",
          ref.map(r -> r.side().name()).orElse("?"), ref.map(SideRef::instrumentId).orElse("?"), SnapshotPoller.suffix(handle));
    }
    subscribedCount = subscribed.size();
  }

  void handleMessage(String message) {
    messages.incrementAndGet();
    try {
      apply(parser.parse(message));
    } catch (FeedException e) {
      malformedMessages.incrementAndGet();
      log.debug("delta stream skipped malformed message: {}", e.toString());
    } catch (RuntimeException e) {
      malformedMessages.incrementAndGet();
      log.warn("delta stream skipped unprocessable message: {}", e.toString());
    }
  }

  private void apply(List<SideDelta> deltas) {
    for (SideDelta delta : deltas) {
      Optional<SideRef> ref = registry.resolveSide(delta.sideHandle());
      if (ref.isEmpty()) {
        unknownHandleDrops.incrementAndGet();
        continue;
      }
      books.applyDelta(delta.sideHandle(), delta.bids(), delta.asks());
      if (registry.resolveSide(delta.sideHandle()).isEmpty()) {
        books.forget(delta.sideHandle());
        unknownHandleDrops.incrementAndGet();
        continue;
      }
      deltasApplied.incrementAndGet();
      if (tickWriter.writeTick(ref.get().instrumentId(), TickSource.DELTA)) {
        ticksWritten.incrementAndGet();
      }
    }
  }

  private void backoff(BooleanSupplier running) {
    dropSession();
    long backoffMillis = properties.deltaStream().reconnectBackoffMillis();
    log.info("delta stream reconnecting in {}ms", backoffMillis);
    long sliceMillis = Math.max(1L, properties.deltaStream().receiveTimeoutMillis());
    long deadline = System.currentTimeMillis() + backoffMillis;
    try {
      long remaining;
      while (running.getAsBoolean() && (remaining = deadline - System.currentTimeMillis()) > 0) {
        Thread.sleep(Math.min(remaining, sliceMillis));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return;
    }
    state = State.CONNECTING;
  }

  private void dropSession() {
    DeltaFeedSession s = session;
    session = null;
    subscribed.clear();
    subscribedCount = 0;
    if (s != null) {
      s.close();
    }
  }

  public State state() {
    return state;
  }

  public int subscribedCount() {
    return subscribedCount;
  }

  public long connects() {
    return connects.get();
  }

  public long disconnects() {
    return disconnects.get();
  }

  public long messages() {
    return messages.get();
  }

  public long malformedMessages() {
    return malformedMessages.get();
  }

  public long deltasApplied() {
    return deltasApplied.get();
  }

  public long unknownHandleDrops() {
    return unknownHandleDrops.get();
  }

  public long ticksWritten() {
    return ticksWritten.get();
  }
}
