package com.polytick.collector.web;

import com.polytick.collector.config.CollectorProperties;
import com.polytick.collector.engine.CollectorEngine;
import com.polytick.collector.feed.DeltaStream;
import com.polytick.collector.feed.SnapshotPoller;
import com.polytick.core.market.InstrumentRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * UP while the collector runs and the snapshot poller keeps cycling. Delta stream state is a detail only.
 */
@Component
@RequiredArgsConstructor
public class CollectorHealthIndicator implements HealthIndicator {

  static final int STALE_CYCLE_FACTOR = 10;

  private final CollectorProperties properties;
  private final CollectorEngine engine;
  private final SnapshotPoller snapshotPoller;
  private final DeltaStream deltaStream;
  private final InstrumentRegistry registry;
  private final Clock clock;

  @Override
  public Health health() {
    long now = clock.millis();
    long staleAfterMillis = properties.snapshot().pollIntervalMillis() * STALE_CYCLE_FACTOR;
    long lastCycle = snapshotPoller.lastCycleAtMillis() > 0 ? snapshotPoller.lastCycleAtMillis() : engine.startedAtMillis();
    boolean pollerFresh = now - lastCycle <= staleAfterMillis;

    Health.Builder builder = engine.isRunning() && pollerFresh ? Health.up() : Health.down();
    return builder
        .withDetail("running", engine.isRunning())
        .withDetail("activeInstruments", registry.size())
        .withDetail("lastSnapshotCycleAtMillis", snapshotPoller.lastCycleAtMillis())
        .withDetail("snapshotStaleAfterMillis", staleAfterMillis)
        .withDetail("deltaStreamState", deltaStream.state().name())
        .withDetail("deltaStreamSubscribed", deltaStream.subscribedCount())
        .build();
  }
}
