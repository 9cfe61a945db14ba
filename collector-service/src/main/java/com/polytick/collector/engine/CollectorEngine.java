package com.polytick.collector.engine;

import com.polytick.collector.config.CollectorProperties;
import com.polytick.collector.discovery.WindowDiscovery;
import com.polytick.collector.feed.DeltaStream;
import com.polytick.collector.feed.SnapshotPoller;
import com.polytick.core.market.WindowClass;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Starts and stops the collector loops around one running flag: a discovery loop per window class and the snapshot
 * poller on the collector scheduler, the delta stream on its own thread. Loops observe the flag at their next
 * sleep or receive-timeout boundary.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollectorEngine {

  private final @NonNull CollectorProperties properties;
  private final @NonNull WindowDiscovery discovery;
  private final @NonNull SnapshotPoller snapshotPoller;
  private final @NonNull DeltaStream deltaStream;
  private final @NonNull TaskScheduler collectorTaskScheduler;
  private final @NonNull Clock clock;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final List<ScheduledFuture<?>> tasks = new CopyOnWriteArrayList<>();
  private final AtomicLong cycleFailures = new AtomicLong(0);
  private volatile Thread deltaThread;
  private volatile long startedAtMillis;

  @PostConstruct
  void startIfEnabled() {
    if (!properties.enabled()) {
      log.info("collector is disabled");
      return;
    }
    start();
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    Instant now = Instant.now(clock);
    startedAtMillis = now.toEpochMilli();
    discovery.initialize(now);

    List<WindowClass> windowClasses = properties.trackedWindowClasses();
    Duration discoveryInterval = Duration.ofSeconds(properties.discovery().intervalSeconds());
    for (WindowClass windowClass : windowClasses) {
      tasks.add(collectorTaskScheduler.scheduleWithFixedDelay(
          () -> runSafely("discovery-" + windowClass.code(), () -> discovery.runCycle(windowClass)),
          discoveryInterval));
    }

    Duration pollInterval = Duration.ofMillis(properties.snapshot().pollIntervalMillis());
    tasks.add(collectorTaskScheduler.scheduleWithFixedDelay(
        () -> runSafely("snapshot-poll", snapshotPoller::pollOnce),
        now.plus(pollInterval),
        pollInterval));

    if (properties.deltaStream().enabled()) {
      Thread t = new Thread(() -> deltaStream.run(running::get), "delta-stream");
      t.setDaemon(true);
      deltaThread = t;
      t.start();
    }

    log.info("collector started (windowClasses={}, discoveryIntervalSeconds={}, pollIntervalMillis={}, deltaStream={})",
        windowClasses.stream().map(WindowClass::code).toList(),
        discoveryInterval.toSeconds(),
        pollInterval.toMillis(),
        properties.deltaStream().enabled());
  }

  @PreDestroy
  public synchronized void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    log.info("collector stopping");
    for (ScheduledFuture<?> task : tasks) {
      task.cancel(false);
    }
    tasks.clear();

    Thread t = deltaThread;
    deltaThread = null;
    if (t != null) {
      long waitMillis = properties.deltaStream().receiveTimeoutMillis() + 2_000L;
      try {
        t.join(waitMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (t.isAlive()) {
        log.warn("delta stream did not stop within {}ms, interrupting", waitMillis);
        t.interrupt();
      }
    }
  }

  void runSafely(String loop, Runnable cycle) {
    if (!running.get()) {
      return;
    }
    try {
      cycle.run();
    } catch (Exception e) {
      cycleFailures.incrementAndGet();
      log.error("{} cycle failed: {}", loop, e.getMessage(), e);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public long cycleFailures() {
    return cycleFailures.get();
  }

  public long startedAtMillis() {
    return startedAtMillis;
  }
}
