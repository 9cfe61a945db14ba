package com.polytick.collector.web;

import com.polytick.collector.config.CollectorProperties;
import com.polytick.collector.discovery.WindowDiscovery;
import com.polytick.collector.engine.CollectorEngine;
import com.polytick.collector.feed.DeltaStream;
import com.polytick.collector.feed.SnapshotPoller;
import com.polytick.core.book.BookStore;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.market.WindowClass;
import com.polytick.core.store.MarketDataStore;
import com.polytick.core.store.MarketStats;
import com.polytick.core.tick.TickSource;
import com.polytick.core.tick.TickWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/collector")
@RequiredArgsConstructor
@Slf4j
public class CollectorController {

  private final Environment env;
  private final CollectorProperties properties;
  private final CollectorEngine engine;
  private final WindowDiscovery discovery;
  private final SnapshotPoller snapshotPoller;
  private final DeltaStream deltaStream;
  private final InstrumentRegistry registry;
  private final BookStore books;
  private final TickWriter tickWriter;
  private final MarketDataStore store;

  @GetMapping("/status")
  public Status status() {
    return new Status(
        env.getProperty("spring.application.name"),
        engine.isRunning(),
        engine.startedAtMillis(),
        engine.cycleFailures(),
        properties.assetPrefix(),
        properties.trackedWindowClasses().stream().map(WindowClass::code).toList(),
        properties.polymarket().gammaApiBaseUrl().toString(),
        properties.polymarket().clobRestBaseUrl().toString(),
        properties.polymarket().clobWsUrl(),
        properties.discovery().intervalSeconds(),
        properties.discovery().graceSeconds(),
        properties.snapshot().pollIntervalMillis(),
        properties.deltaStream().enabled(),
        registry.size(),
        books.size(),
        discovery.cycles(),
        discovery.registered(),
        discovery.expired(),
        discovery.lookupMisses(),
        discovery.failures(),
        snapshotPoller.cycles(),
        snapshotPoller.fetchFailures(),
        snapshotPoller.ticksWritten(),
        snapshotPoller.lastCycleAtMillis(),
        deltaStream.state().name(),
        deltaStream.subscribedCount(),
        deltaStream.connects(),
        deltaStream.disconnects(),
        deltaStream.messages(),
        deltaStream.malformedMessages(),
        deltaStream.deltasApplied(),
        deltaStream.unknownHandleDrops(),
        tickWriter.ticksWritten(TickSource.SNAPSHOT),
        tickWriter.ticksWritten(TickSource.DELTA),
        tickWriter.skippedDuplicates(),
        tickWriter.writeFailures()
    );
  }

  @GetMapping("/stats")
  public MarketStats stats(@RequestParam(name = "windowClass", defaultValue = "5m") String windowClass) {
    return store.stats(WindowClass.fromCode(windowClass));
  }

  @DeleteMapping("/markets/{id}")
  public ResponseEntity<Void> deleteMarket(@PathVariable("id") String id) {
    if (registry.lookup(id).isPresent()) {
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
    if (!store.deleteInstrument(id)) {
      return ResponseEntity.notFound().build();
    }
    log.info("deleted market {} and its ticks", id);
    return ResponseEntity.noContent().build();
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
  }

  public record Status(
      String app,
      boolean running,
      long startedAtMillis,
      long cycleFailures,
      String assetPrefix,
      List<String> windowClasses,
      String gammaApiBaseUrl,
      String clobRestBaseUrl,
      String clobWsUrl,
      int discoveryIntervalSeconds,
      int graceSeconds,
      long pollIntervalMillis,
      boolean deltaStreamEnabled,
      int activeInstruments,
      int trackedBooks,
      long discoveryCycles,
      long instrumentsRegistered,
      long instrumentsExpired,
      long lookupMisses,
      long discoveryFailures,
      long snapshotCycles,
      long snapshotFetchFailures,
      long snapshotTicksWritten,
      long lastSnapshotCycleAtMillis,
      String deltaStreamState,
      int deltaStreamSubscribed,
      long deltaStreamConnects,
      long deltaStreamDisconnects,
      long deltaStreamMessages,
      long deltaStreamMalformedMessages,
      long deltasApplied,
      long unknownHandleDrops,
      long ticksWrittenSnapshot,
      long ticksWrittenDelta,
      long skippedDuplicates,
      long tickWriteFailures
  ) {
  }
}
