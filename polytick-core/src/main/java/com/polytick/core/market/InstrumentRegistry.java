package com.polytick.core.market;

import com.polytick.core.store.MarketDataStore;
import com.polytick.core.store.StoreWriteException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Instruments currently tracked, plus the side handle reverse mapping used to demultiplex feed updates.
 *
 * Reads are lock-free. Registration and expiry are serialized on {@code lock}, and the reverse mapping is removed
 * before the instrument itself so a side handle never resolves to an instrument that has already been retired.
 */
@Slf4j
public final class InstrumentRegistry {

  private final String assetPrefix;
  private final Duration grace;
  private final MarketDataStore store;

  private final Object lock = new Object();
  private final Map<String, Instrument> instruments = new ConcurrentHashMap<>();
  private final Map<String, SideRef> sides = new ConcurrentHashMap<>();

  public InstrumentRegistry(@NonNull String assetPrefix, @NonNull Duration grace, @NonNull MarketDataStore store) {
    if (assetPrefix.isBlank()) {
      throw new IllegalArgumentException("assetPrefix must not be blank");
    }
    if (grace.isNegative()) {
      throw new IllegalArgumentException("grace must be >= 0");
    }
    this.assetPrefix = assetPrefix.trim();
    this.grace = grace;
    this.store = store;
  }

  public MarketWindow currentWindow(WindowClass windowClass, Instant now) {
    return MarketWindow.of(assetPrefix, windowClass, now);
  }

  /**
   * Persists and starts tracking {@code instrument}. A no-op if the id is already tracked.
   *
   * @return true if the instrument was newly registered
   * @throws StoreWriteException if the instrument row could not be saved; nothing is registered in that case
   */
  public boolean register(Instrument instrument) {
    synchronized (lock) {
      if (instruments.containsKey(instrument.id())) {
        return false;
      }
      for (String handle : instrument.handles().both()) {
        SideRef existing = sides.get(handle);
        if (existing != null) {
          throw new IllegalStateException("side handle %s already belongs to %s".formatted(handle, existing.instrumentId()));
        }
      }
      store.saveInstrument(instrument);
      sides.put(instrument.handles().yesHandle(), new SideRef(instrument.id(), SideLabel.YES));
      sides.put(instrument.handles().noHandle(), new SideRef(instrument.id(), SideLabel.NO));
      instruments.put(instrument.id(), instrument);
      return true;
    }
  }

  public Optional<Instrument> lookup(String instrumentId) {
    if (instrumentId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(instruments.get(instrumentId));
  }

  public Optional<SideRef> resolveSide(String sideHandle) {
    if (sideHandle == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sides.get(sideHandle));
  }

  public List<Instrument> activeInstruments(WindowClass windowClass) {
    return instruments.values().stream()
        .filter(i -> i.windowClass() == windowClass)
        .sorted(Comparator.comparing(Instrument::openAt))
        .toList();
  }

  public List<Instrument> activeInstruments() {
    return instruments.values().stream()
        .sorted(Comparator.comparing(Instrument::openAt).thenComparing(Instrument::id))
        .toList();
  }

  public Set<String> activeSideHandles() {
    return Set.copyOf(sides.keySet());
  }

  public int size() {
    return instruments.size();
  }

  public boolean isExpirable(Instrument instrument, Instant now) {
    return now.isAfter(instrument.closeAt().plus(grace));
  }

  /**
   * Stops tracking the instrument and marks it resolved in the store. A failed resolution write is logged; the
   * instrument stays retired in memory.
   */
  public Optional<Instrument> expire(String instrumentId) {
    Instrument removed;
    synchronized (lock) {
      removed = instruments.get(instrumentId);
      if (removed == null) {
        return Optional.empty();
      }
      for (String handle : removed.handles().both()) {
        sides.remove(handle);
      }
      instruments.remove(instrumentId);
    }
    try {
      store.markResolved(instrumentId);
    } catch (StoreWriteException e) {
      log.warn("registry mark-resolved failed id={} error={}", instrumentId, e.toString());
    }
    return Optional.of(removed.asResolved());
  }

  public List<Instrument> expireDue(WindowClass windowClass, Instant now) {
    List<Instrument> expired = new ArrayList<>();
    for (Instrument instrument : activeInstruments(windowClass)) {
      if (isExpirable(instrument, now)) {
        expire(instrument.id()).ifPresent(expired::add);
      }
    }
    return expired;
  }
}
