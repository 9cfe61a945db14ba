package com.polytick.collector.config;

import com.polytick.core.market.WindowClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "collector")
public record CollectorProperties(
    @NotNull Boolean enabled,
    String assetPrefix,
    List<String> windowClasses,
    @Valid Polymarket polymarket,
    @Valid Discovery discovery,
    @Valid Snapshot snapshot,
    @Valid DeltaStream deltaStream
) {

  public CollectorProperties {
    if (enabled == null) {
      enabled = true;
    }
    if (assetPrefix == null || assetPrefix.isBlank()) {
      assetPrefix = "btc";
    }
    windowClasses = sanitizeStringList(windowClasses);
    if (windowClasses.isEmpty()) {
      windowClasses = List.of(WindowClass.FIVE_MINUTES.code(), WindowClass.FIFTEEN_MINUTES.code());
    }
    if (polymarket == null) {
      polymarket = new Polymarket(null, null, null, null, null);
    }
    if (discovery == null) {
      discovery = new Discovery(null, null);
    }
    if (snapshot == null) {
      snapshot = new Snapshot(null, null);
    }
    if (deltaStream == null) {
      deltaStream = new DeltaStream(null, null, null, null);
    }
  }

  /**
   * Configured window classes in declaration order, duplicates removed.
   */
  public List<WindowClass> trackedWindowClasses() {
    LinkedHashSet<WindowClass> out = new LinkedHashSet<>();
    for (String code : windowClasses) {
      out.add(WindowClass.fromCode(code));
    }
    return List.copyOf(out);
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public record Polymarket(
      URI gammaApiBaseUrl,
      URI clobRestBaseUrl,
      String clobWsUrl,
      String userAgent,
      @Min(1) Integer readTimeoutSeconds
  ) {
    public Polymarket {
      if (gammaApiBaseUrl == null) {
        gammaApiBaseUrl = URI.create("https://gamma-api.polymarket.com");
      }
      if (clobRestBaseUrl == null) {
        clobRestBaseUrl = URI.create("https://clob.polymarket.com");
      }
      if (clobWsUrl == null || clobWsUrl.isBlank()) {
        clobWsUrl = "wss://ws-subscriptions-clob.polymarket.com";
      }
      if (userAgent == null || userAgent.isBlank()) {
        userAgent = "polytick-collector/0.1";
      }
      if (readTimeoutSeconds == null) {
        readTimeoutSeconds = 10;
      }
    }
  }

  public record Discovery(
      @Min(1) Integer intervalSeconds,
      @Min(0) Integer graceSeconds
  ) {
    public Discovery {
      if (intervalSeconds == null) {
        intervalSeconds = 3;
      }
      if (graceSeconds == null) {
        graceSeconds = 30;
      }
    }
  }

  public record Snapshot(
      @Min(1) Long pollIntervalMillis,
      /**
       * Concurrent book fetches. Both sides of an instrument are fetched in parallel, so keep this at 2 or more.
       */
      @Min(1) Integer fetchWorkers
  ) {
    public Snapshot {
      if (pollIntervalMillis == null) {
        pollIntervalMillis = 1_000L;
      }
      if (fetchWorkers == null) {
        fetchWorkers = 8;
      }
    }
  }

  public record DeltaStream(
      Boolean enabled,
      @Min(1) Long receiveTimeoutMillis,
      @Min(0) Long reconnectBackoffMillis,
      @Min(1) Integer pingIntervalSeconds
  ) {
    public DeltaStream {
      if (enabled == null) {
        enabled = true;
      }
      if (receiveTimeoutMillis == null) {
        receiveTimeoutMillis = 1_000L;
      }
      if (reconnectBackoffMillis == null) {
        reconnectBackoffMillis = 3_000L;
      }
      if (pingIntervalSeconds == null) {
        pingIntervalSeconds = 30;
      }
    }
  }
}
