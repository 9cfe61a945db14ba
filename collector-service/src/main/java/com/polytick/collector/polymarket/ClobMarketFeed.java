package com.polytick.collector.polymarket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.collector.config.CollectorProperties;
import com.polytick.collector.feed.DeltaFeed;
import com.polytick.collector.feed.DeltaFeedSession;
import com.polytick.core.feed.FeedDisconnectedException;
import com.polytick.core.feed.FeedException;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLOB market channel over {@link java.net.http.WebSocket}. Each {@link #open()} builds a new socket; inbound text
 * frames are reassembled and queued for the consumer thread.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClobMarketFeed implements DeltaFeed {

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(5);

  private final @NonNull CollectorProperties properties;
  private final @NonNull HttpClient httpClient;
  private final @NonNull ObjectMapper objectMapper;

  private final ScheduledExecutorService pingExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "clob-ws-ping");
    t.setDaemon(true);
    return t;
  });

  static URI buildMarketWsUri(String baseWsUrl) {
    String base = baseWsUrl.endsWith("/") ? baseWsUrl.substring(0, baseWsUrl.length() - 1) : baseWsUrl;
    return URI.create(base + "/ws/market");
  }

  @Override
  public DeltaFeedSession open() {
    URI wsUri = buildMarketWsUri(properties.polymarket().clobWsUrl());
    log.info("Connecting to CLOB market websocket: {}", wsUri);

    Session session = new Session();
    WebSocket ws;
    try {
      ws = httpClient.newWebSocketBuilder()
          .connectTimeout(CONNECT_TIMEOUT)
          .buildAsync(wsUri, session.listener)
          .get(CONNECT_TIMEOUT.toMillis() + 5_000L, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FeedException("market ws connect interrupted", e);
    } catch (ExecutionException | TimeoutException e) {
      throw new FeedException("market ws connect failed uri=%s".formatted(wsUri), e);
    }
    session.attach(ws, properties.deltaStream().pingIntervalSeconds());
    log.info("CLOB market websocket connected");
    return session;
  }

  @PreDestroy
  void shutdown() {
    pingExecutor.shutdownNow();
  }

  String buildSubscribeMessage(String sideHandle) {
    Map<String, Object> msg = new LinkedHashMap<>();
    msg.put("auth", Map.of());
    msg.put("type", "subscribe");
    msg.put("channel", "market");
    msg.put("assets_ids", List.of(sideHandle));
    try {
      return objectMapper.writeValueAsString(msg);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build market ws subscribe message", e);
    }
  }

  private final class Session implements DeltaFeedSession {

    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final Listener listener = new Listener();

    private volatile WebSocket webSocket;
    private volatile ScheduledFuture<?> pingTask;
    private volatile boolean closed;
    private volatile String closeReason = "not connected";

    private void attach(WebSocket ws, int pingIntervalSeconds) {
      this.webSocket = ws;
      this.pingTask = pingExecutor.scheduleAtFixedRate(this::ping, pingIntervalSeconds, pingIntervalSeconds, TimeUnit.SECONDS);
    }

    private void ping() {
      WebSocket ws = this.webSocket;
      if (ws == null || closed) {
        return;
      }
      try {
        ws.sendPing(ByteBuffer.wrap(new byte[]{1}));
      } catch (Exception e) {
        log.debug("market ws ping failed: {}", e.toString());
      }
    }

    @Override
    public void subscribe(String sideHandle) {
      WebSocket ws = this.webSocket;
      if (ws == null || closed) {
        throw new FeedDisconnectedException("market ws closed: " + closeReason);
      }
      try {
        ws.sendText(buildSubscribeMessage(sideHandle), true).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FeedDisconnectedException("market ws subscribe interrupted", e);
      } catch (ExecutionException | TimeoutException e) {
        markClosed("send failed: " + e);
        throw new FeedDisconnectedException("market ws subscribe failed tokenId=%s".formatted(sideHandle), e);
      }
    }

    @Override
    public String receive(Duration timeout) throws InterruptedException {
      String message = inbound.poll();
      if (message != null) {
        return message;
      }
      if (closed) {
        throw new FeedDisconnectedException("market ws closed: " + closeReason);
      }
      message = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (message == null && closed && inbound.isEmpty()) {
        throw new FeedDisconnectedException("market ws closed: " + closeReason);
      }
      return message;
    }

    @Override
    public void close() {
      markClosed("closed locally");
      ScheduledFuture<?> task = this.pingTask;
      if (task != null) {
        task.cancel(false);
      }
      WebSocket ws = this.webSocket;
      this.webSocket = null;
      if (ws == null) {
        return;
      }
      try {
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "reconnect").get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        ws.abort();
      } catch (Exception e) {
        log.debug("market ws close failed, aborting: {}", e.toString());
        ws.abort();
      }
    }

    private void markClosed(String reason) {
      if (!closed) {
        closeReason = reason;
        closed = true;
      }
    }

    private final class Listener implements WebSocket.Listener {
      private final StringBuilder buf = new StringBuilder(8192);

      @Override
      public void onOpen(WebSocket webSocket) {
        log.info("CLOB market websocket opened");
        webSocket.request(1);
      }

      @Override
      public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        buf.append(data);
        if (last) {
          inbound.offer(buf.toString());
          buf.setLength(0);
        }
        webSocket.request(1);
        return null;
      }

      @Override
      public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
        webSocket.request(1);
        return null;
      }

      @Override
      public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        log.warn("CLOB market websocket closed (status={}, reason={})", statusCode, reason);
        markClosed("remote close status=%d reason=%s".formatted(statusCode, reason));
        return null;
      }

      @Override
      public void onError(WebSocket webSocket, Throwable error) {
        log.warn("CLOB market websocket error: {}", error.toString());
        markClosed("error " + error);
      }
    }
  }
}
