package com.polytick.collector.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.core.feed.BookSnapshot;
import com.polytick.core.feed.BookSnapshotSource;
import com.polytick.core.feed.FeedException;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Full order book snapshots from the CLOB {@code /book?token_id=} endpoint.
 */
@Component
public class ClobBookClient implements BookSnapshotSource {

  private final @NonNull RestClient clob;
  private final @NonNull ObjectMapper objectMapper;

  public ClobBookClient(
      @Qualifier("polymarketClobRestClient") RestClient clob,
      ObjectMapper objectMapper
  ) {
    this.clob = clob;
    this.objectMapper = objectMapper;
  }

  @Override
  public BookSnapshot fetchBook(String sideHandle) {
    String body;
    try {
      body = clob.get()
          .uri(b -> b.path("/book").queryParam("token_id", sideHandle).build())
          .retrieve()
          .body(String.class);
    } catch (RestClientException e) {
      throw new FeedException("clob book fetch failed tokenId=%s".formatted(sideHandle), e);
    }
    if (body == null || body.isBlank()) {
      throw new FeedException("clob book empty response tokenId=%s".formatted(sideHandle));
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (Exception e) {
      throw new FeedException("clob book unparsable tokenId=%s".formatted(sideHandle), e);
    }
    if (root == null || !root.isObject()) {
      throw new FeedException("clob book unexpected payload tokenId=%s".formatted(sideHandle));
    }
    JsonNode error = root.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      throw new FeedException("clob book error tokenId=%s error=%s".formatted(sideHandle, error.asText()));
    }

    try {
      return new BookSnapshot(
          JsonNodes.levels(JsonNodes.firstArray(root, "bids", "buys")),
          JsonNodes.levels(JsonNodes.firstArray(root, "asks", "sells"))
      );
    } catch (RuntimeException e) {
      throw new FeedException("clob book levels unreadable tokenId=%s".formatted(sideHandle), e);
    }
  }
}
