package com.polytick.collector.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.core.feed.MarketLookup;
import com.polytick.core.market.SideHandles;
import com.polytick.core.market.SideLabel;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;

/**
 * Resolves an up/down slug to its outcome token ids through the Gamma {@code /markets?slug=} endpoint.
 */
@Component
@Slf4j
public class GammaMarketLookupClient implements MarketLookup {

  private final @NonNull RestClient gamma;
  private final @NonNull ObjectMapper objectMapper;

  public GammaMarketLookupClient(
      @Qualifier("polymarketGammaApiRestClient") RestClient gamma,
      ObjectMapper objectMapper
  ) {
    this.gamma = gamma;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<SideHandles> resolve(String instrumentId) {
    if (instrumentId == null || instrumentId.isBlank()) {
      return Optional.empty();
    }
    try {
      String body = gamma.get()
          .uri(b -> b.path("/markets").queryParam("slug", instrumentId).build())
          .retrieve()
          .body(String.class);
      if (body == null || body.isBlank()) {
        return Optional.empty();
      }
      JsonNode root = objectMapper.readTree(body);
      if (!root.isArray() || root.isEmpty()) {
        return Optional.empty();
      }
      return parseHandles(root.get(0));
    } catch (Exception e) {
      log.debug("gamma lookup failed slug={} error={}", instrumentId, e.toString());
      return Optional.empty();
    }
  }

  Optional<SideHandles> parseHandles(JsonNode market) {
    String yes = null;
    String no = null;

    JsonNode tokens = market.path("tokens");
    if (tokens.isArray()) {
      for (JsonNode token : tokens) {
        SideLabel side = SideLabel.fromOutcome(JsonNodes.textOrNull(token.path("outcome")));
        String tokenId = JsonNodes.textOrNull(token.path("token_id"));
        if (side == SideLabel.YES && tokenId != null) {
          yes = tokenId;
        } else if (side == SideLabel.NO && tokenId != null) {
          no = tokenId;
        }
      }
    }

    if (yes == null || no == null) {
      List<String> tokenIds = JsonNodes.parseStringArray(objectMapper, market.path("clobTokenIds"));
      List<String> outcomes = JsonNodes.parseStringArray(objectMapper, market.path("outcomes"));
      if (tokenIds.size() >= 2 && outcomes.size() >= 2) {
        for (int i = 0; i < outcomes.size() && i < tokenIds.size(); i++) {
          SideLabel side = SideLabel.fromOutcome(outcomes.get(i));
          if (side == SideLabel.YES) {
            yes = tokenIds.get(i);
          } else if (side == SideLabel.NO) {
            no = tokenIds.get(i);
          }
        }
      }
    }

    if (yes == null || no == null || yes.equals(no)) {
      log.debug("gamma market has no up/down tokens slug={}", JsonNodes.textOrNull(market.path("slug")));
      return Optional.empty();
    }
    return Optional.of(new SideHandles(yes, no));
  }
}
