package com.polytick.collector.polymarket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.collector.feed.SideDelta;
import com.polytick.core.book.PriceLevel;
import com.polytick.core.feed.FeedException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClobMarketMessageParserTest {

  private final ClobMarketMessageParser parser = new ClobMarketMessageParser(new ObjectMapper());

  @Test
  void priceChangesSplitIntoBidAndAskDeltasPerHandle() {
    List<SideDelta> deltas = parser.parse("""
        {"event_type":"price_change","market":"0xabc","price_changes":[
          {"asset_id":"111","price":"0.51","size":"20","side":"BUY"},
          {"asset_id":"222","price":"0.49","size":"0","side":"SELL"},
          {"asset_id":"111","price":"0.53","size":"5","side":"SELL"}
        ]}
        """);

    assertEquals(2, deltas.size());
    SideDelta yes = deltas.get(0);
    assertEquals("111", yes.sideHandle());
    assertEquals(List.of(PriceLevel.of("0.51", "20")), yes.bids());
    assertEquals(List.of(PriceLevel.of("0.53", "5")), yes.asks());

    SideDelta no = deltas.get(1);
    assertEquals("222", no.sideHandle());
    assertTrue(no.bids().isEmpty());
    assertTrue(no.asks().get(0).isRemoval());
  }

  @Test
  void changeEntriesFallBackToTheParentAssetId() {
    List<SideDelta> deltas = parser.parse("""
        {"asset_id":"111","changes":[{"price":"0.50","size":"3","side":"buy"}]}
        """);

    assertEquals(1, deltas.size());
    assertEquals("111", deltas.get(0).sideHandle());
    assertEquals(1, deltas.get(0).bids().size());
  }

  @Test
  void bookShapedUpdatesInAnArray() {
    List<SideDelta> deltas = parser.parse("""
        [
          {"event_type":"book","asset_id":"111","bids":[{"price":"0.50","size":"10"}],"asks":[{"price":"0.52","size":"4"}]},
          {"event_type":"book","asset_id":"222","buys":[],"sells":[{"price":"0.48","size":"1"}]}
        ]
        """);

    assertEquals(2, deltas.size());
    assertEquals(1, deltas.get(0).bids().size());
    assertEquals(1, deltas.get(0).asks().size());
    assertEquals("222", deltas.get(1).sideHandle());
    assertTrue(deltas.get(1).bids().isEmpty());
  }

  @Test
  void changesWithOutOfRangeExponentsAreDropped() {
    List<SideDelta> deltas = parser.parse("""
        {"price_changes":[
          {"asset_id":"111","price":"1E+2147483647","size":"5","side":"BUY"},
          {"asset_id":"222","price":"0.49","size":"3","side":"BUY"}
        ]}
        """);

    assertEquals(1, deltas.size());
    assertEquals("222", deltas.get(0).sideHandle());
  }

  @Test
  void keepAlivesAndUnrelatedEventsYieldNothing() {
    assertTrue(parser.parse("PONG").isEmpty());
    assertTrue(parser.parse("  ").isEmpty());
    assertTrue(parser.parse("[]").isEmpty());
    assertTrue(parser.parse("""
        {"event_type":"last_trade_price","asset_id":"111","price":"0.5"}
        """).isEmpty());
  }

  @Test
  void entriesMissingFieldsAreSkipped() {
    List<SideDelta> deltas = parser.parse("""
        {"price_changes":[{"asset_id":"111","price":"0.5","side":"BUY"},{"price":"0.5","size":"1","side":"BUY"}]}
        """);

    assertTrue(deltas.isEmpty());
  }

  @Test
  void malformedJsonIsRejected() {
    assertThrows(FeedException.class, () -> parser.parse("{\"price_changes\": ["));
  }
}
