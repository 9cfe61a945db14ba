package com.polytick.collector.polymarket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytick.core.book.PriceLevel;
import com.polytick.core.feed.BookSnapshot;
import com.polytick.core.feed.FeedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ClobBookClientTest {

  private static final String URL = "https://clob.test/book?token_id=111";

  private MockRestServiceServer server;
  private ClobBookClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl("https://clob.test");
    server = MockRestServiceServer.bindTo(builder).build();
    client = new ClobBookClient(builder.build(), new ObjectMapper());
  }

  @Test
  void parsesStringAndNumericLevels() {
    server.expect(requestTo(URL)).andRespond(withSuccess("""
        {"market":"0xabc","asset_id":"111",
         "bids":[{"price":"0.48","size":"120.5"},{"price":0.47,"size":10}],
         "asks":[{"price":"0.52","size":"80"}]}
        """, MediaType.APPLICATION_JSON));

    BookSnapshot book = client.fetchBook("111");

    assertEquals(2, book.bids().size());
    assertEquals(PriceLevel.of("0.48", "120.5"), book.bids().get(0));
    assertEquals(0, book.bids().get(1).price().compareTo(new BigDecimal("0.47")));
    assertEquals(1, book.asks().size());
    server.verify();
  }

  @Test
  void acceptsBuysAndSellsAliases() {
    server.expect(requestTo(URL)).andRespond(withSuccess("""
        {"buys":[{"price":"0.40","size":"1"}],"sells":[{"price":"0.60","size":"2"}]}
        """, MediaType.APPLICATION_JSON));

    BookSnapshot book = client.fetchBook("111");

    assertEquals(1, book.bids().size());
    assertEquals(1, book.asks().size());
  }

  @Test
  void skipsUnparsableLevels() {
    server.expect(requestTo(URL)).andRespond(withSuccess("""
        {"bids":[{"price":"abc","size":"1"},{"price":"0.41"}],"asks":[{"price":"0.6","size":"3"}]}
        """, MediaType.APPLICATION_JSON));

    BookSnapshot book = client.fetchBook("111");

    assertEquals(0, book.bids().size());
    assertEquals(1, book.asks().size());
  }

  @Test
  void skipsLevelsWithOutOfRangeExponents() {
    server.expect(requestTo(URL)).andRespond(withSuccess("""
        {"bids":[{"price":"1E+2147483647","size":"5"},{"price":"0.45","size":"5"}],
         "asks":[{"price":"0.55","size":"1E-2147483647"},{"price":"0.56","size":"2"}]}
        """, MediaType.APPLICATION_JSON));

    BookSnapshot book = client.fetchBook("111");

    assertEquals(List.of(PriceLevel.of("0.45", "5")), book.bids());
    assertEquals(List.of(PriceLevel.of("0.56", "2")), book.asks());
  }

  @Test
  void httpErrorIsAFeedException() {
    server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThrows(FeedException.class, () -> client.fetchBook("111"));
  }

  @Test
  void errorPayloadIsAFeedException() {
    server.expect(requestTo(URL)).andRespond(withSuccess("""
        {"error":"No orderbook exists for the requested token id"}
        """, MediaType.APPLICATION_JSON));

    assertThrows(FeedException.class, () -> client.fetchBook("111"));
  }

  @Test
  void garbageIsAFeedException() {
    server.expect(requestTo(URL)).andRespond(withSuccess("<html>", MediaType.TEXT_HTML));

    assertThrows(FeedException.class, () -> client.fetchBook("111"));
  }
}
