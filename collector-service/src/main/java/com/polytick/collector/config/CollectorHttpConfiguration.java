package com.polytick.collector.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class CollectorHttpConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public RestClientCustomizer polymarketCommonHeadersRestClientCustomizer(CollectorProperties properties) {
    String userAgent = properties.polymarket().userAgent();
    return builder -> builder
        .defaultHeader(HttpHeaders.USER_AGENT, userAgent);
  }

  @Bean
  public RestClient polymarketGammaApiRestClient(
      CollectorProperties properties,
      RestClient.Builder builder,
      HttpClient httpClient
  ) {
    return jsonRestClient(builder, httpClient, properties.polymarket().gammaApiBaseUrl(),
        properties.polymarket().readTimeoutSeconds());
  }

  @Bean
  public RestClient polymarketClobRestClient(
      CollectorProperties properties,
      RestClient.Builder builder,
      HttpClient httpClient
  ) {
    return jsonRestClient(builder, httpClient, properties.polymarket().clobRestBaseUrl(),
        properties.polymarket().readTimeoutSeconds());
  }

  private static RestClient jsonRestClient(RestClient.Builder builder, HttpClient httpClient, URI baseUrl,
      int readTimeoutSeconds) {
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(Duration.ofSeconds(readTimeoutSeconds));

    return builder
        .baseUrl(baseUrl.toString())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, "application/json")
        .build();
  }
}
