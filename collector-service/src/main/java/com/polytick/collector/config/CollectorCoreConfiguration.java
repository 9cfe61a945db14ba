package com.polytick.collector.config;

import com.polytick.core.book.BookStore;
import com.polytick.core.market.InstrumentRegistry;
import com.polytick.core.store.MarketDataStore;
import com.polytick.core.tick.TickWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class CollectorCoreConfiguration {

  @Bean
  public BookStore bookStore() {
    return new BookStore();
  }

  @Bean
  public InstrumentRegistry instrumentRegistry(CollectorProperties properties, MarketDataStore store) {
    return new InstrumentRegistry(
        properties.assetPrefix(),
        Duration.ofSeconds(properties.discovery().graceSeconds()),
        store
    );
  }

  @Bean
  public TickWriter tickWriter(InstrumentRegistry registry, BookStore bookStore, MarketDataStore store, Clock clock) {
    return new TickWriter(registry, bookStore, store, clock);
  }

  /**
   * One thread per discovery loop plus the snapshot poller, so no loop waits on another.
   */
  @Bean
  public ThreadPoolTaskScheduler collectorTaskScheduler(CollectorProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.trackedWindowClasses().size() + 1);
    scheduler.setThreadNamePrefix("collector-");
    scheduler.setDaemon(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }
}
