package com.polytick.collector.feed;

import com.polytick.core.feed.FeedException;

/**
 * Streaming source of incremental book updates.
 */
public interface DeltaFeed {

  /**
   * Opens a fresh connection with no subscriptions.
   *
   * @throws FeedException if the connection could not be established
   */
  DeltaFeedSession open();
}
