package com.polytick.collector.feed;

import com.polytick.core.feed.FeedDisconnectedException;

import java.time.Duration;

public interface DeltaFeedSession extends AutoCloseable {

  /**
   * Sends the subscribe message for one side handle.
   *
   * @throws FeedDisconnectedException if the message could not be sent
   */
  void subscribe(String sideHandle);

  /**
   * Next inbound message, or {@code null} if none arrived within {@code timeout}.
   *
   * @throws FeedDisconnectedException once the connection is closed and every buffered message was consumed
   */
  String receive(Duration timeout) throws InterruptedException;

  @Override
  void close();
}
