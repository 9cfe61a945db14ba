package com.polytick.core.feed;

public interface BookSnapshotSource {

  /**
   * Full order book for one side handle.
   *
   * @throws FeedException on any transport, status or parse failure
   */
  BookSnapshot fetchBook(String sideHandle);
}
