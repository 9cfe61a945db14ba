package com.polytick.core.store;

import com.polytick.core.market.Instrument;
import com.polytick.core.market.WindowClass;
import com.polytick.core.tick.Tick;

/**
 * Durable instrument and tick records. Every write is committed on its own.
 * Write methods throw {@link StoreWriteException} when the row could not be committed.
 */
public interface MarketDataStore {

  /**
   * Insert-or-ignore: an existing row for the same id is left untouched.
   */
  void saveInstrument(Instrument instrument);

  void appendTick(Tick tick);

  void markResolved(String instrumentId);

  MarketStats stats(WindowClass windowClass);

  /**
   * Deletes the instrument and all of its ticks.
   *
   * @return true if an instrument row was removed
   */
  boolean deleteInstrument(String instrumentId);

  long countTicks(String instrumentId);
}
