package com.polytick.core.feed;

import com.polytick.core.market.SideHandles;

import java.util.Optional;

public interface MarketLookup {

  /**
   * Side handles of a listed instrument; empty when the instrument is not (yet) listed or the lookup failed.
   */
  Optional<SideHandles> resolve(String instrumentId);
}
