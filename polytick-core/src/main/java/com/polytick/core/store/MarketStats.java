package com.polytick.core.store;

public record MarketStats(
    long total,
    long resolved,
    long active,
    long totalTicks
) {
}
