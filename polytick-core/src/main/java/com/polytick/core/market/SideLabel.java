package com.polytick.core.market;

import java.util.Locale;

public enum SideLabel {
  YES,
  NO;

  /**
   * Maps a Gamma outcome name ("Up", "Yes", "Down", "No") to a side, or {@code null} if it is neither.
   */
  public static SideLabel fromOutcome(String outcome) {
    if (outcome == null) {
      return null;
    }
    return switch (outcome.trim().toLowerCase(Locale.ROOT)) {
      case "up", "yes" -> YES;
      case "down", "no" -> NO;
      default -> null;
    };
  }
}
