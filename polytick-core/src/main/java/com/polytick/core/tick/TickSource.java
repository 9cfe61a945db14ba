package com.polytick.core.tick;

public enum TickSource {
  SNAPSHOT("rest"),
  DELTA("ws");

  private final String tag;

  TickSource(String tag) {
    this.tag = tag;
  }

  /**
   * Value stored in the {@code source} column.
   */
  public String tag() {
    return tag;
  }
}
