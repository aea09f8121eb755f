package com.harness.noti.names;

public enum NameType {
  USER("Unknown User"),
  CHANNEL("Unknown Channel"),
  GUILD("Unknown Guild");

  private final String unknown;

  NameType(String unknown) {
    this.unknown = unknown;
  }

  /** Placeholder shown when an id cannot be resolved. */
  public String unknown() {
    return unknown;
  }
}
