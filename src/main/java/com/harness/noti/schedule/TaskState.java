package com.harness.noti.schedule;

public enum TaskState {
  RESTORING,
  CATCHING_UP,
  WAITING_PREFETCH,
  PREFETCHING,
  WAITING_DISPATCH,
  DISPATCHING,
  /** Ran out of occurrences; the record was deleted. */
  COMPLETED,
  CANCELLED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}
