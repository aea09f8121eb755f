package com.harness.noti.schedule;

/** How one occurrence was resolved. Every outcome marks the occurrence as handled. */
public enum DispatchOutcome {
  DELIVERED,
  DELIVERED_FALLBACK,
  FAILED,
  SKIPPED_LATE
}
