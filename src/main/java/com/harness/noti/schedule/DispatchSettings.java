package com.harness.noti.schedule;

import java.time.Duration;

/**
 * Timing knobs shared by every dispatch task.
 *
 * @param lateDeliveryWindow how stale an occurrence may be and still be sent
 * @param prefetchBuffer lead time before dispatch used to warm lookups
 * @param retryBackoff pause between attempts after a transient delivery failure
 */
public record DispatchSettings(
    Duration lateDeliveryWindow,
    Duration prefetchBuffer,
    Duration retryBackoff
) {
  public DispatchSettings {
    if (lateDeliveryWindow == null || lateDeliveryWindow.isNegative()) {
      throw new IllegalArgumentException("lateDeliveryWindow must be >= 0");
    }
    if (prefetchBuffer == null || prefetchBuffer.isNegative()) {
      throw new IllegalArgumentException("prefetchBuffer must be >= 0");
    }
    if (retryBackoff == null || retryBackoff.isZero() || retryBackoff.isNegative()) {
      throw new IllegalArgumentException("retryBackoff must be > 0");
    }
  }
}
