package com.harness.noti.delivery;

public enum DeliveryFailure {
  /** The channel refuses the primary path; go straight to the fallback send. */
  PERMISSION_DENIED,
  /** Worth another attempt after a short pause while the deadline allows it. */
  TRANSIENT
}
