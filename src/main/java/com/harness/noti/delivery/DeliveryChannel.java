package com.harness.noti.delivery;

import com.harness.noti.model.Destination;

/**
 * Outbound side of the scheduler. Implementations wrap the chat platform; the scheduler only
 * distinguishes permission failures from transient ones.
 */
public interface DeliveryChannel {

  /** Warms whatever the primary path needs for {@code destination} ahead of dispatch. */
  void prepare(Destination destination) throws DeliveryException;

  /** Primary path: posts the message under the scheduling user's name. */
  void deliver(Delivery delivery) throws DeliveryException;

  /** Plain send used after a permission failure or once retries ran out. */
  void deliverFallback(Delivery delivery) throws DeliveryException;
}
