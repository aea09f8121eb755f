package com.harness.noti.delivery;

import com.harness.noti.model.Destination;
import java.time.Instant;

/**
 * One message handed to a {@link DeliveryChannel}.
 *
 * @param senderName display name the primary path posts under; may be null
 */
public record Delivery(
    long notificationId,
    Destination destination,
    String message,
    String senderName,
    long userId,
    Instant occurrence
) {}
