package com.harness.noti.delivery;

import com.harness.noti.model.Destination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Default channel: writes each delivery to the log. A platform integration replaces this bean.
 */
@Service
public class LoggingDeliveryChannel implements DeliveryChannel {

  private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

  @Override
  public void prepare(Destination destination) {
    log.debug("Nothing to prepare for guildId={}, channelId={}",
        destination.guildId(), destination.channelId());
  }

  @Override
  public void deliver(Delivery delivery) {
    write(delivery, "PRIMARY");
  }

  @Override
  public void deliverFallback(Delivery delivery) {
    write(delivery, "FALLBACK");
  }

  private void write(Delivery delivery, String path) {
    log.warn(
        "NOTIFICATION DELIVERED: notificationId={}, guildId={}, channelId={}, sender={}, occurrence={}, path={}, message={}",
        delivery.notificationId(),
        delivery.destination().guildId(),
        delivery.destination().channelId(),
        delivery.senderName(),
        delivery.occurrence(),
        path,
        delivery.message()
    );
  }
}
