package com.harness.noti.schedule;

import com.harness.noti.delivery.DeliveryChannel;
import com.harness.noti.names.NameResolver;
import com.harness.noti.service.NotificationStore;
import java.time.Clock;

/** Collaborators shared by all dispatch tasks. */
public record DispatchContext(
    NotificationStore store,
    DeliveryChannel channel,
    NameResolver names,
    DispatchSettings settings,
    Clock clock,
    Sleeper sleeper,
    DispatchListener listener
) {}
