package com.harness.noti.model;

import java.time.Instant;

public record NotificationView(
    long id,
    long guildId,
    long channelId,
    String channelName,
    long userId,
    String userName,
    Instant startTime,
    String message,
    boolean repeating,
    String interval,
    Instant endTime,
    Integer maxOccurrences,
    Instant lastTriggered,
    Instant nextOccurrence
) {}
