package com.harness.noti.schedule;

import java.time.Instant;

/**
 * One resolution step of a notification.
 *
 * @param occurrence the occurrence resolved, or the last one when several stale occurrences
 *     were skipped together
 * @param occurrences how many occurrences this step resolved
 * @param remaining occurrences left afterwards, null when unbounded
 */
public record DispatchEvent(
    long notificationId,
    long guildId,
    long channelId,
    Instant occurrence,
    long occurrences,
    DispatchOutcome outcome,
    Integer remaining,
    Instant resolvedAt
) {}
