package com.harness.noti.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Body of an add request. Times are {@code yyyy-MM-dd HH:mm} in UTC; {@code interval} uses the
 * interval text form ({@code 30m}, {@code 2h}, {@code 1w}).
 */
public record NotificationRequest(
    @NotNull @Positive Long channelId,
    @NotBlank String time,
    @NotBlank @Size(max = 2000) String message,
    String interval,
    String endTime,
    @Positive Integer maxOccurrences,
    Boolean confirmUnbounded
) {}
