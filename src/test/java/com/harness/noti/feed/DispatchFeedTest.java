package com.harness.noti.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.harness.noti.schedule.DispatchEvent;
import com.harness.noti.schedule.DispatchOutcome;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchFeedTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final DispatchFeed feed = new DispatchFeed(new ObjectMapper().registerModule(new JavaTimeModule()));

  @Test
  void keepsMostRecentStepsNewestFirst() {
    for (int i = 0; i < DispatchFeed.MAX_SIZE + 5; i++) {
      feed.resolved(event(i, 1L, DispatchOutcome.DELIVERED, 1));
    }

    List<DispatchFeed.Entry> recent = feed.recent(null);
    assertThat(recent).hasSize(DispatchFeed.MAX_SIZE);
    assertThat(recent.get(0).event().notificationId()).isEqualTo(DispatchFeed.MAX_SIZE + 4L);
    assertThat(recent.get(0).sequence()).isEqualTo(DispatchFeed.MAX_SIZE + 5L);
    assertThat(recent.get(recent.size() - 1).event().notificationId()).isEqualTo(5L);
  }

  @Test
  void filtersByGuild() {
    feed.resolved(event(1, 1L, DispatchOutcome.DELIVERED, 1));
    feed.resolved(event(2, 2L, DispatchOutcome.SKIPPED_LATE, 1));
    feed.resolved(event(3, 1L, DispatchOutcome.FAILED, 1));

    assertThat(feed.recent(1L)).extracting(entry -> entry.event().notificationId())
        .containsExactly(3L, 1L);
    assertThat(feed.recent(3L)).isEmpty();
  }

  @Test
  void totalsCountOccurrencesNotSteps() {
    feed.resolved(event(1, 1L, DispatchOutcome.SKIPPED_LATE, 6));
    feed.resolved(event(1, 1L, DispatchOutcome.DELIVERED, 1));
    feed.resolved(event(2, 1L, DispatchOutcome.DELIVERED_FALLBACK, 1));

    assertThat(feed.totals())
        .containsEntry(DispatchOutcome.SKIPPED_LATE, 6L)
        .containsEntry(DispatchOutcome.DELIVERED, 1L)
        .containsEntry(DispatchOutcome.DELIVERED_FALLBACK, 1L)
        .containsEntry(DispatchOutcome.FAILED, 0L);
  }

  @Test
  void subscribersDoNotBlockResolution() {
    feed.subscribe(1L);
    feed.subscribe(null);

    feed.resolved(event(1, 1L, DispatchOutcome.DELIVERED, 1));
    feed.resolved(event(2, 2L, DispatchOutcome.DELIVERED, 1));

    assertThat(feed.recent(null)).hasSize(2);
    assertThat(feed.subscriberCount()).isEqualTo(2);
  }

  private static DispatchEvent event(long notificationId, long guildId, DispatchOutcome outcome,
                                     long occurrences) {
    return new DispatchEvent(notificationId, guildId, 9L, T0, occurrences, outcome, null, T0);
  }
}
