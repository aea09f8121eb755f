package com.harness.noti.service;

import com.harness.noti.interval.Interval;
import com.harness.noti.interval.IntervalUnit;
import com.harness.noti.model.NotificationRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class JpaNotificationStoreIntegrationTest {

  private static final Instant T0 = Instant.parse("2030-01-01T09:00:00Z");

  @Autowired
  private NotificationStore store;

  @Test
  void insertAssignsIdAndRoundTripsAllFields() {
    NotificationRecord saved = store.insert(NotificationRecord.repeating(
        101L, 7L, 42L, T0, "weekly sync", new Interval(2, IntervalUnit.WEEK),
        T0.plusSeconds(86_400L * 60), 5));

    assertThat(saved.id()).isNotNull();
    assertThat(saved.createdAt()).isNotNull();

    NotificationRecord loaded = store.find(saved.id()).orElseThrow();
    assertThat(loaded.guildId()).isEqualTo(101L);
    assertThat(loaded.channelId()).isEqualTo(7L);
    assertThat(loaded.userId()).isEqualTo(42L);
    assertThat(loaded.startTime()).isEqualTo(T0);
    assertThat(loaded.message()).isEqualTo("weekly sync");
    assertThat(loaded.repeating()).isTrue();
    assertThat(loaded.interval()).isEqualTo(new Interval(2, IntervalUnit.WEEK));
    assertThat(loaded.endTime()).isEqualTo(T0.plusSeconds(86_400L * 60));
    assertThat(loaded.maxOccurrences()).isEqualTo(5);
    assertThat(loaded.lastTriggered()).isNull();
  }

  @Test
  void oneOffHasNoInterval() {
    NotificationRecord saved = store.insert(NotificationRecord.oneOff(102L, 7L, 42L, T0, "once"));

    NotificationRecord loaded = store.find(saved.id()).orElseThrow();
    assertThat(loaded.repeating()).isFalse();
    assertThat(loaded.interval()).isNull();
    assertThat(loaded.maxOccurrences()).isNull();
  }

  @Test
  void updateProgressPersistsLastTriggeredAndRemainingCount() {
    NotificationRecord saved = store.insert(NotificationRecord.repeating(
        103L, 7L, 42L, T0, "hourly", new Interval(1, IntervalUnit.HOUR), null, 3));

    store.updateProgress(saved.id(), T0, 2);

    NotificationRecord loaded = store.find(saved.id()).orElseThrow();
    assertThat(loaded.lastTriggered()).isEqualTo(T0);
    assertThat(loaded.maxOccurrences()).isEqualTo(2);
  }

  @Test
  void updateProgressOnMissingRowIsANoOp() {
    store.updateProgress(987_654L, T0, null);

    assertThat(store.find(987_654L)).isEmpty();
  }

  @Test
  void findByGuildOrdersByStartTimeAndDeleteRemovesRow() {
    NotificationRecord later = store.insert(NotificationRecord.oneOff(104L, 7L, 42L, T0.plusSeconds(60), "later"));
    NotificationRecord earlier = store.insert(NotificationRecord.oneOff(104L, 7L, 42L, T0, "earlier"));
    store.insert(NotificationRecord.oneOff(105L, 7L, 42L, T0, "other guild"));

    List<NotificationRecord> guild = store.findByGuild(104L);
    assertThat(guild).extracting(NotificationRecord::message).containsExactly("earlier", "later");

    assertThat(store.delete(earlier.id())).isTrue();
    assertThat(store.delete(earlier.id())).isFalse();
    assertThat(store.findByGuild(104L)).extracting(NotificationRecord::id).containsExactly(later.id());
    assertThat(store.listAll()).extracting(NotificationRecord::id).contains(later.id());
  }
}
