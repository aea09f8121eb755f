package com.harness.noti.schedule;

import com.harness.noti.interval.Interval;
import com.harness.noti.interval.IntervalUnit;
import com.harness.noti.model.NotificationRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulerManagerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final DispatchSettings SETTINGS =
      new DispatchSettings(Duration.ofMinutes(2), Duration.ofSeconds(5), Duration.ofSeconds(5));

  private final MutableClock clock = new MutableClock(NOW);
  private final FakeNotificationStore store = new FakeNotificationStore();
  private final RecordingChannel channel = new RecordingChannel();
  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void loadAllStartsOneTaskPerRecordAndAddDoesNotDuplicate() {
    NotificationRecord first = store.insert(future("first"));
    store.insert(future("second"));
    SchedulerManager manager = manager(parkingSleeper());

    assertThat(manager.loadAll()).isEqualTo(2);
    assertThat(manager.add(first)).isFalse();
    assertThat(manager.loadAll()).isZero();
    assertThat(manager.liveTasks()).extracting(SchedulerManager.TaskSnapshot::id)
        .containsExactly(1L, 2L);
    assertThat(manager.liveTasks()).extracting(SchedulerManager.TaskSnapshot::scheduledTime)
        .containsOnly(NOW.plus(Duration.ofDays(1)));
  }

  @Test
  void removeCancelsTaskAndIsIdempotent() {
    NotificationRecord record = store.insert(future("standup"));
    SchedulerManager manager = manager(parkingSleeper());
    manager.add(record);

    assertThat(manager.remove(record.id())).isTrue();
    assertThat(manager.isRunning(record.id())).isFalse();
    assertThat(manager.remove(record.id())).isFalse();
    assertThat(manager.remove(999L)).isFalse();
    assertThat(store.find(record.id())).isPresent();
  }

  @Test
  void stopAllKeepsRecordsForALaterReload() {
    store.insert(future("a"));
    store.insert(future("b"));
    SchedulerManager manager = manager(parkingSleeper());
    manager.loadAll();

    manager.stopAll();

    assertThat(manager.liveTasks()).isEmpty();
    assertThat(store.listAll()).hasSize(2);
    assertThat(manager.loadAll()).isEqualTo(2);
  }

  @Test
  void finishedTaskDeletesItsRecordAndLeavesTheRegistry() {
    NotificationRecord record = store.insert(
        NotificationRecord.oneOff(10L, 20L, 30L, NOW.plusSeconds(30), "lunch"));
    SchedulerManager manager = manager(new AdvancingSleeper(clock));

    assertThat(manager.add(record)).isTrue();

    assertThat(eventually(() -> !manager.isRunning(record.id()))).isTrue();
    assertThat(store.find(record.id())).isEmpty();
    assertThat(channel.deliveredOccurrences()).containsExactly(NOW.plusSeconds(30));
  }

  @Test
  void cancelledTaskDoesNotUnregisterItsReplacement() throws Exception {
    NotificationRecord record = store.insert(future("standup"));
    SchedulerManager manager = manager(parkingSleeper());

    manager.add(record);
    manager.remove(record.id());
    assertThat(manager.add(record)).isTrue();

    Thread.sleep(200);
    assertThat(manager.isRunning(record.id())).isTrue();
  }

  @Test
  void recordThatCannotBeScheduledDoesNotStopTheOthers() {
    NotificationRecord broken = store.insert(NotificationRecord
        .repeating(10L, 20L, 30L, NOW, "broken", new Interval(Long.MAX_VALUE, IntervalUnit.WEEK), null, null)
        .withProgress(NOW, null));
    NotificationRecord healthy = store.insert(future("healthy"));
    SchedulerManager manager = manager(parkingSleeper());

    assertThat(manager.loadAll()).isEqualTo(1);

    assertThat(manager.isRunning(healthy.id())).isTrue();
    assertThat(manager.isRunning(broken.id())).isFalse();
    assertThat(store.find(broken.id())).isPresent();
  }

  @Test
  void recordWithoutRepresentableNextOccurrenceIsRetiredWhileOthersRun() {
    Interval longest = new Interval(Long.MAX_VALUE / IntervalUnit.WEEK.seconds(), IntervalUnit.WEEK);
    NotificationRecord exhausted = store.insert(NotificationRecord
        .repeating(10L, 20L, 30L, NOW.minusSeconds(60), "done", longest, null, null)
        .withProgress(NOW.minusSeconds(60), null));
    NotificationRecord healthy = store.insert(future("healthy"));
    SchedulerManager manager = manager(parkingSleeper());

    assertThat(manager.loadAll()).isEqualTo(2);

    assertThat(eventually(() -> store.find(exhausted.id()).isEmpty())).isTrue();
    assertThat(eventually(() -> !manager.isRunning(exhausted.id()))).isTrue();
    assertThat(manager.isRunning(healthy.id())).isTrue();
  }

  @Test
  void addRejectsUnsavedRecord() {
    SchedulerManager manager = manager(parkingSleeper());

    assertThatThrownBy(() -> manager.add(future("unsaved")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private SchedulerManager manager(Sleeper sleeper) {
    DispatchContext context = new DispatchContext(
        store, channel, (type, id, scopeId) -> "user-" + id, SETTINGS, clock, sleeper, event -> { });
    return new SchedulerManager(store, context, executor);
  }

  private static Sleeper parkingSleeper() {
    return target -> new CountDownLatch(1).await();
  }

  private static NotificationRecord future(String message) {
    return NotificationRecord.oneOff(10L, 20L, 30L, NOW.plus(Duration.ofDays(1)), message);
  }

  private static boolean eventually(BooleanSupplier condition) {
    long deadline = System.currentTimeMillis() + 5_000;
    while (System.currentTimeMillis() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      try {
        Thread.sleep(20);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return condition.getAsBoolean();
  }
}
