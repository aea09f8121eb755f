package com.harness.noti.schedule;

import com.harness.noti.delivery.Delivery;
import com.harness.noti.delivery.DeliveryException;
import com.harness.noti.delivery.DeliveryFailure;
import com.harness.noti.model.NotificationRecord;
import com.harness.noti.names.NameType;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives every occurrence of one notification, strictly in time order: replay what was missed
 * while offline, then for each upcoming occurrence pre-fetch, wait, dispatch and persist.
 *
 * <p>The task owns its record exclusively. Cancellation (interrupt or {@link #cancel()}) is
 * honoured at each wait and before each write; an occurrence interrupted before its progress
 * was persisted stays unresolved and is picked up again by the next load.
 */
public class DispatchTask implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(DispatchTask.class);

  /** Callbacks into whoever tracks the live tasks. */
  public interface Owner {

    void deleteRecord(long id);

    void taskFinished(DispatchTask task);
  }

  private final long id;
  private final DispatchContext context;
  private final Owner owner;

  private volatile NotificationRecord record;
  private volatile Instant scheduledTime;
  private volatile TaskState state = TaskState.RESTORING;
  private volatile boolean cancelled;
  private String senderName;

  public DispatchTask(NotificationRecord record, DispatchContext context, Owner owner) {
    Objects.requireNonNull(record.id(), "record must be persisted before it is scheduled");
    this.id = record.id();
    this.record = record;
    this.context = Objects.requireNonNull(context);
    this.owner = Objects.requireNonNull(owner);
    this.scheduledTime = OccurrenceClock.pendingOccurrence(record).orElse(null);
  }

  public long id() {
    return id;
  }

  public TaskState state() {
    return state;
  }

  public NotificationRecord record() {
    return record;
  }

  /** Occurrence the task is currently working towards. */
  public Optional<Instant> scheduledTime() {
    return Optional.ofNullable(scheduledTime);
  }

  /** Flags the task as cancelled. The owner also interrupts the thread running it. */
  public void cancel() {
    cancelled = true;
  }

  @Override
  public void run() {
    try {
      log.info("Restoring notification {}, next run at {}", id,
          OccurrenceClock.nextOccurrence(record, now()).map(Instant::toString).orElse("none"));
      if (record.repeating()) {
        state = TaskState.CATCHING_UP;
        catchUp();
      }
      runLoop();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state = TaskState.CANCELLED;
      log.warn("Cancelled task {}", id);
    } catch (RuntimeException e) {
      state = TaskState.FAILED;
      log.error("Error in dispatch task {}", id, e);
    } finally {
      owner.taskFinished(this);
    }
  }

  private void catchUp() throws InterruptedException {
    Duration interval = record.intervalDuration().orElseThrow();
    Duration window = context.settings().lateDeliveryWindow();
    Instant now = now();
    if (scheduledTime == null || !scheduledTime.isBefore(now)) {
      return;
    }

    skipStale(interval, now.minus(window));
    if (scheduledTime == null || record.hasEnded(scheduledTime)) {
      return;
    }

    List<Instant> missed =
        OccurrenceClock.missedOccurrences(scheduledTime.minus(interval), interval, now, window);
    for (Instant occurrence : missed) {
      if (record.hasEnded(occurrence)) {
        break;
      }
      ensureActive();
      try {
        resolve(occurrence);
      } catch (RuntimeException e) {
        log.error("Error dispatching missed notification {} at {}", id, occurrence, e);
      }
      scheduledTime = OccurrenceClock.after(occurrence, interval).orElse(null);
    }
  }

  /**
   * Resolves in one write every pending occurrence older than the late window. They are not
   * sent but still count against max occurrences.
   */
  private void skipStale(Duration interval, Instant cutoff) throws InterruptedException {
    Instant limit = cutoff;
    if (record.endTime() != null && record.endTime().isBefore(cutoff)) {
      limit = record.endTime().plusNanos(1);
    }
    long stale = OccurrenceClock.countBefore(scheduledTime, interval, limit);
    if (stale == 0) {
      return;
    }
    Instant lastStale = scheduledTime.plus(interval.multipliedBy(stale - 1));
    log.warn("Skipping {} occurrence(s) of notification {} between {} and {} (past late-delivery window)",
        stale, id, scheduledTime, lastStale);
    ensureActive();
    persist(lastStale, decrement(record.maxOccurrences(), stale));
    publish(lastStale, stale, DispatchOutcome.SKIPPED_LATE);
    scheduledTime = OccurrenceClock.after(lastStale, interval).orElse(null);
  }

  private void runLoop() throws InterruptedException {
    while (true) {
      Instant occurrence = scheduledTime;
      if (occurrence == null || record.hasEnded(occurrence)) {
        complete();
        return;
      }

      state = TaskState.WAITING_PREFETCH;
      context.sleeper().sleepUntil(occurrence.minus(context.settings().prefetchBuffer()));
      ensureActive();

      state = TaskState.PREFETCHING;
      prefetch();

      state = TaskState.WAITING_DISPATCH;
      context.sleeper().sleepUntil(occurrence);
      ensureActive();

      state = TaskState.DISPATCHING;
      resolve(occurrence);

      if (!record.repeating()) {
        complete();
        return;
      }
      scheduledTime = OccurrenceClock.after(occurrence, record.intervalDuration().orElseThrow())
          .orElse(null);
    }
  }

  private void prefetch() {
    try {
      context.channel().prepare(record.destination());
    } catch (DeliveryException e) {
      log.warn("Cannot prepare channel {} for notification {}, continuing: {}",
          record.channelId(), id, e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Error preparing channel {} for notification {}", record.channelId(), id, e);
    }
    try {
      senderName = context.names().resolve(NameType.USER, record.userId(), record.guildId());
    } catch (RuntimeException e) {
      log.warn("User pre-fetch failed for {}: {}", record.userId(), e.getMessage());
    }
  }

  /** Sends or skips one occurrence against its deadline, then records it as handled. */
  DispatchOutcome resolve(Instant occurrence) throws InterruptedException {
    Instant deadline = occurrence.plus(context.settings().lateDeliveryWindow());
    DispatchOutcome outcome;
    if (now().isBefore(deadline)) {
      outcome = deliverBefore(occurrence, deadline);
    } else {
      log.warn("Skipping notification {} scheduled for {} (past late-delivery window)", id, occurrence);
      outcome = DispatchOutcome.SKIPPED_LATE;
    }
    ensureActive();
    persist(occurrence, decrement(record.maxOccurrences(), 1));
    publish(occurrence, 1, outcome);
    return outcome;
  }

  private DispatchOutcome deliverBefore(Instant occurrence, Instant deadline)
      throws InterruptedException {
    Delivery delivery = new Delivery(id, record.destination(), record.message(), senderName(),
        record.userId(), occurrence);
    while (true) {
      try {
        context.channel().deliver(delivery);
        log.info("Dispatched notification {} at {} as {}", id, occurrence, delivery.senderName());
        return DispatchOutcome.DELIVERED;
      } catch (DeliveryException e) {
        if (e.failure() == DeliveryFailure.PERMISSION_DENIED) {
          log.warn("Primary delivery forbidden for notification {}, falling back: {}", id, e.getMessage());
          return deliverFallback(delivery);
        }
        Instant retryAt = now().plus(context.settings().retryBackoff());
        if (!retryAt.isBefore(deadline)) {
          log.warn("Delivery of notification {} still failing at its deadline, falling back: {}",
              id, e.getMessage());
          return deliverFallback(delivery);
        }
        log.warn("Delivery of notification {} failed, retrying at {}: {}", id, retryAt, e.getMessage());
        context.sleeper().sleepUntil(retryAt);
        ensureActive();
      }
    }
  }

  private DispatchOutcome deliverFallback(Delivery delivery) {
    try {
      context.channel().deliverFallback(delivery);
      log.info("Dispatched notification {} at {} via fallback", id, delivery.occurrence());
      return DispatchOutcome.DELIVERED_FALLBACK;
    } catch (DeliveryException e) {
      log.error("Fallback send failed for notification {}: {}", id, e.getMessage());
      return DispatchOutcome.FAILED;
    }
  }

  private String senderName() {
    if (senderName == null) {
      try {
        senderName = context.names().resolve(NameType.USER, record.userId(), record.guildId());
      } catch (RuntimeException e) {
        log.warn("Could not resolve sender name for {}: {}", record.userId(), e.getMessage());
      }
    }
    return senderName;
  }

  private void persist(Instant lastTriggered, Integer maxOccurrences) {
    context.store().updateProgress(id, lastTriggered, maxOccurrences);
    record = record.withProgress(lastTriggered, maxOccurrences);
  }

  private void publish(Instant occurrence, long occurrences, DispatchOutcome outcome) {
    DispatchEvent event = new DispatchEvent(id, record.guildId(), record.channelId(), occurrence,
        occurrences, outcome, record.maxOccurrences(), now());
    try {
      context.listener().resolved(event);
    } catch (RuntimeException e) {
      log.warn("Dispatch listener rejected event for notification {}: {}", id, e.getMessage());
    }
  }

  private void complete() throws InterruptedException {
    ensureActive();
    state = TaskState.COMPLETED;
    log.info("Notification {} has no further occurrences, deleting it", id);
    owner.deleteRecord(id);
  }

  private void ensureActive() throws InterruptedException {
    if (cancelled || Thread.currentThread().isInterrupted()) {
      throw new InterruptedException("dispatch task " + id + " cancelled");
    }
  }

  private Instant now() {
    return context.clock().instant();
  }

  private static Integer decrement(Integer maxOccurrences, long by) {
    if (maxOccurrences == null) {
      return null;
    }
    return (int) Math.max(0L, maxOccurrences - by);
  }
}
