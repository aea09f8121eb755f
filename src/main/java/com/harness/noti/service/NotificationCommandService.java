package com.harness.noti.service;

import com.harness.noti.interval.Interval;
import com.harness.noti.model.NotificationRecord;
import com.harness.noti.model.NotificationRequest;
import com.harness.noti.model.NotificationView;
import com.harness.noti.names.NameResolver;
import com.harness.noti.names.NameType;
import com.harness.noti.schedule.OccurrenceClock;
import com.harness.noti.schedule.SchedulerManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Add, list and delete operations behind the REST surface. */
@Service
public class NotificationCommandService {

  private static final Logger log = LoggerFactory.getLogger(NotificationCommandService.class);

  static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
  static final Duration MIN_LEAD_TIME = Duration.ofSeconds(5);

  private final NotificationStore store;
  private final SchedulerManager scheduler;
  private final NameResolver names;
  private final Clock clock;

  public NotificationCommandService(NotificationStore store,
                                    SchedulerManager scheduler,
                                    NameResolver names,
                                    Clock clock) {
    this.store = store;
    this.scheduler = scheduler;
    this.names = names;
    this.clock = clock;
  }

  public NotificationRecord add(long guildId, long userId, NotificationRequest request) {
    Instant start = parseTime(request.time(), "Invalid time format.");

    Interval interval = null;
    if (request.interval() != null && !request.interval().isBlank()) {
      interval = Interval.parse(request.interval())
          .orElseThrow(() -> new InvalidScheduleException("Invalid interval."));
    }
    boolean repeating = interval != null;

    Instant end = null;
    if (request.endTime() != null && !request.endTime().isBlank()) {
      end = parseTime(request.endTime(), "Invalid end time.");
      if (end.isBefore(start)) {
        throw new InvalidScheduleException("End time must not be before the first occurrence.");
      }
    }

    if (repeating && end == null && request.maxOccurrences() == null
        && !Boolean.TRUE.equals(request.confirmUnbounded())) {
      throw new InvalidScheduleException(
          "Unbounded repeating notification: resend with confirmUnbounded=true to schedule it.");
    }

    Instant now = clock.instant();
    if (!repeating && !start.isAfter(now.plus(MIN_LEAD_TIME))) {
      throw new InvalidScheduleException("Time must be in the future for non-repeating notifications.");
    }

    NotificationRecord draft = repeating
        ? NotificationRecord.repeating(guildId, request.channelId(), userId, start,
            request.message(), interval, end, request.maxOccurrences())
        : NotificationRecord.oneOff(guildId, request.channelId(), userId, start, request.message());

    NotificationRecord saved = store.insert(draft);
    log.info("User {} added notification {} in guild {} channel {}",
        userId, saved.id(), guildId, saved.channelId());
    scheduler.add(saved);
    return saved;
  }

  public List<NotificationView> list(long guildId) {
    Instant now = clock.instant();
    return store.findByGuild(guildId).stream()
        .map(record -> toView(record, now))
        .toList();
  }

  /**
   * Deletes one notification of {@code guildId}. Only its owner, or a user allowed to manage
   * messages, may do so.
   */
  public void delete(long guildId, long id, long userId, boolean canManageMessages) {
    NotificationRecord record = store.find(id)
        .filter(r -> r.guildId() == guildId)
        .orElseThrow(() -> new NotificationNotFoundException(id));
    if (record.userId() != userId && !canManageMessages) {
      throw new DeletionNotAllowedException(id, userId);
    }
    scheduler.remove(id);
    store.delete(id);
    log.info("User {} deleted notification {}", userId, id);
  }

  /** @return number of notifications deleted */
  public int deleteAll(long guildId, long userId) {
    int deleted = 0;
    for (NotificationRecord record : store.findByGuild(guildId)) {
      scheduler.remove(record.id());
      if (store.delete(record.id())) {
        deleted++;
      }
    }
    log.info("User {} deleted all {} notifications of guild {}", userId, deleted, guildId);
    return deleted;
  }

  private NotificationView toView(NotificationRecord record, Instant now) {
    return new NotificationView(
        record.id(),
        record.guildId(),
        record.channelId(),
        names.resolve(NameType.CHANNEL, record.channelId(), null),
        record.userId(),
        names.resolve(NameType.USER, record.userId(), record.guildId()),
        record.startTime(),
        record.message(),
        record.repeating(),
        record.interval() != null ? record.interval().toText() : null,
        record.endTime(),
        record.remainingOccurrences().orElse(null),
        record.lastTriggered(),
        OccurrenceClock.nextOccurrence(record, now).orElse(null)
    );
  }

  private static Instant parseTime(String text, String error) {
    try {
      return LocalDateTime.parse(text.trim(), TIME_FORMAT).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new InvalidScheduleException(error);
    }
  }
}
