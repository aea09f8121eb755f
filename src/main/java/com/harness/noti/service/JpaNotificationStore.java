package com.harness.noti.service;

import com.harness.noti.interval.Interval;
import com.harness.noti.model.NotificationRecord;
import com.harness.noti.repository.NotificationEntity;
import com.harness.noti.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

@Service
public class JpaNotificationStore implements NotificationStore {

  private static final Logger log = LoggerFactory.getLogger(JpaNotificationStore.class);

  private final NotificationRepository repository;
  private final Clock clock;

  public JpaNotificationStore(NotificationRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  public NotificationRecord insert(NotificationRecord draft) {
    NotificationEntity entity = new NotificationEntity();
    entity.setGuildId(draft.guildId());
    entity.setChannelId(draft.channelId());
    entity.setUserId(draft.userId());
    entity.setStartTime(draft.startTime());
    entity.setMessage(draft.message());
    entity.setCreatedAt(clock.instant());
    entity.setRepeating(draft.repeating());
    if (draft.interval() != null) {
      entity.setIntervalValue(draft.interval().value());
      entity.setIntervalUnit(draft.interval().unit());
    }
    entity.setEndTime(draft.endTime());
    entity.setMaxOccurrences(draft.maxOccurrences());
    entity.setLastTriggered(draft.lastTriggered());
    NotificationEntity saved = withReconnect("insert", () -> repository.save(entity));
    return toRecord(saved);
  }

  @Override
  public Optional<NotificationRecord> find(long id) {
    return withReconnect("find", () -> repository.findById(id)).map(this::toRecord);
  }

  @Override
  public List<NotificationRecord> listAll() {
    return withReconnect("listAll", repository::findAllByOrderByIdAsc).stream()
        .map(this::toRecord)
        .toList();
  }

  @Override
  public List<NotificationRecord> findByGuild(long guildId) {
    return withReconnect("findByGuild", () -> repository.findByGuildIdOrderByStartTimeAsc(guildId))
        .stream()
        .map(this::toRecord)
        .toList();
  }

  @Override
  public void updateProgress(long id, Instant lastTriggered, Integer maxOccurrences) {
    int updated = withReconnect("updateProgress",
        () -> repository.updateProgress(id, lastTriggered, maxOccurrences));
    if (updated == 0) {
      log.debug("No notification row {} to update, it was deleted concurrently", id);
    }
  }

  @Override
  public boolean delete(long id) {
    int deleted = withReconnect("delete", () -> repository.deleteRow(id));
    log.debug("Deleted notification row {} (rows={})", id, deleted);
    return deleted > 0;
  }

  /**
   * Runs {@code action}, and once more if the first attempt lost its connection. The pool
   * hands the second attempt a fresh connection.
   */
  private <T> T withReconnect(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessResourceFailureException
             | RecoverableDataAccessException
             | TransientDataAccessException e) {
      log.warn("Lost database connection during {}, reconnecting: {}", operation, e.getMessage());
      return action.get();
    }
  }

  private NotificationRecord toRecord(NotificationEntity entity) {
    Interval interval = null;
    if (entity.isRepeating() && entity.getIntervalValue() != null && entity.getIntervalUnit() != null) {
      interval = new Interval(entity.getIntervalValue(), entity.getIntervalUnit());
    }
    return new NotificationRecord(
        entity.getId(),
        entity.getGuildId(),
        entity.getChannelId(),
        entity.getUserId(),
        entity.getStartTime(),
        entity.getMessage(),
        interval != null,
        interval,
        entity.getEndTime(),
        entity.getMaxOccurrences(),
        entity.getLastTriggered(),
        entity.getCreatedAt()
    );
  }
}
