package com.harness.noti.service;

import com.harness.noti.model.NotificationRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of notification records. Every write touches a single row by id, so tasks owning
 * different records never contend.
 */
public interface NotificationStore {

  /** Stores a new record and returns it with the id the store assigned. */
  NotificationRecord insert(NotificationRecord draft);

  Optional<NotificationRecord> find(long id);

  List<NotificationRecord> listAll();

  /** Records of one guild, earliest start first. */
  List<NotificationRecord> findByGuild(long guildId);

  void updateProgress(long id, Instant lastTriggered, Integer maxOccurrences);

  /** @return false when no row had that id */
  boolean delete(long id);
}
