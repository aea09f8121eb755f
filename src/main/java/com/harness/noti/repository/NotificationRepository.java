package com.harness.noti.repository;

import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface NotificationRepository extends JpaRepository<NotificationEntity, Long> {

  List<NotificationEntity> findByGuildIdOrderByStartTimeAsc(long guildId);

  List<NotificationEntity> findAllByOrderByIdAsc();

  @Transactional
  @Modifying(clearAutomatically = true)
  @Query("update NotificationEntity n set n.lastTriggered = :lastTriggered, "
      + "n.maxOccurrences = :maxOccurrences where n.id = :id")
  int updateProgress(@Param("id") long id,
                     @Param("lastTriggered") Instant lastTriggered,
                     @Param("maxOccurrences") Integer maxOccurrences);

  @Transactional
  @Modifying(clearAutomatically = true)
  @Query("delete from NotificationEntity n where n.id = :id")
  int deleteRow(@Param("id") long id);

  @Query("select distinct n.guildId, n.userId from NotificationEntity n")
  List<Object[]> findDistinctGuildAndUser();

  @Query("select distinct n.channelId from NotificationEntity n")
  List<Long> findDistinctChannelIds();

  @Query("select distinct n.guildId from NotificationEntity n")
  List<Long> findDistinctGuildIds();
}
