package com.harness.noti.names;

import com.harness.noti.repository.NameCacheKey;
import com.harness.noti.repository.NotificationRepository;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class NameRefreshJob {

  private static final Logger log = LoggerFactory.getLogger(NameRefreshJob.class);

  private final CachingNameResolver resolver;
  private final NotificationRepository notifications;
  private final long throttleMs;

  public NameRefreshJob(CachingNameResolver resolver,
                        NotificationRepository notifications,
                        @Value("${noti.names.refresh-throttle-ms:2000}") long throttleMs) {
    this.resolver = resolver;
    this.notifications = notifications;
    this.throttleMs = throttleMs;
  }

  @Scheduled(
      initialDelayString = "${noti.names.refresh-interval-ms:300000}",
      fixedDelayString = "${noti.names.refresh-interval-ms:300000}")
  public void refreshAll() {
    Set<NameCacheKey> targets = collectTargets();
    log.debug("Refreshing {} cached names", targets.size());
    int refreshed = 0;
    for (NameCacheKey key : targets) {
      try {
        NameType type = NameType.valueOf(key.getObjType());
        Long scope = key.getScopeId() != 0 ? key.getScopeId() : null;
        if (resolver.refresh(type, key.getId(), scope)) {
          refreshed++;
        }
      } catch (IllegalArgumentException e) {
        log.warn("Skipping cache entry with unknown type {}", key.getObjType());
      }
      if (!pause()) {
        log.warn("Name refresh interrupted after {} of {} entries", refreshed, targets.size());
        return;
      }
    }
    log.info("Completed id_cache refresh: {} of {} names resolved", refreshed, targets.size());
  }

  Set<NameCacheKey> collectTargets() {
    Set<NameCacheKey> targets = new LinkedHashSet<>(resolver.persistedKeys());
    for (Object[] pair : notifications.findDistinctGuildAndUser()) {
      long guildId = ((Number) pair[0]).longValue();
      long userId = ((Number) pair[1]).longValue();
      targets.add(new NameCacheKey(userId, guildId, NameType.USER.name()));
    }
    for (Long channelId : notifications.findDistinctChannelIds()) {
      targets.add(new NameCacheKey(channelId, 0L, NameType.CHANNEL.name()));
    }
    for (Long guildId : notifications.findDistinctGuildIds()) {
      targets.add(new NameCacheKey(guildId, 0L, NameType.GUILD.name()));
    }
    return targets;
  }

  private boolean pause() {
    if (throttleMs <= 0) {
      return true;
    }
    try {
      Thread.sleep(throttleMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
