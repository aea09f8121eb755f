package com.harness.noti.names;

import com.harness.noti.repository.NameCacheKey;
import com.harness.noti.repository.NotificationRepository;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class NameRefreshJobTest {

  private final CachingNameResolver resolver = mock(CachingNameResolver.class);
  private final NotificationRepository notifications = mock(NotificationRepository.class);
  private final NameRefreshJob job = new NameRefreshJob(resolver, notifications, 0);

  @Test
  void targetsCoverCachedKeysAndEveryReferencedId() {
    given(resolver.persistedKeys()).willReturn(List.of(new NameCacheKey(8L, 0L, "USER")));
    given(notifications.findDistinctGuildAndUser()).willReturn(List.<Object[]>of(new Object[] {1L, 5L}));
    given(notifications.findDistinctChannelIds()).willReturn(List.of(9L));
    given(notifications.findDistinctGuildIds()).willReturn(List.of(1L));

    assertThat(job.collectTargets()).containsExactly(
        new NameCacheKey(8L, 0L, "USER"),
        new NameCacheKey(5L, 1L, "USER"),
        new NameCacheKey(9L, 0L, "CHANNEL"),
        new NameCacheKey(1L, 0L, "GUILD"));
  }

  @Test
  void refreshAllRefreshesEachTargetWithItsScope() {
    given(resolver.persistedKeys()).willReturn(List.of(new NameCacheKey(3L, 0L, "BOGUS")));
    given(notifications.findDistinctGuildAndUser()).willReturn(List.<Object[]>of(new Object[] {1L, 5L}));
    given(notifications.findDistinctChannelIds()).willReturn(List.of(9L));
    given(notifications.findDistinctGuildIds()).willReturn(List.of());

    job.refreshAll();

    verify(resolver).refresh(NameType.USER, 5L, 1L);
    verify(resolver).refresh(NameType.CHANNEL, 9L, null);
  }
}
