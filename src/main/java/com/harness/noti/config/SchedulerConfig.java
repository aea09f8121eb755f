package com.harness.noti.config;

import com.harness.noti.delivery.DeliveryChannel;
import com.harness.noti.interval.Interval;
import com.harness.noti.names.DirectoryLookup;
import com.harness.noti.names.NameResolver;
import com.harness.noti.schedule.ClockSleeper;
import com.harness.noti.schedule.DispatchContext;
import com.harness.noti.schedule.DispatchListener;
import com.harness.noti.schedule.DispatchSettings;
import com.harness.noti.schedule.Sleeper;
import com.harness.noti.service.NotificationStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SchedulerConfig {

  private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

  static final String DEFAULT_DELIVER_LATE = "2min";
  static final String DEFAULT_PREFETCH_BUFFER = "5s";
  static final String DEFAULT_RETRY_BACKOFF = "5s";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper(Clock clock) {
    return new ClockSleeper(clock);
  }

  @Bean
  public DispatchSettings dispatchSettings(
      @Value("${noti.dispatch.deliver-late:" + DEFAULT_DELIVER_LATE + "}") String deliverLate,
      @Value("${noti.dispatch.prefetch-buffer:" + DEFAULT_PREFETCH_BUFFER + "}") String prefetchBuffer,
      @Value("${noti.dispatch.retry-backoff:" + DEFAULT_RETRY_BACKOFF + "}") String retryBackoff) {
    DispatchSettings settings = new DispatchSettings(
        parseDuration("noti.dispatch.deliver-late", deliverLate, DEFAULT_DELIVER_LATE),
        parseDuration("noti.dispatch.prefetch-buffer", prefetchBuffer, DEFAULT_PREFETCH_BUFFER),
        parseDuration("noti.dispatch.retry-backoff", retryBackoff, DEFAULT_RETRY_BACKOFF)
    );
    log.info("Dispatch settings: lateWindow={}, prefetch={}, retryBackoff={}",
        settings.lateDeliveryWindow(), settings.prefetchBuffer(), settings.retryBackoff());
    return settings;
  }

  @Bean
  public DispatchContext dispatchContext(NotificationStore store,
                                         DeliveryChannel channel,
                                         NameResolver names,
                                         DispatchSettings settings,
                                         Clock clock,
                                         Sleeper sleeper,
                                         DispatchListener listener) {
    return new DispatchContext(store, channel, names, settings, clock, sleeper, listener);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService dispatchExecutor() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "dispatch-task-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /** Used until a platform integration contributes its own lookup. */
  @Bean
  @ConditionalOnMissingBean(DirectoryLookup.class)
  public DirectoryLookup directoryLookup() {
    return (type, id, scopeId) -> {
      log.debug("No directory configured, cannot resolve {} {}", type, id);
      return Optional.empty();
    };
  }

  /** Parses {@code text}, falling back to {@code fallback} (itself interval text) when invalid. */
  static Duration parseDuration(String key, String text, String fallback) {
    Optional<Interval> parsed = Interval.parse(text);
    if (parsed.isEmpty()) {
      log.warn("Invalid duration '{}' for {}, using {}", text, key, fallback);
      parsed = Interval.parse(fallback);
    }
    return parsed.orElseThrow().toDuration();
  }
}
