package com.harness.noti.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.noti.schedule.DispatchEvent;
import com.harness.noti.schedule.DispatchListener;
import com.harness.noti.schedule.DispatchOutcome;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Outcome of every resolved occurrence, kept for the last {@value #MAX_SIZE} steps and pushed to
 * SSE subscribers. Subscribers may follow one guild or all of them.
 */
@Component
public class DispatchFeed implements DispatchListener {

  private static final Logger log = LoggerFactory.getLogger(DispatchFeed.class);
  static final int MAX_SIZE = 200;

  private final ObjectMapper objectMapper;
  private final Deque<Entry> recent = new ConcurrentLinkedDeque<>();
  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Map<DispatchOutcome, AtomicLong> totals = new EnumMap<>(DispatchOutcome.class);

  public DispatchFeed(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    for (DispatchOutcome outcome : DispatchOutcome.values()) {
      totals.put(outcome, new AtomicLong());
    }
  }

  @Override
  public void resolved(DispatchEvent event) {
    Entry entry = new Entry(sequence.incrementAndGet(), event);
    recent.addFirst(entry);
    while (recent.size() > MAX_SIZE) {
      recent.pollLast();
    }
    totals.get(event.outcome()).addAndGet(event.occurrences());
    broadcast(entry);
  }

  /** Most recent first; {@code guildId} null means every guild. */
  public List<Entry> recent(Long guildId) {
    List<Entry> matching = new ArrayList<>();
    for (Entry entry : recent) {
      if (guildId == null || entry.event().guildId() == guildId) {
        matching.add(entry);
      }
    }
    return matching;
  }

  /** Occurrences resolved per outcome since startup. */
  public Map<DispatchOutcome, Long> totals() {
    Map<DispatchOutcome, Long> snapshot = new EnumMap<>(DispatchOutcome.class);
    totals.forEach((outcome, count) -> snapshot.put(outcome, count.get()));
    return snapshot;
  }

  public SseEmitter subscribe(Long guildId) {
    SseEmitter emitter = new SseEmitter(0L);
    Subscription subscription = new Subscription(emitter, guildId);
    subscriptions.add(subscription);
    emitter.onCompletion(() -> subscriptions.remove(subscription));
    emitter.onTimeout(() -> subscriptions.remove(subscription));
    emitter.onError(e -> subscriptions.remove(subscription));
    return emitter;
  }

  int subscriberCount() {
    return subscriptions.size();
  }

  private void broadcast(Entry entry) {
    if (subscriptions.isEmpty()) {
      return;
    }
    String json;
    try {
      json = objectMapper.writeValueAsString(entry.event());
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize dispatch event {}", entry.sequence(), e);
      return;
    }
    for (Subscription subscription : subscriptions) {
      if (!subscription.accepts(entry.event())) {
        continue;
      }
      try {
        subscription.emitter().send(SseEmitter.event()
            .id(Long.toString(entry.sequence()))
            .name(entry.event().outcome().name().toLowerCase(Locale.ROOT))
            .data(json));
      } catch (IOException | IllegalStateException e) {
        log.debug("Dropping dispatch subscriber after send failure: {}", e.getMessage());
        subscriptions.remove(subscription);
      }
    }
  }

  public record Entry(long sequence, DispatchEvent event) {}

  private record Subscription(SseEmitter emitter, Long guildId) {

    boolean accepts(DispatchEvent event) {
      return guildId == null || guildId == event.guildId();
    }
  }
}
