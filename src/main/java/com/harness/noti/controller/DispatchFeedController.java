package com.harness.noti.controller;

import com.harness.noti.feed.DispatchFeed;
import com.harness.noti.schedule.DispatchOutcome;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1/dispatches")
public class DispatchFeedController {

  private final DispatchFeed feed;

  public DispatchFeedController(DispatchFeed feed) {
    this.feed = feed;
  }

  @GetMapping
  public ResponseEntity<List<DispatchFeed.Entry>> recent(@RequestParam(required = false) Long guildId) {
    return ResponseEntity.ok(feed.recent(guildId));
  }

  @GetMapping("/totals")
  public ResponseEntity<Map<DispatchOutcome, Long>> totals() {
    return ResponseEntity.ok(feed.totals());
  }

  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(@RequestParam(required = false) Long guildId) {
    return feed.subscribe(guildId);
  }
}
