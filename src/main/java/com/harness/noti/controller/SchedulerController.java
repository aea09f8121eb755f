package com.harness.noti.controller;

import com.harness.noti.schedule.SchedulerManager;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hooks for the delivery channel's connection lifecycle: pause on disconnect so nothing fires
 * twice, resume to rebuild the tasks from the store.
 */
@RestController
@RequestMapping("/api/v1/scheduler")
public class SchedulerController {

  private final SchedulerManager scheduler;

  public SchedulerController(SchedulerManager scheduler) {
    this.scheduler = scheduler;
  }

  @PostMapping("/pause")
  public ResponseEntity<Void> pause() {
    scheduler.stopAll();
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/resume")
  public ResponseEntity<ResumeResponse> resume() {
    return ResponseEntity.ok(new ResumeResponse(scheduler.loadAll()));
  }

  @GetMapping("/tasks")
  public ResponseEntity<List<SchedulerManager.TaskSnapshot>> liveTasks() {
    return ResponseEntity.ok(scheduler.liveTasks());
  }

  public record ResumeResponse(int started) {}
}
