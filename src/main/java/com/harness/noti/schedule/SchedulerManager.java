package com.harness.noti.schedule;

import com.harness.noti.model.NotificationRecord;
import com.harness.noti.service.NotificationStore;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Keeps exactly one live {@link DispatchTask} per stored notification, each on its own thread.
 */
@Component
public class SchedulerManager implements DispatchTask.Owner {

  private static final Logger log = LoggerFactory.getLogger(SchedulerManager.class);

  private final NotificationStore store;
  private final DispatchContext context;
  private final ExecutorService executor;

  private final Map<Long, RunningTask> tasks = new ConcurrentHashMap<>();

  public SchedulerManager(NotificationStore store,
                          DispatchContext context,
                          @Qualifier("dispatchExecutor") ExecutorService executor) {
    this.store = store;
    this.context = context;
    this.executor = executor;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    loadAll();
  }

  /**
   * Starts a task for every stored notification that has none yet. Safe to call again after
   * {@link #stopAll()}. A record whose task cannot be built is logged and left in the store.
   *
   * @return number of tasks started
   */
  public int loadAll() {
    List<NotificationRecord> records = store.listAll();
    int started = 0;
    int broken = 0;
    for (NotificationRecord record : records) {
      try {
        if (start(record)) {
          started++;
        }
      } catch (RuntimeException e) {
        broken++;
        log.error("Cannot schedule notification {}, skipping it", record.id(), e);
      }
    }
    log.info("Loaded {} notifications, started {} tasks, {} unschedulable",
        records.size(), started, broken);
    return started;
  }

  /**
   * Starts the task for a freshly stored notification.
   *
   * @return false when a task for that id is already running
   */
  public boolean add(NotificationRecord record) {
    if (record.id() == null) {
      throw new IllegalArgumentException("notification must be stored before it is scheduled");
    }
    boolean started = start(record);
    if (!started) {
      log.debug("Task for notification {} already running, not starting another", record.id());
    }
    return started;
  }

  /** Cancels the task for {@code id}. Unknown ids are ignored. */
  public boolean remove(long id) {
    RunningTask running = tasks.remove(id);
    if (running == null) {
      return false;
    }
    running.cancel();
    log.info("Removed task for notification {}", id);
    return true;
  }

  @Override
  public void deleteRecord(long id) {
    boolean deleted = store.delete(id);
    log.debug("Deleted notification record {} (existed={})", id, deleted);
  }

  @Override
  public void taskFinished(DispatchTask task) {
    tasks.computeIfPresent(task.id(), (id, running) -> running.task() == task ? null : running);
  }

  /** Cancels every task, leaving stored notifications untouched for a later {@link #loadAll()}. */
  @PreDestroy
  public void stopAll() {
    int count = tasks.size();
    tasks.values().forEach(RunningTask::cancel);
    tasks.clear();
    log.warn("Stopped {} notification tasks", count);
  }

  public boolean isRunning(long id) {
    return tasks.containsKey(id);
  }

  public List<TaskSnapshot> liveTasks() {
    return tasks.values().stream()
        .map(running -> new TaskSnapshot(
            running.task().id(),
            running.task().state(),
            running.task().scheduledTime().orElse(null)))
        .sorted(Comparator.comparingLong(TaskSnapshot::id))
        .toList();
  }

  private boolean start(NotificationRecord record) {
    boolean[] started = {false};
    tasks.computeIfAbsent(record.id(), id -> {
      DispatchTask task = new DispatchTask(record, context, this);
      Future<?> future = executor.submit(task);
      started[0] = true;
      return new RunningTask(task, future);
    });
    return started[0];
  }

  public record TaskSnapshot(long id, TaskState state, Instant scheduledTime) {}

  private record RunningTask(DispatchTask task, Future<?> future) {

    void cancel() {
      task.cancel();
      future.cancel(true);
    }
  }
}
