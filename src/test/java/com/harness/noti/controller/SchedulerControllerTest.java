package com.harness.noti.controller;

import com.harness.noti.schedule.SchedulerManager;
import com.harness.noti.schedule.TaskState;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SchedulerController.class)
class SchedulerControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private SchedulerManager scheduler;

  @Test
  void pauseStopsAllTasks() throws Exception {
    mockMvc.perform(post("/api/v1/scheduler/pause"))
        .andExpect(status().isNoContent());

    verify(scheduler).stopAll();
  }

  @Test
  void resumeReloadsFromStore() throws Exception {
    given(scheduler.loadAll()).willReturn(4);

    mockMvc.perform(post("/api/v1/scheduler/resume"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.started").value(4));
  }

  @Test
  void tasksListsLiveSnapshots() throws Exception {
    given(scheduler.liveTasks()).willReturn(List.of(new SchedulerManager.TaskSnapshot(
        7L, TaskState.WAITING_DISPATCH, Instant.parse("2026-03-01T10:00:00Z"))));

    mockMvc.perform(get("/api/v1/scheduler/tasks"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(7))
        .andExpect(jsonPath("$[0].state").value("WAITING_DISPATCH"));
  }
}
