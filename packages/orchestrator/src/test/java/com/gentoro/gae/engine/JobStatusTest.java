package com.gentoro.gae.engine;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class JobStatusTest {

  @ParameterizedTest
  @CsvSource({
    "done, COMPLETED",
    "Succeeded, COMPLETED",
    "error, FAILED",
    "queued, PENDING",
    "canceled, CANCELLED",
    "running, RUNNING",
    "loading vertices, RUNNING"
  })
  void fromRemoteState(String state, JobStatus expected) {
    assertEquals(expected, JobStatus.fromRemoteState(state));
  }

  @Test
  @DisplayName("no state means the job is still pending")
  void blank() {
    assertEquals(JobStatus.PENDING, JobStatus.fromRemoteState(null));
    assertFalse(JobStatus.PENDING.isTerminal());
    assertTrue(JobStatus.CANCELLED.isTerminal());
  }
}
