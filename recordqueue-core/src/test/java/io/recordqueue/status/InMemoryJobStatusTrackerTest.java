package io.recordqueue.status;

import io.recordqueue.Job;
import io.recordqueue.JobData;
import io.recordqueue.JobPriority;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStatusTrackerTest {

  @Test
  void recordsLatestState() {
    InMemoryJobStatusTracker tracker = new InMemoryJobStatusTracker(10);
    Job job = job();

    tracker.record(job, JobStatus.PENDING, null);
    tracker.record(job, JobStatus.PROCESSING, null);
    tracker.record(job.withNextAttempt(), JobStatus.FAILED, "boom");

    JobStatusView view = tracker.find(job.id()).orElseThrow();
    assertEquals(JobStatus.FAILED, view.status());
    assertEquals(1, view.attempts());
    assertEquals("boom", view.lastError());
    assertEquals("create", view.action());
    assertEquals(JobPriority.NORMAL, view.priority());
  }

  @Test
  void latePendingDoesNotOverwriteProgress() {
    InMemoryJobStatusTracker tracker = new InMemoryJobStatusTracker(10);
    Job job = job();

    tracker.record(job, JobStatus.PROCESSING, null);
    tracker.record(job, JobStatus.PENDING, null);

    assertEquals(JobStatus.PROCESSING, tracker.find(job.id()).orElseThrow().status());
  }

  @Test
  void evictsEarliestTrackedJob() {
    InMemoryJobStatusTracker tracker = new InMemoryJobStatusTracker(2);
    Job first = job();
    Job second = job();
    Job third = job();

    tracker.record(first, JobStatus.PENDING, null);
    tracker.record(second, JobStatus.PENDING, null);
    tracker.record(third, JobStatus.PENDING, null);

    assertFalse(tracker.find(first.id()).isPresent());
    assertTrue(tracker.find(third.id()).isPresent());
    assertEquals(2, tracker.size());
  }

  @Test
  void terminalStates() {
    assertTrue(JobStatus.SUCCEEDED.isTerminal());
    assertTrue(JobStatus.FAILED.isTerminal());
    assertTrue(JobStatus.DROPPED.isTerminal());
    assertFalse(JobStatus.RETRY_SCHEDULED.isTerminal());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new InMemoryJobStatusTracker(0));
  }

  private static Job job() {
    return Job.newJob(JobData.create("owner", "{}"), JobPriority.NORMAL);
  }
}
