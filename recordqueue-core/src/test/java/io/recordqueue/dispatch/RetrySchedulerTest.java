package io.recordqueue.dispatch;

import io.recordqueue.Job;
import io.recordqueue.JobData;
import io.recordqueue.JobPriority;
import io.recordqueue.queue.JobQueue;
import io.recordqueue.spi.MetricsExporter;
import io.recordqueue.status.InMemoryJobStatusTracker;
import io.recordqueue.status.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RetrySchedulerTest {

  @Test
  void scheduledJobIsRequeuedAfterDelay() throws Exception {
    JobQueue queue = new JobQueue();
    try (RetryScheduler scheduler = new RetryScheduler(queue)) {
      Job job = job("a").withNextAttempt();

      assertTrue(scheduler.schedule(job, 20));

      Job requeued = queue.dequeue(Duration.ofSeconds(2)).orElseThrow();
      assertEquals(job.id(), requeued.id());
      assertEquals(1, requeued.attempts());
      assertEquals(0, scheduler.waitingCount());
    }
  }

  @Test
  void closeAndDrainReturnsWaitingJobsAndRejectsLaterSchedules() {
    RetryScheduler scheduler = new RetryScheduler(new JobQueue());
    Job waiting = job("a");
    assertTrue(scheduler.schedule(waiting, 60_000));

    List<Job> dropped = scheduler.closeAndDrain();

    assertEquals(1, dropped.size());
    assertEquals(waiting.id(), dropped.get(0).id());
    assertFalse(scheduler.schedule(job("b"), 10));
    assertEquals(0, scheduler.waitingCount());
  }

  @Test
  void scheduleRacingCloseEitherAcceptsAndDrainsOrRejects() throws Exception {
    RetryScheduler scheduler = new RetryScheduler(new JobQueue());
    Set<String> accepted = ConcurrentHashMap.newKeySet();
    int producers = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(producers);
    List<Job> dropped;
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int p = 0; p < producers; p++) {
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < 500; i++) {
            Job job = job("owner");
            if (scheduler.schedule(job, 60_000)) {
              accepted.add(job.id());
            }
          }
          return null;
        }));
      }
      start.countDown();
      Thread.sleep(5);
      dropped = scheduler.closeAndDrain();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    Set<String> droppedIds = new HashSet<>();
    for (Job job : dropped) {
      droppedIds.add(job.id());
    }
    assertEquals(accepted, droppedIds);
    assertEquals(0, scheduler.waitingCount());
  }

  @Test
  void releaseAfterQueueClosedMarksJobDropped() throws Exception {
    JobQueue queue = new JobQueue();
    InMemoryJobStatusTracker tracker = new InMemoryJobStatusTracker(10);
    try (RetryScheduler scheduler = new RetryScheduler(queue, tracker, MetricsExporter.NOOP)) {
      Job job = job("a");
      queue.close();

      assertTrue(scheduler.schedule(job, 10));

      assertTrue(WorkerPoolTest.waitFor(() -> tracker.find(job.id())
          .map(view -> view.status() == JobStatus.DROPPED).orElse(false), 2000));
    }
  }

  private static Job job(String ownerId) {
    return Job.newJob(JobData.create(ownerId, "{}"), JobPriority.NORMAL);
  }
}
