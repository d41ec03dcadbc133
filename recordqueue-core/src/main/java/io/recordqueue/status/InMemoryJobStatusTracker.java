package io.recordqueue.status;

import io.recordqueue.Job;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory {@link JobStatusTracker}. Keeps at most {@code maxEntries} jobs and
 * evicts the earliest-tracked job first.
 *
 * <p>Status is lost on restart, like the queued jobs themselves.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryJobStatusTracker implements JobStatusTracker {
  private final Map<String, JobStatusView> views;

  public InMemoryJobStatusTracker(int maxEntries) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
    }
    this.views = new LinkedHashMap<>(16, 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, JobStatusView> eldest) {
        return size() > maxEntries;
      }
    };
  }

  @Override
  public synchronized void record(Job job, JobStatus status, String error) {
    if (status == JobStatus.PENDING && views.containsKey(job.id())) {
      return;
    }
    views.put(job.id(), new JobStatusView(job.id(), job.action(), job.priority(), status,
        job.attempts(), error, Instant.now()));
  }

  @Override
  public synchronized Optional<JobStatusView> find(String jobId) {
    return Optional.ofNullable(views.get(jobId));
  }

  public synchronized int size() {
    return views.size();
  }
}
