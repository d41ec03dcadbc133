package io.recordqueue.dispatch;

import io.recordqueue.EditNotPermittedException;
import io.recordqueue.Job;
import io.recordqueue.JobContext;
import io.recordqueue.JobData;
import io.recordqueue.JobPriority;
import io.recordqueue.JobValidationException;
import io.recordqueue.RecordStoreException;
import io.recordqueue.StoreTimeoutException;
import io.recordqueue.StoredRecord;
import io.recordqueue.StubRecordStore;
import io.recordqueue.UnrecognizedActionException;
import io.recordqueue.dead.InMemoryDeadLetterSink;
import io.recordqueue.queue.JobQueue;
import io.recordqueue.spi.MetricsExporter;
import io.recordqueue.status.InMemoryJobStatusTracker;
import io.recordqueue.status.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobProcessorTest {

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsNullRecordStore() {
        assertThrows(NullPointerException.class, () -> JobProcessor.builder().build());
    }

    @Test
    void builderRejectsMaxAttemptsLessThanOne() {
        assertThrows(IllegalArgumentException.class, () ->
                JobProcessor.builder().recordStore(new StubRecordStore()).maxAttempts(0).build());
    }

    @Test
    void builderRequiresRetrySchedulerForRetries() {
        assertThrows(IllegalArgumentException.class, () ->
                JobProcessor.builder().recordStore(new StubRecordStore()).maxAttempts(3).build());
    }

    @Test
    void builderRejectsNullInterceptor() {
        assertThrows(NullPointerException.class, () -> JobProcessor.builder().interceptor(null));
    }

    // ── Actions ─────────────────────────────────────────────────────

    @Test
    void createStoresRecord() {
        var store = new StubRecordStore();
        var tracker = new InMemoryJobStatusTracker(10);
        try (var processor = JobProcessor.builder().recordStore(store).statusTracker(tracker).build()) {
            Job job = job(JobData.create("user-1", "{\"name\":\"Ayla\"}"));

            JobOutcome outcome = processor.process(job);

            StoredRecord record = assertInstanceOf(JobOutcome.Succeeded.class, outcome).record();
            assertEquals("user-1", record.ownerId());
            assertEquals(1, store.size());
            assertEquals(JobStatus.SUCCEEDED, tracker.find(job.id()).orElseThrow().status());
            assertEquals(1, tracker.find(job.id()).orElseThrow().attempts());
        }
    }

    @Test
    void createWithoutPayloadFailsValidationWithoutStoreCall() {
        var store = new StubRecordStore();
        var sink = new InMemoryDeadLetterSink(10);
        try (var processor = JobProcessor.builder().recordStore(store).deadLetterSink(sink).build()) {
            Job job = job(JobData.builder().action("create").ownerId("user-1").build());

            JobOutcome outcome = processor.process(job);

            Throwable error = assertInstanceOf(JobOutcome.Failed.class, outcome).error();
            assertInstanceOf(JobValidationException.class, error);
            assertEquals(0, store.calls.get());
            assertEquals("JobValidationException", sink.find(job.id()).orElseThrow().errorType());
        }
    }

    @Test
    void deleteWithoutActingAdminNeverReachesStore() {
        var store = new StubRecordStore();
        StoredRecord existing = store.seed("user-1", "{}", null);
        try (var processor = JobProcessor.builder().recordStore(store).build()) {
            JobOutcome noContext = processor.process(job(JobData.delete("user-1", existing.id(), null)));
            JobOutcome noAdmin = processor.process(job(JobData.delete("user-1", existing.id(),
                    JobContext.builder().reason("spam").build())));

            assertInstanceOf(JobOutcome.Failed.class, noContext);
            assertInstanceOf(JobOutcome.Failed.class, noAdmin);
            assertEquals(0, store.calls.get());
            assertTrue(!store.find(existing.id()).orElseThrow().deleted());
        }
    }

    @Test
    void deleteSoftDeletesRecord() {
        var store = new StubRecordStore();
        StoredRecord existing = store.seed("user-1", "{}", null);
        try (var processor = JobProcessor.builder().recordStore(store).build()) {
            JobOutcome outcome = processor.process(job(JobData.delete("user-1", existing.id(),
                    JobContext.ofAdmin("admin-7", "policy"))));

            assertInstanceOf(JobOutcome.Succeeded.class, outcome);
            StoredRecord deleted = store.find(existing.id()).orElseThrow();
            assertTrue(deleted.deleted());
            assertEquals("admin-7", deleted.deletedBy());
            assertNotNull(deleted.deletedAt());
        }
    }

    @Test
    void unknownActionIsRejected() {
        var store = new StubRecordStore();
        try (var processor = JobProcessor.builder().recordStore(store).build()) {
            JobOutcome outcome = processor.process(job(JobData.builder()
                    .action("archive").ownerId("u").targetId("t").build()));

            Throwable error = assertInstanceOf(JobOutcome.Failed.class, outcome).error();
            assertEquals("archive", assertInstanceOf(UnrecognizedActionException.class, error).action());
            assertEquals(0, store.calls.get());
        }
    }

    @Test
    void nonEditableUpdateFailsAndLeavesRecordUnchanged() {
        var store = new StubRecordStore();
        StoredRecord recent = store.seed("user-1", "{\"v\":1}", Instant.now().minus(Duration.ofDays(1)));
        var tracker = new InMemoryJobStatusTracker(10);
        try (var processor = JobProcessor.builder().recordStore(store).statusTracker(tracker).build()) {
            Job job = job(JobData.update("user-1", recent.id(), "{\"v\":2}"));

            JobOutcome outcome = processor.process(job);

            assertInstanceOf(EditNotPermittedException.class,
                    assertInstanceOf(JobOutcome.Failed.class, outcome).error());
            assertEquals("{\"v\":1}", store.find(recent.id()).orElseThrow().payloadJson());
            assertEquals(JobStatus.FAILED, tracker.find(job.id()).orElseThrow().status());
        }
    }

    @Test
    void updateAfterCooldownSucceeds() {
        var store = new StubRecordStore();
        StoredRecord old = store.seed("user-1", "{\"v\":1}", Instant.now().minus(Duration.ofDays(8)));
        try (var processor = JobProcessor.builder().recordStore(store).build()) {
            JobOutcome outcome = processor.process(job(JobData.update("user-1", old.id(), "{\"v\":2}")));

            StoredRecord updated = assertInstanceOf(JobOutcome.Succeeded.class, outcome).record();
            assertEquals("{\"v\":2}", updated.payloadJson());
            assertTrue(updated.edited());
        }
    }

    // ── Failures and retries ────────────────────────────────────────

    @Test
    void permanentStoreErrorIsNotRetried() {
        var store = new StubRecordStore().failNext(new RecordStoreException("constraint"));
        var jobQueue = new JobQueue();
        var scheduler = new RetryScheduler(jobQueue);
        try (var processor = JobProcessor.builder().recordStore(store)
                .maxAttempts(3).retryScheduler(scheduler).build()) {

            JobOutcome outcome = processor.process(job(JobData.create("u", "{}")));

            assertInstanceOf(JobOutcome.Failed.class, outcome);
            assertEquals(0, scheduler.waitingCount());
        } finally {
            scheduler.close();
        }
    }

    @Test
    void transientStoreErrorIsRequeuedWithNextAttempt() throws Exception {
        var store = new StubRecordStore().failNext(new RecordStoreException("connection reset", null, true));
        var jobQueue = new JobQueue();
        var tracker = new InMemoryJobStatusTracker(10);
        var scheduler = new RetryScheduler(jobQueue);
        try (var processor = JobProcessor.builder().recordStore(store).statusTracker(tracker)
                .maxAttempts(3).retryPolicy(attempts -> 0L).retryScheduler(scheduler).build()) {
            Job job = job(JobData.create("u", "{}"));

            JobOutcome outcome = processor.process(job);

            assertInstanceOf(JobOutcome.RetryScheduled.class, outcome);
            assertEquals(JobStatus.RETRY_SCHEDULED, tracker.find(job.id()).orElseThrow().status());
            Job retried = jobQueue.dequeue(Duration.ofSeconds(2)).orElseThrow();
            assertEquals(job.id(), retried.id());
            assertEquals(1, retried.attempts());

            assertInstanceOf(JobOutcome.Succeeded.class, processor.process(retried));
            assertEquals(2, tracker.find(job.id()).orElseThrow().attempts());
        } finally {
            scheduler.close();
        }
    }

    @Test
    void transientErrorOnLastAttemptIsTerminal() {
        var store = new StubRecordStore().failNext(new RecordStoreException("deadlock", null, true));
        var scheduler = new RetryScheduler(new JobQueue());
        var sink = new InMemoryDeadLetterSink(10);
        try (var processor = JobProcessor.builder().recordStore(store).deadLetterSink(sink)
                .maxAttempts(2).retryScheduler(scheduler).build()) {
            Job lastAttempt = new Job(Job.newJobId(), JobData.create("u", "{}"), JobPriority.NORMAL,
                    Instant.now(), 1);

            JobOutcome outcome = processor.process(lastAttempt);

            assertInstanceOf(JobOutcome.Failed.class, outcome);
            assertEquals(2, sink.find(lastAttempt.id()).orElseThrow().job().attempts());
        } finally {
            scheduler.close();
        }
    }

    @Test
    void slowStoreCallTimesOut() {
        var store = new StubRecordStore() {
            @Override
            public StoredRecord create(String ownerId, String payloadJson) {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.create(ownerId, payloadJson);
            }
        };
        try (var processor = JobProcessor.builder().recordStore(store)
                .storeCallTimeout(Duration.ofMillis(50)).build()) {

            JobOutcome outcome = processor.process(job(JobData.create("u", "{}")));

            Throwable error = assertInstanceOf(JobOutcome.Failed.class, outcome).error();
            assertTrue(assertInstanceOf(StoreTimeoutException.class, error).isTransient());
        }
    }

    @Test
    void failingDeadLetterSinkDoesNotPropagate() {
        var store = new StubRecordStore();
        try (var processor = JobProcessor.builder().recordStore(store)
                .deadLetterSink(dead -> {
                    throw new IllegalStateException("sink down");
                }).build()) {

            JobOutcome outcome = processor.process(job(JobData.builder().action("create").build()));

            assertInstanceOf(JobOutcome.Failed.class, outcome);
        }
    }

    @Test
    void unexpectedRuntimeExceptionBecomesFailure() {
        var store = new StubRecordStore().failNext(new IllegalStateException("bug"));
        try (var processor = JobProcessor.builder().recordStore(store).build()) {
            JobOutcome outcome = processor.process(job(JobData.create("u", "{}")));

            assertInstanceOf(IllegalStateException.class,
                    assertInstanceOf(JobOutcome.Failed.class, outcome).error());
        }
    }

    @Test
    void linkageErrorIsRecordedAsTerminalFailure() {
        var store = new StubRecordStore().failNext(new NoClassDefFoundError("org/h2/Driver"));
        var tracker = new InMemoryJobStatusTracker(10);
        var sink = new InMemoryDeadLetterSink(10);
        var metrics = new CountingMetrics();
        List<Throwable> seen = new ArrayList<>();
        try (var processor = JobProcessor.builder().recordStore(store)
                .statusTracker(tracker).deadLetterSink(sink).metrics(metrics)
                .interceptor(JobInterceptor.after((job, error) -> seen.add(error)))
                .build()) {
            Job job = job(JobData.create("u", "{}"));

            JobOutcome outcome = processor.process(job);

            assertInstanceOf(NoClassDefFoundError.class,
                    assertInstanceOf(JobOutcome.Failed.class, outcome).error());
            assertEquals(JobStatus.FAILED, tracker.find(job.id()).orElseThrow().status());
            assertEquals(1, metrics.failed);
            assertEquals(1, metrics.processingSamples);
            assertEquals("NoClassDefFoundError", sink.find(job.id()).orElseThrow().errorType());
            assertEquals(1, seen.size());
            assertInstanceOf(NoClassDefFoundError.class, seen.get(0));
        }
    }

    @Test
    void virtualMachineErrorIsRecordedThenRethrown() {
        var store = new StubRecordStore().failNext(new OutOfMemoryError("heap"));
        var tracker = new InMemoryJobStatusTracker(10);
        var sink = new InMemoryDeadLetterSink(10);
        try (var processor = JobProcessor.builder().recordStore(store)
                .statusTracker(tracker).deadLetterSink(sink).build()) {
            Job job = job(JobData.create("u", "{}"));

            assertThrows(OutOfMemoryError.class, () -> processor.process(job));

            assertEquals(JobStatus.FAILED, tracker.find(job.id()).orElseThrow().status());
            assertEquals("OutOfMemoryError", sink.find(job.id()).orElseThrow().errorType());
        }
    }

    // ── Interceptors and metrics ────────────────────────────────────

    @Test
    void interceptorsRunBeforeInOrderAndAfterInReverse() {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        try (var processor = JobProcessor.builder().recordStore(new StubRecordStore())
                .interceptor(named("first", calls))
                .interceptor(named("second", calls))
                .build()) {

            processor.process(job(JobData.create("u", "{}")));

            assertEquals(List.of("before:first", "before:second", "after:second", "after:first"), calls);
        }
    }

    @Test
    void failingBeforeHookFailsJobAndSkipsStore() {
        var store = new StubRecordStore();
        List<Throwable> seen = new ArrayList<>();
        try (var processor = JobProcessor.builder().recordStore(store)
                .interceptor(JobInterceptor.after((job, error) -> seen.add(error)))
                .interceptor(JobInterceptor.before(job -> {
                    throw new IllegalStateException("blocked");
                }))
                .build()) {

            JobOutcome outcome = processor.process(job(JobData.create("u", "{}")));

            assertInstanceOf(JobOutcome.Failed.class, outcome);
            assertEquals(0, store.calls.get());
            assertEquals(1, seen.size());
            assertEquals("blocked", seen.get(0).getMessage());
        }
    }

    @Test
    void afterHookErrorsAreIgnored() {
        try (var processor = JobProcessor.builder().recordStore(new StubRecordStore())
                .interceptor(JobInterceptor.after((job, error) -> {
                    throw new IllegalStateException("after failed");
                }))
                .build()) {

            assertInstanceOf(JobOutcome.Succeeded.class, processor.process(job(JobData.create("u", "{}"))));
        }
    }

    @Test
    void reportsOutcomeMetrics() {
        var metrics = new CountingMetrics();
        try (var processor = JobProcessor.builder().recordStore(new StubRecordStore())
                .metrics(metrics).build()) {
            processor.process(job(JobData.create("u1", "{}")));
            processor.process(job(JobData.create("u2", null)));

            assertEquals(1, metrics.succeeded);
            assertEquals(1, metrics.failed);
            assertEquals(2, metrics.processingSamples);
        }
    }

    private static JobInterceptor named(String name, List<String> calls) {
        return new JobInterceptor() {
            @Override
            public void beforeProcess(Job job) {
                calls.add("before:" + name);
            }

            @Override
            public void afterProcess(Job job, Throwable error) {
                calls.add("after:" + name);
            }
        };
    }

    private static Job job(JobData data) {
        return Job.newJob(data, JobPriority.NORMAL);
    }

    static final class CountingMetrics implements MetricsExporter {
        volatile int succeeded;
        volatile int failed;
        volatile int processingSamples;

        @Override
        public void incrementEnqueued(io.recordqueue.queue.Lane lane) {
        }

        @Override
        public synchronized void incrementSucceeded() {
            succeeded++;
        }

        @Override
        public synchronized void incrementFailed() {
            failed++;
        }

        @Override
        public void recordLaneDepths(int high, int normal, int low) {
        }

        @Override
        public synchronized void recordProcessingMs(long durationMs) {
            processingSamples++;
        }
    }
}
