package io.recordqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.recordqueue.queue.Lane;
import io.recordqueue.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code recordqueue.enqueued} (tag {@code lane}): jobs appended to a lane</li>
 *   <li>{@code recordqueue.jobs.succeeded}: jobs applied to the store</li>
 *   <li>{@code recordqueue.jobs.failed}: jobs that failed terminally</li>
 *   <li>{@code recordqueue.jobs.retried}: failed attempts scheduled for retry</li>
 *   <li>{@code recordqueue.jobs.dropped}: jobs discarded at shutdown</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code recordqueue.lane.depth} (tag {@code lane}): current lane depth</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code recordqueue.job.wait.ms}: time from enqueue to pickup</li>
 *   <li>{@code recordqueue.job.processing.ms}: time spent processing a job</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Map<Lane, Counter> enqueued = new EnumMap<>(Lane.class);
    private final Map<Lane, AtomicInteger> laneDepths = new EnumMap<>(Lane.class);
    private final List<Meter> meters = new ArrayList<>();
    private final Counter succeeded;
    private final Counter failed;
    private final Counter retried;
    private final Counter dropped;
    private final DistributionSummary waitTime;
    private final DistributionSummary processingTime;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "recordqueue"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "recordqueue");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "profiles.queue"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        for (Lane lane : Lane.values()) {
            String tag = lane.name().toLowerCase(Locale.ROOT);
            Counter counter = Counter.builder(namePrefix + ".enqueued")
                    .description("Jobs appended to a lane")
                    .tag("lane", tag)
                    .register(registry);
            enqueued.put(lane, counter);
            meters.add(counter);

            AtomicInteger depth = new AtomicInteger();
            laneDepths.put(lane, depth);
            meters.add(Gauge.builder(namePrefix + ".lane.depth", depth, AtomicInteger::get)
                    .description("Jobs currently waiting in a lane")
                    .tag("lane", tag)
                    .register(registry));
        }
        this.succeeded = register(Counter.builder(namePrefix + ".jobs.succeeded")
                .description("Jobs applied to the record store")
                .register(registry));
        this.failed = register(Counter.builder(namePrefix + ".jobs.failed")
                .description("Jobs that failed terminally")
                .register(registry));
        this.retried = register(Counter.builder(namePrefix + ".jobs.retried")
                .description("Failed attempts scheduled for retry")
                .register(registry));
        this.dropped = register(Counter.builder(namePrefix + ".jobs.dropped")
                .description("Jobs discarded at shutdown")
                .register(registry));
        this.waitTime = register(DistributionSummary.builder(namePrefix + ".job.wait.ms")
                .description("Time from enqueue to pickup in milliseconds")
                .register(registry));
        this.processingTime = register(DistributionSummary.builder(namePrefix + ".job.processing.ms")
                .description("Job processing time in milliseconds")
                .register(registry));
    }

    private <M extends Meter> M register(M meter) {
        meters.add(meter);
        return meter;
    }

    @Override
    public void incrementEnqueued(Lane lane) {
        if (closed) return;
        enqueued.get(lane).increment();
    }

    @Override
    public void incrementSucceeded() {
        if (closed) return;
        succeeded.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementRetried() {
        if (closed) return;
        retried.increment();
    }

    @Override
    public void incrementDropped(int count) {
        if (closed || count <= 0) return;
        dropped.increment(count);
    }

    @Override
    public void recordLaneDepths(int high, int normal, int low) {
        if (closed) return;
        laneDepths.get(Lane.HIGH).set(high);
        laneDepths.get(Lane.NORMAL).set(normal);
        laneDepths.get(Lane.LOW).set(low);
    }

    @Override
    public void recordWaitMs(long waitMs) {
        if (closed) return;
        waitTime.record(waitMs);
    }

    @Override
    public void recordProcessingMs(long durationMs) {
        if (closed) return;
        processingTime.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>{@link io.recordqueue.RecordQueue} calls this once its workers have stopped.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
