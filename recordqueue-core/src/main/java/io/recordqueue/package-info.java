/**
 * Root API for record-queue: an in-process priority job queue that applies record
 * mutations (create, update, soft delete) asynchronously.
 *
 * <h2>Core Design</h2>
 * <p>Producers hand a {@link io.recordqueue.JobData} and a
 * {@link io.recordqueue.JobPriority} to {@link io.recordqueue.RecordQueue#enqueue} and
 * receive a job id immediately. Jobs are routed to one of three FIFO lanes
 * (high, normal, low). A fixed pool of workers always serves the highest non-empty lane
 * first and applies each job against a {@link io.recordqueue.spi.RecordStore}.
 *
 * <p>A failing job never stops a worker. Validation errors, edit rejections and store
 * errors are logged, recorded in the job's status and handed to the
 * {@linkplain io.recordqueue.spi.DeadLetterSink dead-letter sink}. Queued jobs are held in
 * memory only and are dropped at shutdown.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>recordqueue-core</b>: model, lanes, workers, processor</li>
 *   <li><b>recordqueue-jdbc</b>: JDBC record store (H2, PostgreSQL), dead-letter table</li>
 *   <li><b>recordqueue-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>recordqueue-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * @see io.recordqueue.RecordQueue
 * @see io.recordqueue.JobData
 * @see io.recordqueue.spi.RecordStore
 */
package io.recordqueue;
