package io.recordqueue.dispatch;

import io.recordqueue.Job;

/**
 * Hook around job processing.
 *
 * <p>For each attempt:
 * <ol>
 *   <li>{@link #beforeProcess} in registration order</li>
 *   <li>validation and the store call</li>
 *   <li>{@link #afterProcess} in reverse registration order, only for interceptors whose
 *       {@code beforeProcess} completed</li>
 * </ol>
 *
 * <p>An exception from {@code beforeProcess} fails the attempt like any other processing
 * error. Exceptions from {@code afterProcess} are logged and ignored.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RecordQueue.builder()
 *     .interceptor(JobInterceptor.after((job, error) -> {
 *         if (error != null) audit.failed(job.id(), error);
 *     }))
 *     ...
 * }</pre>
 */
public interface JobInterceptor {

    /**
     * Called before the job is validated and applied.
     *
     * @param job the job about to be processed
     * @throws Exception to fail this attempt
     */
    default void beforeProcess(Job job) throws Exception {
    }

    /**
     * Called after the attempt finished.
     *
     * @param job   the processed job
     * @param error {@code null} on success, otherwise the failure
     */
    default void afterProcess(Job job, Throwable error) {
    }

    static JobInterceptor before(BeforeHook hook) {
        return new JobInterceptor() {
            @Override
            public void beforeProcess(Job job) throws Exception {
                hook.accept(job);
            }
        };
    }

    static JobInterceptor after(AfterHook hook) {
        return new JobInterceptor() {
            @Override
            public void afterProcess(Job job, Throwable error) {
                hook.accept(job, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Job job) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Job job, Throwable error);
    }
}
