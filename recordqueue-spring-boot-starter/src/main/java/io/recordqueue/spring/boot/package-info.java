/**
 * Spring Boot auto-configuration for the record queue.
 *
 * <p>{@link io.recordqueue.spring.boot.RecordQueueAutoConfiguration} wires a
 * {@link io.recordqueue.RecordQueue} from {@code recordqueue.*} application properties
 * and the application {@link javax.sql.DataSource}. Beans of type
 * {@link io.recordqueue.dispatch.JobInterceptor} are applied in {@code @Order} order.
 *
 * @see io.recordqueue.spring.boot.RecordQueueAutoConfiguration
 * @see io.recordqueue.spring.boot.RecordQueueProperties
 * @see io.recordqueue.spring.boot.RecordQueueLifecycle
 */
package io.recordqueue.spring.boot;
