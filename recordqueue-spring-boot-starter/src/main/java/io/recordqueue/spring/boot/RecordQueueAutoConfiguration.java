package io.recordqueue.spring.boot;

import io.recordqueue.RecordQueue;
import io.recordqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.recordqueue.dispatch.JobInterceptor;
import io.recordqueue.dispatch.RetryPolicy;
import io.recordqueue.jdbc.ConnectionProvider;
import io.recordqueue.jdbc.DataSourceConnectionProvider;
import io.recordqueue.jdbc.JdbcRecordStore;
import io.recordqueue.jdbc.dead.JdbcDeadLetterSink;
import io.recordqueue.spi.DeadLetterSink;
import io.recordqueue.spi.MetricsExporter;
import io.recordqueue.spi.RecordStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the record queue.
 *
 * <p>Wires a {@link RecordQueue} backed by a {@link JdbcRecordStore} on the application
 * {@link DataSource}, configured from {@link RecordQueueProperties}. The queue is started
 * and stopped with the context by {@link RecordQueueLifecycle}. The store belongs to the
 * context, so the queue leaves it open at shutdown.
 *
 * @see RecordQueueProperties
 * @see RecordQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(RecordQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RecordQueueProperties.class)
public class RecordQueueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider recordQueueConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(RecordStore.class)
    public JdbcRecordStore recordStore(ConnectionProvider connectionProvider, RecordQueueProperties props) {
        return JdbcRecordStore.builder()
                .connectionProvider(connectionProvider)
                .tableName(props.getTableName())
                .editCooldown(props.getEditCooldown())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterSink.class)
    @ConditionalOnProperty(prefix = "recordqueue.dead-letter", name = "enabled", havingValue = "true")
    public JdbcDeadLetterSink deadLetterSink(ConnectionProvider connectionProvider, RecordQueueProperties props) {
        return new JdbcDeadLetterSink(connectionProvider, props.getDeadLetter().getTableName());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RecordQueue recordQueue(RecordQueueProperties props,
                                   RecordStore recordStore,
                                   ObjectProvider<MetricsExporter> metricsProvider,
                                   ObjectProvider<DeadLetterSink> deadLetterProvider,
                                   ObjectProvider<RetryPolicy> retryPolicyProvider,
                                   ObjectProvider<JobInterceptor> interceptorProvider) {
        RecordQueueProperties.Worker worker = props.getWorker();
        RetryPolicy retryPolicy = retryPolicyProvider.getIfAvailable(() -> new ExponentialBackoffRetryPolicy(
                props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()));

        var builder = RecordQueue.builder()
                .recordStore(recordStore)
                .workerCount(worker.getCount())
                .idleInterval(worker.getIdleInterval())
                .errorBackoff(worker.getErrorBackoff())
                .maxAttempts(worker.getMaxAttempts())
                .retryPolicy(retryPolicy)
                .statusRetention(props.getStatusRetention())
                .shutdownTimeout(props.getShutdownTimeout())
                .closeStoreOnShutdown(false);
        if (worker.getStoreCallTimeout() != null) {
            builder.storeCallTimeout(worker.getStoreCallTimeout());
        }
        if (worker.getAgingThreshold() != null) {
            builder.agingThreshold(worker.getAgingThreshold());
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        DeadLetterSink deadLetterSink = deadLetterProvider.getIfAvailable();
        if (deadLetterSink != null) {
            builder.deadLetterSink(deadLetterSink);
        }
        interceptorProvider.orderedStream().forEach(builder::interceptor);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordQueueLifecycle recordQueueLifecycle(RecordQueue recordQueue, RecordQueueProperties props) {
        return new RecordQueueLifecycle(recordQueue, props.isAutoStartup());
    }
}
