package io.recordqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.recordqueue.micrometer.MicrometerMetricsExporter;
import io.recordqueue.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code recordqueue.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link RecordQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the queue. The queue closes the exporter at
 * shutdown, which removes its meters.
 */
@AutoConfiguration(before = RecordQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "recordqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RecordQueueProperties.class)
public class RecordQueueMicrometerAutoConfiguration {

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, RecordQueueProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
