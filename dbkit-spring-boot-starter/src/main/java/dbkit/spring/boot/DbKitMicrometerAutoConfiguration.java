package dbkit.spring.boot;

import dbkit.micrometer.MicrometerRepositoryMetrics;
import dbkit.spi.RepositoryMetrics;
import io.micrometer.core.instrument.MeterRegistry;

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
 * <p>Creates a {@link MicrometerRepositoryMetrics} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code dbkit.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link DbKitAutoConfiguration} so the {@link RepositoryMetrics} bean is
 * available to the connection manager.
 */
@AutoConfiguration(before = DbKitAutoConfiguration.class)
@ConditionalOnClass({MicrometerRepositoryMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "dbkit.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(DbKitProperties.class)
public class DbKitMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(RepositoryMetrics.class)
  public MicrometerRepositoryMetrics micrometerRepositoryMetrics(MeterRegistry meterRegistry,
      DbKitProperties props) {
    return new MicrometerRepositoryMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
