package dbkit.spring.boot;

import dbkit.config.AppVersion;
import dbkit.event.EventDispatcher;
import dbkit.jdbc.DatabaseConnectionManager;
import dbkit.spi.RepositoryMetrics;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for dbkit.
 *
 * <p>Creates a {@link DatabaseConnectionManager} initialized from {@code dbkit.datasource.*} (when a
 * username is configured) and closed with the context, an {@link EventDispatcher}, and an
 * {@link AppVersion} when {@code dbkit.version} is set.
 *
 * @see DbKitProperties
 * @see DbKitMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DatabaseConnectionManager.class)
@EnableConfigurationProperties(DbKitProperties.class)
public class DbKitAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "dbkit.datasource", name = "username")
  public DatabaseConnectionManager databaseConnectionManager(DbKitProperties props,
      ObjectProvider<RepositoryMetrics> metricsProvider) {
    DatabaseConnectionManager manager =
        new DatabaseConnectionManager(metricsProvider.getIfAvailable(() -> RepositoryMetrics.NOOP));
    manager.init(props.getDatasource().toSettings());
    return manager;
  }

  @Bean
  @ConditionalOnMissingBean
  public EventDispatcher eventDispatcher() {
    return new EventDispatcher();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "dbkit", name = "version")
  public AppVersion appVersion(DbKitProperties props) {
    return AppVersion.parse(props.getVersion());
  }
}
