package dbkit.spring.boot;

import dbkit.config.DatabaseSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for dbkit.
 *
 * @see DbKitAutoConfiguration
 */
@ConfigurationProperties(prefix = "dbkit")
public class DbKitProperties {

  /**
   * Application version, {@code YEAR.MONTH.PATCH}.
   */
  private String version;

  private final Datasource datasource = new Datasource();
  private final Metrics metrics = new Metrics();

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public Datasource getDatasource() {
    return datasource;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Datasource {
    private String host = DatabaseSettings.DEFAULT_HOST;
    private int port = DatabaseSettings.DEFAULT_PORT;
    private String username;
    private String password;
    private String database;
    private String vendor = DatabaseSettings.DEFAULT_VENDOR;
    /**
     * Explicit JDBC URL; overrides host, port, vendor and database when set.
     */
    private String url;
    /**
     * Log every SQL statement at INFO.
     */
    private boolean echo;
    private int maximumPoolSize = DatabaseSettings.DEFAULT_MAXIMUM_POOL_SIZE;
    private Duration connectionTimeout = DatabaseSettings.DEFAULT_CONNECTION_TIMEOUT;
    private String poolName = DatabaseSettings.DEFAULT_POOL_NAME;

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public String getDatabase() {
      return database;
    }

    public void setDatabase(String database) {
      this.database = database;
    }

    public String getVendor() {
      return vendor;
    }

    public void setVendor(String vendor) {
      this.vendor = vendor;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public boolean isEcho() {
      return echo;
    }

    public void setEcho(boolean echo) {
      this.echo = echo;
    }

    public int getMaximumPoolSize() {
      return maximumPoolSize;
    }

    public void setMaximumPoolSize(int maximumPoolSize) {
      this.maximumPoolSize = maximumPoolSize;
    }

    public Duration getConnectionTimeout() {
      return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
    }

    public String getPoolName() {
      return poolName;
    }

    public void setPoolName(String poolName) {
      this.poolName = poolName;
    }

    /**
     * Validates these properties into {@link DatabaseSettings}.
     *
     * @throws dbkit.error.InvalidSettingException if a value is missing or out of range
     */
    public DatabaseSettings toSettings() {
      return DatabaseSettings.builder()
          .host(host)
          .port(port)
          .username(username)
          .password(password)
          .database(database)
          .vendor(vendor)
          .url(url)
          .echo(echo)
          .maximumPoolSize(maximumPoolSize)
          .connectionTimeout(connectionTimeout)
          .poolName(poolName)
          .build();
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "dbkit.repository";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
