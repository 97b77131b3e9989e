package dbkit.config;

import dbkit.error.InvalidSettingException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, validated connection settings.
 *
 * <p>Built with {@link #builder()} or read from {@code DB_}-prefixed environment variables with
 * {@link #fromEnvironment(Map)}. Validation happens in {@link Builder#build()}; every failure
 * raises {@link InvalidSettingException} naming the offending setting.
 */
public final class DatabaseSettings {
  public static final String ENV_PREFIX = "DB_";
  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_VENDOR = "postgresql";
  public static final int DEFAULT_MAXIMUM_POOL_SIZE = 10;
  public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
  public static final String DEFAULT_POOL_NAME = "dbkit";

  private final String host;
  private final int port;
  private final String username;
  private final String password;
  private final String database;
  private final String vendor;
  private final String url;
  private final boolean echo;
  private final int maximumPoolSize;
  private final Duration connectionTimeout;
  private final String poolName;

  private DatabaseSettings(Builder builder) {
    this.host = requireText("host", builder.host);
    this.port = builder.port;
    if (port < 1 || port > 65535) {
      throw new InvalidSettingException("port", "must be between 1 and 65535, was " + port);
    }
    this.username = requireText("username", builder.username);
    this.password = requireText("password", builder.password);
    this.database = requireText("database", builder.database);
    this.vendor = requireText("vendor", builder.vendor);
    if (builder.url != null && !builder.url.startsWith("jdbc:")) {
      throw new InvalidSettingException("url", "must be a JDBC URL starting with 'jdbc:'");
    }
    this.url = builder.url;
    this.echo = builder.echo;
    this.maximumPoolSize = builder.maximumPoolSize;
    if (maximumPoolSize <= 0) {
      throw new InvalidSettingException("maximumPoolSize", "must be > 0, was " + maximumPoolSize);
    }
    this.connectionTimeout = builder.connectionTimeout;
    if (connectionTimeout == null || connectionTimeout.isZero() || connectionTimeout.isNegative()) {
      throw new InvalidSettingException("connectionTimeout", "must be positive");
    }
    this.poolName = requireText("poolName", builder.poolName);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads settings from the process environment.
   *
   * @see #fromEnvironment(Map)
   */
  public static DatabaseSettings fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads {@code DB_HOST}, {@code DB_PORT}, {@code DB_USERNAME}, {@code DB_PASSWORD},
   * {@code DB_DATABASE}, {@code DB_VENDOR}, {@code DB_URL}, {@code DB_ECHO} and
   * {@code DB_POOL_SIZE}. Absent variables fall back to the builder defaults.
   *
   * @param env environment variables
   * @return validated settings
   * @throws InvalidSettingException if a value is missing or malformed
   */
  public static DatabaseSettings fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    Builder builder = builder();
    String host = env.get(ENV_PREFIX + "HOST");
    if (host != null) {
      builder.host(host);
    }
    String port = env.get(ENV_PREFIX + "PORT");
    if (port != null) {
      builder.port(parseInt("port", port));
    }
    builder.username(env.get(ENV_PREFIX + "USERNAME"));
    builder.password(env.get(ENV_PREFIX + "PASSWORD"));
    builder.database(env.get(ENV_PREFIX + "DATABASE"));
    String vendor = env.get(ENV_PREFIX + "VENDOR");
    if (vendor != null) {
      builder.vendor(vendor);
    }
    builder.url(env.get(ENV_PREFIX + "URL"));
    String echo = env.get(ENV_PREFIX + "ECHO");
    if (echo != null) {
      builder.echo(parseBoolean("echo", echo));
    }
    String poolSize = env.get(ENV_PREFIX + "POOL_SIZE");
    if (poolSize != null) {
      builder.maximumPoolSize(parseInt("maximumPoolSize", poolSize));
    }
    return builder.build();
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public String database() {
    return database;
  }

  public String vendor() {
    return vendor;
  }

  /**
   * Returns the explicit URL if one was configured, else {@code jdbc:<vendor>://<host>:<port>/<database>}.
   */
  public String jdbcUrl() {
    if (url != null) {
      return url;
    }
    return "jdbc:" + vendor + "://" + host + ":" + port + "/" + database;
  }

  /**
   * Returns {@code true} if executed SQL should be logged.
   */
  public boolean echo() {
    return echo;
  }

  public int maximumPoolSize() {
    return maximumPoolSize;
  }

  public Duration connectionTimeout() {
    return connectionTimeout;
  }

  public String poolName() {
    return poolName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DatabaseSettings other)) return false;
    return port == other.port && echo == other.echo && maximumPoolSize == other.maximumPoolSize
        && host.equals(other.host) && username.equals(other.username) && password.equals(other.password)
        && database.equals(other.database) && vendor.equals(other.vendor) && Objects.equals(url, other.url)
        && connectionTimeout.equals(other.connectionTimeout) && poolName.equals(other.poolName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, username, password, database, vendor, url, echo, maximumPoolSize,
        connectionTimeout, poolName);
  }

  @Override
  public String toString() {
    return "DatabaseSettings{url=" + jdbcUrl() + ", username=" + username + ", password=****"
        + ", echo=" + echo + ", maximumPoolSize=" + maximumPoolSize
        + ", connectionTimeout=" + connectionTimeout + ", poolName=" + poolName + "}";
  }

  private static String requireText(String setting, String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidSettingException(setting, "must not be empty");
    }
    return value;
  }

  private static int parseInt(String setting, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidSettingException(setting, "not an integer: " + value, e);
    }
  }

  private static boolean parseBoolean(String setting, String value) {
    String v = value.trim();
    if (v.equalsIgnoreCase("true") || v.equals("1")) {
      return true;
    }
    if (v.equalsIgnoreCase("false") || v.equals("0")) {
      return false;
    }
    throw new InvalidSettingException(setting, "not a boolean: " + value);
  }

  public static final class Builder {
    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String username;
    private String password;
    private String database;
    private String vendor = DEFAULT_VENDOR;
    private String url;
    private boolean echo;
    private int maximumPoolSize = DEFAULT_MAXIMUM_POOL_SIZE;
    private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    private String poolName = DEFAULT_POOL_NAME;

    private Builder() {}

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder database(String database) {
      this.database = database;
      return this;
    }

    /**
     * Sets the JDBC subprotocol used to derive the URL, e.g. {@code postgresql} or {@code mysql}.
     */
    public Builder vendor(String vendor) {
      this.vendor = vendor;
      return this;
    }

    /**
     * Sets an explicit JDBC URL that takes precedence over host, port, vendor and database.
     */
    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder echo(boolean echo) {
      this.echo = echo;
      return this;
    }

    public Builder maximumPoolSize(int maximumPoolSize) {
      this.maximumPoolSize = maximumPoolSize;
      return this;
    }

    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    public Builder poolName(String poolName) {
      this.poolName = poolName;
      return this;
    }

    public DatabaseSettings build() {
      return new DatabaseSettings(this);
    }
  }
}
