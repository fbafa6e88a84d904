package io.scilit;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for one database file and its connection pool.
 *
 * <p>Create instances via {@link #builder()}; every value has a default and is
 * range-checked when {@link Builder#build()} is called.
 *
 * <pre>{@code
 * DatabaseConfig config = DatabaseConfig.builder()
 *     .path(Path.of("data/literature.db"))
 *     .poolSize(8)
 *     .acquireTimeout(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 */
public final class DatabaseConfig {
  public static final Path DEFAULT_PATH = Paths.get("data", "scientific_literature.db");
  public static final int DEFAULT_POOL_SIZE = 5;
  public static final int MIN_POOL_SIZE = 1;
  public static final int MAX_POOL_SIZE = 20;
  public static final int DEFAULT_CACHE_SIZE_PAGES = 2000;
  public static final int MIN_CACHE_SIZE_PAGES = 100;
  public static final int MAX_CACHE_SIZE_PAGES = 1_000_000;
  public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);

  private static final Duration MAX_TIMEOUT = Duration.ofMinutes(10);

  private final Path path;
  private final int poolSize;
  private final boolean walEnabled;
  private final int cacheSizePages;
  private final SynchronousMode synchronousMode;
  private final Duration acquireTimeout;
  private final Duration busyTimeout;
  private final Path schemaScript;

  private DatabaseConfig(Builder builder) {
    this.path = Objects.requireNonNull(builder.path, "path");
    this.synchronousMode = Objects.requireNonNull(builder.synchronousMode, "synchronousMode");
    this.acquireTimeout = Objects.requireNonNull(builder.acquireTimeout, "acquireTimeout");
    this.busyTimeout = Objects.requireNonNull(builder.busyTimeout, "busyTimeout");

    if (path.toString().isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    if (builder.poolSize < MIN_POOL_SIZE || builder.poolSize > MAX_POOL_SIZE) {
      throw new IllegalArgumentException(
          "poolSize must be between " + MIN_POOL_SIZE + " and " + MAX_POOL_SIZE + ": " + builder.poolSize);
    }
    if (builder.cacheSizePages < MIN_CACHE_SIZE_PAGES || builder.cacheSizePages > MAX_CACHE_SIZE_PAGES) {
      throw new IllegalArgumentException("cacheSizePages must be between " + MIN_CACHE_SIZE_PAGES
          + " and " + MAX_CACHE_SIZE_PAGES + ": " + builder.cacheSizePages);
    }
    if (acquireTimeout.isNegative() || acquireTimeout.isZero() || acquireTimeout.compareTo(MAX_TIMEOUT) > 0) {
      throw new IllegalArgumentException("acquireTimeout must be > 0 and <= " + MAX_TIMEOUT + ": " + acquireTimeout);
    }
    if (busyTimeout.isNegative() || busyTimeout.compareTo(MAX_TIMEOUT) > 0) {
      throw new IllegalArgumentException("busyTimeout must be >= 0 and <= " + MAX_TIMEOUT + ": " + busyTimeout);
    }

    this.poolSize = builder.poolSize;
    this.walEnabled = builder.walEnabled;
    this.cacheSizePages = builder.cacheSizePages;
    this.schemaScript = builder.schemaScript;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Configuration with every value at its default. */
  public static DatabaseConfig defaults() {
    return builder().build();
  }

  public Path path() {
    return path;
  }

  /** JDBC URL of the database file. */
  public String jdbcUrl() {
    return "jdbc:sqlite:" + path.toAbsolutePath();
  }

  public int poolSize() {
    return poolSize;
  }

  public boolean walEnabled() {
    return walEnabled;
  }

  /** Page cache size applied to every connection, in pages. */
  public int cacheSizePages() {
    return cacheSizePages;
  }

  public SynchronousMode synchronousMode() {
    return synchronousMode;
  }

  public Duration acquireTimeout() {
    return acquireTimeout;
  }

  public Duration busyTimeout() {
    return busyTimeout;
  }

  /** Explicit schema script location; empty means "resolve next to the database, else bundled". */
  public Optional<Path> schemaScript() {
    return Optional.ofNullable(schemaScript);
  }

  /** Returns a builder pre-populated with this configuration's values. */
  public Builder toBuilder() {
    return new Builder()
        .path(path)
        .poolSize(poolSize)
        .walEnabled(walEnabled)
        .cacheSizePages(cacheSizePages)
        .synchronousMode(synchronousMode)
        .acquireTimeout(acquireTimeout)
        .busyTimeout(busyTimeout)
        .schemaScript(schemaScript);
  }

  @Override
  public String toString() {
    return "DatabaseConfig{path=" + path
        + ", poolSize=" + poolSize
        + ", walEnabled=" + walEnabled
        + ", cacheSizePages=" + cacheSizePages
        + ", synchronousMode=" + synchronousMode
        + ", acquireTimeout=" + acquireTimeout
        + ", busyTimeout=" + busyTimeout
        + ", schemaScript=" + schemaScript + '}';
  }

  public static final class Builder {
    private Path path = DEFAULT_PATH;
    private int poolSize = DEFAULT_POOL_SIZE;
    private boolean walEnabled = true;
    private int cacheSizePages = DEFAULT_CACHE_SIZE_PAGES;
    private SynchronousMode synchronousMode = SynchronousMode.NORMAL;
    private Duration acquireTimeout = DEFAULT_ACQUIRE_TIMEOUT;
    private Duration busyTimeout = DEFAULT_BUSY_TIMEOUT;
    private Path schemaScript;

    private Builder() {
    }

    public Builder path(Path path) {
      this.path = path;
      return this;
    }

    public Builder path(String path) {
      this.path = Paths.get(Objects.requireNonNull(path, "path"));
      return this;
    }

    public Builder poolSize(int poolSize) {
      this.poolSize = poolSize;
      return this;
    }

    public Builder walEnabled(boolean walEnabled) {
      this.walEnabled = walEnabled;
      return this;
    }

    public Builder cacheSizePages(int cacheSizePages) {
      this.cacheSizePages = cacheSizePages;
      return this;
    }

    public Builder synchronousMode(SynchronousMode synchronousMode) {
      this.synchronousMode = synchronousMode;
      return this;
    }

    public Builder acquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    public Builder busyTimeout(Duration busyTimeout) {
      this.busyTimeout = busyTimeout;
      return this;
    }

    public Builder schemaScript(Path schemaScript) {
      this.schemaScript = schemaScript;
      return this;
    }

    public DatabaseConfig build() {
      return new DatabaseConfig(this);
    }
  }
}
