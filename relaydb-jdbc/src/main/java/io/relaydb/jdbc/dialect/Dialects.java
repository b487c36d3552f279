package io.relaydb.jdbc.dialect;

import io.relaydb.jdbc.RelayStoreException;
import io.relaydb.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Chooses the {@link Dialect}, and so the migration catalog, for a database.
 *
 * <p>Dialects come from {@code META-INF/services/io.relaydb.jdbc.spi.Dialect}. Two
 * dialects claiming the same name or the same JDBC URL prefix would make the catalog
 * ambiguous and are rejected when this class loads.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * MigrationRunner runner = MigrationRunner.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .dialect(dialect)
 *     .build();
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME;
  private static final Map<String, Dialect> BY_URL_PREFIX;

  static {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    Map<String, Dialect> byPrefix = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      Dialect previous = byName.putIfAbsent(key(dialect.name()), dialect);
      if (previous != null) {
        throw new IllegalStateException("Dialects " + previous.getClass().getName() + " and " +
            dialect.getClass().getName() + " are both named '" + dialect.name() + "'");
      }
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        previous = byPrefix.putIfAbsent(prefix, dialect);
        if (previous != null) {
          throw new IllegalStateException("JDBC URL prefix " + prefix + " is claimed by both " +
              previous.name() + " and " + dialect.name());
        }
      }
    }
    BY_NAME = Map.copyOf(byName);
    BY_URL_PREFIX = byPrefix;
  }

  private Dialects() {
  }

  /**
   * Registered dialects, in service-file order.
   */
  public static List<Dialect> all() {
    return BY_URL_PREFIX.values().stream().distinct().toList();
  }

  /**
   * @throws IllegalArgumentException if no dialect has that name (case-insensitive)
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(key(name));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + describe());
    }
    return dialect;
  }

  /**
   * Dialect whose URL prefix matches {@code jdbcUrl}, if any.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    return BY_URL_PREFIX.entrySet().stream()
        .filter(e -> jdbcUrl.startsWith(e.getKey()))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  /**
   * Detects the dialect from the URL the driver reports for a live connection.
   *
   * @throws RelayStoreException if no connection can be obtained
   * @throws IllegalArgumentException if the database has no migration catalog
   */
  public static Dialect detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to read the JDBC URL needed to choose a migration dialect", e);
    }
    return detect(url);
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or no dialect supports it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "Relay schema migrations are not available for " + jdbcUrl +
            ". Supported databases: " + describe()));
  }

  private static String describe() {
    return BY_URL_PREFIX.entrySet().stream()
        .map(e -> e.getValue().name() + " (" + e.getKey() + ")")
        .collect(Collectors.joining(", "));
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
