package io.intellixity.querywall.jdbc;

import java.time.Duration;
import java.util.Objects;

/** Connection settings for one pooled store. */
public record JdbcStoreSettings(String jdbcUrl,
                                String username,
                                String password,
                                String schema,
                                int maximumPoolSize,
                                Duration connectionTimeout) {
  public JdbcStoreSettings {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    if (jdbcUrl.isBlank()) throw new IllegalArgumentException("jdbcUrl is blank");
    if (maximumPoolSize <= 0) maximumPoolSize = 10;
    if (connectionTimeout == null || connectionTimeout.isZero() || connectionTimeout.isNegative()) {
      connectionTimeout = Duration.ofSeconds(5);
    }
  }

  public static JdbcStoreSettings of(String jdbcUrl, String username, String password) {
    return new JdbcStoreSettings(jdbcUrl, username, password, null, 10, null);
  }
}
