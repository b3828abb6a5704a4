package io.intellixity.querywall.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** Builds read-only HikariCP pools for the query stores. */
public final class JdbcPools {
  private JdbcPools() {}

  public static HikariDataSource create(String poolName, JdbcStoreSettings s) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName(poolName);
    hc.setJdbcUrl(s.jdbcUrl());
    hc.setUsername(s.username());
    hc.setPassword(s.password());
    hc.setMaximumPoolSize(s.maximumPoolSize());
    hc.setConnectionTimeout(s.connectionTimeout().toMillis());
    hc.setReadOnly(true);
    hc.setAutoCommit(true);
    // connect lazily; an unreachable store must not block startup
    hc.setInitializationFailTimeout(-1);
    return new HikariDataSource(hc);
  }

  public static JdbcHandle handle(String id, JdbcStoreSettings s) {
    return new JdbcHandle(id, create("querywall-" + id, s), s.schema());
  }
}
