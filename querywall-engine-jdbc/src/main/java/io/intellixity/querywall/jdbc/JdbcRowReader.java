package io.intellixity.querywall.jdbc;

import io.intellixity.querywall.jdbc.dialect.JdbcDialect;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Reads the current row into a label-keyed map, preserving column order. */
final class JdbcRowReader {
  private final ResultSet rs;
  private final JdbcDialect dialect;
  private String[] labels;

  JdbcRowReader(ResultSet rs, JdbcDialect dialect) {
    this.rs = rs;
    this.dialect = dialect;
  }

  Map<String, Object> read() throws SQLException {
    String[] cols = labels();
    Map<String, Object> row = new LinkedHashMap<>(Math.max(4, cols.length * 2));
    for (int i = 0; i < cols.length; i++) {
      row.put(cols[i], dialect.readValue(rs, i + 1));
    }
    return row;
  }

  private String[] labels() throws SQLException {
    if (labels == null) {
      ResultSetMetaData md = rs.getMetaData();
      labels = new String[md.getColumnCount()];
      for (int i = 1; i <= labels.length; i++) {
        labels[i - 1] = md.getColumnLabel(i);
      }
    }
    return labels;
  }
}
