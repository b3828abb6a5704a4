package io.intellixity.querywall.jdbc.dialect;

import java.io.IOException;
import java.io.Reader;
import java.sql.Array;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Driver-neutral value unwrapping.\n
 *
 * LOBs, SQL arrays, structs and UUIDs become strings or lists so results serialize as plain JSON.\n
 * Dialects override {@link #unwrapVendor(Object)} for their driver's own types.\n
 */
public abstract class AbstractJdbcDialect implements JdbcDialect {
  static final int MAX_LOB_CHARS = 100_000;
  private static final int MAX_NESTED_DEPTH = 3;

  @Override
  public Object readValue(ResultSet rs, int column) throws SQLException {
    return toPlainValue(rs.getObject(column));
  }

  public Object toPlainValue(Object raw) throws SQLException {
    return unwrap(raw, 0);
  }

  /** Returns a replacement for a driver-specific value, or {@code null} when not handled. */
  protected Object unwrapVendor(Object v) throws SQLException {
    return null;
  }

  protected final Object unwrap(Object v, int depth) throws SQLException {
    if (v == null) return null;
    if (depth > MAX_NESTED_DEPTH) return String.valueOf(v);

    Object vendor = unwrapVendor(v);
    if (vendor != null) return vendor;

    if (v instanceof Clob clob) return readClob(clob);
    if (v instanceof SQLXML xml) return xml.getString();
    if (v instanceof UUID u) return u.toString();
    if (v instanceof Array arr) {
      try {
        return unwrap(arr.getArray(), depth + 1);
      } finally {
        arr.free();
      }
    }
    if (v instanceof Struct s) {
      Object[] attrs = s.getAttributes();
      return unwrapAll(attrs == null ? List.of() : Arrays.asList(attrs), depth);
    }
    if (v instanceof Object[] oa) return unwrapAll(Arrays.asList(oa), depth);
    if (v instanceof List<?> l) return unwrapAll(l, depth);
    if (v instanceof long[] la) return Arrays.stream(la).boxed().toList();
    if (v instanceof int[] ia) return Arrays.stream(ia).boxed().toList();
    if (v instanceof double[] da) return Arrays.stream(da).boxed().toList();
    return v;
  }

  private List<Object> unwrapAll(List<?> in, int depth) throws SQLException {
    List<Object> out = new ArrayList<>(in.size());
    for (Object o : in) out.add(unwrap(o, depth + 1));
    return out;
  }

  private static String readClob(Clob clob) throws SQLException {
    StringBuilder sb = new StringBuilder();
    char[] buf = new char[4096];
    try (Reader r = clob.getCharacterStream()) {
      int n;
      while ((n = r.read(buf)) >= 0 && sb.length() < MAX_LOB_CHARS) {
        sb.append(buf, 0, Math.min(n, MAX_LOB_CHARS - sb.length()));
      }
    } catch (IOException e) {
      throw new SQLException("Failed to read CLOB", e);
    } finally {
      clob.free();
    }
    return sb.toString();
  }
}
