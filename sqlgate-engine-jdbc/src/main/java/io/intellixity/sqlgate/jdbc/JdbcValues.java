package io.intellixity.sqlgate.jdbc;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.Clob;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/** Conversion of driver values into JSON-safe values. */
public final class JdbcValues {
  static final int MAX_BINARY_HEX = 50;
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private JdbcValues() {}

  /**
   * - temporal values as ISO-8601 strings\n
   * - numbers and booleans unchanged\n
   * - binary as lower-case hex, cut to 50 characters\n
   * - arrays element-wise\n
   * - anything else via {@code toString()}\n
   */
  public static Object normalize(Object v) throws SQLException {
    if (v == null) return null;
    if (v instanceof String || v instanceof Boolean) return v;
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) return v;
    if (v instanceof Double || v instanceof Float || v instanceof BigDecimal || v instanceof BigInteger) return v;
    if (v instanceof java.sql.Timestamp ts) return ts.toLocalDateTime().toString();
    if (v instanceof java.sql.Date d) return d.toLocalDate().toString();
    if (v instanceof java.sql.Time t) return t.toLocalTime().toString();
    if (v instanceof java.util.Date d) return d.toInstant().toString();
    if (v instanceof TemporalAccessor) return v.toString();
    if (v instanceof byte[] b) return hex(b);
    if (v instanceof UUID) return v.toString();
    if (v instanceof Clob c) return c.getSubString(1, (int) Math.min(Integer.MAX_VALUE, c.length()));
    if (v instanceof Array a) return normalizeArray(a.getArray());
    if (v instanceof Object[] oa) return normalizeArray(oa);
    return v.toString();
  }

  /** Column labels in order; a repeated label gets a numeric suffix ({@code id}, {@code id_2}, ...). */
  public static List<String> columnLabels(ResultSetMetaData md) throws SQLException {
    int n = md.getColumnCount();
    List<String> out = new ArrayList<>(n);
    Set<String> seen = new HashSet<>();
    for (int i = 1; i <= n; i++) {
      String label = md.getColumnLabel(i);
      if (label == null || label.isBlank()) label = "column" + i;
      String unique = label;
      int k = 2;
      while (!seen.add(unique)) unique = label + "_" + k++;
      out.add(unique);
    }
    return out;
  }

  static String hex(byte[] b) {
    int chars = Math.min(b.length * 2, MAX_BINARY_HEX);
    StringBuilder sb = new StringBuilder(chars);
    for (int i = 0; sb.length() < chars; i++) {
      sb.append(HEX[(b[i] >> 4) & 0xf]);
      if (sb.length() < chars) sb.append(HEX[b[i] & 0xf]);
    }
    return sb.toString();
  }

  private static List<Object> normalizeArray(Object array) throws SQLException {
    if (!(array instanceof Object[] oa)) return List.of(array.toString());
    List<Object> out = new ArrayList<>(oa.length);
    for (Object o : oa) out.add(normalize(o));
    return out;
  }
}
