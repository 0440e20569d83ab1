package io.intellixity.sqlgate.jdbc.postgres;

import java.util.regex.Pattern;

final class SqlNames {
  // optional schema qualifier; table names come from configuration and are spliced into SQL
  private static final Pattern TABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private SqlNames() {}

  static String requireTableName(String name) {
    if (name == null || !TABLE.matcher(name.trim()).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + name);
    }
    return name.trim();
  }
}
