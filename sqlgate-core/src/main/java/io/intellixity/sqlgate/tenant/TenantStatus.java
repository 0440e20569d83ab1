package io.intellixity.sqlgate.tenant;

import java.util.Locale;

public enum TenantStatus {
  ACTIVE,
  SUSPENDED;

  /**
   * Parses the status column of a tenant record.\n
   *
   * Missing values default to {@link #ACTIVE} (the admin table's column default). Anything that is not
   * recognisably active is treated as suspended.\n
   */
  public static TenantStatus parse(String raw) {
    if (raw == null || raw.isBlank()) return ACTIVE;
    return "active".equals(raw.trim().toLowerCase(Locale.ROOT)) ? ACTIVE : SUSPENDED;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
