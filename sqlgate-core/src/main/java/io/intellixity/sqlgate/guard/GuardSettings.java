package io.intellixity.sqlgate.guard;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * @param defaultRowLimit limit appended to statements without a row-limiting clause
 * @param blockedKeywords keywords rejected anywhere in the statement (word-boundary, case-insensitive)
 */
public record GuardSettings(int defaultRowLimit, Set<String> blockedKeywords) {

  public static final int DEFAULT_ROW_LIMIT = 1000;

  public static final Set<String> DEFAULT_BLOCKED_KEYWORDS = Set.of(
      "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "TRUNCATE", "GRANT", "REVOKE", "CREATE", "EXEC",
      "EXECUTE", "CALL", "COMMIT", "ROLLBACK");

  public GuardSettings {
    if (defaultRowLimit <= 0) throw new IllegalArgumentException("defaultRowLimit must be > 0");
    blockedKeywords = normalize(blockedKeywords == null || blockedKeywords.isEmpty()
        ? DEFAULT_BLOCKED_KEYWORDS : blockedKeywords);
  }

  public static GuardSettings defaults() {
    return new GuardSettings(DEFAULT_ROW_LIMIT, DEFAULT_BLOCKED_KEYWORDS);
  }

  private static Set<String> normalize(Set<String> in) {
    Set<String> out = new LinkedHashSet<>();
    for (String k : in) {
      if (k == null) continue;
      String s = k.trim().toUpperCase(Locale.ROOT);
      if (s.isEmpty()) continue;
      if (!s.chars().allMatch(c -> Character.isLetter(c) || c == '_')) {
        throw new IllegalArgumentException("Blocked keyword must be a single word: " + k);
      }
      out.add(s);
    }
    return Set.copyOf(out);
  }
}
