package io.intellixity.sqlgate.guard;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default read-only guard.\n
 *
 * Rules, applied in order on the masked text (see {@link SqlText#mask}):\n
 * 1. a single statement: a terminator may only be followed by whitespace or comments\n
 * 2. the statement begins with SELECT or WITH\n
 * 3. no blocked keyword appears as a standalone word\n
 * 4. without a top-level LIMIT / FETCH FIRST|NEXT, a row limit is appended\n
 */
public final class DefaultStatementGuard implements StatementGuard {
  private static final Pattern ROW_LIMIT = Pattern.compile(
      "(?i)(?<![A-Za-z0-9_$])(?:LIMIT|FETCH\\s+(?:FIRST|NEXT))(?![A-Za-z0-9_$])");

  private final GuardSettings settings;
  private final Pattern blocked;

  public DefaultStatementGuard() {
    this(GuardSettings.defaults());
  }

  public DefaultStatementGuard(GuardSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.blocked = Pattern.compile(
        "(?i)(?<![A-Za-z0-9_$])(" + String.join("|", settings.blockedKeywords()) + ")(?![A-Za-z0-9_$])");
  }

  @Override
  public GuardVerdict validate(String statement) {
    return validate(statement, settings.defaultRowLimit());
  }

  @Override
  public GuardVerdict validate(String statement, int rowLimit) {
    if (statement == null || statement.isBlank()) return GuardVerdict.rejected(statement, "empty statement");
    int limit = rowLimit > 0 ? rowLimit : settings.defaultRowLimit();
    String masked = SqlText.mask(statement);

    int terminator = masked.indexOf(';');
    if (terminator >= 0 && !masked.substring(terminator + 1).isBlank()) {
      return GuardVerdict.rejected(statement, "multiple statements are not allowed");
    }

    String head = SqlText.firstWord(masked).toUpperCase(Locale.ROOT);
    if (!"SELECT".equals(head) && !"WITH".equals(head)) {
      if (head.isEmpty()) return GuardVerdict.rejected(statement, "not a read query: statement must begin with SELECT or WITH");
      if (settings.blockedKeywords().contains(head)) {
        return GuardVerdict.rejected(statement, "not a read query: blocked keyword " + head);
      }
      return GuardVerdict.rejected(statement, "not a read query: statement begins with " + head + ", expected SELECT or WITH");
    }

    Matcher m = blocked.matcher(masked);
    if (m.find()) {
      return GuardVerdict.rejected(statement, "blocked keyword " + m.group(1).toUpperCase(Locale.ROOT));
    }

    int end = contentEnd(masked);
    String body = statement.substring(0, end);
    if (hasTopLevelRowLimit(masked.substring(0, end))) return GuardVerdict.accepted(body, null);
    return GuardVerdict.accepted(body + " LIMIT " + limit, limit);
  }

  public GuardSettings settings() {
    return settings;
  }

  // end of the last meaningful character, dropping trailing whitespace, comments and the terminator
  private static int contentEnd(String masked) {
    int end = masked.length();
    while (end > 0) {
      char c = masked.charAt(end - 1);
      if (!Character.isWhitespace(c) && c != ';') break;
      end--;
    }
    return end;
  }

  private static boolean hasTopLevelRowLimit(String masked) {
    Matcher m = ROW_LIMIT.matcher(masked);
    while (m.find()) {
      if (SqlText.depthAt(masked, m.start()) == 0) return true;
    }
    return false;
  }
}
