package io.intellixity.sqlgate.guard;

/**
 * Lexical helpers for SQL text.\n
 *
 * {@link #mask} returns a copy of the input with the same length in which comments are blanked out and the contents
 * of string literals, quoted identifiers and dollar-quoted bodies are replaced by spaces. Quote characters are kept,
 * so a literal still counts as content. Unterminated literals and comments extend to the end of the text.\n
 */
final class SqlText {
  private SqlText() {}

  static String mask(String sql) {
    int n = sql.length();
    char[] out = sql.toCharArray();
    int i = 0;
    while (i < n) {
      char c = sql.charAt(i);
      if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int nl = sql.indexOf('\n', i);
        i = blank(out, i, nl < 0 ? n : nl);
      } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int close = sql.indexOf("*/", i + 2);
        i = blank(out, i, close < 0 ? n : close + 2);
      } else if (c == '\'') {
        i = maskQuoted(sql, out, i, '\'', isEscapeString(sql, i));
      } else if (c == '"') {
        i = maskQuoted(sql, out, i, '"', false);
      } else if (c == '$') {
        String tag = dollarTag(sql, i);
        if (tag == null) {
          i++;
          continue;
        }
        int body = i + tag.length();
        int close = sql.indexOf(tag, body);
        blank(out, body, close < 0 ? n : close);
        i = close < 0 ? n : close + tag.length();
      } else {
        i++;
      }
    }
    return new String(out);
  }

  /** First word of masked text after leading whitespace; empty if the text starts with a non-word character. */
  static String firstWord(String masked) {
    int i = 0;
    int n = masked.length();
    while (i < n && Character.isWhitespace(masked.charAt(i))) i++;
    int start = i;
    while (i < n && isIdentPart(masked.charAt(i))) i++;
    return masked.substring(start, i);
  }

  /** Parenthesis depth of masked text just before {@code index}. */
  static int depthAt(String masked, int index) {
    int depth = 0;
    for (int i = 0; i < index; i++) {
      char c = masked.charAt(i);
      if (c == '(') depth++;
      else if (c == ')' && depth > 0) depth--;
    }
    return depth;
  }

  static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  private static int blank(char[] out, int from, int to) {
    for (int j = from; j < to; j++) out[j] = ' ';
    return to;
  }

  private static int maskQuoted(String sql, char[] out, int start, char quote, boolean backslashEscapes) {
    int n = sql.length();
    int j = start + 1;
    while (j < n) {
      char d = sql.charAt(j);
      if (backslashEscapes && d == '\\' && j + 1 < n) {
        out[j] = ' ';
        out[j + 1] = ' ';
        j += 2;
        continue;
      }
      if (d == quote) {
        if (j + 1 < n && sql.charAt(j + 1) == quote) {
          out[j] = ' ';
          out[j + 1] = ' ';
          j += 2;
          continue;
        }
        return j + 1;
      }
      out[j] = ' ';
      j++;
    }
    return n;
  }

  // E'...' literals allow backslash escapes
  private static boolean isEscapeString(String sql, int quoteIndex) {
    if (quoteIndex == 0) return false;
    char p = sql.charAt(quoteIndex - 1);
    if (p != 'E' && p != 'e') return false;
    return quoteIndex < 2 || !isIdentPart(sql.charAt(quoteIndex - 2));
  }

  private static String dollarTag(String sql, int i) {
    if (i > 0 && isIdentPart(sql.charAt(i - 1))) return null;
    int n = sql.length();
    int j = i + 1;
    while (j < n && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) j++;
    if (j >= n || sql.charAt(j) != '$') return null;
    if (j > i + 1 && Character.isDigit(sql.charAt(i + 1))) return null; // $1 positional parameter
    return sql.substring(i, j + 1);
  }
}
