package io.intellixity.sqlgate.exec;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Normalized rows of one successful execution.\n
 *
 * Each row maps column label to a JSON-safe value, in column order.\n
 * {@code truncated} is true when the row cap cut off further rows.\n
 */
public record QueryResult(List<String> columns,
                          List<Map<String, Object>> rows,
                          boolean truncated,
                          Duration elapsed) {

  public QueryResult {
    columns = columns == null ? List.of() : List.copyOf(columns);
    rows = rows == null ? List.of() : List.copyOf(rows);
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }

  public int rowCount() {
    return rows.size();
  }
}
