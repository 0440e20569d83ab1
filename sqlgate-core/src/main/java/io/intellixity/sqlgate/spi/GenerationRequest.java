package io.intellixity.sqlgate.spi;

import java.util.Objects;

/**
 * Input to the statement-generation collaborator.\n
 *
 * A first-round request carries only the intent and the catalog. A revision additionally carries the statement
 * that failed and the database's error text.\n
 */
public record GenerationRequest(String tenantKey,
                                String intent,
                                String catalog,
                                String priorStatement,
                                String priorError) {

  public GenerationRequest {
    Objects.requireNonNull(tenantKey, "tenantKey");
    catalog = catalog == null ? "" : catalog;
  }

  public static GenerationRequest initial(String tenantKey, String intent, String catalog) {
    return new GenerationRequest(tenantKey, intent, catalog, null, null);
  }

  public static GenerationRequest revision(String tenantKey, String intent, String catalog,
                                           String priorStatement, String priorError) {
    return new GenerationRequest(tenantKey, intent, catalog,
        Objects.requireNonNull(priorStatement, "priorStatement"), priorError);
  }

  public boolean isRevision() {
    return priorStatement != null;
  }
}
