package io.intellixity.sqlgate.gateway;

import org.slf4j.MDC;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Tenant key bound to the current request thread.\n
 *
 * The key is also placed in the logging MDC under {@code tenant} for the duration of the call.\n
 */
public final class TenantContext {
  public static final String MDC_KEY = "tenant";

  private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

  private TenantContext() {}

  /** Run {@code work} with {@code tenantKey} bound; the previous binding is restored afterwards. */
  public static <T> T inContext(String tenantKey, Supplier<T> work) {
    Objects.requireNonNull(tenantKey, "tenantKey");
    Objects.requireNonNull(work, "work");
    String previous = CURRENT.get();
    String previousMdc = MDC.get(MDC_KEY);
    CURRENT.set(tenantKey);
    MDC.put(MDC_KEY, tenantKey);
    try {
      return work.get();
    } finally {
      restore(previous, previousMdc);
    }
  }

  public static String currentOrNull() {
    return CURRENT.get();
  }

  public static String currentOrThrow() {
    String k = CURRENT.get();
    if (k == null) throw new IllegalStateException("No tenant bound to the current request");
    return k;
  }

  private static void restore(String previous, String previousMdc) {
    if (previous == null) CURRENT.remove();
    else CURRENT.set(previous);
    if (previousMdc == null) MDC.remove(MDC_KEY);
    else MDC.put(MDC_KEY, previousMdc);
  }
}
