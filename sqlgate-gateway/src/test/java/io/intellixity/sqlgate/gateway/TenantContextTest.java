package io.intellixity.sqlgate.gateway;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TenantContextTest {

  @Test
  void bindingIsVisibleInsideAndRemovedAfter() {
    assertNull(TenantContext.currentOrNull());

    String seen = TenantContext.inContext("acme", TenantContext::currentOrThrow);

    assertEquals("acme", seen);
    assertNull(TenantContext.currentOrNull());
    assertThrows(IllegalStateException.class, TenantContext::currentOrThrow);
  }

  @Test
  void nestedBindingRestoresOuterTenant() {
    String after = TenantContext.inContext("outer", () -> {
      String inner = TenantContext.inContext("inner", TenantContext::currentOrNull);
      assertEquals("inner", inner);
      return TenantContext.currentOrNull();
    });
    assertEquals("outer", after);
  }

  @Test
  void bindingIsRestoredWhenWorkThrows() {
    assertThrows(IllegalArgumentException.class, () -> TenantContext.inContext("acme", () -> {
      throw new IllegalArgumentException("boom");
    }));
    assertNull(TenantContext.currentOrNull());
  }
}
