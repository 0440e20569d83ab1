package io.intellixity.sqlgate.tenant;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.error.TenantNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TenantDescriptorTest {

  @Test
  void defaultsAreApplied() {
    TenantDescriptor d = new TenantDescriptor("acme", null, "db.local", 0, "acme", "ro", "secret", null, null);
    assertEquals("postgres", d.dbType());
    assertEquals(5432, d.port());
    assertEquals("", d.catalog());
    assertTrue(d.active());
  }

  @Test
  void toString_neverRendersPassword() {
    TenantDescriptor d = new TenantDescriptor("acme", "postgres", "db.local", 5432, "acme", "ro", "hunter2",
        "customers(id, name)", TenantStatus.ACTIVE);
    String s = d.toString();
    assertFalse(s.contains("hunter2"));
    assertTrue(s.contains("catalogLength=19"));
  }

  @Test
  void statusParsing() {
    assertEquals(TenantStatus.ACTIVE, TenantStatus.parse(null));
    assertEquals(TenantStatus.ACTIVE, TenantStatus.parse(" Active "));
    assertEquals(TenantStatus.SUSPENDED, TenantStatus.parse("suspended"));
    assertEquals(TenantStatus.SUSPENDED, TenantStatus.parse("archived"));
  }

  @Test
  void getRequired_throwsForUnknownKey() {
    Map<String, TenantDescriptor> m = Map.of();
    TenantDirectory dir = m::get;
    TenantNotFoundException e = assertThrows(TenantNotFoundException.class, () -> dir.getRequired("nope"));
    assertEquals(ErrorCategory.TENANT_NOT_FOUND, e.category());
    assertTrue(e.getMessage().contains("nope"));
  }
}
