package io.intellixity.sqlgate.guard;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultStatementGuardTest {

  private final DefaultStatementGuard guard = new DefaultStatementGuard();

  @Test
  void plainSelect_getsDefaultLimitAppended() {
    GuardVerdict v = guard.validate("SELECT name FROM customers");
    assertTrue(v.accepted());
    assertEquals("SELECT name FROM customers LIMIT 1000", v.statement());
    assertEquals(1000, v.injectedLimit());
  }

  @Test
  void trailingTerminator_isDroppedBeforeLimit() {
    GuardVerdict v = guard.validate("SELECT * FROM orders;  \n");
    assertTrue(v.accepted());
    assertEquals("SELECT * FROM orders LIMIT 1000", v.statement());
  }

  @Test
  void existingLimit_isKept() {
    GuardVerdict v = guard.validate("select * from orders limit 5");
    assertTrue(v.accepted());
    assertEquals("select * from orders limit 5", v.statement());
    assertFalse(v.limitInjected());
  }

  @Test
  void fetchFirst_countsAsRowLimit() {
    GuardVerdict v = guard.validate("SELECT id FROM t ORDER BY id FETCH FIRST 3 ROWS ONLY");
    assertTrue(v.accepted());
    assertFalse(v.limitInjected());
  }

  @Test
  void limitInsideSubquery_doesNotCountAtTopLevel() {
    GuardVerdict v = guard.validate("SELECT * FROM (SELECT id FROM t LIMIT 2) s");
    assertTrue(v.accepted());
    assertEquals("SELECT * FROM (SELECT id FROM t LIMIT 2) s LIMIT 1000", v.statement());
  }

  @Test
  void explicitRowLimit_overridesDefault() {
    GuardVerdict v = guard.validate("SELECT 1", 25);
    assertEquals("SELECT 1 LIMIT 25", v.statement());
    assertEquals(25, v.injectedLimit());
  }

  @Test
  void withQuery_isAccepted() {
    GuardVerdict v = guard.validate("WITH x AS (SELECT 1 AS a) SELECT a FROM x");
    assertTrue(v.accepted());
  }

  @Test
  void multipleStatements_areRejected() {
    GuardVerdict v = guard.validate("SELECT 1; SELECT 2");
    assertFalse(v.accepted());
    assertEquals("multiple statements are not allowed", v.reason());
  }

  @Test
  void terminatorFollowedByComment_isSingleStatement() {
    GuardVerdict v = guard.validate("SELECT 1; -- done");
    assertTrue(v.accepted());
    assertEquals("SELECT 1 LIMIT 1000", v.statement());
  }

  @Test
  void semicolonInsideLiteral_isNotATerminator() {
    GuardVerdict v = guard.validate("SELECT * FROM notes WHERE body = 'a;b'");
    assertTrue(v.accepted());
    assertEquals("SELECT * FROM notes WHERE body = 'a;b' LIMIT 1000", v.statement());
  }

  @Test
  void nonSelect_isRejectedRegardlessOfCaseWhitespaceAndComments() {
    for (String s : new String[] {"delete from users", "  \n\tDeLeTe FROM users", "/* hi */ DELETE FROM users",
        "-- note\nDELETE FROM users"}) {
      GuardVerdict v = guard.validate(s);
      assertFalse(v.accepted(), s);
      assertEquals("not a read query: blocked keyword DELETE", v.reason(), s);
    }
  }

  @Test
  void drop_isCitedInReason() {
    GuardVerdict v = guard.validate("DROP TABLE users");
    assertFalse(v.accepted());
    assertTrue(v.reason().contains("DROP"));
  }

  @Test
  void unknownLeadingWord_isRejected() {
    GuardVerdict v = guard.validate("SHOW tables");
    assertFalse(v.accepted());
    assertTrue(v.reason().contains("SHOW"));
  }

  @Test
  void blockedKeywordInsideSelect_isRejected() {
    GuardVerdict v = guard.validate("WITH d AS (DELETE FROM t RETURNING *) SELECT * FROM d");
    assertFalse(v.accepted());
    assertEquals("blocked keyword DELETE", v.reason());
  }

  @Test
  void keywordsAsPartsOfIdentifiers_areAllowed() {
    GuardVerdict v = guard.validate("SELECT created_at, delete_reason, update_count FROM audit");
    assertTrue(v.accepted(), v.reason());
  }

  @Test
  void keywordsInsideLiteralsAndQuotedIdentifiers_areAllowed() {
    assertTrue(guard.validate("SELECT * FROM logs WHERE msg = 'DROP TABLE x'").accepted());
    assertTrue(guard.validate("SELECT \"update\" FROM t").accepted());
    assertTrue(guard.validate("SELECT $$ delete me $$ AS s").accepted());
  }

  @Test
  void emptyStatement_isRejected() {
    assertFalse(guard.validate("   ").accepted());
    assertFalse(guard.validate(null).accepted());
  }

  @Test
  void customKeywords_areNormalized() {
    DefaultStatementGuard g = new DefaultStatementGuard(new GuardSettings(10, Set.of(" copy ")));
    assertEquals("blocked keyword COPY", g.validate("SELECT 1 FROM t WHERE copy = 1").reason());
    assertTrue(g.validate("SELECT 1 FROM t").accepted());
  }
}
