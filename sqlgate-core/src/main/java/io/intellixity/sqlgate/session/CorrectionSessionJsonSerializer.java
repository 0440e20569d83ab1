package io.intellixity.sqlgate.session;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.time.Instant;

/**
 * Canonical JSON form of a {@link CorrectionSession}, as written to the audit trail.\n
 *
 * Rows are never included, only row counts.\n
 */
public final class CorrectionSessionJsonSerializer extends JsonSerializer<CorrectionSession> {
  @Override
  public void serialize(CorrectionSession s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("sessionId", s.sessionId());
    g.writeStringField("tenantKey", s.tenantKey());
    g.writeStringField("intent", s.intent());
    g.writeStringField("status", s.status() == null ? null : s.status().wireName());
    if (s.errorCategory() != null) g.writeStringField("errorCategory", s.errorCategory().wireName());
    if (s.message() != null) g.writeStringField("message", s.message());
    g.writeNumberField("maxAttempts", s.maxAttempts());
    writeInstant(g, "startedAt", s.startedAt());
    writeInstant(g, "finishedAt", s.finishedAt());
    g.writeNumberField("elapsedMs", s.elapsed().toMillis());

    g.writeArrayFieldStart("attempts");
    for (QueryAttempt a : s.attempts()) {
      g.writeStartObject();
      g.writeNumberField("number", a.number());
      g.writeStringField("sql", a.statement());
      g.writeBooleanField("success", a.isSuccess());
      if (a.isSuccess()) {
        g.writeNumberField("rowCount", a.result().rowCount());
        g.writeBooleanField("truncated", a.result().truncated());
      } else {
        g.writeStringField("errorCategory", a.errorCategory().wireName());
        g.writeStringField("message", a.message());
      }
      g.writeNumberField("elapsedMs", a.elapsed().toMillis());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeEndObject();
  }

  private static void writeInstant(JsonGenerator g, String field, Instant at) throws IOException {
    if (at == null) return;
    g.writeStringField(field, at.toString());
  }
}
