package io.intellixity.sqlgate.server.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.sqlgate.error.GenerationFailedException;
import io.intellixity.sqlgate.spi.GenerationRequest;
import io.intellixity.sqlgate.spi.StatementGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Objects;

/**
 * Statement generator backed by an OpenAI-compatible {@code chat/completions} endpoint.\n
 *
 * - first round: the intent and the tenant catalog\n
 * - revision: additionally the failed statement and the database error\n
 *
 * Calls run at temperature 0; markdown code fences are stripped from the answer. Requests go through the JDK
 * request factory, which gives up when the calling thread is interrupted, so the correction loop's generation
 * timeout cancels them.\n
 */
public final class OpenAiStatementGenerator implements StatementGenerator {
  private static final Logger log = LoggerFactory.getLogger(OpenAiStatementGenerator.class);

  static final int MAX_TOKENS = 2000;
  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

  private final RestClient client;
  private final ObjectMapper mapper;
  private final String apiKey;
  private final String model;

  public OpenAiStatementGenerator(RestClient.Builder builder, String baseUrl, String apiKey, String model,
                                  Duration requestTimeout, ObjectMapper mapper) {
    this(builder.clone().requestFactory(requestFactory(requestTimeout)), baseUrl, apiKey, model, mapper);
  }

  OpenAiStatementGenerator(RestClient.Builder builder, String baseUrl, String apiKey, String model,
                           ObjectMapper mapper) {
    this.client = builder
        .baseUrl(stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl")))
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .build();
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.apiKey = apiKey;
    this.model = Objects.requireNonNull(model, "model");
  }

  @Override
  public String generate(GenerationRequest request) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new GenerationFailedException("No API key configured for statement generation");
    }
    String prompt = request.isRevision() ? revisionPrompt(request) : initialPrompt(request);

    String body;
    try {
      body = client.post()
          .uri("/chat/completions")
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
          .body(body(prompt))
          .retrieve()
          .body(String.class);
    } catch (RestClientResponseException e) {
      throw new GenerationFailedException("Statement generation returned HTTP " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      if (Thread.currentThread().isInterrupted()) {
        throw new GenerationFailedException("Statement generation interrupted", e);
      }
      throw new GenerationFailedException("Statement generation request failed: " + e.getMessage(), e);
    }
    if (body == null) throw new GenerationFailedException("Completion response was empty");

    String sql = stripFences(extractContent(body));
    if (log.isDebugEnabled()) {
      log.debug("sqlgate.llm generated tenant={} revision={} sql={}", request.tenantKey(), request.isRevision(),
          abbreviate(sql));
    }
    return sql;
  }

  static String initialPrompt(GenerationRequest r) {
    return "You are a PostgreSQL expert. Generate a SQL query for this question.\n\n"
        + "DATABASE SCHEMA:\n" + r.catalog() + "\n\n"
        + "RULES:\n"
        + "- Return ONLY the SQL query, no explanations\n"
        + "- Use proper JOINs when needed\n"
        + "- Use table aliases (e.g., users u)\n"
        + "- Column names are case-sensitive\n"
        + "- Do NOT add LIMIT unless user asks for it\n\n"
        + "USER QUESTION: " + r.intent() + "\n\n"
        + "SQL:";
  }

  static String revisionPrompt(GenerationRequest r) {
    return "Fix this SQL query that failed with an error.\n\n"
        + "DATABASE SCHEMA:\n" + r.catalog() + "\n\n"
        + "ORIGINAL QUESTION: " + r.intent() + "\n\n"
        + "FAILED SQL:\n" + r.priorStatement() + "\n\n"
        + "ERROR:\n" + r.priorError() + "\n\n"
        + "INSTRUCTIONS:\n"
        + "- Analyze the error carefully\n"
        + "- Fix the SQL to resolve the error\n"
        + "- Return ONLY the corrected SQL\n\n"
        + "FIXED SQL:";
  }

  static String stripFences(String content) {
    return content.replace("```sql", "").replace("```", "").trim();
  }

  String body(String prompt) {
    ObjectNode root = mapper.createObjectNode();
    root.put("model", model);
    root.put("max_tokens", MAX_TOKENS);
    root.put("temperature", 0);
    ArrayNode messages = root.putArray("messages");
    messages.addObject().put("role", "user").put("content", prompt);
    try {
      return mapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize completion request", e);
    }
  }

  String extractContent(String body) {
    JsonNode content;
    try {
      content = mapper.readTree(body).path("choices").path(0).path("message").path("content");
    } catch (JsonProcessingException e) {
      throw new GenerationFailedException("Unreadable completion response: " + e.getOriginalMessage(), e);
    }
    if (!content.isTextual()) throw new GenerationFailedException("Completion response carries no message content");
    return content.asText();
  }

  private static JdkClientHttpRequestFactory requestFactory(Duration requestTimeout) {
    ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
        .withConnectTimeout(CONNECT_TIMEOUT)
        .withReadTimeout(Objects.requireNonNull(requestTimeout, "requestTimeout"));
    return ClientHttpRequestFactories.get(JdkClientHttpRequestFactory.class, settings);
  }

  private static String stripTrailingSlash(String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  private static String abbreviate(String s) {
    return s.length() <= 100 ? s : s.substring(0, 100) + "...";
  }
}
