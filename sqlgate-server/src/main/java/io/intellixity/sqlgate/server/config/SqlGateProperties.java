package io.intellixity.sqlgate.server.config;

import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantStatus;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "sqlgate")
public class SqlGateProperties {
  private final Limits limits = new Limits();
  private final Pool pool = new Pool();
  private final Admin admin = new Admin();
  private final Auth auth = new Auth();
  private final Generator generator = new Generator();
  private final Guard guard = new Guard();

  /** Statically declared tenants, used when no admin database is configured. */
  private final Map<String, StaticTenant> tenants = new HashMap<>();

  public Limits getLimits() { return limits; }
  public Pool getPool() { return pool; }
  public Admin getAdmin() { return admin; }
  public Auth getAuth() { return auth; }
  public Generator getGenerator() { return generator; }
  public Guard getGuard() { return guard; }
  public Map<String, StaticTenant> getTenants() { return tenants; }

  public static class Limits {
    private int maxResultRows = 1000;
    private int maxAttempts = 5;
    private Duration queryTimeout = Duration.ofSeconds(30);
    private Duration generationTimeout = Duration.ofSeconds(15);
    private Duration cancelGrace = Duration.ofSeconds(5);
    private int transportRetries = 1;

    public int getMaxResultRows() { return maxResultRows; }
    public void setMaxResultRows(int maxResultRows) { this.maxResultRows = maxResultRows; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Duration getQueryTimeout() { return queryTimeout; }
    public void setQueryTimeout(Duration queryTimeout) { this.queryTimeout = queryTimeout; }
    public Duration getGenerationTimeout() { return generationTimeout; }
    public void setGenerationTimeout(Duration generationTimeout) { this.generationTimeout = generationTimeout; }
    public Duration getCancelGrace() { return cancelGrace; }
    public void setCancelGrace(Duration cancelGrace) { this.cancelGrace = cancelGrace; }
    public int getTransportRetries() { return transportRetries; }
    public void setTransportRetries(int transportRetries) { this.transportRetries = transportRetries; }
  }

  public static class Pool {
    private int minIdle = 1;
    private int maxConnections = 5;
    private Duration checkoutTimeout = Duration.ofSeconds(10);
    private Duration idleTimeout = Duration.ofMinutes(10);
    private Duration evictionInterval = Duration.ofSeconds(30);

    public int getMinIdle() { return minIdle; }
    public void setMinIdle(int minIdle) { this.minIdle = minIdle; }
    public int getMaxConnections() { return maxConnections; }
    public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }
    public Duration getCheckoutTimeout() { return checkoutTimeout; }
    public void setCheckoutTimeout(Duration checkoutTimeout) { this.checkoutTimeout = checkoutTimeout; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
    public Duration getEvictionInterval() { return evictionInterval; }
    public void setEvictionInterval(Duration evictionInterval) { this.evictionInterval = evictionInterval; }
  }

  public static class Admin {
    /** JDBC URL of the admin database holding tenant descriptors and the audit log; empty disables both. */
    private String jdbcUrl;
    private String username;
    private String password;
    private String tenantsTable = "db_connection_infos";
    private String auditTable = "onboarding_audit_log";
    private int auditQueueCapacity = 1000;
    private Duration directoryCacheTtl = Duration.ofSeconds(60);

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getTenantsTable() { return tenantsTable; }
    public void setTenantsTable(String tenantsTable) { this.tenantsTable = tenantsTable; }
    public String getAuditTable() { return auditTable; }
    public void setAuditTable(String auditTable) { this.auditTable = auditTable; }
    public int getAuditQueueCapacity() { return auditQueueCapacity; }
    public void setAuditQueueCapacity(int auditQueueCapacity) { this.auditQueueCapacity = auditQueueCapacity; }
    public Duration getDirectoryCacheTtl() { return directoryCacheTtl; }
    public void setDirectoryCacheTtl(Duration directoryCacheTtl) { this.directoryCacheTtl = directoryCacheTtl; }

    public boolean configured() {
      return jdbcUrl != null && !jdbcUrl.isBlank();
    }
  }

  public static class Auth {
    private boolean requireTenantKey = true;
    /** Used when a request carries no tenant key. */
    private String defaultTenant;

    public boolean isRequireTenantKey() { return requireTenantKey; }
    public void setRequireTenantKey(boolean requireTenantKey) { this.requireTenantKey = requireTenantKey; }
    public String getDefaultTenant() { return defaultTenant; }
    public void setDefaultTenant(String defaultTenant) { this.defaultTenant = defaultTenant; }
  }

  public static class Generator {
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
  }

  public static class Guard {
    /** Replaces the default blocklist when non-empty. */
    private List<String> blockedKeywords = new ArrayList<>();

    public List<String> getBlockedKeywords() { return blockedKeywords; }
    public void setBlockedKeywords(List<String> blockedKeywords) { this.blockedKeywords = blockedKeywords; }
  }

  public static class StaticTenant {
    private String dbType = TenantDescriptor.DEFAULT_DB_TYPE;
    private String host;
    private int port = TenantDescriptor.DEFAULT_PORT;
    private String database;
    private String username;
    private String password;
    private String catalog = "";
    private TenantStatus status = TenantStatus.ACTIVE;

    public String getDbType() { return dbType; }
    public void setDbType(String dbType) { this.dbType = dbType; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getCatalog() { return catalog; }
    public void setCatalog(String catalog) { this.catalog = catalog; }
    public TenantStatus getStatus() { return status; }
    public void setStatus(TenantStatus status) { this.status = status; }

    TenantDescriptor toDescriptor(String tenantKey) {
      return new TenantDescriptor(tenantKey, dbType, host, port, database, username, password, catalog, status);
    }
  }
}
