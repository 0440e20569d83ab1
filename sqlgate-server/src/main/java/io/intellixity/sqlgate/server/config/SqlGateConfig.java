package io.intellixity.sqlgate.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlgate.gateway.AsyncAuditSink;
import io.intellixity.sqlgate.gateway.CachingTenantDirectory;
import io.intellixity.sqlgate.gateway.CorrectionLoopController;
import io.intellixity.sqlgate.gateway.CorrectionSettings;
import io.intellixity.sqlgate.gateway.QueryGateway;
import io.intellixity.sqlgate.guard.DefaultStatementGuard;
import io.intellixity.sqlgate.guard.GuardSettings;
import io.intellixity.sqlgate.guard.StatementGuard;
import io.intellixity.sqlgate.jdbc.ExecutorSettings;
import io.intellixity.sqlgate.jdbc.JdbcQueryExecutor;
import io.intellixity.sqlgate.jdbc.PoolSettings;
import io.intellixity.sqlgate.jdbc.TenantPoolManager;
import io.intellixity.sqlgate.jdbc.postgres.JdbcAuditSink;
import io.intellixity.sqlgate.jdbc.postgres.JdbcTenantDirectory;
import io.intellixity.sqlgate.jdbc.postgres.PostgresDataSourceFactory;
import io.intellixity.sqlgate.jdbc.postgres.PostgresSqlErrorClassifier;
import io.intellixity.sqlgate.server.llm.OpenAiStatementGenerator;
import io.intellixity.sqlgate.server.web.TenantKeyFilter;
import io.intellixity.sqlgate.spi.AuditSink;
import io.intellixity.sqlgate.spi.StatementGenerator;
import io.intellixity.sqlgate.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashSet;
import java.util.Set;

@Configuration
@EnableConfigurationProperties(SqlGateProperties.class)
public class SqlGateConfig {
  private static final Logger log = LoggerFactory.getLogger(SqlGateConfig.class);

  @Bean(destroyMethod = "close")
  public AdminDatabase adminDatabase(SqlGateProperties props) {
    return AdminDatabase.open(props.getAdmin());
  }

  @Bean
  public TenantDirectory tenantDirectory(SqlGateProperties props, AdminDatabase admin) {
    SqlGateProperties.Admin a = props.getAdmin();
    if (admin.dataSource().isPresent()) {
      log.info("sqlgate.config tenants=admin-db table={} cacheTtlMs={}", a.getTenantsTable(),
          a.getDirectoryCacheTtl().toMillis());
      return new CachingTenantDirectory(new JdbcTenantDirectory(admin.dataSource().get(), a.getTenantsTable()),
          CachingTenantDirectory.DEFAULT_MAX_ENTRIES, a.getDirectoryCacheTtl(), System::currentTimeMillis);
    }
    if (props.getTenants().isEmpty() && props.getAuth().isRequireTenantKey()) {
      throw new IllegalStateException(
          "sqlgate.admin.jdbc-url is required when tenant keys are required and no static tenants are declared");
    }
    log.info("sqlgate.config tenants=static count={}", props.getTenants().size());
    return new PropertiesTenantDirectory(props.getTenants());
  }

  @Bean
  public AuditSink auditSink(SqlGateProperties props, AdminDatabase admin, ObjectMapper mapper) {
    if (admin.dataSource().isEmpty()) return new LoggingAuditSink();
    SqlGateProperties.Admin a = props.getAdmin();
    return new AsyncAuditSink(new JdbcAuditSink(admin.dataSource().get(), mapper, a.getAuditTable(),
        JdbcAuditSink.DetailsBinding.JSONB), a.getAuditQueueCapacity());
  }

  @Bean
  public StatementGuard statementGuard(SqlGateProperties props) {
    Set<String> keywords = new LinkedHashSet<>(props.getGuard().getBlockedKeywords());
    return new DefaultStatementGuard(new GuardSettings(props.getLimits().getMaxResultRows(), keywords));
  }

  @Bean
  public TenantPoolManager tenantPoolManager(SqlGateProperties props, TenantDirectory directory) {
    SqlGateProperties.Pool p = props.getPool();
    PoolSettings settings = new PoolSettings(p.getMinIdle(), p.getMaxConnections(), p.getCheckoutTimeout(),
        p.getIdleTimeout(), p.getEvictionInterval());
    return new TenantPoolManager(directory, new PostgresDataSourceFactory(), settings);
  }

  @Bean
  public JdbcQueryExecutor queryExecutor(SqlGateProperties props, TenantPoolManager pools) {
    SqlGateProperties.Limits l = props.getLimits();
    return new JdbcQueryExecutor(pools, new PostgresSqlErrorClassifier(),
        new ExecutorSettings(l.getQueryTimeout(), l.getCancelGrace(), l.getTransportRetries()));
  }

  @Bean
  public StatementGenerator statementGenerator(SqlGateProperties props,
                                               RestClient.Builder restClientBuilder,
                                               ObjectMapper mapper) {
    SqlGateProperties.Generator g = props.getGenerator();
    if (g.getApiKey() == null || g.getApiKey().isBlank()) {
      log.warn("sqlgate.config generator=disabled reason=no-api-key");
    }
    return new OpenAiStatementGenerator(restClientBuilder, g.getBaseUrl(), g.getApiKey(), g.getModel(),
        props.getLimits().getGenerationTimeout(), mapper);
  }

  @Bean
  public CorrectionLoopController correctionLoopController(SqlGateProperties props,
                                                           StatementGuard guard,
                                                           JdbcQueryExecutor executor,
                                                           StatementGenerator generator,
                                                           AuditSink audit) {
    SqlGateProperties.Limits l = props.getLimits();
    CorrectionSettings settings = new CorrectionSettings(l.getMaxAttempts(), l.getGenerationTimeout(),
        l.getMaxResultRows(), l.getQueryTimeout());
    return new CorrectionLoopController(guard, executor, generator, audit, settings);
  }

  @Bean
  public QueryGateway queryGateway(TenantDirectory directory, TenantPoolManager pools, CorrectionLoopController loop) {
    return new QueryGateway(directory, pools, loop);
  }

  @Bean
  public TenantKeyFilter tenantKeyFilter(SqlGateProperties props) {
    SqlGateProperties.Auth auth = props.getAuth();
    if (!auth.isRequireTenantKey() && (auth.getDefaultTenant() == null || auth.getDefaultTenant().isBlank())) {
      throw new IllegalStateException("sqlgate.auth.default-tenant is required when tenant keys are not required");
    }
    return new TenantKeyFilter(auth.getDefaultTenant());
  }
}
