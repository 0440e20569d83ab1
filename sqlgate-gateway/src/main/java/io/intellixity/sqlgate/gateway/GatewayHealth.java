package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.jdbc.PoolStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record GatewayHealth(String status,
                            Instant timestamp,
                            boolean directoryReachable,
                            int activePools,
                            List<PoolStats> pools,
                            Map<String, Object> configuration) {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";

  public boolean healthy() {
    return HEALTHY.equals(status);
  }
}
