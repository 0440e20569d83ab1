package io.intellixity.sqlgate.jdbc;

import java.time.Instant;

/** Point-in-time view of one tenant pool. */
public record PoolStats(String tenantKey,
                        int maxConnections,
                        int inUse,
                        long totalCheckouts,
                        Instant createdAt,
                        Instant lastActivity) {
}
