package tech.yump.tenancy.pool;

import lombok.Getter;
import tech.yump.tenancy.core.DataSourceManagerException;

/**
 * Backpressure signal raised when the client pool is at capacity.
 * Transient: callers should retry with backoff or reject the request as retryable.
 */
@Getter
public class PoolExhaustedException extends DataSourceManagerException {

    private final int liveClients;
    private final int maxClients;

    public PoolExhaustedException(int liveClients, int maxClients) {
        super("Tenant client pool exhausted: " + liveClients + " live clients, limit " + maxClients);
        this.liveClients = liveClients;
        this.maxClients = maxClients;
    }
}
