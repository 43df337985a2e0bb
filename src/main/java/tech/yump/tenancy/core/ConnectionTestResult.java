package tech.yump.tenancy.core;

/**
 * Outcome of a one-off connectivity check against a tenant's data source.
 *
 * @param error          failure message, null on success
 * @param responseTimeMs wall time of the whole check
 * @param canConnect     a connection was opened and reported valid
 * @param canQuery       a trivial query round-tripped
 */
public record ConnectionTestResult(
        boolean success,
        String error,
        long responseTimeMs,
        boolean canConnect,
        boolean canQuery
) {

    public static ConnectionTestResult succeeded(long responseTimeMs) {
        return new ConnectionTestResult(true, null, responseTimeMs, true, true);
    }

    public static ConnectionTestResult failed(String error, long responseTimeMs, boolean canConnect) {
        return new ConnectionTestResult(false, error, responseTimeMs, canConnect, false);
    }
}
