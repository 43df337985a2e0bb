package tech.yump.tenancy.pool;

/**
 * Access level a tenant client connects with.
 */
public enum ClientRole {
    /** Restricted login, subject to row-level policies in the tenant store. */
    ANON,
    /** Service-level login. */
    SERVICE;

    public static final ClientRole DEFAULT = SERVICE;
}
