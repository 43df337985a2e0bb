package tech.yump.tenancy.core;

/**
 * Base exception for errors raised while resolving tenant data sources.
 */
public class DataSourceManagerException extends RuntimeException {
    public DataSourceManagerException(String message) {
        super(message);
    }

    public DataSourceManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
