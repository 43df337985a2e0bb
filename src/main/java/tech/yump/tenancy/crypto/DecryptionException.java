package tech.yump.tenancy.crypto;

import tech.yump.tenancy.core.DataSourceManagerException;

/**
 * Thrown when an encrypted secret is malformed or fails GCM authentication.
 * Treated as tampering or corruption: never downgraded to a default value.
 */
public class DecryptionException extends DataSourceManagerException {
    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
