package com.driverlens.core.store;

/**
 * Base class for artifact store failures.
 *
 * @since 1.0.0
 */
public class ArtifactStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
