package com.driverlens.core.store;

/**
 * Thrown when a stored artifact exists but its content cannot be parsed.
 *
 * @since 1.0.0
 */
public class ArtifactCorruptException extends ArtifactStoreException {

    private static final long serialVersionUID = 1L;

    public ArtifactCorruptException(String message) {
        super(message);
    }

    public ArtifactCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
