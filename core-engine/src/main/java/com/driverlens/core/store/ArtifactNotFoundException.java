package com.driverlens.core.store;

/**
 * Thrown when no stored version matches a load request.
 *
 * @since 1.0.0
 */
public class ArtifactNotFoundException extends ArtifactStoreException {

    private static final long serialVersionUID = 1L;

    public ArtifactNotFoundException(String message) {
        super(message);
    }
}
