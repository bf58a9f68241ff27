package com.driverlens.core.store;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One pipeline run's storage scope.
 *
 * <p>
 * Created once by {@link ArtifactStore#startSession(Path)} and passed
 * explicitly to every component that reads or writes artifacts.
 * </p>
 *
 * @since 1.0.0
 */
public final class Session {

    /** Name of the per-session metadata document. */
    public static final String METADATA_FILE = "metadata.json";

    private final String sessionId;
    private final Path baseDirectory;
    private final Path sessionDirectory;
    private final ArtifactRegistry registry;

    Session(String sessionId, Path baseDirectory, Instant createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
        this.sessionDirectory = baseDirectory.resolve(sessionId);
        this.registry = new ArtifactRegistry(sessionId, createdAt);
    }

    public String getSessionId() {
        return sessionId;
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public Path getSessionDirectory() {
        return sessionDirectory;
    }

    public Path getMetadataFile() {
        return sessionDirectory.resolve(METADATA_FILE);
    }

    public Instant getCreatedAt() {
        return registry.getCreatedAt();
    }

    public ArtifactRegistry getRegistry() {
        return registry;
    }

    @Override
    public String toString() {
        return "Session{sessionId='" + sessionId + "', directory=" + sessionDirectory + '}';
    }
}
