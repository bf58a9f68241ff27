package com.driverlens.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session metadata document: session id, creation time and one
 * {@link ArtifactEntry} per artifact name.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All accessors are synchronized. {@link ArtifactStore} additionally holds
 * this object's monitor while it rewrites {@code metadata.json}, so a
 * snapshot on disk never mixes two concurrent updates.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactRegistry {

    private String sessionId;
    private Instant createdAt;
    private final Map<String, ArtifactEntry> artifacts = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public ArtifactRegistry() {
    }

    ArtifactRegistry(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
    }

    /**
     * Record a newly saved version. An entry is only replaced by a version at
     * least as new, so the registry keeps pointing at the latest one.
     *
     * @param name  artifact name
     * @param entry entry for the saved version
     */
    synchronized void register(String name, ArtifactEntry entry) {
        ArtifactEntry current = artifacts.get(name);
        if (current == null || current.getVersion() <= entry.getVersion()) {
            artifacts.put(name, entry);
        }
    }

    /**
     * @param name artifact name
     * @return the entry for the latest saved version, if any
     */
    public synchronized Optional<ArtifactEntry> find(String name) {
        return Optional.ofNullable(artifacts.get(name));
    }

    /**
     * @param kind type filter, or {@code null} for all artifacts
     * @return names in registration order
     */
    public synchronized List<String> names(ArtifactKind kind) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, ArtifactEntry> e : artifacts.entrySet()) {
            if (kind == null || e.getValue().getType() == kind) {
                names.add(e.getKey());
            }
        }
        return names;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("session_id")
    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("created_at")
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * @return unmodifiable copy of all entries
     */
    public synchronized Map<String, ArtifactEntry> getArtifacts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public synchronized void setArtifacts(Map<String, ArtifactEntry> artifacts) {
        this.artifacts.clear();
        if (artifacts != null) {
            this.artifacts.putAll(artifacts);
        }
    }
}
