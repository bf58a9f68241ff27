package com.driverlens.core.store;

import java.util.Objects;

/**
 * Handle to one saved artifact version, as returned by a save call.
 *
 * <p>
 * {@link #getRelativePath()} is relative to the store's base directory, e.g.
 * {@code 20250101T120000000Z-3fa2c1/impact_ranking.v2.json}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArtifactReference {

    private final String name;
    private final int version;
    private final String relativePath;

    public ArtifactReference(String name, int version, String relativePath) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.version = version;
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath must not be null");
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    public String getRelativePath() {
        return relativePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ArtifactReference that))
            return false;
        return version == that.version && name.equals(that.name) && relativePath.equals(that.relativePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, relativePath);
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
