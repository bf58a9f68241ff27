/**
 * Versioned, session-scoped artifact storage.
 *
 * <p>
 * {@link com.driverlens.core.store.ArtifactStore#startSession(java.nio.file.Path)}
 * creates a {@link com.driverlens.core.store.Session}; an
 * {@link com.driverlens.core.store.ArtifactStore} bound to it saves tables
 * (CSV) and records (JSON) as immutable numbered versions and keeps the
 * session's {@link com.driverlens.core.store.ArtifactRegistry} in
 * {@code metadata.json} up to date.
 * </p>
 *
 * @since 1.0.0
 */
package com.driverlens.core.store;
