package com.driverlens.core.store;

import com.driverlens.core.model.DataTable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The ways a pipeline stage can be handed its input table.
 *
 * <p>
 * Resolved exactly once, at the boundary, via {@link #resolve(ArtifactStore)};
 * the statistical stages only ever see the resulting {@link DataTable}.
 * </p>
 *
 * <ul>
 * <li>{@link Inline}: a table already in memory</li>
 * <li>{@link Reference}: a table artifact in the session, latest or a fixed
 * version</li>
 * <li>{@link RawBytes}: UTF-8 CSV content</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class TableInput {

    private TableInput() {
    }

    public static TableInput inline(DataTable table) {
        return new Inline(table);
    }

    public static TableInput reference(String name) {
        return new Reference(name, null);
    }

    public static TableInput reference(String name, Integer version) {
        return new Reference(name, version);
    }

    public static TableInput rawBytes(byte[] content) {
        return new RawBytes(content);
    }

    /**
     * Turn this input into a table.
     *
     * @param store the session's store, used by {@link Reference}
     * @return the resolved table
     * @throws ArtifactNotFoundException if a referenced artifact is missing
     * @throws IllegalArgumentException  if raw content is not a valid CSV table
     */
    public abstract DataTable resolve(ArtifactStore store);

    /** A table already in memory. */
    public static final class Inline extends TableInput {
        private final DataTable table;

        private Inline(DataTable table) {
            this.table = Objects.requireNonNull(table, "table must not be null");
        }

        public DataTable getTable() {
            return table;
        }

        @Override
        public DataTable resolve(ArtifactStore store) {
            return table;
        }

        @Override
        public String toString() {
            return "Inline(" + table + ")";
        }
    }

    /** A table artifact stored in the session. */
    public static final class Reference extends TableInput {
        private final String name;
        private final Integer version;

        private Reference(String name, Integer version) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.version = version;
        }

        public String getName() {
            return name;
        }

        /**
         * @return the fixed version, or {@code null} for the latest
         */
        public Integer getVersion() {
            return version;
        }

        @Override
        public DataTable resolve(ArtifactStore store) {
            Objects.requireNonNull(store, "store must not be null");
            return store.loadTable(name, version);
        }

        @Override
        public String toString() {
            return "Reference(" + name + (version != null ? " v" + version : ", latest") + ")";
        }
    }

    /** CSV content supplied as bytes. */
    public static final class RawBytes extends TableInput {
        private final byte[] content;

        private RawBytes(byte[] content) {
            this.content = Objects.requireNonNull(content, "content must not be null").clone();
        }

        @Override
        public DataTable resolve(ArtifactStore store) {
            try (Reader reader = new StringReader(new String(content, StandardCharsets.UTF_8))) {
                return TableCsvCodec.read(reader);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read raw table content", e);
            }
        }

        @Override
        public String toString() {
            return "RawBytes(" + content.length + " bytes)";
        }
    }
}
