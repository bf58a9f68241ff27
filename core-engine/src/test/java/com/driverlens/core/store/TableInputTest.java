package com.driverlens.core.store;

import com.driverlens.core.model.DataTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TableInput}.
 */
class TableInputTest {

    @TempDir
    Path baseDir;

    private ArtifactStore store;

    private final DataTable table = DataTable.builder()
            .numericColumn("value_speed", 1.0, 2.0)
            .numericColumn("value_temp", 3.0, 4.0)
            .build();

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(ArtifactStore.startSession(baseDir));
    }

    @Test
    @DisplayName("Inline input should resolve to the same table")
    void shouldResolveInline() {
        assertThat(TableInput.inline(table).resolve(store)).isSameAs(table);
    }

    @Test
    @DisplayName("Reference input should load the latest or a fixed version")
    void shouldResolveReference() {
        DataTable newer = DataTable.builder().numericColumn("value_speed", 9.0).build();
        store.saveTable("unified_dataset", table);
        store.saveTable("unified_dataset", newer);

        assertThat(TableInput.reference("unified_dataset").resolve(store)).isEqualTo(newer);
        assertThat(TableInput.reference("unified_dataset", 1).resolve(store)).isEqualTo(table);
    }

    @Test
    @DisplayName("Reference to a missing artifact should propagate ArtifactNotFoundException")
    void shouldPropagateMissingReference() {
        assertThatThrownBy(() -> TableInput.reference("unified_dataset").resolve(store))
                .isInstanceOf(ArtifactNotFoundException.class);
    }

    @Test
    @DisplayName("Raw bytes should be parsed as CSV")
    void shouldResolveRawBytes() {
        byte[] csv = "value_speed,value_temp\n1,3\n2,4\n".getBytes(StandardCharsets.UTF_8);

        assertThat(TableInput.rawBytes(csv).resolve(store)).isEqualTo(table);
    }

    @Test
    @DisplayName("Malformed raw bytes should be rejected as invalid input")
    void shouldRejectMalformedBytes() {
        byte[] csv = "a,b\n1,2,3\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> TableInput.rawBytes(csv).resolve(store))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
