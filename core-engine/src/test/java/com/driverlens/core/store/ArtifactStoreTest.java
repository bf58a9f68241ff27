package com.driverlens.core.store;

import com.driverlens.core.model.DataTable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ArtifactStore}.
 */
class ArtifactStoreTest {

    @TempDir
    Path baseDir;

    private ArtifactStore store;

    private final DataTable table = DataTable.builder()
            .numericColumn("value_speed", 100.0, 102.5, Double.NaN)
            .numericColumn("value_temp", 20.0, 21.0, 22.0)
            .textColumn("line", "A", "B", null)
            .build();

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(ArtifactStore.startSession(baseDir));
    }

    @Test
    @DisplayName("Should create the session directory and an initial metadata document")
    void shouldStartSession() {
        Session session = store.getSession();

        assertThat(session.getSessionId()).matches("\\d{8}T\\d{9}Z-[0-9a-f]{6}");
        assertThat(session.getSessionDirectory()).isDirectory();
        assertThat(session.getMetadataFile()).isRegularFile();
    }

    @Test
    @DisplayName("Two sessions in the same base directory should get distinct ids")
    void shouldAllocateDistinctSessions() {
        Session other = ArtifactStore.startSession(baseDir);

        assertThat(other.getSessionId()).isNotEqualTo(store.getSession().getSessionId());
    }

    @Test
    @DisplayName("Should number versions from 1 and load the saved content back")
    void shouldVersionAndRoundTripTables() {
        ArtifactReference first = store.saveTable("unified_dataset", table);
        ArtifactReference second = store.saveTable("unified_dataset", table);

        assertThat(first.getVersion()).isEqualTo(1);
        assertThat(second.getVersion()).isEqualTo(2);
        assertThat(second.getRelativePath())
                .isEqualTo(store.getSession().getSessionId() + "/unified_dataset.v2.csv");
        assertThat(store.loadTable("unified_dataset", 1)).isEqualTo(table);
        assertThat(store.listVersions("unified_dataset", ArtifactKind.TABLE)).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Loading without a version should return the latest save")
    void shouldLoadLatestVersion() {
        DataTable newer = DataTable.builder().numericColumn("value_speed", 7.0).build();
        store.saveTable("unified_dataset", table);
        store.saveTable("unified_dataset", newer);

        assertThat(store.loadTable("unified_dataset")).isEqualTo(newer);
    }

    @Test
    @DisplayName("Should reject saving a version that already exists")
    void shouldRejectExistingVersion() {
        store.saveTable("unified_dataset", table, 3);

        assertThatThrownBy(() -> store.saveTable("unified_dataset", table, 3))
                .isInstanceOf(ArtifactStoreException.class)
                .hasMessageContaining("already exists");
        assertThat(store.saveTable("unified_dataset", table).getVersion()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject invalid names and versions")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> store.saveTable("../escape", table))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.saveRecord("report", Map.of("a", 1), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.saveRecord("report", List.of(1, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    @DisplayName("Should round-trip records and keep key order")
    void shouldRoundTripRecords() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kpi", "value_speed");
        record.put("count", 3);
        record.put("drivers", List.of("value_temp", "value_pressure"));

        ArtifactReference ref = store.saveRecord("correlation_matrix", record);
        Map<String, Object> loaded = store.loadRecord("correlation_matrix", ref.getVersion());

        assertThat(ref.getRelativePath()).endsWith("correlation_matrix.v1.json");
        assertThat(loaded).containsExactlyEntriesOf(record);
    }

    @Test
    @DisplayName("Should throw ArtifactNotFoundException for a missing name or version")
    void shouldThrowNotFound() {
        store.saveRecord("impact_ranking", Map.of("ranking", List.of()));

        assertThatThrownBy(() -> store.loadRecord("missing"))
                .isInstanceOf(ArtifactNotFoundException.class);
        assertThatThrownBy(() -> store.loadRecord("impact_ranking", 5))
                .isInstanceOf(ArtifactNotFoundException.class)
                .hasMessageContaining("Version 5");
        assertThatThrownBy(() -> store.loadTable("impact_ranking"))
                .isInstanceOf(ArtifactNotFoundException.class);
    }

    @Test
    @DisplayName("Should throw ArtifactCorruptException for unparseable content")
    void shouldThrowCorrupt() throws Exception {
        Path dir = store.getSession().getSessionDirectory();
        Files.writeString(dir.resolve("broken.v1.json"), "{not json", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("ragged.v1.csv"), "a,b\n1\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store.loadRecord("broken"))
                .isInstanceOf(ArtifactCorruptException.class);
        assertThatThrownBy(() -> store.loadTable("ragged"))
                .isInstanceOf(ArtifactCorruptException.class);
    }

    @Test
    @DisplayName("Should load the referenced file when a table holds only a path")
    void shouldFollowCrossReference() throws Exception {
        Path csv = baseDir.resolve("raw").resolve("speed.csv");
        Files.createDirectories(csv.getParent());
        Files.writeString(csv, "value_speed,value_temp\n1,2\n3,4\n", StandardCharsets.UTF_8);

        store.saveTable("unified_dataset", DataTable.builder().textColumn("path", "raw/speed.csv").build());
        DataTable loaded = store.loadTable("unified_dataset");

        assertThat(loaded.getColumnNames()).containsExactly("value_speed", "value_temp");
        assertThat(loaded.numericValues("value_speed")).containsExactly(1.0, 3.0);
    }

    @Test
    @DisplayName("Should keep a path-like value as data when no file exists behind it")
    void shouldKeepUnresolvedPathLikeValue() {
        DataTable dates = DataTable.builder().textColumn("report_date", "2024/01/15").build();
        store.saveTable("dates", dates);

        assertThat(store.loadTable("dates", 1)).isEqualTo(dates);

        DataTable path = DataTable.builder().textColumn("path", "nowhere/data.csv").build();
        store.saveTable("unified_dataset", path);

        assertThat(store.loadTable("unified_dataset")).isEqualTo(path);
    }

    @Test
    @DisplayName("Should keep metadata.json in sync with every save")
    void shouldRewriteMetadata() throws Exception {
        store.saveTable("unified_dataset", table);
        store.saveRecord("outlier_report", Map.of("outliers", List.of()));
        store.saveRecord("outlier_report", Map.of("outliers", List.of()));

        JsonNode metadata = new ObjectMapper().readTree(store.getSession().getMetadataFile().toFile());
        JsonNode artifacts = metadata.get("artifacts");

        assertThat(metadata.get("session_id").asText()).isEqualTo(store.getSession().getSessionId());
        assertThat(artifacts.get("unified_dataset").get("type").asText()).isEqualTo("table");
        assertThat(artifacts.get("unified_dataset").get("rows").asInt()).isEqualTo(3);
        assertThat(artifacts.get("outlier_report").get("version").asInt()).isEqualTo(2);
        assertThat(artifacts.get("outlier_report").get("path").asText()).endsWith("outlier_report.v2.json");
        assertThat(store.listArtifacts()).containsExactly("unified_dataset", "outlier_report");
        assertThat(store.listArtifacts(ArtifactKind.RECORD)).containsExactly("outlier_report");
    }

    @Test
    @DisplayName("Concurrent saves under different names should all be registered")
    void shouldHandleConcurrentSavesUnderDistinctNames() {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<ArtifactReference>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String name = "stage_" + i;
                futures.add(CompletableFuture.supplyAsync(
                        () -> store.saveRecord(name, Map.of("index", name)), executor));
            }
            futures.forEach(CompletableFuture::join);
        } finally {
            executor.shutdown();
        }

        assertThat(store.listArtifacts()).hasSize(8);
        for (int i = 0; i < 8; i++) {
            assertThat(store.loadRecord("stage_" + i)).containsEntry("index", "stage_" + i);
        }
    }

    @Test
    @DisplayName("Should derive artifact names from reference paths")
    void shouldResolveNameFromReference() {
        assertThat(ArtifactStore.resolveArtifactNameFromReference("20250101T120000000Z-3fa2c1/impact_ranking.v3.json"))
                .isEqualTo("impact_ranking");
        assertThat(ArtifactStore.resolveArtifactNameFromReference("C:\\data\\unified_dataset.v12.csv"))
                .isEqualTo("unified_dataset");
        assertThat(ArtifactStore.resolveArtifactNameFromReference("plain.csv")).isEqualTo("plain");
        assertThat(ArtifactStore.resolveArtifactNameFromReference("  ")).isEmpty();
        assertThat(ArtifactStore.resolveArtifactNameFromReference(null)).isEmpty();
    }
}
