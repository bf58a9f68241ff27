package com.driverlens.core.store;

import com.driverlens.core.model.ColumnType;
import com.driverlens.core.model.DataTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Session-scoped, versioned storage for tables and records.
 *
 * <h3>Layout</h3>
 *
 * <pre>
 *   base/sessionId/metadata.json
 *   base/sessionId/{name}.v{n}.csv     (tables)
 *   base/sessionId/{name}.v{n}.json    (records)
 * </pre>
 *
 * <h3>Versioning</h3>
 * <p>
 * Version numbers are per artifact name and start at 1. A save without an
 * explicit version takes the highest version present on disk for that name
 * (of either kind) plus one, so two saves of identical content still produce
 * two versions. A saved version file is never rewritten; saving an explicit
 * version that already exists fails. {@code metadata.json} is rewritten in
 * full after every save.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Saves under <em>different</em> names may run concurrently. Saves under the
 * same name must be serialized by the caller. Any number of readers may load
 * a version once the save that created it has returned.
 * </p>
 *
 * @since 1.0.0
 */
public class ArtifactStore {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactStore.class);

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern VERSION_SUFFIX = Pattern.compile("^(.*)\\.v\\d+$");
    private static final DateTimeFormatter SESSION_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);
    private static final int MAX_SESSION_ATTEMPTS = 16;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Session session;

    /**
     * @param session an already started session
     */
    public ArtifactStore(Session session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    // ---------------------------------------------------------------
    // Session lifecycle
    // ---------------------------------------------------------------

    /**
     * Create a new session under {@code baseDirectory}.
     *
     * <p>
     * The base directory is created if missing. The session id is the UTC
     * start time to the millisecond plus a random suffix; a colliding
     * directory causes a retry with a fresh id. The empty metadata document is
     * written before this method returns.
     * </p>
     *
     * @param baseDirectory root under which session directories live
     * @return the started session
     * @throws ArtifactStoreException if the directories or the metadata
     *                                document cannot be written
     */
    public static Session startSession(Path baseDirectory) {
        Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
        try {
            Files.createDirectories(baseDirectory);
            for (int attempt = 0; attempt < MAX_SESSION_ATTEMPTS; attempt++) {
                Instant now = Instant.now();
                String sessionId = SESSION_ID_FORMAT.format(now) + "-"
                        + UUID.randomUUID().toString().substring(0, 6);
                Session session = new Session(sessionId, baseDirectory, now);
                try {
                    Files.createDirectory(session.getSessionDirectory());
                } catch (FileAlreadyExistsException e) {
                    LOG.debug("Session directory {} already exists, retrying", session.getSessionDirectory());
                    continue;
                }
                writeMetadata(session);
                LOG.info("Artifact session started: id={} base={}", sessionId, baseDirectory);
                return session;
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to start session under " + baseDirectory, e);
        }
        throw new ArtifactStoreException("Could not allocate a unique session directory under "
                + baseDirectory + " after " + MAX_SESSION_ATTEMPTS + " attempts");
    }

    public Session getSession() {
        return session;
    }

    // ---------------------------------------------------------------
    // Tables
    // ---------------------------------------------------------------

    public ArtifactReference saveTable(String name, DataTable table) {
        return saveTable(name, table, null);
    }

    /**
     * Save a table as a new version.
     *
     * @param name    artifact name ({@code [A-Za-z0-9_-]+})
     * @param table   the table; must have at least one column
     * @param version explicit version (&ge; 1), or {@code null} for the next one
     * @return reference to the saved version
     * @throws ArtifactStoreException if the version exists or writing fails
     */
    public ArtifactReference saveTable(String name, DataTable table, Integer version) {
        requireValidName(name);
        Objects.requireNonNull(table, "table must not be null");
        if (table.getColumnCount() == 0) {
            throw new IllegalArgumentException("Table '" + name + "' has no columns");
        }
        int resolved = resolveSaveVersion(name, version);
        Path file = session.getSessionDirectory().resolve(ArtifactKind.TABLE.fileName(name, resolved));

        try (OutputStream os = openNew(file, name, resolved);
             Writer writer = new OutputStreamWriter(os, StandardCharsets.UTF_8)) {
            TableCsvCodec.write(table, writer);
        } catch (IOException e) {
            throw discardPartial(file, new ArtifactStoreException(
                    "Failed to write table '" + name + "' v" + resolved, e));
        }

        ArtifactEntry entry = new ArtifactEntry(ArtifactKind.TABLE, relativePath(file), resolved, Instant.now());
        entry.setRows(table.getRowCount());
        entry.setColumns(table.getColumnCount());
        entry.setColumnNames(table.getColumnNames());
        register(name, entry);

        LOG.info("Saved table '{}' v{} ({} rows x {} columns)", name, resolved,
                table.getRowCount(), table.getColumnCount());
        return new ArtifactReference(name, resolved, entry.getPath());
    }

    public DataTable loadTable(String name) {
        return loadTable(name, null);
    }

    /**
     * Load a table version.
     *
     * <p>
     * If the stored table has a single text cell that looks like a path to a
     * CSV file (it contains a path separator or ends in {@code .csv}) and that
     * file exists, the file is loaded instead: such an artifact holds a stale
     * cross-reference rather than data. A path-like cell with no file behind
     * it is ordinary data and is returned unchanged.
     * </p>
     *
     * @param name    artifact name
     * @param version explicit version, or {@code null} for the latest
     * @return the table
     * @throws ArtifactNotFoundException if no matching version exists
     * @throws ArtifactCorruptException  if the file, or the file it refers
     *                                   to, cannot be parsed
     */
    public DataTable loadTable(String name, Integer version) {
        requireValidName(name);
        Path file = resolveLoadFile(name, version, ArtifactKind.TABLE);
        DataTable table = readTableFile(file, name);

        String reference = crossReference(table);
        if (reference != null) {
            Path target = locateReferencedTable(reference);
            if (target == null) {
                LOG.warn("Table '{}' holds the path-like value '{}' but no such file exists, keeping it as data",
                        name, reference);
                return table;
            }
            LOG.warn("Table '{}' contains a file reference instead of data, loading {}", name, target);
            return readTableFile(target, name);
        }
        return table;
    }

    // ---------------------------------------------------------------
    // Records
    // ---------------------------------------------------------------

    public ArtifactReference saveRecord(String name, Object record) {
        return saveRecord(name, record, null);
    }

    /**
     * Save a structured record as a new version.
     *
     * @param name    artifact name ({@code [A-Za-z0-9_-]+})
     * @param record  a map or Jackson-serializable bean that serializes to a
     *                JSON object
     * @param version explicit version (&ge; 1), or {@code null} for the next one
     * @return reference to the saved version
     * @throws IllegalArgumentException if the record is not a JSON object
     * @throws ArtifactStoreException   if the version exists or writing fails
     */
    public ArtifactReference saveRecord(String name, Object record, Integer version) {
        requireValidName(name);
        Objects.requireNonNull(record, "record must not be null");
        JsonNode tree = MAPPER.valueToTree(record);
        if (!tree.isObject()) {
            throw new IllegalArgumentException("Record '" + name + "' must serialize to a JSON object, got "
                    + tree.getNodeType());
        }
        int resolved = resolveSaveVersion(name, version);
        Path file = session.getSessionDirectory().resolve(ArtifactKind.RECORD.fileName(name, resolved));

        try (OutputStream os = openNew(file, name, resolved)) {
            MAPPER.writeValue(os, tree);
        } catch (IOException e) {
            throw discardPartial(file, new ArtifactStoreException(
                    "Failed to write record '" + name + "' v" + resolved, e));
        }

        ArtifactEntry entry = new ArtifactEntry(ArtifactKind.RECORD, relativePath(file), resolved, Instant.now());
        register(name, entry);

        LOG.info("Saved record '{}' v{}", name, resolved);
        return new ArtifactReference(name, resolved, entry.getPath());
    }

    public Map<String, Object> loadRecord(String name) {
        return loadRecord(name, (Integer) null);
    }

    /**
     * Load a record version as a generic map.
     *
     * @param name    artifact name
     * @param version explicit version, or {@code null} for the latest
     * @return the record's key-value content, in document order
     * @throws ArtifactNotFoundException if no matching version exists
     * @throws ArtifactCorruptException  if the file is not a JSON object
     */
    public Map<String, Object> loadRecord(String name, Integer version) {
        return readRecord(name, version,
                MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class));
    }

    /**
     * Load a record version bound to a type.
     *
     * @param name    artifact name
     * @param version explicit version, or {@code null} for the latest
     * @param type    target type
     * @param <T>     target type
     * @return the bound record
     * @throws ArtifactNotFoundException if no matching version exists
     * @throws ArtifactCorruptException  if the file cannot be bound to
     *                                   {@code type}
     */
    public <T> T loadRecord(String name, Integer version, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return readRecord(name, version, MAPPER.constructType(type));
    }

    private <T> T readRecord(String name, Integer version, JavaType type) {
        requireValidName(name);
        Path file = resolveLoadFile(name, version, ArtifactKind.RECORD);
        try (InputStream is = Files.newInputStream(file)) {
            T value = MAPPER.readValue(is, type);
            if (value == null) {
                throw new ArtifactCorruptException("Record '" + name + "' (" + file.getFileName() + ") is null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ArtifactCorruptException("Record '" + name + "' (" + file.getFileName()
                    + ") cannot be parsed: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read record '" + name + "' from " + file, e);
        }
    }

    // ---------------------------------------------------------------
    // Registry queries
    // ---------------------------------------------------------------

    public List<String> listArtifacts() {
        return listArtifacts(null);
    }

    /**
     * @param kind type filter, or {@code null} for every artifact
     * @return registered artifact names in registration order
     */
    public List<String> listArtifacts(ArtifactKind kind) {
        return session.getRegistry().names(kind);
    }

    /**
     * List the stored versions of an artifact kind, ascending.
     *
     * @param name artifact name
     * @param kind artifact kind
     * @return versions on disk, possibly empty
     */
    public List<Integer> listVersions(String name, ArtifactKind kind) {
        requireValidName(name);
        Objects.requireNonNull(kind, "kind must not be null");
        return scanVersions(name, kind);
    }

    /**
     * Derive the artifact name from a stored reference path.
     *
     * <p>
     * {@code "20250101T120000000Z-3fa2c1/impact_ranking.v3.json"} yields
     * {@code "impact_ranking"}. A path without a version suffix yields its
     * file name without extension; {@code null} or blank yields {@code ""}.
     * </p>
     *
     * @param referencePath relative or absolute reference path
     * @return the artifact name
     */
    public static String resolveArtifactNameFromReference(String referencePath) {
        if (referencePath == null || referencePath.isBlank()) {
            return "";
        }
        String fileName = referencePath.trim();
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (slash >= 0) {
            fileName = fileName.substring(slash + 1);
        }
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        Matcher m = VERSION_SUFFIX.matcher(stem);
        return m.matches() ? m.group(1) : stem;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireValidName(String name) {
        Objects.requireNonNull(name, "Artifact name must not be null");
        if (!VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid artifact name: '" + name
                    + "'. Allowed characters: letters, digits, '_' and '-'");
        }
    }

    private int resolveSaveVersion(String name, Integer version) {
        if (version != null) {
            if (version < 1) {
                throw new IllegalArgumentException("Version must be >= 1, got: " + version);
            }
            return version;
        }
        OptionalInt max = scanVersions(name, null).stream().mapToInt(Integer::intValue).max();
        return max.isPresent() ? max.getAsInt() + 1 : 1;
    }

    private Path resolveLoadFile(String name, Integer version, ArtifactKind kind) {
        if (version != null) {
            Path file = session.getSessionDirectory().resolve(kind.fileName(name, version));
            if (!Files.isRegularFile(file)) {
                throw new ArtifactNotFoundException("Version " + version + " of " + kind + " '"
                        + name + "' not found in session " + session.getSessionId());
            }
            return file;
        }
        List<Integer> versions = scanVersions(name, kind);
        if (versions.isEmpty()) {
            throw new ArtifactNotFoundException("No versions found for " + kind + " '" + name
                    + "' in session " + session.getSessionId());
        }
        int latest = versions.get(versions.size() - 1);
        return session.getSessionDirectory().resolve(kind.fileName(name, latest));
    }

    private List<Integer> scanVersions(String name, ArtifactKind kind) {
        String extensions = kind != null
                ? Pattern.quote(kind.getExtension())
                : "(?:" + ArtifactKind.TABLE.getExtension() + "|" + ArtifactKind.RECORD.getExtension() + ")";
        Pattern pattern = Pattern.compile(Pattern.quote(name) + "\\.v(\\d+)\\." + extensions);

        List<Integer> versions = new ArrayList<>();
        Path dir = session.getSessionDirectory();
        if (!Files.isDirectory(dir)) {
            return versions;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(p -> {
                Matcher m = pattern.matcher(p.getFileName().toString());
                if (m.matches()) {
                    try {
                        versions.add(Integer.parseInt(m.group(1)));
                    } catch (NumberFormatException e) {
                        LOG.warn("Ignoring artifact file with out-of-range version: {}", p.getFileName());
                    }
                }
            });
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to list session directory " + dir, e);
        }
        versions.sort(null);
        return versions;
    }

    private OutputStream openNew(Path file, String name, int version) throws IOException {
        Files.createDirectories(file.getParent());
        try {
            return Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new ArtifactStoreException("Version " + version + " of '" + name
                    + "' already exists; saved versions are immutable", e);
        }
    }

    private static ArtifactStoreException discardPartial(Path file, ArtifactStoreException failure) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        return failure;
    }

    private String relativePath(Path file) {
        return session.getSessionId() + "/" + file.getFileName();
    }

    private void register(String name, ArtifactEntry entry) {
        ArtifactRegistry registry = session.getRegistry();
        synchronized (registry) {
            registry.register(name, entry);
            try {
                writeMetadata(session);
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to update " + Session.METADATA_FILE
                        + " for session " + session.getSessionId(), e);
            }
        }
    }

    private static void writeMetadata(Session session) throws IOException {
        Path target = session.getMetadataFile();
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling(Session.METADATA_FILE + ".tmp");
        MAPPER.writeValue(tmp.toFile(), session.getRegistry());
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static DataTable readTableFile(Path file, String name) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return TableCsvCodec.read(reader);
        } catch (IllegalArgumentException e) {
            throw new ArtifactCorruptException("Table '" + name + "' (" + file.getFileName()
                    + ") cannot be parsed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read table '" + name + "' from " + file, e);
        }
    }

    private static String crossReference(DataTable table) {
        if (table.getColumnCount() != 1 || table.getRowCount() != 1) {
            return null;
        }
        String column = table.getColumnNames().get(0);
        if (table.getColumnType(column) != ColumnType.TEXT) {
            return null;
        }
        String value = table.cellAsText(column, 0);
        if (value == null) {
            return null;
        }
        value = value.trim();
        boolean looksLikePath = value.contains("/") || value.contains("\\") || value.endsWith(".csv");
        return looksLikePath ? value : null;
    }

    private Path locateReferencedTable(String reference) {
        List<Path> candidates = new ArrayList<>();
        try {
            Path given = Path.of(reference);
            candidates.add(given);
            if (!given.isAbsolute()) {
                candidates.add(session.getBaseDirectory().resolve(given));
                candidates.add(session.getSessionDirectory().resolve(given));
            }
        } catch (InvalidPathException e) {
            LOG.debug("Reference '{}' is not a valid path: {}", reference, e.getMessage());
            return null;
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
