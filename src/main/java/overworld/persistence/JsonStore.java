package overworld.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import overworld.planning.NavConfig;

import java.io.IOException;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Versioned JSON files under a data directory.
 *
 * Every file holds a {@link VersionedData} wrapper. Writes go to a temp file
 * that is atomically moved over the target, after the previous content has
 * been copied to a timestamped backup. Only the newest backups are kept.
 *
 * All failures surface as {@link IOException}; callers decide whether they
 * are fatal.
 */
public class JsonStore {

    public static final int SCHEMA_VERSION = 1;

    /** Backups kept per file */
    public static final int MAX_BACKUPS = 3;

    private final Path dataDirectory;
    private final ObjectMapper jsonMapper;

    public JsonStore(Path dataDirectory) {
        this.dataDirectory = dataDirectory;

        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.jsonMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    /**
     * Saves data wrapped with its schema version.
     *
     * @param filename path relative to the data directory, may contain subdirectories
     */
    public <T> void saveJson(String filename, T data, int schemaVersion) throws IOException {
        Path file = resolve(filename);
        Files.createDirectories(file.getParent());

        if (Files.exists(file)) {
            backupFile(file);
        }

        VersionedData<T> versioned = new VersionedData<>(schemaVersion, data);

        Path tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        jsonMapper.writeValue(tempFile.toFile(), versioned);
        Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        logVerbose("[JsonStore] Saved " + filename + " (schema v" + schemaVersion + ")");
    }

    /**
     * Loads data saved by {@link #saveJson}.
     *
     * @return the data, or null if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public <T> T loadJson(String filename, Class<T> dataClass) throws IOException {
        Path file = resolve(filename);
        if (!Files.exists(file)) {
            logVerbose("[JsonStore] " + filename + " not found");
            return null;
        }

        JavaType type = jsonMapper.getTypeFactory().constructParametricType(VersionedData.class, dataClass);
        VersionedData<T> versioned = jsonMapper.readValue(file.toFile(), type);
        if (versioned == null || versioned.data == null) {
            throw new IOException("No data in " + filename);
        }

        if (versioned.schemaVersion > SCHEMA_VERSION) {
            throw new IOException("Unsupported schema v" + versioned.schemaVersion + " in " + filename);
        }
        if (versioned.schemaVersion < SCHEMA_VERSION) {
            logNormal("[JsonStore] " + filename + " has old schema v" + versioned.schemaVersion
                    + ", reading as v" + SCHEMA_VERSION);
        }

        logVerbose("[JsonStore] Loaded " + filename + " (schema v" + versioned.schemaVersion + ")");
        return versioned.data;
    }

    public boolean exists(String filename) {
        return Files.exists(resolve(filename));
    }

    /**
     * Lists the JSON files (not backups or temp files) in a subdirectory.
     *
     * @return file names, sorted; empty if the directory does not exist
     */
    public List<String> list(String subdirectory) throws IOException {
        Path dir = resolve(subdirectory);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".json"))
                    .sorted()
                    .forEach(names::add);
        }
        return names;
    }

    // ========== Internal Helpers ==========

    private Path resolve(String filename) {
        return dataDirectory.resolve(filename);
    }

    private void backupFile(Path file) throws IOException {
        String backupName = file.getFileName() + ".backup." + Instant.now().toEpochMilli();
        Files.copy(file, file.resolveSibling(backupName), StandardCopyOption.REPLACE_EXISTING);
        cleanOldBackups(file);
    }

    /**
     * Deletes all but the newest {@link #MAX_BACKUPS} backups of a file.
     */
    private void cleanOldBackups(Path file) throws IOException {
        String prefix = file.getFileName() + ".backup.";
        List<Path> backups = new ArrayList<>();
        try (Stream<Path> siblings = Files.list(file.getParent())) {
            siblings.filter(p -> p.getFileName().toString().startsWith(prefix)).forEach(backups::add);
        }
        if (backups.size() <= MAX_BACKUPS) return;

        // Names end in the epoch millis, so they sort by age
        backups.sort((a, b) -> Long.compare(backupTime(a, prefix), backupTime(b, prefix)));
        for (int i = 0; i < backups.size() - MAX_BACKUPS; i++) {
            Files.deleteIfExists(backups.get(i));
        }
    }

    private static long backupTime(Path backup, String prefix) {
        try {
            return Long.parseLong(backup.getFileName().toString().substring(prefix.length()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private void logNormal(String msg) {
        if (NavConfig.isNormal())
            System.err.println(msg);
    }

    private void logVerbose(String msg) {
        if (NavConfig.isVerbose())
            System.err.println(msg);
    }

    /**
     * Versioned data wrapper for migration support.
     */
    public static class VersionedData<T> {
        public int schemaVersion;
        public T data;

        public VersionedData() {} // For Jackson

        public VersionedData(int schemaVersion, T data) {
            this.schemaVersion = schemaVersion;
            this.data = data;
        }
    }
}
