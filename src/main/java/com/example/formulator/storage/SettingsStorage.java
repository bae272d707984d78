package com.example.formulator.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.*;
import java.nio.file.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final Path dir;
    private final Path file;

    public SettingsStorage() {
        this(Path.of(System.getProperty("user.home"), ".food-formulator"));
    }

    public SettingsStorage(Path dir) {
        this.dir = dir;
        this.file = dir.resolve("settings.json");
    }

    public Path getFile() { return file; }

    /** Missing or unreadable settings fall back to defaults. */
    public Settings load() {
        if (!Files.exists(file)) return new Settings();
        try (InputStream in = Files.newInputStream(file)) {
            Settings s = mapper.readValue(in, Settings.class);
            return s == null ? new Settings() : s;
        } catch (IOException ex) {
            log.warn("Could not read settings from {}, using defaults: {}", file, ex.getMessage());
            return new Settings();
        }
    }

    public void save(Settings s) throws IOException {
        if (!Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            mapper.writeValue(out, s);
        }
    }
}
