package com.verilog.hierarchy.snapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.verilog.hierarchy.model.VerilogModule;
import com.verilog.hierarchy.util.FileWriteUtil;

/**
 * Stores the module set as a single JSON document.
 */
public class JsonSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(JsonSnapshotStore.class);

    public static final String DEFAULT_FILE_NAME = "verilog_modules.json";
    static final int FORMAT_VERSION = 1;

    private final Path location;
    private final ObjectMapper mapper;

    public JsonSnapshotStore(Path location) {
        this.location = Objects.requireNonNull(location, "location");
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void save(Collection<VerilogModule> modules) {
        Objects.requireNonNull(modules, "modules");
        log.info("saving {} modules to {} ...", modules.size(), location);

        ModuleSnapshot snapshot = ModuleSnapshot.builder()
                .formatVersion(FORMAT_VERSION)
                .modules(List.copyOf(modules))
                .build();
        try {
            FileWriteUtil.safeWriteString(location, mapper.writeValueAsString(snapshot));
        } catch (IOException e) {
            throw new SnapshotException("Failed to write module snapshot: " + location, e);
        }
    }

    @Override
    public Optional<List<VerilogModule>> load() {
        if (!exists()) {
            return Optional.empty();
        }
        log.debug("reading in {} ...", location);

        ModuleSnapshot snapshot;
        try {
            snapshot = mapper.readValue(location.toFile(), ModuleSnapshot.class);
        } catch (IOException e) {
            throw new SnapshotException("Failed to read module snapshot: " + location, e);
        }
        if (snapshot.getFormatVersion() != FORMAT_VERSION) {
            throw new SnapshotException("Unsupported snapshot format version " + snapshot.getFormatVersion()
                    + " in " + location + " (expected " + FORMAT_VERSION + ")");
        }
        return Optional.of(snapshot.getModules());
    }

    @Override
    public boolean delete() {
        try {
            boolean deleted = Files.deleteIfExists(location);
            if (deleted) {
                log.info("removing {} ...", location);
            }
            return deleted;
        } catch (IOException e) {
            throw new SnapshotException("Failed to remove module snapshot: " + location, e);
        }
    }

    @Override
    public boolean exists() {
        return Files.isRegularFile(location);
    }

    public Path getLocation() {
        return location;
    }
}
