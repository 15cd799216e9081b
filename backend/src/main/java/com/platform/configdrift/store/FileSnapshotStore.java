package com.platform.configdrift.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.platform.configdrift.error.SnapshotNotFoundException;
import com.platform.configdrift.error.SnapshotStoreException;
import com.platform.configdrift.error.ValidationException;
import com.platform.configdrift.operation.OperationDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stores snapshots as pretty-printed JSON files under
 * {@code <directory>/<scope folder>/<operation folder>/<file name>-<timestamp>.json}.
 */
@Slf4j
@Component
public class FileSnapshotStore implements SnapshotStore {

    private static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Path root;
    private final DateTimeFormatter timestampFormat;
    private final Clock clock;

    public FileSnapshotStore(ObjectMapper objectMapper, SnapshotStoreProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
        this.writer = objectMapper.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(indenter)
            .withArrayIndenter(indenter));
        this.root = Paths.get(properties.getDirectory());
        this.timestampFormat = DateTimeFormatter.ofPattern(properties.getTimestampPattern());
        this.clock = clock;
    }

    @Override
    public String save(OperationDescriptor descriptor, JsonNode snapshot) {
        Path folder = operationFolder(descriptor.getScope().getFolder(), descriptor.getFolder());
        String filename = descriptor.getFileName() + "-" + LocalDateTime.now(clock).format(timestampFormat) + EXTENSION;
        Path file = folder.resolve(filename);

        try {
            Files.createDirectories(folder);
            writer.writeValue(file.toFile(), snapshot);
        } catch (IOException e) {
            throw new SnapshotStoreException(file.toString(), "Failed to write snapshot " + file + ": " + e.getMessage(), e);
        }

        log.info("Saved {} snapshot to {}", descriptor.getName(), file);
        return filename;
    }

    @Override
    public JsonNode load(String scopeFolder, String operationFolder, String filename) {
        requireSimpleName(filename);
        Path file = operationFolder(scopeFolder, operationFolder).resolve(filename);

        if (!Files.isRegularFile(file)) {
            throw new SnapshotNotFoundException(file.toString());
        }
        try {
            JsonNode snapshot = objectMapper.readTree(file.toFile());
            log.debug("Loaded snapshot {}", file);
            return snapshot;
        } catch (NoSuchFileException e) {
            throw new SnapshotNotFoundException(file.toString(), e);
        } catch (JsonProcessingException e) {
            throw new SnapshotStoreException(file.toString(), "Snapshot " + file + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SnapshotStoreException(file.toString(), "Failed to read snapshot " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listSnapshots(OperationDescriptor descriptor) {
        Path folder = operationFolder(descriptor.getScope().getFolder(), descriptor.getFolder());
        if (!Files.isDirectory(folder)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(folder)) {
            return files
                .filter(Files::isRegularFile)
                .map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(EXTENSION))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new SnapshotStoreException(folder.toString(), "Failed to list snapshots in " + folder + ": " + e.getMessage(), e);
        }
    }

    private Path operationFolder(String scopeFolder, String operationFolder) {
        return root.resolve(scopeFolder).resolve(operationFolder);
    }

    private static void requireSimpleName(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ValidationException("filename", filename, "a snapshot filename is required");
        }
        if (filename.contains("/") || filename.contains("\\") || filename.contains("..")) {
            throw new ValidationException("filename", filename, "must be a plain file name");
        }
    }
}
