package com.platform.configdrift.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.TestJson;
import com.platform.configdrift.error.ErrorCode;
import com.platform.configdrift.error.SnapshotNotFoundException;
import com.platform.configdrift.error.SnapshotStoreException;
import com.platform.configdrift.error.ValidationException;
import com.platform.configdrift.operation.OperationDescriptor;
import com.platform.configdrift.operation.OperationScope;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.platform.configdrift.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class FileSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private FileSnapshotStore store;
    private OperationDescriptor descriptor;

    @BeforeEach
    void setUp() {
        SnapshotStoreProperties properties = new SnapshotStoreProperties();
        properties.setDirectory(tempDir.toString());
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T09:15:30Z"), ZoneOffset.UTC);
        store = new FileSnapshotStore(TestJson.MAPPER, properties, clock);
        descriptor = OperationDescriptor.builder()
                .name("network_ssids")
                .scope(OperationScope.NETWORK_LEVEL)
                .folder("SSIDs")
                .fileName("ssids")
                .fetcher(mock(SnapshotFetcher.class))
                .build();
    }

    @Test
    void savesUnderScopeAndOperationFolders() throws IOException {
        String filename = store.save(descriptor, json("[{'name': 'corp', 'enabled': true}]"));

        assertThat(filename).isEqualTo("ssids-2024-03-01_09-15-30.json");
        Path file = tempDir.resolve("Network_config").resolve("SSIDs").resolve(filename);
        assertThat(file).exists();
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).contains("\n    {");
    }

    @Test
    void loadReturnsWhatWasSaved() {
        JsonNode snapshot = json("{'admins': [{'email': 'a@example.com', 'orgAccess': 'full'}], 'count': 1.5}");
        String filename = store.save(descriptor, snapshot);

        assertThat(store.load(descriptor, filename)).isEqualTo(snapshot);
    }

    @Test
    void emptySnapshotIsAValidBaseline() {
        String filename = store.save(descriptor, json("[]"));

        assertThat(store.load(descriptor, filename)).isEmpty();
    }

    @Test
    void missingFileIsNotFound() {
        assertThatThrownBy(() -> store.load(descriptor, "ssids-1999-01-01_00-00-00.json"))
                .isInstanceOf(SnapshotNotFoundException.class)
                .extracting(e -> ((SnapshotNotFoundException) e).getErrorCode())
                .isEqualTo(ErrorCode.SNAPSHOT_NOT_FOUND);
    }

    @Test
    void malformedFileIsAStoreError() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("Network_config").resolve("SSIDs"));
        Files.writeString(folder.resolve("broken.json"), "{\"name\": ");

        assertThatThrownBy(() -> store.load(descriptor, "broken.json"))
                .isInstanceOf(SnapshotStoreException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void filenamesMayNotLeaveTheOperationFolder() {
        assertThatThrownBy(() -> store.load(descriptor, "../other/ssids.json"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_FIELD_VALUE);
        assertThatThrownBy(() -> store.load(descriptor, " "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void listsJsonFilesInOrder() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("Network_config").resolve("SSIDs"));
        Files.writeString(folder.resolve("ssids-2024-02-01_00-00-00.json"), "[]");
        Files.writeString(folder.resolve("notes.txt"), "skip");
        Files.writeString(folder.resolve("ssids-2024-01-01_00-00-00.json"), "[]");

        assertThat(store.listSnapshots(descriptor))
                .containsExactly("ssids-2024-01-01_00-00-00.json", "ssids-2024-02-01_00-00-00.json");
    }

    @Test
    void listIsEmptyBeforeFirstSave() {
        assertThat(store.listSnapshots(descriptor)).isEmpty();
    }
}
