package com.platform.configdrift.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A registered operation: where its snapshots are stored, how its items are keyed, and how to fetch it.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationDescriptor {

    @NonNull
    String name;

    String displayName;

    @NonNull
    OperationScope scope;

    /**
     * Folder under the scope folder; defaults to the operation name.
     */
    String folder;

    /**
     * Base name of snapshot files.
     */
    String fileName;

    /**
     * Attribute identifying list elements across snapshots.
     */
    String groupingKey;

    /**
     * Product type entities must have, e.g. {@code wireless}.
     */
    String productType;

    @JsonIgnore
    @NonNull
    SnapshotFetcher fetcher;

    public JsonNode fetch(DashboardContext context, String entityId) {
        return fetcher.fetch(context, entityId);
    }

    public String getFolder() {
        return folder != null && !folder.isBlank() ? folder : name;
    }

    public String getFileName() {
        return fileName != null && !fileName.isBlank() ? fileName : name;
    }

    public String getDisplayName() {
        return displayName != null ? displayName : name;
    }

    public boolean hasGroupingKey() {
        return groupingKey != null && !groupingKey.isBlank();
    }
}
