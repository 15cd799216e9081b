package com.platform.configdrift.operation;

import com.platform.configdrift.error.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lookup of operations by scope and name, built from the configured catalog and the fetcher beans.
 */
@Slf4j
@Component
public class OperationRegistry {

    private final Map<OperationScope, Map<String, OperationDescriptor>> operations = new EnumMap<>(OperationScope.class);

    public OperationRegistry(OperationCatalogProperties properties, List<SnapshotFetcher> fetchers) {
        Map<String, SnapshotFetcher> fetchersByName = fetchers.stream()
            .collect(Collectors.toMap(SnapshotFetcher::getOperationName, Function.identity()));

        for (OperationCatalogProperties.OperationProperties entry : properties.getOperations()) {
            SnapshotFetcher fetcher = fetchersByName.get(entry.getName());
            if (fetcher == null) {
                log.warn("No fetcher for configured operation '{}', skipping", entry.getName());
                continue;
            }
            if (entry.getScope() == null) {
                log.warn("Operation '{}' has no scope, skipping", entry.getName());
                continue;
            }
            register(OperationDescriptor.builder()
                .name(entry.getName())
                .displayName(entry.getDisplayName())
                .scope(entry.getScope())
                .folder(entry.getFolder())
                .fileName(entry.getFileName())
                .groupingKey(entry.getGroupingKey())
                .productType(entry.getProductType())
                .fetcher(fetcher)
                .build());
        }

        log.info("Operation registry initialized with {} operations", 
            operations.values().stream().mapToInt(Map::size).sum());
    }

    public void register(OperationDescriptor descriptor) {
        operations.computeIfAbsent(descriptor.getScope(), k -> new LinkedHashMap<>())
            .put(descriptor.getName(), descriptor);
    }

    public Optional<OperationDescriptor> find(OperationScope scope, String name) {
        return Optional.ofNullable(operations.getOrDefault(scope, Map.of()).get(name));
    }

    public OperationDescriptor get(OperationScope scope, String name) {
        return find(scope, name)
            .orElseThrow(() -> ResourceNotFoundException.operation(scope.getName(), name));
    }

    public Collection<OperationDescriptor> getOperations(OperationScope scope) {
        return Collections.unmodifiableCollection(operations.getOrDefault(scope, Map.of()).values());
    }

    public Set<OperationScope> getScopes() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    /**
     * Folder holding snapshots of an operation, relative to the scope folder.
     */
    public String getOperationFolderName(OperationScope scope, String name) {
        return get(scope, name).getFolder();
    }
}
