package com.platform.configdrift.api;

import com.platform.configdrift.core.DriftOperationService;
import com.platform.configdrift.core.OperationRequest;
import com.platform.configdrift.core.OperationResult;
import com.platform.configdrift.core.OperationTask;
import com.platform.configdrift.operation.OperationDescriptor;
import com.platform.configdrift.operation.OperationRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for baseline snapshots and drift comparisons.
 */
@RestController
@RequestMapping("/api/drift")
@AllArgsConstructor
public class DriftController {

    private final DriftOperationService driftOperationService;
    private final OperationRegistry operationRegistry;

    /**
     * List scopes with their operations.
     */
    @GetMapping("/scopes")
    public List<ScopeDTO> getScopes() {
        return operationRegistry.getScopes().stream()
            .map(scope -> new ScopeDTO(
                scope.getName(),
                scope.getDisplayName(),
                scope.getFolder(),
                new ArrayList<>(operationRegistry.getOperations(scope))))
            .collect(Collectors.toList());
    }

    /**
     * List stored baselines of an operation.
     */
    @GetMapping("/scopes/{scope}/operations/{operation}/snapshots")
    public List<String> getSnapshots(@PathVariable String scope, @PathVariable String operation) {
        return driftOperationService.listSnapshots(scope, operation);
    }

    /**
     * Fetch live state of one entity and store it as a baseline.
     */
    @PostMapping("/scopes/{scope}/operations/{operation}/store")
    public ResponseEntity<OperationResult> store(
            @PathVariable String scope,
            @PathVariable String operation,
            @RequestBody(required = false) StoreRequest request) {

        StoreRequest body = request != null ? request : new StoreRequest();
        OperationResult result = driftOperationService.coreDataOperation(OperationRequest.builder()
            .scope(scope)
            .operationName(operation)
            .task(OperationTask.STORE.getName())
            .identifier(body.identifier)
            .organizationId(body.organizationId)
            .build());

        return toResponse(result);
    }

    /**
     * Compare live state of all matching entities against a stored baseline.
     */
    @PostMapping("/scopes/{scope}/operations/{operation}/compare")
    public ResponseEntity<OperationResult> compare(
            @PathVariable String scope,
            @PathVariable String operation,
            @Valid @RequestBody CompareRequest request) {

        OperationResult result = driftOperationService.coreDataOperation(OperationRequest.builder()
            .scope(scope)
            .operationName(operation)
            .task(OperationTask.COMPARE.getName())
            .filename(request.filename)
            .comparisonMethod(request.comparisonMethod)
            .organizationId(request.organizationId)
            .organizationIds(nonNull(request.organizationIds))
            .networkTags(nonNull(request.networkTags))
            .deviceTags(nonNull(request.deviceTags))
            .deviceModels(nonNull(request.deviceModels))
            .productTypes(nonNull(request.productTypes))
            .build());

        return toResponse(result);
    }

    private ResponseEntity<OperationResult> toResponse(OperationResult result) {
        if (result.isError()) {
            int status = result.errorCode() != null ? result.errorCode().getHttpStatus() : 500;
            return ResponseEntity.status(status).body(result);
        }
        return ResponseEntity.ok(result);
    }

    private static List<String> nonNull(List<String> values) {
        return values != null ? values : new ArrayList<>();
    }

    // DTOs

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScopeDTO {
        private String name;
        private String displayName;
        private String folder;
        private List<OperationDescriptor> operations;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoreRequest {
        /** Organization id, network id or device serial. */
        private String identifier;
        private String organizationId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompareRequest {
        @NotBlank
        private String filename;
        private String comparisonMethod;
        private String organizationId;
        private List<String> organizationIds;
        private List<String> networkTags;
        private List<String> deviceTags;
        private List<String> deviceModels;
        private List<String> productTypes;
    }
}
