package com.platform.configdrift.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.classify.ChangeStatus;

/**
 * One differing dotted key. The reference value is null for added keys, the current value null for removed ones.
 */
public record FlatChange(String key, ChangeStatus status, JsonNode referenceValue, JsonNode currentValue) {
}
