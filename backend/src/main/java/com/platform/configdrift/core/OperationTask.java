package com.platform.configdrift.core;

import com.platform.configdrift.error.ValidationException;

import java.util.Arrays;

public enum OperationTask {
    STORE("store"),
    COMPARE("compare");

    private final String name;

    OperationTask(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static OperationTask fromName(String name) {
        return Arrays.stream(values())
            .filter(task -> task.name.equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new ValidationException("task", name, "must be 'store' or 'compare'"));
    }
}
