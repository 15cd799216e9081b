package com.platform.configdrift.entity;

/**
 * Decides whether an entity takes part in a comparison run.
 */
@FunctionalInterface
public interface EntityFilter {

    boolean accept(EntityRecord entity);

    static EntityFilter acceptAll() {
        return entity -> true;
    }

    default EntityFilter and(EntityFilter other) {
        return entity -> accept(entity) && other.accept(entity);
    }
}
