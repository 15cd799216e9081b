package com.platform.configdrift.diff;

/**
 * Decoded diff path: the top-level item it belongs to and the dotted field path below it.
 */
public record PathComponents(Object itemId, String fieldPath, boolean rootItem) {

    static final PathComponents NONE = new PathComponents(null, null, false);

    public boolean hasItemId() {
        return itemId != null;
    }
}
