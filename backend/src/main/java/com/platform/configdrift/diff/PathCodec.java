package com.platform.configdrift.diff;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Splits diff paths into item id and field path, and renders them for display.
 */
@Slf4j
public final class PathCodec {

    public static final String FIELD_SEPARATOR = ".";

    private PathCodec() {
    }

    /**
     * First segment is the item id; the rest, joined with dots, is the field path.
     * Never throws: an empty or null path decodes to no item.
     */
    public static PathComponents decode(List<PathSegment> path) {
        if (path == null || path.isEmpty()) {
            log.debug("Cannot decode empty diff path");
            return PathComponents.NONE;
        }
        Object itemId = path.get(0).value();
        if (path.size() == 1) {
            return new PathComponents(itemId, null, true);
        }
        String fieldPath = path.subList(1, path.size()).stream()
            .map(PathSegment::toString)
            .collect(Collectors.joining(FIELD_SEPARATOR));
        return new PathComponents(itemId, fieldPath, false);
    }

    /**
     * Raw display form, e.g. {@code root['ssids'][0]['name']}.
     */
    public static String render(List<PathSegment> path) {
        StringBuilder rendered = new StringBuilder("root");
        if (path != null) {
            path.forEach(segment -> rendered.append(segment.render()));
        }
        return rendered.toString();
    }
}
