package com.platform.configdrift.classify;

import java.util.List;

public record SummaryCounts(int added, int removed, int changed, int other) {

    public static final SummaryCounts ZERO = new SummaryCounts(0, 0, 0, 0);

    public static SummaryCounts of(List<EntityChange> relevant, int other) {
        int added = 0;
        int removed = 0;
        int changed = 0;
        for (EntityChange change : relevant) {
            switch (change.status()) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case CHANGED -> changed++;
            }
        }
        return new SummaryCounts(added, removed, changed, other);
    }

    public int total() {
        return added + removed + changed + other;
    }
}
