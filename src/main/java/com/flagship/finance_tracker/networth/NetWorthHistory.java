package com.flagship.finance_tracker.networth;

import java.util.ArrayList;
import java.util.List;

/**
 * Day-keyed net worth history.
 * At most one snapshot per date; at most {@link #MAX_POINTS} entries, oldest evicted first.
 */
public final class NetWorthHistory {

    public static final int MAX_POINTS = 180;

    private NetWorthHistory() {
        // Utility class
    }

    /**
     * Replaces the snapshot for the same day, or appends a new one, then trims
     * the history to the retention limit.
     *
     * @return a new list; the input is not modified
     */
    public static List<NetWorthSnapshot> upsert(List<NetWorthSnapshot> history, NetWorthSnapshot snapshot) {
        List<NetWorthSnapshot> next = new ArrayList<>(history);

        int existingIndex = -1;
        for (int i = 0; i < next.size(); i++) {
            if (next.get(i).getDate().equals(snapshot.getDate())) {
                existingIndex = i;
                break;
            }
        }

        if (existingIndex >= 0) {
            next.set(existingIndex, snapshot);
        } else {
            next.add(snapshot);
        }

        if (next.size() > MAX_POINTS) {
            next = new ArrayList<>(next.subList(next.size() - MAX_POINTS, next.size()));
        }
        return next;
    }
}
