package com.openforge.mnemo.memory.model;

import java.util.List;

/**
 * Summary of a forgetting cycle.
 *
 * @param details one line per action taken, in order
 */
public record ForgettingResult(
        String       userId,
        int          totalScanned,
        int          compressed,
        int          archived,
        int          deleted,
        double       elapsedMillis,
        List<String> details
) {

    public ForgettingResult {
        details = List.copyOf(details);
    }

    public static ForgettingResult nothingScanned(String userId, double elapsedMillis) {
        return new ForgettingResult(userId, 0, 0, 0, 0, elapsedMillis, List.of());
    }
}
