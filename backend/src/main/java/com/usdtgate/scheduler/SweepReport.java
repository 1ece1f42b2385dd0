package com.usdtgate.scheduler;

/**
 * Counts of what one verification sweep did. {@code aborted} is set when the sweep lost its lease and
 * stopped before finishing.
 */
public record SweepReport(
        int expired,
        int scanned,
        int matched,
        int checked,
        int confirmed,
        int completed,
        int failed,
        int errors,
        boolean aborted
) {

    public boolean hasActivity() {
        return aborted || expired + matched + confirmed + completed + failed + errors > 0;
    }
}
