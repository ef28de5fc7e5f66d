package com.questrail.plc.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record summarizing one completed scan.
 *
 * @param programsExecuted PROGRAM bodies run this scan (FUNCTION and FUNCTION_BLOCK
 *                         declarations are not counted)
 * @param timersAdvanced   timers that were running when time was applied
 * @param scanTimeMillis   elapsed time applied to those timers
 */
public record ScanCompletedEvent(
    Instant timestamp,
    int programsExecuted,
    int timersAdvanced,
    long scanTimeMillis
) {
    public ScanCompletedEvent {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
