package com.questrail.plc.observability;

/**
 * Receives interpreter observability events.
 * Implementations can provide logging, metrics, or a diagnostics panel.
 */
public interface ScanObservabilitySink {
    /**
     * Called once at the end of every scan, after timers have been advanced.
     * @param event the scan summary
     */
    void onScanCompleted(ScanCompletedEvent event);

    /**
     * Called when the interpreter skips or degrades a construct instead of
     * failing (unknown function, CONSTANT write, unresolvable call, ...).
     * @param diagnostic what was skipped and why
     */
    void onDiagnostic(InterpreterDiagnostic diagnostic);
}
