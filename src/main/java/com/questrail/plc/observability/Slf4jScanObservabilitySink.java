package com.questrail.plc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ScanObservabilitySink that emits logs via SLF4J.
 * Diagnostics are logged at WARN, scan completions at DEBUG.
 */
public final class Slf4jScanObservabilitySink implements ScanObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jScanObservabilitySink.class);

    @Override
    public void onScanCompleted(ScanCompletedEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Scan complete: {} program(s), {} timer(s) advanced by {} ms",
                event.programsExecuted(),
                event.timersAdvanced(),
                event.scanTimeMillis());
        }
    }

    @Override
    public void onDiagnostic(InterpreterDiagnostic diagnostic) {
        log.warn("ST {} [{}]: {}", diagnostic.kind(), diagnostic.subject(), diagnostic.message());
    }
}
