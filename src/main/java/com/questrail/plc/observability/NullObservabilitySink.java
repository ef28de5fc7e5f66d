package com.questrail.plc.observability;

/**
 * No-op implementation of ScanObservabilitySink.
 */
public final class NullObservabilitySink implements ScanObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onScanCompleted(ScanCompletedEvent event) {}

    @Override
    public void onDiagnostic(InterpreterDiagnostic diagnostic) {}
}
