package com.questrail.plc.config;

import com.questrail.plc.observability.NullObservabilitySink;
import com.questrail.plc.observability.ScanObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * InterpreterConfig
 * -----------------------------------------------------------------------------
 * Settings for one simulation session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>scanTime</b> - elapsed time applied to running timers at the end of
 *       every scan. Whole milliseconds; the interpreter never reads a clock, so
 *       this is the only source of time.</li>
 *   <li><b>observabilitySink</b> - receives scan summaries and diagnostics.</li>
 *   <li><b>clearOnLoad</b> - whether loading a program clears the store before
 *       initializing it. Hosts that pre-seed inputs turn this off.</li>
 * </ul>
 */
public record InterpreterConfig(
        Duration scanTime,
        ScanObservabilitySink observabilitySink,
        boolean clearOnLoad
) {
    public static final Duration DEFAULT_SCAN_TIME = Duration.ofMillis(100);

    /**
     * Canonical constructor with validation.
     */
    public InterpreterConfig {
        Objects.requireNonNull(scanTime, "scanTime");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        if (scanTime.isNegative()) {
            throw new IllegalArgumentException("scanTime must be non-negative");
        }
    }

    /**
     * 100 ms scans, no observability, store cleared on load.
     */
    public static InterpreterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long scanTimeMillis() {
        return scanTime.toMillis();
    }

    public static final class Builder {
        private Duration scanTime = DEFAULT_SCAN_TIME;
        private ScanObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private boolean clearOnLoad = true;

        public Builder withScanTime(Duration scanTime) {
            this.scanTime = scanTime;
            return this;
        }

        public Builder withObservabilitySink(ScanObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClearOnLoad(boolean clearOnLoad) {
            this.clearOnLoad = clearOnLoad;
            return this;
        }

        public InterpreterConfig build() {
            return new InterpreterConfig(scanTime, observabilitySink, clearOnLoad);
        }
    }
}
