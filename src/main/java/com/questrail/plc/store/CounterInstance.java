package com.questrail.plc.store;

import java.util.Objects;

/**
 * CounterInstance
 * -----------------------------------------------------------------------------
 * State of one CTU / CTD / CTUD instance.
 * <p>
 * The mutators are primitive steps; the order in which they are applied during
 * a call (and the edge detection that gates {@link #countUp()} and
 * {@link #countDown()}) belongs to the function-block handler.
 * <p>
 * Invariant: {@code CV >= 0}. {@link #recomputeOutputs()} restores
 * {@code QU == (CV >= PV)} and {@code QD == (CV <= 0)}.
 */
public final class CounterInstance
{
    private final CounterKind kind;
    private boolean cu;
    private boolean cd;
    private boolean r;
    private boolean ld;
    private long pv;
    private long cv;
    private boolean qu;
    private boolean qd;

    CounterInstance(CounterKind kind, long pv) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pv = pv;
    }

    public CounterKind kind() {
        return kind;
    }

    public boolean cu() {
        return cu;
    }

    public boolean cd() {
        return cd;
    }

    public boolean r() {
        return r;
    }

    public boolean ld() {
        return ld;
    }

    public long pv() {
        return pv;
    }

    public long cv() {
        return cv;
    }

    public boolean qu() {
        return qu;
    }

    public boolean qd() {
        return qd;
    }

    /** Records the raw inputs of the current call for display and field reads. */
    public void recordInputs(boolean cu, boolean cd, boolean r, boolean ld) {
        this.cu = cu;
        this.cd = cd;
        this.r = r;
        this.ld = ld;
    }

    public void setPv(long pv) {
        this.pv = pv;
    }

    public void countUp() {
        cv++;
    }

    /** Decrements, clamping at zero. */
    public void countDown() {
        cv = Math.max(0, cv - 1);
    }

    public void reset() {
        cv = 0;
    }

    public void load() {
        cv = Math.max(0, pv);
    }

    public void recomputeOutputs() {
        qu = cv >= pv;
        qd = cv <= 0;
    }

    @Override
    public String toString() {
        return kind + "{CV=" + cv + ", PV=" + pv + ", QU=" + qu + ", QD=" + qd + "}";
    }
}
