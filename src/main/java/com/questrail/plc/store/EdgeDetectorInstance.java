package com.questrail.plc.store;

/**
 * EdgeDetectorInstance
 * -----------------------------------------------------------------------------
 * State of one R_TRIG / F_TRIG instance: the last clock {@code CLK}, the memory
 * {@code M} of the previous clock, and the output {@code Q}.
 * <p>
 * A fresh instance has {@code M = false}, so the very first TRUE seen by an
 * R_TRIG is a rising edge and the very first FALSE seen by an F_TRIG is not a
 * falling edge. {@code Q} is recomputed on every update and is never sticky.
 */
public final class EdgeDetectorInstance
{
    private boolean clk;
    private boolean m;
    private boolean q;

    EdgeDetectorInstance() {
    }

    public boolean clk() {
        return clk;
    }

    public boolean m() {
        return m;
    }

    public boolean q() {
        return q;
    }

    /** R_TRIG: {@code Q := CLK AND NOT M; M := CLK}. */
    public boolean updateRising(boolean clock) {
        q = clock && !m;
        clk = clock;
        m = clock;
        return q;
    }

    /** F_TRIG: {@code Q := NOT CLK AND M; M := CLK}. */
    public boolean updateFalling(boolean clock) {
        q = !clock && m;
        clk = clock;
        m = clock;
        return q;
    }

    @Override
    public String toString() {
        return "EdgeDetector{CLK=" + clk + ", M=" + m + ", Q=" + q + "}";
    }
}
