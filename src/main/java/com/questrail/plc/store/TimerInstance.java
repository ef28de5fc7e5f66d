package com.questrail.plc.store;

import java.util.Objects;

/**
 * TimerInstance
 * -----------------------------------------------------------------------------
 * State of one TON / TOF / TP instance.
 *
 * <h2>Two entry points</h2>
 * <ul>
 *   <li>{@link #applyInput(boolean)} is called once per function-block call and
 *       reacts to edges of {@code IN}</li>
 *   <li>{@link #advance(long)} is called by the scan-cycle driver and is the only
 *       place elapsed time is applied</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code 0 <= ET <= PT}</li>
 *   <li>{@code running} is true only strictly between start and timeout</li>
 * </ul>
 *
 * Instances are mutable and unsynchronized; they belong to exactly one
 * {@link VariableStore}.
 */
public final class TimerInstance
{
    private final TimerKind kind;
    private boolean in;
    private long pt;
    private long et;
    private boolean q;
    private boolean running;

    TimerInstance(TimerKind kind, long pt) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pt = pt;
    }

    public TimerKind kind() {
        return kind;
    }

    public boolean in() {
        return in;
    }

    public long pt() {
        return pt;
    }

    public long et() {
        return et;
    }

    public boolean q() {
        return q;
    }

    public boolean running() {
        return running;
    }

    /**
     * Updates the preset. ET is clamped so that {@code ET <= PT} keeps holding.
     */
    public void setPt(long pt) {
        this.pt = pt;
        if (et > Math.max(pt, 0)) {
            et = Math.max(pt, 0);
        }
    }

    /**
     * Applies one observation of {@code IN}.
     *
     * @param input the value of {@code IN} for this call
     */
    public void applyInput(boolean input) {
        boolean risingEdge = input && !in;
        boolean fallingEdge = !input && in;
        boolean heldLow = !input && !in;
        boolean heldHigh = input && in;
        in = input;

        switch (kind) {
            case TON -> {
                if (risingEdge) {
                    et = 0;
                    if (pt <= 0) {
                        q = true;
                        running = false;
                    } else {
                        running = true;
                        q = false;
                    }
                } else if (fallingEdge) {
                    // Q survives the falling edge; it clears on the next low call.
                    running = false;
                    et = 0;
                } else if (heldLow && q) {
                    q = false;
                }
            }
            case TOF -> {
                if (risingEdge) {
                    q = true;
                    et = 0;
                    running = false;
                } else if (fallingEdge) {
                    et = 0;
                    if (pt <= 0) {
                        q = false;
                        running = false;
                    } else {
                        running = true;
                    }
                } else if (heldHigh) {
                    et = 0;
                    running = false;
                    q = true;
                }
            }
            case TP -> {
                if (risingEdge && !running && !q) {
                    et = 0;
                    if (pt <= 0) {
                        q = false;
                        running = false;
                    } else {
                        q = true;
                        running = true;
                    }
                }
            }
        }
    }

    /**
     * Advances a running timer by {@code deltaMillis}. Idle timers are left
     * untouched.
     *
     * @return {@code true} if the timer was running when called
     */
    public boolean advance(long deltaMillis) {
        if (!running) {
            return false;
        }

        et = Math.max(0, Math.min(et + deltaMillis, Math.max(pt, 0)));
        boolean timedOut = et >= pt;
        if (timedOut) {
            running = false;
            q = kind == TimerKind.TON;
        }
        return true;
    }

    @Override
    public String toString() {
        return kind + "{IN=" + in + ", PT=" + pt + ", ET=" + et + ", Q=" + q + ", running=" + running + "}";
    }
}
