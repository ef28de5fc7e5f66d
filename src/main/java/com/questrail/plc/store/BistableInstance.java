package com.questrail.plc.store;

/**
 * State of one SR / RS latch. Both commands false leaves {@code Q1} unchanged.
 */
public final class BistableInstance
{
    private boolean q1;

    BistableInstance() {
    }

    public boolean q1() {
        return q1;
    }

    /** SR: {@code S1} checked first. */
    public boolean updateSetDominant(boolean s1, boolean r) {
        if (s1) {
            q1 = true;
        } else if (r) {
            q1 = false;
        }
        return q1;
    }

    /** RS: {@code R1} checked first. */
    public boolean updateResetDominant(boolean s, boolean r1) {
        if (r1) {
            q1 = false;
        } else if (s) {
            q1 = true;
        }
        return q1;
    }

    @Override
    public String toString() {
        return "Bistable{Q1=" + q1 + "}";
    }
}
