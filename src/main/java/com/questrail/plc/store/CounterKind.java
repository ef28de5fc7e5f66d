package com.questrail.plc.store;

/**
 * IEC 61131-3 standard counter types.
 */
public enum CounterKind
{
    CTU,
    CTD,
    CTUD;

    public boolean countsUp() {
        return this != CTD;
    }

    public boolean countsDown() {
        return this != CTU;
    }
}
