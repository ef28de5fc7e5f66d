package com.questrail.plc.store;

/**
 * IEC 61131-3 standard timer types.
 */
public enum TimerKind
{
    /** On-delay. */
    TON,
    /** Off-delay. */
    TOF,
    /** Pulse. */
    TP
}
