package com.questrail.plc.ast;

/**
 * Declaration block kinds.
 */
public enum VarScope
{
    VAR,
    VAR_INPUT,
    VAR_OUTPUT,
    VAR_IN_OUT,
    VAR_TEMP,
    VAR_GLOBAL
}
