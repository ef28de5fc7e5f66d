package com.questrail.plc.ast;

/**
 * Program organisation unit kinds.
 */
public enum PouType
{
    PROGRAM,
    FUNCTION_BLOCK,
    FUNCTION
}
