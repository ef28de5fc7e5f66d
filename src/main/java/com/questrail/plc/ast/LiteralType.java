package com.questrail.plc.ast;

/**
 * Literal categories produced by the ST parser.
 */
public enum LiteralType
{
    BOOL,
    INT,
    REAL,
    /** Duration literal ({@code T#...}); the numeric value is in milliseconds. */
    TIME
}
