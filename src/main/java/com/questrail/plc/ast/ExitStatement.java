package com.questrail.plc.ast;

/** Leaves the innermost enclosing loop. */
public record ExitStatement() implements Statement
{
}
