package com.questrail.plc.ast;

/** Skips to the next iteration of the innermost enclosing loop. */
public record ContinueStatement() implements Statement
{
}
