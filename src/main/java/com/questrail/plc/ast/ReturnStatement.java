package com.questrail.plc.ast;

/** Leaves the body of the current program, function block or function. */
public record ReturnStatement() implements Statement
{
}
