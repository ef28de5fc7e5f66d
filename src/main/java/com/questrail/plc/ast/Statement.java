package com.questrail.plc.ast;

/**
 * Statement
 * -----------------------------------------------------------------------------
 * Marker for every Structured Text statement node. Closed, so the statement
 * executor can dispatch exhaustively.
 */
public sealed interface Statement
        permits Assignment, FunctionBlockCall, IfStatement, CaseStatement, ForStatement,
                WhileStatement, RepeatStatement, ExitStatement, ContinueStatement, ReturnStatement
{
}
