package com.questrail.plc.ast;

/**
 * Expression
 * -----------------------------------------------------------------------------
 * Marker for every Structured Text expression node consumed by the interpreter.
 *
 * The hierarchy is closed so that evaluation can be written as an exhaustive
 * dispatch over the concrete node types.
 */
public sealed interface Expression
        permits Literal, VariableRef, BinaryExpression, UnaryExpression, FunctionCall, ParenExpression
{
}
