package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

/**
 * FunctionCall
 * -----------------------------------------------------------------------------
 * A call appearing inside an expression: a standard function such as
 * {@code ABS(x)} or a user-declared {@code FUNCTION}. Arguments may be
 * positional (no name) or named ({@code Scale(Value := x)}).
 */
public record FunctionCall(String name, List<CallArgument> arguments) implements Expression
{
    public FunctionCall {
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(arguments);
    }
}
