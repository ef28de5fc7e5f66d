package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

/**
 * Invocation of a function-block instance as a statement, e.g.
 * {@code Timer1(IN := Start, PT := T#500ms, Q => Done);}.
 */
public record FunctionBlockCall(String instanceName, List<CallArgument> arguments) implements Statement
{
    public FunctionBlockCall {
        Objects.requireNonNull(instanceName, "instanceName");
        arguments = List.copyOf(arguments);
    }
}
