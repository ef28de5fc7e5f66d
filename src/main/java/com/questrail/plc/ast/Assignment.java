package com.questrail.plc.ast;

import java.util.Objects;

/** {@code target := expression;} */
public record Assignment(VariableRef target, Expression expression) implements Statement
{
    public Assignment {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(expression, "expression");
    }
}
