package com.questrail.plc.ast;

import java.util.Objects;

public record ParenExpression(Expression expression) implements Expression
{
    public ParenExpression {
        Objects.requireNonNull(expression, "expression");
    }
}
