package com.questrail.plc.ast;

import java.util.Objects;

public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression
{
    public UnaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }
}
