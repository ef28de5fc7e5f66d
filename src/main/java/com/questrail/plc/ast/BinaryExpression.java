package com.questrail.plc.ast;

import java.util.Objects;

public record BinaryExpression(BinaryOperator operator,
                               Expression left,
                               Expression right) implements Expression
{
    public BinaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
