package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

public record WhileStatement(Expression condition, List<Statement> body) implements Statement
{
    public WhileStatement {
        Objects.requireNonNull(condition, "condition");
        body = List.copyOf(body);
    }
}
