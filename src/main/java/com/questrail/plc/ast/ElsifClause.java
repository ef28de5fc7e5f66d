package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

public record ElsifClause(Expression condition, List<Statement> statements)
{
    public ElsifClause {
        Objects.requireNonNull(condition, "condition");
        statements = List.copyOf(statements);
    }
}
