package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code FOR variable := start TO end [BY step] DO body END_FOR}.
 * A missing step is {@code null} and means 1.
 */
public record ForStatement(String variable,
                           Expression start,
                           Expression end,
                           Expression step,
                           List<Statement> body) implements Statement
{
    public ForStatement {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        body = List.copyOf(body);
    }

    public Optional<Expression> stepExpression() {
        return Optional.ofNullable(step);
    }
}
