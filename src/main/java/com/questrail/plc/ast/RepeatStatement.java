package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

/** {@code REPEAT body UNTIL condition END_REPEAT}; exits once the condition is TRUE. */
public record RepeatStatement(List<Statement> body, Expression until) implements Statement
{
    public RepeatStatement {
        body = List.copyOf(body);
        Objects.requireNonNull(until, "until");
    }
}
