package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

/**
 * IF / ELSIF / ELSE. An absent ELSE branch is represented by an empty list.
 */
public record IfStatement(Expression condition,
                          List<Statement> thenBranch,
                          List<ElsifClause> elsifClauses,
                          List<Statement> elseBranch) implements Statement
{
    public IfStatement {
        Objects.requireNonNull(condition, "condition");
        thenBranch = List.copyOf(thenBranch);
        elsifClauses = List.copyOf(elsifClauses);
        elseBranch = List.copyOf(elseBranch);
    }
}
