package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

public record CaseStatement(Expression selector,
                            List<CaseClause> cases,
                            List<Statement> elseBranch) implements Statement
{
    public CaseStatement {
        Objects.requireNonNull(selector, "selector");
        cases = List.copyOf(cases);
        elseBranch = List.copyOf(elseBranch);
    }
}
