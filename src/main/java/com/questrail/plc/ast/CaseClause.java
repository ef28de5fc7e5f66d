package com.questrail.plc.ast;

import java.util.List;

public record CaseClause(List<CaseLabel> labels, List<Statement> statements)
{
    public CaseClause {
        labels = List.copyOf(labels);
        statements = List.copyOf(statements);
    }
}
