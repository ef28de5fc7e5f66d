package com.questrail.plc.ast;

import java.util.List;

/**
 * StAst
 * -----------------------------------------------------------------------------
 * Root of a parsed Structured Text source: the declared POUs plus any
 * statements and declarations written outside of a POU.
 * <p>
 * The interpreter assumes the tree is structurally valid; parse errors are
 * the parser's concern and never reach this type.
 */
public record StAst(List<Program> programs,
                    List<Statement> topLevelStatements,
                    List<VarBlock> topLevelVarBlocks)
{
    public StAst {
        programs = List.copyOf(programs);
        topLevelStatements = List.copyOf(topLevelStatements);
        topLevelVarBlocks = List.copyOf(topLevelVarBlocks);
    }

    public static StAst of(Program... programs) {
        return new StAst(List.of(programs), List.of(), List.of());
    }
}
