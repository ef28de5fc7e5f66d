package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Program
 * -----------------------------------------------------------------------------
 * A program organisation unit: a PROGRAM executed every scan, a FUNCTION_BLOCK
 * type instantiated by declarations, or a FUNCTION called from expressions.
 * {@code returnType} is only meaningful for functions and is {@code null}
 * otherwise.
 */
public record Program(String name,
                      PouType pouType,
                      String returnType,
                      List<VarBlock> varBlocks,
                      List<Statement> statements)
{
    public Program {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pouType, "pouType");
        varBlocks = List.copyOf(varBlocks);
        statements = List.copyOf(statements);
    }

    public Optional<String> declaredReturnType() {
        return Optional.ofNullable(returnType);
    }

    public boolean isExecutedEachScan() {
        return pouType == PouType.PROGRAM;
    }
}
