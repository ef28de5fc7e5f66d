package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code VAR ... END_VAR} block, optionally qualified {@code CONSTANT}.
 */
public record VarBlock(VarScope scope, boolean constant, List<VariableDeclaration> declarations)
{
    public VarBlock {
        Objects.requireNonNull(scope, "scope");
        declarations = List.copyOf(declarations);
    }
}
