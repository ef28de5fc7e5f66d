package com.questrail.plc.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code A, B : INT := 5;} declares the names {@code A} and {@code B}. The
 * initial value is {@code null} when absent.
 */
public record VariableDeclaration(List<String> names, String typeName, Expression initialValue)
{
    public VariableDeclaration {
        names = List.copyOf(names);
        Objects.requireNonNull(typeName, "typeName");
    }

    public Optional<Expression> initializer() {
        return Optional.ofNullable(initialValue);
    }
}
