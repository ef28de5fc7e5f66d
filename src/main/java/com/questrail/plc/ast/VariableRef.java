package com.questrail.plc.ast;

import java.util.List;

/**
 * VariableRef
 * -----------------------------------------------------------------------------
 * A reference to a variable, optionally followed by member access
 * ({@code Timer1.Q} has the access path {@code [Timer1, Q]}).
 */
public record VariableRef(List<String> accessPath) implements Expression
{
    public VariableRef {
        accessPath = List.copyOf(accessPath);
        if (accessPath.isEmpty()) {
            throw new IllegalArgumentException("accessPath must not be empty");
        }
    }

    public static VariableRef of(String name) {
        return new VariableRef(List.of(name.split("\\.")));
    }

    /** The dotted name, e.g. {@code Timer1.Q}. */
    public String name() {
        return String.join(".", accessPath);
    }

    public String baseName() {
        return accessPath.get(0);
    }

    public boolean isMemberAccess() {
        return accessPath.size() > 1;
    }
}
