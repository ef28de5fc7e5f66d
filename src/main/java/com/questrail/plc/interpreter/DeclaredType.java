package com.questrail.plc.interpreter;

import java.util.Locale;
import java.util.Set;

/**
 * Category of a declared variable type.
 * <p>
 * Scalar categories decide the storage family and coercion of assignments;
 * the remaining categories mark function-block instances.
 */
public enum DeclaredType
{
    BOOL,
    INT,
    REAL,
    TIME,
    TIMER,
    COUNTER,
    R_TRIG,
    F_TRIG,
    BISTABLE,
    USER_FUNCTION_BLOCK,
    UNKNOWN;

    private static final Set<String> INTEGER_TYPES = Set.of(
            "INT", "DINT", "SINT", "LINT", "UINT", "UDINT", "USINT", "ULINT", "WORD", "DWORD", "BYTE");

    /**
     * Classifies a type name. User function-block names are not known here and
     * classify as {@link #UNKNOWN}; {@link TypeRegistry} refines them.
     */
    public static DeclaredType classify(String typeName) {
        if (typeName == null) {
            return UNKNOWN;
        }
        String upper = typeName.trim().toUpperCase(Locale.ROOT);
        if (INTEGER_TYPES.contains(upper)) {
            return INT;
        }
        return switch (upper) {
            case "BOOL" -> BOOL;
            case "REAL", "LREAL" -> REAL;
            case "TIME" -> TIME;
            case "TON", "TOF", "TP" -> TIMER;
            case "CTU", "CTD", "CTUD" -> COUNTER;
            case "R_TRIG" -> R_TRIG;
            case "F_TRIG" -> F_TRIG;
            case "SR", "RS" -> BISTABLE;
            default -> UNKNOWN;
        };
    }

    public boolean isScalar() {
        return this == BOOL || this == INT || this == REAL || this == TIME;
    }

    public boolean isFunctionBlock() {
        return !isScalar() && this != UNKNOWN;
    }
}
