package com.questrail.plc.interpreter;

import com.questrail.plc.ast.CallArgument;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * FunctionBlockKind
 * -----------------------------------------------------------------------------
 * Closed set of function-block families the handler can dispatch to.
 *
 * <h2>Resolution</h2>
 * The kind of an instance comes from its declared type. Instances that were
 * never declared are classified from the argument names of the call that
 * first touches them:
 * <ul>
 *   <li>{@code CLK} - edge detector; F_TRIG when the instance name starts with
 *       {@code F_} or contains {@code FTRIG}, otherwise R_TRIG</li>
 *   <li>{@code S1} and {@code R} - SR</li>
 *   <li>{@code S} and {@code R1} - RS</li>
 *   <li>{@code IN} or {@code PT} - TON</li>
 *   <li>{@code CU}, {@code CD} or {@code PV} - CTUD</li>
 * </ul>
 */
public enum FunctionBlockKind
{
    TON,
    TOF,
    TP,
    CTU,
    CTD,
    CTUD,
    R_TRIG,
    F_TRIG,
    SR,
    RS,
    USER_DEFINED;

    /**
     * Maps a built-in type name (case-insensitive) to its kind.
     */
    public static Optional<FunctionBlockKind> fromTypeName(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        String upper = typeName.trim().toUpperCase(Locale.ROOT);
        for (FunctionBlockKind kind : values()) {
            if (kind != USER_DEFINED && kind.name().equals(upper)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Guesses the kind of an undeclared instance from the call's argument names.
     */
    public static Optional<FunctionBlockKind> infer(String instanceName, List<CallArgument> arguments) {
        if (hasArgument(arguments, "CLK")) {
            String upper = instanceName.toUpperCase(Locale.ROOT);
            return Optional.of(upper.startsWith("F_") || upper.contains("FTRIG") ? F_TRIG : R_TRIG);
        }
        if (hasArgument(arguments, "S1") && hasArgument(arguments, "R")) {
            return Optional.of(SR);
        }
        if (hasArgument(arguments, "S") && hasArgument(arguments, "R1")) {
            return Optional.of(RS);
        }
        if (hasArgument(arguments, "IN") || hasArgument(arguments, "PT")) {
            return Optional.of(TON);
        }
        if (hasArgument(arguments, "CU") || hasArgument(arguments, "CD") || hasArgument(arguments, "PV")) {
            return Optional.of(CTUD);
        }
        return Optional.empty();
    }

    private static boolean hasArgument(List<CallArgument> arguments, String parameter) {
        for (CallArgument argument : arguments) {
            if (argument.named(parameter)) {
                return true;
            }
        }
        return false;
    }

    public boolean isTimer() {
        return this == TON || this == TOF || this == TP;
    }

    public boolean isCounter() {
        return this == CTU || this == CTD || this == CTUD;
    }
}
