package com.questrail.plc.interpreter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * StandardFunctions
 * -----------------------------------------------------------------------------
 * The IEC 61131-3 standard functions the interpreter understands, looked up
 * case-insensitively:
 * <ul>
 *   <li>{@code ABS}, {@code SQRT}, {@code TRUNC}</li>
 *   <li>{@code MIN}, {@code MAX} over one or more arguments</li>
 *   <li>{@code LIMIT(MN, IN, MX)}</li>
 *   <li>{@code EXPT(base, exponent)}</li>
 *   <li>{@code <A>_TO_<B>} among the BOOL, INT, REAL and TIME families, with any
 *       concrete type name of a family ({@code DINT_TO_LREAL} etc.)</li>
 * </ul>
 * Missing arguments read as 0. Pure: no store access.
 */
final class StandardFunctions
{
    private StandardFunctions() {
    }

    /**
     * @return the result, or empty when {@code name} is not a standard function
     */
    static Optional<Value> call(String name, List<Value> args) {
        String upper = name.toUpperCase(Locale.ROOT);
        switch (upper) {
            case "ABS":
                return number(Math.abs(arg(args, 0)));
            case "SQRT":
                return number(Math.sqrt(arg(args, 0)));
            case "TRUNC":
                return number(Cell.truncate(arg(args, 0)));
            case "EXPT":
                return number(Math.pow(arg(args, 0), arg(args, 1)));
            case "LIMIT":
                return number(Math.min(Math.max(arg(args, 1), arg(args, 0)), arg(args, 2)));
            case "MIN":
            case "MAX":
                return extremum(upper.equals("MIN"), args);
            default:
                return conversion(upper, args);
        }
    }

    /** Parameter names of {@code LIMIT} and {@code EXPT}, for named calls. */
    static Optional<List<String>> parameterNames(String name) {
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "LIMIT" -> Optional.of(List.of("MN", "IN", "MX"));
            case "EXPT" -> Optional.of(List.of("IN1", "IN2"));
            default -> Optional.empty();
        };
    }

    private static Optional<Value> extremum(boolean min, List<Value> args) {
        if (args.isEmpty()) {
            return number(0);
        }
        double result = args.get(0).asNumber();
        for (Value v : args.subList(1, args.size())) {
            result = min ? Math.min(result, v.asNumber()) : Math.max(result, v.asNumber());
        }
        return number(result);
    }

    private static Optional<Value> conversion(String upper, List<Value> args) {
        int split = upper.indexOf("_TO_");
        if (split <= 0) {
            return Optional.empty();
        }
        DeclaredType from = DeclaredType.classify(upper.substring(0, split));
        DeclaredType to = DeclaredType.classify(upper.substring(split + 4));
        if (!from.isScalar() || !to.isScalar()) {
            return Optional.empty();
        }

        Value input = args.isEmpty() ? Value.ZERO : args.get(0);
        Value converted = switch (to) {
            case BOOL -> Value.of(input.asBoolean());
            case INT, TIME -> Value.of((double) Cell.truncate(input.asNumber()));
            default -> Value.of(input.asNumber());
        };
        return Optional.of(converted);
    }

    private static double arg(List<Value> args, int index) {
        return index < args.size() ? args.get(index).asNumber() : 0.0;
    }

    private static Optional<Value> number(double value) {
        return Optional.of(Value.of(value));
    }
}
