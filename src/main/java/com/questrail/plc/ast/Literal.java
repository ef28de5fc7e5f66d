package com.questrail.plc.ast;

import java.util.Objects;

/**
 * Literal
 * -----------------------------------------------------------------------------
 * A constant appearing in source text.
 * <p>
 * BOOL literals carry their value in {@link #boolValue()}; every other literal
 * carries it in {@link #numericValue()} (TIME literals in milliseconds).
 * {@link #rawValue()} preserves the original spelling for diagnostics.
 */
public record Literal(LiteralType literalType,
                      boolean boolValue,
                      double numericValue,
                      String rawValue) implements Expression
{
    public Literal {
        Objects.requireNonNull(literalType, "literalType");
        Objects.requireNonNull(rawValue, "rawValue");
    }

    public static Literal ofBool(boolean value) {
        return new Literal(LiteralType.BOOL, value, value ? 1 : 0, value ? "TRUE" : "FALSE");
    }

    public static Literal ofInt(long value) {
        return new Literal(LiteralType.INT, value != 0, value, Long.toString(value));
    }

    public static Literal ofReal(double value) {
        return new Literal(LiteralType.REAL, value != 0, value, Double.toString(value));
    }

    public static Literal ofTime(String text) {
        long millis = TimeLiterals.parseMillis(text);
        return new Literal(LiteralType.TIME, millis != 0, millis, text);
    }

    public static Literal ofTimeMillis(long millis) {
        return new Literal(LiteralType.TIME, millis != 0, millis, "T#" + millis + "ms");
    }
}
