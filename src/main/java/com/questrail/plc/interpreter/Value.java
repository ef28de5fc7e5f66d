package com.questrail.plc.interpreter;

/**
 * Value
 * -----------------------------------------------------------------------------
 * Result of evaluating an expression: a boolean or a number.
 * <p>
 * Every numeric value, whatever family it was read from, is carried as a
 * {@code double}. The storage family of a result is only decided when it is
 * written back (see {@link Cell#write(Value)}).
 */
public sealed interface Value permits Value.BoolValue, Value.NumberValue
{
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);
    NumberValue ZERO = new NumberValue(0.0);

    /** Truthiness: a number is true when non-zero. */
    boolean asBoolean();

    /** Numeric view: TRUE is 1, FALSE is 0. */
    double asNumber();

    static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static NumberValue of(double value) {
        return new NumberValue(value);
    }

    record BoolValue(boolean value) implements Value
    {
        @Override
        public boolean asBoolean() {
            return value;
        }

        @Override
        public double asNumber() {
            return value ? 1.0 : 0.0;
        }

        @Override
        public String toString() {
            return value ? "TRUE" : "FALSE";
        }
    }

    record NumberValue(double value) implements Value
    {
        @Override
        public boolean asBoolean() {
            return value != 0.0;
        }

        @Override
        public double asNumber() {
            return value;
        }

        /** Whole and finite, so it can live in the integer family. */
        public boolean isWhole() {
            return Double.isFinite(value) && value == Math.rint(value)
                    && value >= Long.MIN_VALUE && value <= Long.MAX_VALUE;
        }

        @Override
        public String toString() {
            return isWhole() ? Long.toString((long) value) : Double.toString(value);
        }
    }
}
