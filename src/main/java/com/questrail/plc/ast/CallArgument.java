package com.questrail.plc.ast;

import java.util.Objects;

/**
 * CallArgument
 * -----------------------------------------------------------------------------
 * One argument of a function or function-block call.
 *
 * <ul>
 *   <li>{@link Direction#INPUT}: {@code name := expression}, or positional when
 *       {@code name} is {@code null}</li>
 *   <li>{@link Direction#OUTPUT}: {@code name => variable}; the expression must
 *       be a {@link VariableRef}</li>
 * </ul>
 */
public record CallArgument(String name, Expression expression, Direction direction)
{
    public enum Direction
    {
        INPUT,
        OUTPUT
    }

    public CallArgument {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(direction, "direction");
        if (direction == Direction.OUTPUT && name == null) {
            throw new IllegalArgumentException("output arguments must be named");
        }
        if (direction == Direction.OUTPUT && !(expression instanceof VariableRef)) {
            throw new IllegalArgumentException("output argument " + name + " must target a variable");
        }
    }

    public static CallArgument positional(Expression expression) {
        return new CallArgument(null, expression, Direction.INPUT);
    }

    public static CallArgument input(String name, Expression expression) {
        return new CallArgument(Objects.requireNonNull(name, "name"), expression, Direction.INPUT);
    }

    public static CallArgument output(String name, VariableRef target) {
        return new CallArgument(name, target, Direction.OUTPUT);
    }

    public boolean isPositional() {
        return name == null;
    }

    public boolean isOutput() {
        return direction == Direction.OUTPUT;
    }

    /** Case-insensitive match against a parameter name. */
    public boolean named(String parameter) {
        return name != null && name.equalsIgnoreCase(parameter);
    }
}
