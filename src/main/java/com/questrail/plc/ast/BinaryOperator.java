package com.questrail.plc.ast;

/**
 * Binary operators of Structured Text.
 */
public enum BinaryOperator
{
    AND("AND"),
    OR("OR"),
    XOR("XOR"),
    EQ("="),
    NE("<>"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("MOD"),
    POW("**");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isLogical() {
        return this == AND || this == OR || this == XOR;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
    }

    public boolean isArithmetic() {
        return !isLogical() && !isComparison();
    }
}
