package com.questrail.plc.ast;

public enum UnaryOperator
{
    NOT,
    NEGATE
}
