package com.questrail.plc.interpreter;

import com.questrail.plc.ast.BinaryOperator;
import com.questrail.plc.ast.St;
import com.questrail.plc.observability.InterpreterDiagnostic;
import com.questrail.plc.store.TimerKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.questrail.plc.ast.St.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionEvaluatorTest
 * -----------------------------------------------------------------------------
 * Pure expression evaluation against a store with no declarations, so that
 * every variable read goes through the by-presence path.
 */
class ExpressionEvaluatorTest {

    private Harness h;

    @BeforeEach
    void setUp() {
        h = Harness.empty();
    }

    @Test
    void literalsEvaluateToTheirValues() {
        assertEquals(Value.TRUE, h.eval(bool(true)));
        assertEquals(42.0, h.eval(num(42)).asNumber());
        assertEquals(2.5, h.eval(real(2.5)).asNumber());
        assertEquals(1500.0, h.eval(time("T#1.5s")).asNumber());
    }

    @Test
    void variablesReadFromWhicheverFamilyHoldsThem() {
        h.store.setBool("B", true);
        h.store.setInt("I", 7);
        h.store.setReal("R", 1.25);
        h.store.setTime("T", 300);

        assertEquals(Value.TRUE, h.eval(ref("B")));
        assertEquals(7.0, h.eval(ref("I")).asNumber());
        assertEquals(1.25, h.eval(ref("R")).asNumber());
        assertEquals(300.0, h.eval(ref("T")).asNumber());
        assertEquals(Value.FALSE, h.eval(ref("Unknown")));
    }

    @Test
    void arithmeticIsComputedInDouble() {
        assertEquals(3.5, h.eval(div(num(7), num(2))).asNumber());
        assertEquals(-1.0, h.eval(mod(num(-7), num(3))).asNumber(), "MOD takes the dividend's sign");
        assertEquals(8.0, h.eval(binary(BinaryOperator.POW, num(2), num(3))).asNumber());
        assertEquals(-5.0, h.eval(neg(num(5))).asNumber());
        assertEquals(14.0, h.eval(mul(paren(add(num(3), num(4))), num(2))).asNumber());
    }

    @Test
    void divisionByZeroFollowsIeee754() {
        assertEquals(Double.POSITIVE_INFINITY, h.eval(div(num(1), num(0))).asNumber());
        assertTrue(Double.isNaN(h.eval(div(num(0), num(0))).asNumber()));
        assertTrue(Double.isNaN(h.eval(mod(num(5), num(0))).asNumber()));
    }

    @Test
    void equalityIsStrictBetweenBooleansAndNumbers() {
        assertEquals(Value.FALSE, h.eval(eq(bool(true), num(1))));
        assertEquals(Value.TRUE, h.eval(ne(bool(false), num(0))));
        assertEquals(Value.TRUE, h.eval(eq(num(2), real(2.0))));
        assertEquals(Value.TRUE, h.eval(eq(bool(false), bool(false))));
    }

    @Test
    void orderingComparesNumerically() {
        assertEquals(Value.TRUE, h.eval(lt(num(1), real(1.5))));
        assertEquals(Value.TRUE, h.eval(ge(num(2), num(2))));
        assertEquals(Value.TRUE, h.eval(le(num(2), num(3))));
        assertEquals(Value.FALSE, h.eval(gt(num(2), num(3))));
    }

    @Test
    void logicalOperatorsUseTruthiness() {
        assertEquals(Value.TRUE, h.eval(and(bool(true), num(5))));
        assertEquals(Value.FALSE, h.eval(or(bool(false), num(0))));
        assertEquals(Value.TRUE, h.eval(binary(BinaryOperator.XOR, bool(true), bool(false))));
        assertEquals(Value.FALSE, h.eval(not(num(3))));
    }

    @Test
    void logicalOperatorsEvaluateBothOperands() {
        Harness withFunction = Harness.of(
                St.function("Bump", "BOOL")
                        .body(St.assign("Calls", add(ref("Calls"), num(1))),
                                St.assign("Bump", bool(true)))
                        .build());

        withFunction.store.setInt("Calls", 0);
        withFunction.eval(and(bool(false), fn("Bump")));
        withFunction.eval(or(bool(true), fn("Bump")));

        assertEquals(2L, withFunction.store.getInt("Calls"));
    }

    @Test
    void fieldAccessReadsInstanceState() {
        h.store.initTimer("T1", 500, TimerKind.TON).applyInput(true);
        h.store.timers().get("T1").advance(200);

        assertEquals(200.0, h.eval(ref("T1.ET")).asNumber());
        assertEquals(500.0, h.eval(ref("T1.PT")).asNumber());
        assertEquals(Value.TRUE, h.eval(ref("T1.IN")));
        assertEquals(Value.FALSE, h.eval(ref("T1.Q")));
    }

    @Test
    void fieldsOfAbsentInstancesReadAsFalseOrZero() {
        assertEquals(Value.FALSE, h.eval(ref("Ghost.Q")));
        assertEquals(Value.FALSE, h.eval(ref("Ghost.QU")));
        assertEquals(Value.FALSE, h.eval(ref("Ghost.Q1")));
        assertEquals(Value.ZERO, h.eval(ref("Ghost.ET")));
        assertEquals(Value.ZERO, h.eval(ref("Ghost.CV")));
    }

    @Test
    void unknownFunctionIsReportedAndEvaluatesToZero() {
        assertEquals(0.0, h.eval(fn("FROBNICATE", num(1))).asNumber());
        assertEquals(1, h.sink.countDiagnostics(InterpreterDiagnostic.Kind.UNKNOWN_FUNCTION));
    }

    @Test
    void standardFunctionsAreCaseInsensitive() {
        assertEquals(4.0, h.eval(fn("abs", num(-4))).asNumber());
        assertEquals(3.0, h.eval(fn("Sqrt", num(9))).asNumber());
        assertEquals(0, h.sink.getDiagnostics().size());
    }
}
