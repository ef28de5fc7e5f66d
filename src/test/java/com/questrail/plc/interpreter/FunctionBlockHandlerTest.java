package com.questrail.plc.interpreter;

import com.questrail.plc.ast.CallArgument;
import com.questrail.plc.ast.St;
import com.questrail.plc.observability.InterpreterDiagnostic;
import com.questrail.plc.store.CounterKind;
import com.questrail.plc.store.TimerKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.plc.ast.St.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * FunctionBlockHandlerTest
 * -----------------------------------------------------------------------------
 * Dispatch, kind inference and parameter binding. The per-family state
 * machines are covered by the compliance suites.
 */
class FunctionBlockHandlerTest {

    // ---------------------------------------------------------------------
    // Kind resolution
    // ---------------------------------------------------------------------

    @Test
    void declaredTypeSelectsTheFamily() {
        Harness h = Harness.of(St.program("Main")
                .var("Delay", "TOF")
                .var("Pulses", "ctd")
                .build());

        h.exec(call("Delay", arg("IN", bool(true)), arg("PT", time("T#1s"))),
                call("Pulses", arg("CD", bool(true)), arg("PV", num(3))));

        assertEquals(TimerKind.TOF, h.store.findTimer("Delay").orElseThrow().kind());
        assertEquals(CounterKind.CTD, h.store.findCounter("Pulses").orElseThrow().kind());
    }

    @Test
    void undeclaredInstancesAreInferredFromArguments() {
        Harness h = Harness.empty();

        h.exec(call("Rise", arg("CLK", bool(true))),
                call("F_Edge", arg("CLK", bool(true))),
                call("Latch", arg("S1", bool(true)), arg("R", bool(false))),
                call("Unlatch", arg("S", bool(true)), arg("R1", bool(false))),
                call("Delay", arg("IN", bool(true)), arg("PT", num(200))),
                call("Items", arg("CU", bool(true)), arg("PV", num(2))));

        assertTrue(h.store.findEdgeDetector("Rise").orElseThrow().q(), "R_TRIG fires on first TRUE");
        assertFalse(h.store.findEdgeDetector("F_Edge").orElseThrow().q(), "F_TRIG does not fire on TRUE");
        assertTrue(h.store.findBistable("Latch").orElseThrow().q1());
        assertTrue(h.store.findBistable("Unlatch").orElseThrow().q1());
        assertEquals(TimerKind.TON, h.store.findTimer("Delay").orElseThrow().kind());
        assertEquals(CounterKind.CTUD, h.store.findCounter("Items").orElseThrow().kind());
    }

    @Test
    void kindInferenceRecognisesFallingTriggerNames() {
        assertEquals(FunctionBlockKind.F_TRIG,
                FunctionBlockKind.infer("DoorFTrig", List.of(CallArgument.input("CLK", bool(true)))).orElseThrow());
        assertEquals(FunctionBlockKind.R_TRIG,
                FunctionBlockKind.infer("Door", List.of(CallArgument.input("CLK", bool(true)))).orElseThrow());
        assertTrue(FunctionBlockKind.infer("Mystery", List.of(CallArgument.input("X", num(1)))).isEmpty());
    }

    @Test
    void unresolvableInstanceIsReportedAndIgnored() {
        Harness h = Harness.empty();
        h.exec(call("Mystery", arg("X", num(1))));

        assertEquals(1, h.sink.countDiagnostics(InterpreterDiagnostic.Kind.UNRESOLVED_FUNCTION_BLOCK));
        assertTrue(h.store.timers().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Built-in parameters
    // ---------------------------------------------------------------------

    @Test
    void outputBindingsCopyBuiltInOutputs() {
        Harness h = Harness.of(St.program("Main")
                .var("Timer1", "TON")
                .var("Done", "BOOL")
                .var("Elapsed", "TIME")
                .build());

        h.exec(call("Timer1", arg("IN", bool(true)), arg("PT", time("T#0ms")),
                out("Q", "Done"), out("ET", "Elapsed")));

        assertTrue(h.store.getBool("Done"));
        assertEquals(0L, h.store.getTime("Elapsed"));
    }

    @Test
    void parametersNotAcceptedByTheFamilyAreReported() {
        Harness h = Harness.of(St.program("Main").var("Up", "CTU").build());

        h.exec(call("Up", arg("CU", bool(true)), arg("CD", bool(true)), arg("PV", num(5))));

        assertEquals(1L, h.store.findCounter("Up").orElseThrow().cv());
        assertEquals(1, h.sink.countDiagnostics(InterpreterDiagnostic.Kind.INVALID_ARGUMENT));
    }

    @Test
    void omittedInputsKeepPreviousValues() {
        Harness h = Harness.of(St.program("Main").var("Timer1", "TON").build());
        h.exec(call("Timer1", arg("IN", bool(true)), arg("PT", num(300))));
        h.exec(call("Timer1"));

        assertTrue(h.store.findTimer("Timer1").orElseThrow().in());
        assertEquals(300L, h.store.findTimer("Timer1").orElseThrow().pt());
        assertTrue(h.store.findTimer("Timer1").orElseThrow().running());
    }

    // ---------------------------------------------------------------------
    // User-defined blocks
    // ---------------------------------------------------------------------

    @Test
    void userBlockMembersLiveUnderInstancePrefix() {
        Harness h = Harness.of(
                St.functionBlock("Accumulator")
                        .input("Amount", "INT")
                        .output("Total", "INT")
                        .body(assign("Total", add(ref("Total"), ref("Amount"))))
                        .build(),
                St.program("Main")
                        .var("Acc", "Accumulator")
                        .var("Result", "INT")
                        .body(call("Acc", arg("Amount", num(5)), out("Total", "Result")))
                        .build());

        h.scans(3);

        assertEquals(15L, h.store.getInt("Acc.Total"));
        assertEquals(5L, h.store.getInt("Acc.Amount"));
        assertEquals(15L, h.store.getInt("Result"));
        assertEquals(15.0, h.eval(ref("Acc.Total")).asNumber());
        assertFalse(h.store.containsInt("Total"), "members never leak into the global namespace");
    }

    @Test
    void inputsAreEvaluatedBeforeAnyIsWritten() {
        Harness h = Harness.of(
                St.functionBlock("Pair")
                        .input("A", "INT")
                        .input("B", "INT")
                        .build(),
                St.program("Main")
                        .var("P", "Pair")
                        .var("A", "INT", num(1))
                        .build());

        h.exec(call("P", arg("A", num(7)), arg("B", ref("A"))));

        assertEquals(7L, h.store.getInt("P.A"));
        assertEquals(1L, h.store.getInt("P.B"), "B reads the caller's A, not the member just bound");
    }

    @Test
    void inOutBoundToExpressionIsReported() {
        Harness h = Harness.of(
                St.functionBlock("Inc")
                        .inOut("Value", "INT")
                        .body(assign("Value", add(ref("Value"), num(1))))
                        .build(),
                St.program("Main").var("I", "Inc").build());

        h.exec(call("I", arg("Value", num(3))));

        assertEquals(1, h.sink.countDiagnostics(InterpreterDiagnostic.Kind.INVALID_ARGUMENT));
    }

    @Test
    void returnEndsOnlyTheBlockBody() {
        Harness h = Harness.of(
                St.functionBlock("Early")
                        .output("Reached", "BOOL")
                        .body(ret(), assign("Reached", bool(true)))
                        .build(),
                St.program("Main")
                        .var("E", "Early")
                        .var("After", "BOOL")
                        .body(call("E"), assign("After", bool(true)))
                        .build());

        h.scan();

        assertFalse(h.store.getBool("E.Reached"));
        assertTrue(h.store.getBool("After"));
    }
}
