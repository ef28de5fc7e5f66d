package com.questrail.plc.interpreter;

import com.questrail.plc.ast.St;
import com.questrail.plc.ast.StAst;
import com.questrail.plc.observability.ScanCompletedEvent;
import com.questrail.plc.store.TimerInstance;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.plc.ast.St.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ScanCycleDriverTest
 * -----------------------------------------------------------------------------
 * Scan ordering, time application and single-step execution.
 */
class ScanCycleDriverTest {

    @Test
    void timerObservesOneScanPeriodPerScan() {
        Harness h = Harness.of(St.program("Main")
                .var("Timer1", "TON")
                .var("Elapsed", "TIME")
                .body(call("Timer1", arg("IN", bool(true)), arg("PT", time("T#500ms"))),
                        assign("Elapsed", ref("Timer1.ET")))
                .build());

        h.scan();
        assertEquals(0L, h.store.getTime("Elapsed"), "body runs before time is applied");

        h.scans(3);
        TimerInstance timer = h.store.findTimer("Timer1").orElseThrow();
        assertEquals(400L, timer.et());
        assertFalse(timer.q());

        h.scans(2);
        assertEquals(500L, timer.et());
        assertTrue(timer.q());

        h.scans(5);
        assertEquals(500L, timer.et(), "ET is clamped at PT");
        assertTrue(timer.q());
    }

    @Test
    void programsRunInOrderBeforeTopLevelStatements() {
        StAst ast = new StAst(
                List.of(St.program("First").body(assign("Trace", num(1))).build(),
                        St.functionBlock("Skipped").body(assign("Trace", num(99))).build(),
                        St.program("Second").body(assign("Trace", mul(ref("Trace"), num(10)))).build()),
                List.of(assign("Trace", add(ref("Trace"), num(5)))),
                List.of());
        Harness h = Harness.of(ast);

        h.scan();

        assertEquals(15L, h.store.getInt("Trace"));
    }

    @Test
    void returnEndsOnlyItsOwnProgram() {
        Harness h = Harness.of(
                St.program("A").body(assign("X", num(1)), ret(), assign("X", num(2))).build(),
                St.program("B").body(assign("Y", num(3))).build());

        h.scan();

        assertEquals(1L, h.store.getInt("X"));
        assertEquals(3L, h.store.getInt("Y"));
    }

    @Test
    void everyScanIsReportedToTheSink() {
        Harness h = Harness.of(St.program("Main")
                .var("Timer1", "TON")
                .body(call("Timer1", arg("IN", bool(true)), arg("PT", num(1000))))
                .build());

        h.scans(2);

        List<ScanCompletedEvent> scans = h.sink.getScans();
        assertEquals(2, scans.size());
        assertEquals(1, scans.get(0).programsExecuted());
        assertEquals(1, scans.get(0).timersAdvanced());
        assertEquals(100L, scans.get(0).scanTimeMillis());
        assertNotNull(scans.get(0).timestamp());
    }

    @Test
    void zeroScanTimeFreezesTimers() {
        Harness h = Harness.of(St.program("Main")
                .var("Timer1", "TON")
                .body(call("Timer1", arg("IN", bool(true)), arg("PT", num(100))))
                .build());
        h.store.setScanTime(0);

        h.scans(10);

        assertEquals(0L, h.store.findTimer("Timer1").orElseThrow().et());
        assertFalse(h.store.findTimer("Timer1").orElseThrow().q());
    }

    @Test
    void singleStepWalksProgramsThenTopLevel() {
        StAst ast = new StAst(
                List.of(St.program("Main").body(assign("A", num(1)), assign("B", num(2))).build(),
                        St.function("Ignored", "INT").body(assign("Ignored", num(0))).build()),
                List.of(assign("C", num(3))),
                List.of());
        Harness h = Harness.of(ast);

        assertEquals(3, ScanCycleDriver.totalStatementCount(ast));

        assertTrue(h.driver.executeOneStatement(ast, h.store, h.runtime, 1));
        assertEquals(2L, h.store.getInt("B"));
        assertFalse(h.store.containsInt("A"));

        assertTrue(h.driver.executeOneStatement(ast, h.store, h.runtime, 2));
        assertEquals(3L, h.store.getInt("C"));

        assertFalse(h.driver.executeOneStatement(ast, h.store, h.runtime, 3));
        assertFalse(h.driver.executeOneStatement(ast, h.store, h.runtime, -1));
    }

    @Test
    void identicalInputsProduceIdenticalStores() {
        StAst ast = StAst.of(St.program("Main")
                .var("Blink", "TON")
                .var("Out", "BOOL")
                .var("Count", "CTU")
                .body(call("Blink", arg("IN", not(ref("Blink.Q"))), arg("PT", num(300))),
                        call("Count", arg("CU", ref("Blink.Q")), arg("PV", num(100))),
                        assign("Out", ref("Blink.Q")))
                .build());

        Harness first = Harness.of(ast);
        Harness second = Harness.of(ast);
        first.scans(25);
        second.scans(25);

        assertEquals(first.store.findCounter("Count").orElseThrow().cv(),
                second.store.findCounter("Count").orElseThrow().cv());
        assertEquals(first.store.booleans(), second.store.booleans());
    }
}
