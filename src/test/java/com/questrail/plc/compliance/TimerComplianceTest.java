package com.questrail.plc.compliance;

import com.questrail.plc.ast.St;
import com.questrail.plc.ast.StAst;
import com.questrail.plc.config.InterpreterConfig;
import com.questrail.plc.runtime.PlcSimulation;
import com.questrail.plc.store.TimerInstance;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static com.questrail.plc.ast.St.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TimerComplianceTest
 * -----------------------------------------------------------------------------
 * IEC 61131-3 TON / TOF / TP behaviour observed through whole scans at the
 * default 100 ms scan time.
 */
class TimerComplianceTest {

    private static PlcSimulation load(StAst ast) {
        PlcSimulation sim = new PlcSimulation(InterpreterConfig.defaults());
        sim.load(ast);
        return sim;
    }

    private static StAst timerProgram(String type, String preset) {
        return StAst.of(St.program("Main")
                .var("Input", "BOOL")
                .var("Timer1", type)
                .body(call("Timer1", arg("IN", ref("Input")), arg("PT", time(preset))))
                .build());
    }

    @Test
    void tonReachesPresetAfterFivePeriods() {
        PlcSimulation sim = load(timerProgram("TON", "T#500ms"));
        sim.store().setBool("Input", true);

        sim.run(4);
        TimerInstance timer = sim.store().findTimer("Timer1").orElseThrow();
        assertEquals(400L, timer.et());
        assertFalse(timer.q());

        sim.run(2);
        assertEquals(500L, timer.et());
        assertTrue(timer.q());

        sim.run(3);
        assertEquals(500L, timer.et());
        assertTrue(timer.q());
    }

    @Test
    void tonRestartsFromZeroAfterInputDrops() {
        PlcSimulation sim = load(timerProgram("TON", "T#300ms"));
        sim.store().setBool("Input", true);
        sim.run(2);

        sim.store().setBool("Input", false);
        sim.step();
        TimerInstance timer = sim.store().findTimer("Timer1").orElseThrow();
        assertEquals(0L, timer.et());
        assertFalse(timer.q());

        sim.store().setBool("Input", true);
        sim.run(3);
        assertTrue(timer.q());
    }

    @Test
    void selfResettingTonProducesRepeatedPulses() {
        StAst ast = StAst.of(St.program("Main")
                .var("Pulse", "TON")
                .var("Pulses", "INT")
                .body(call("Pulse", arg("IN", not(ref("Pulse.Q"))), arg("PT", time("T#300ms"))),
                        ifThen(ref("Pulse.Q"), assign("Pulses", add(ref("Pulses"), num(1)))))
                .build());
        PlcSimulation sim = load(ast);

        sim.run(10);

        assertTrue(sim.store().getInt("Pulses") >= 2);
    }

    @Test
    void tofKeepsOutputHighForPresetAfterFallingEdge() {
        PlcSimulation sim = load(timerProgram("TOF", "T#300ms"));
        sim.store().setBool("Input", true);
        sim.step();
        TimerInstance timer = sim.store().findTimer("Timer1").orElseThrow();
        assertTrue(timer.q());

        sim.store().setBool("Input", false);
        sim.run(2);
        assertTrue(timer.q());
        assertEquals(200L, timer.et());

        sim.step();
        assertFalse(timer.q());
        assertEquals(300L, timer.et());
    }

    @Test
    void tpProducesFixedLengthPulseIgnoringInputChanges() {
        PlcSimulation sim = load(timerProgram("TP", "T#300ms"));
        sim.store().setBool("Input", true);
        sim.step();
        TimerInstance timer = sim.store().findTimer("Timer1").orElseThrow();
        assertTrue(timer.q());

        sim.store().setBool("Input", false);
        sim.step();
        assertTrue(timer.q(), "pulse continues after IN drops");
        sim.store().setBool("Input", true);
        sim.step();
        assertFalse(timer.q(), "pulse ends at PT and is not retriggered while running");

        sim.run(2);
        assertFalse(timer.q(), "IN held high does not start a new pulse");
    }

    @Test
    void elapsedNeverExceedsPresetUnderRandomInput() {
        PlcSimulation sim = load(timerProgram("TON", "T#700ms"));
        Random random = new Random(42);
        int heldScans = 0;

        for (int i = 0; i < 500; i++) {
            boolean input = random.nextInt(4) != 0;
            sim.store().setBool("Input", input);
            sim.step();

            TimerInstance timer = sim.store().findTimer("Timer1").orElseThrow();
            assertTrue(timer.et() >= 0 && timer.et() <= timer.pt(), "0 <= ET <= PT");

            heldScans = input ? heldScans + 1 : 0;
            if (input) {
                assertEquals(Math.min(heldScans * 100L, 700L), timer.et());
                assertEquals(timer.et() >= timer.pt(), timer.q());
            }
        }
    }

    @Test
    void presetDroppedBelowZeroWhileRunningNeverMakesElapsedNegative() {
        PlcSimulation sim = new PlcSimulation(InterpreterConfig.builder()
                .withScanTime(Duration.ofMillis(500))
                .build());
        sim.load(StAst.of(St.program("Main")
                .var("Preset", "TIME", time("T#2s"))
                .var("Timer1", "TON")
                .body(call("Timer1", arg("IN", bool(true)), arg("PT", ref("Preset"))))
                .build()));

        sim.run(2);
        assertEquals(1000L, sim.store().findTimer("Timer1").orElseThrow().et());

        sim.store().setTime("Preset", -100);
        sim.step();

        TimerInstance timer = sim.store().findTimer("Timer1").orElseThrow();
        assertEquals(0L, timer.et());
        assertTrue(timer.q());
    }
}
