package com.questrail.plc.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CounterInstanceTest {

    @Test
    void countDownClampsAtZero() {
        CounterInstance c = new CounterInstance(CounterKind.CTD, 3);
        c.countDown();
        assertEquals(0L, c.cv());
    }

    @Test
    void loadCopiesPresetAndOutputsFollowValue() {
        CounterInstance c = new CounterInstance(CounterKind.CTUD, 2);
        c.load();
        c.recomputeOutputs();
        assertEquals(2L, c.cv());
        assertTrue(c.qu());
        assertFalse(c.qd());

        c.reset();
        c.recomputeOutputs();
        assertFalse(c.qu());
        assertTrue(c.qd());
    }

    @Test
    void kindDeterminesCountingDirections() {
        assertTrue(CounterKind.CTU.countsUp());
        assertFalse(CounterKind.CTU.countsDown());
        assertTrue(CounterKind.CTD.countsDown());
        assertFalse(CounterKind.CTD.countsUp());
        assertTrue(CounterKind.CTUD.countsUp());
        assertTrue(CounterKind.CTUD.countsDown());
    }

    @Test
    void edgeDetectorsAndLatches() {
        EdgeDetectorInstance rising = new EdgeDetectorInstance();
        assertTrue(rising.updateRising(true));
        assertFalse(rising.updateRising(true));
        assertFalse(rising.updateRising(false));

        EdgeDetectorInstance falling = new EdgeDetectorInstance();
        assertFalse(falling.updateFalling(false), "fresh F_TRIG has M = false");
        falling.updateFalling(true);
        assertTrue(falling.updateFalling(false));

        BistableInstance sr = new BistableInstance();
        assertTrue(sr.updateSetDominant(true, true));
        assertTrue(sr.updateSetDominant(false, false));
        assertFalse(sr.updateSetDominant(false, true));

        BistableInstance rs = new BistableInstance();
        assertFalse(rs.updateResetDominant(true, true));
        assertTrue(rs.updateResetDominant(true, false));
    }
}
