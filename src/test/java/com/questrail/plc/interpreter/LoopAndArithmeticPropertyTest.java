package com.questrail.plc.interpreter;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.questrail.plc.ast.St.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Property checks over seeded pseudo-random inputs.
 */
class LoopAndArithmeticPropertyTest {

    private static final int ROUNDS = 300;

    @Test
    void forLoopRunsTheExpectedNumberOfIterations() {
        Random random = new Random(61131);

        for (int round = 0; round < ROUNDS; round++) {
            long start = random.nextInt(41) - 20;
            long end = random.nextInt(41) - 20;
            long step = random.nextInt(11) - 5;

            Harness h = Harness.empty();
            h.exec(assign("Count", num(0)),
                    assign("I", num(-999)),
                    forLoop("I", num(start), num(end), num(step), assign("Count", add(ref("Count"), num(1)))));

            long expected;
            if (step > 0 && start <= end) {
                expected = (end - start) / step + 1;
            } else if (step < 0 && start >= end) {
                expected = (start - end) / -step + 1;
            } else {
                expected = 0;
            }
            String label = "FOR I := " + start + " TO " + end + " BY " + step;

            assertEquals(expected, h.store.getInt("Count"), label);
            long last = expected == 0 ? -999 : start + (expected - 1) * step;
            assertEquals(last, h.store.getInt("I"), label);
        }
    }

    @Test
    void whileAndRepeatAgreeWithArithmetic() {
        Random random = new Random(42);

        for (int round = 0; round < ROUNDS; round++) {
            long limit = random.nextInt(50) + 1;

            Harness h = Harness.empty();
            h.exec(assign("N", num(0)),
                    whileLoop(lt(ref("N"), num(limit)), assign("N", add(ref("N"), num(1)))),
                    assign("M", num(0)),
                    repeat(ge(ref("M"), num(limit)), assign("M", add(ref("M"), num(1)))));

            assertEquals(limit, h.store.getInt("N"));
            assertEquals(limit, h.store.getInt("M"));
        }
    }

    @Test
    void integerArithmeticMatchesJava() {
        Random random = new Random(7);

        for (int round = 0; round < ROUNDS; round++) {
            long a = random.nextInt(2001) - 1000;
            long b = random.nextInt(2001) - 1000;
            if (b == 0) {
                b = 1;
            }

            Harness h = Harness.empty();
            assertEquals((double) (a + b), h.eval(add(num(a), num(b))).asNumber());
            assertEquals((double) (a - b), h.eval(sub(num(a), num(b))).asNumber());
            assertEquals((double) (a * b), h.eval(mul(num(a), num(b))).asNumber());
            assertEquals((double) (a % b), h.eval(mod(num(a), num(b))).asNumber());
            assertEquals(a < b, h.eval(lt(num(a), num(b))).asBoolean());
            assertEquals(a == b, h.eval(eq(num(a), num(b))).asBoolean());
        }
    }

    @Test
    void assigningAQuotientToAnIntTruncatesTowardZero() {
        Random random = new Random(1131);

        for (int round = 0; round < ROUNDS; round++) {
            long a = random.nextInt(2001) - 1000;
            long b = random.nextInt(19) - 9;
            if (b == 0) {
                b = 3;
            }

            Harness h = Harness.of(program("Main").var("Q", "INT").build());
            h.exec(assign("Q", div(num(a), num(b))));

            assertEquals(a / b, h.store.getInt("Q"), a + " / " + b);
        }
    }
}
