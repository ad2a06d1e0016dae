package com.radoncal.server.error;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;

public class RunningErrorCalculatorTest {

    @Test
    public void testFoldStaysWithinQuarterTurn() {
        Random random = new Random(3);
        for (int i = 0; i < 1000; i++) {
            double d = (random.nextDouble() - 0.5) * 2000;
            double folded = CircularError.fold(d);
            Assertions.assertTrue(folded >= 0 && folded <= 90, d + " folded to " + folded);
        }
    }

    @Test
    public void testFoldValues() {
        Assertions.assertEquals(0.0, CircularError.fold(180));
        Assertions.assertEquals(10.0, CircularError.fold(170));
        Assertions.assertEquals(10.0, CircularError.fold(-170));
        Assertions.assertEquals(90.0, CircularError.fold(90));
        Assertions.assertEquals(5.0, CircularError.fold(365));
        Assertions.assertEquals(2.0, CircularError.between(1, 179));
    }

    @Test
    public void testUpdateAccumulates() {
        RunningErrorCalculator calc = new RunningErrorCalculator();
        Assertions.assertEquals(10.0, calc.update(100, 90));
        Assertions.assertEquals(2.0, calc.update(179, 1));

        Assertions.assertEquals(12.0, calc.getTotalError());
        Assertions.assertEquals(2, calc.getRunningCount());
        Assertions.assertEquals(6.0, calc.getAverage());
    }

    @Test
    public void testAverageWithoutDataThrows() {
        RunningErrorCalculator calc = new RunningErrorCalculator();
        Assertions.assertThrows(NoErrorDataException.class, calc::getAverage);
        Assertions.assertEquals("n/a (0/0)", calc.toString());
    }

    @Test
    public void testMergeIsAssociativeAndCommutative() {
        RunningErrorCalculator a1 = new RunningErrorCalculator(3.0, 1);
        RunningErrorCalculator b1 = new RunningErrorCalculator(5.5, 2);
        RunningErrorCalculator c1 = new RunningErrorCalculator(1.25, 4);

        RunningErrorCalculator left = new RunningErrorCalculator(3.0, 1)
                .merge(new RunningErrorCalculator(5.5, 2))
                .merge(new RunningErrorCalculator(1.25, 4));
        RunningErrorCalculator right = a1.merge(b1.merge(c1));
        RunningErrorCalculator reversed = new RunningErrorCalculator(1.25, 4)
                .merge(new RunningErrorCalculator(5.5, 2))
                .merge(new RunningErrorCalculator(3.0, 1));

        Assertions.assertEquals(left.getTotalError(), right.getTotalError(), 1e-12);
        Assertions.assertEquals(left.getRunningCount(), right.getRunningCount());
        Assertions.assertEquals(left.getTotalError(), reversed.getTotalError(), 1e-12);
        Assertions.assertEquals(7, reversed.getRunningCount());
    }

    @Test
    public void testMergeWithEmptyIsNeutral() {
        RunningErrorCalculator calc = new RunningErrorCalculator(4.0, 2).merge(new RunningErrorCalculator());
        Assertions.assertEquals(4.0, calc.getTotalError());
        Assertions.assertEquals(2, calc.getRunningCount());
    }

    @Test
    public void testNegativeSeedRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RunningErrorCalculator(-1.0, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RunningErrorCalculator(0.0, -1));
    }
}
