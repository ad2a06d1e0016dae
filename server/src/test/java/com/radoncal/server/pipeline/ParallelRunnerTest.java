package com.radoncal.server.pipeline;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class ParallelRunnerTest {

    private static List<Integer> range(int n) {
        List<Integer> items = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            items.add(i);
        }
        return items;
    }

    @Test
    public void testResultsKeepInputOrder() {
        List<Integer> items = range(37);
        List<UnitResult<Integer>> results = ParallelRunner.runInParallel(i -> {
            Thread.sleep((37 - i) % 5);
            return i * i;
        }, items, 6, null);

        Assertions.assertEquals(37, results.size());
        for (int i = 0; i < 37; i++) {
            Assertions.assertFalse(results.get(i).isFailed());
            Assertions.assertEquals(i * i, results.get(i).getValue());
        }
    }

    @Test
    public void testFailureIsIsolatedToItsItem() {
        List<UnitResult<String>> results = ParallelRunner.runInParallel(i -> {
            if (i == 4) {
                throw new IllegalStateException("bad item");
            }
            return "ok" + i;
        }, range(10), 3, null);

        for (int i = 0; i < 10; i++) {
            if (i == 4) {
                Assertions.assertTrue(results.get(i).isFailed());
                Assertions.assertEquals("bad item", results.get(i).getFailure().getMessage());
                Assertions.assertNull(results.get(i).getValue());
            } else {
                Assertions.assertEquals("ok" + i, results.get(i).getValue());
            }
        }
    }

    @Test
    public void testErrorDoesNotStopTheRestOfTheSlice() {
        List<Integer> executed = Collections.synchronizedList(new ArrayList<>());
        List<UnitResult<Integer>> results = ParallelRunner.runInParallel(i -> {
            executed.add(i);
            if (i == 0) {
                throw new StackOverflowError("deep image");
            }
            return i * 10;
        }, range(4), 1, null);

        Assertions.assertEquals(range(4), executed);
        Assertions.assertTrue(results.get(0).isFailed());
        Assertions.assertTrue(results.get(0).getFailure() instanceof StackOverflowError);
        for (int i = 1; i < 4; i++) {
            Assertions.assertFalse(results.get(i).isFailed());
            Assertions.assertEquals(i * 10, results.get(i).getValue());
        }
    }

    @Test
    public void testAssertionErrorIsRecordedAsFailure() {
        List<UnitResult<Integer>> results = ParallelRunner.runInParallel(i -> {
            if (i == 2) {
                throw new AssertionError("broken invariant");
            }
            return i;
        }, range(6), 2, null);

        Assertions.assertEquals("broken invariant", results.get(2).getFailure().getMessage());
        Assertions.assertEquals(4, results.get(4).getValue());
    }

    @Test
    public void testOnlyJvmErrorsAreFatal() {
        Assertions.assertTrue(ParallelRunner.isFatal(new OutOfMemoryError()));
        Assertions.assertTrue(ParallelRunner.isFatal(new InternalError()));
        Assertions.assertFalse(ParallelRunner.isFatal(new StackOverflowError()));
        Assertions.assertFalse(ParallelRunner.isFatal(new AssertionError()));
        Assertions.assertFalse(ParallelRunner.isFatal(new IllegalStateException()));
    }

    @Test
    public void testProgressCallbackRunsOncePerItem() {
        AtomicInteger done = new AtomicInteger();
        ParallelRunner.runInParallel(i -> {
            if (i % 3 == 0) {
                throw new Exception("checked failure");
            }
            return i;
        }, range(25), 4, done::incrementAndGet);

        Assertions.assertEquals(25, done.get());
    }

    @Test
    public void testNeverUsesMoreWorkersThanItems() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        ParallelRunner.runInParallel(i -> {
            threads.add(Thread.currentThread().getName());
            return i;
        }, range(3), 16, null);

        Assertions.assertTrue(threads.size() <= 3);
    }

    @Test
    public void testStrideAssignment() {
        List<String> owners = Collections.synchronizedList(new ArrayList<>());
        List<UnitResult<String>> results = ParallelRunner.runInParallel(
                i -> Thread.currentThread().getName(), range(9), 3, null);

        for (int i = 0; i < 9; i++) {
            owners.add(results.get(i).getValue());
        }
        Assertions.assertEquals(owners.get(0), owners.get(3));
        Assertions.assertEquals(owners.get(0), owners.get(6));
        Assertions.assertEquals(owners.get(1), owners.get(4));
        Assertions.assertNotEquals(owners.get(0), owners.get(1));
    }

    @Test
    public void testEmptyInput() {
        Assertions.assertTrue(ParallelRunner.runInParallel(i -> i, new ArrayList<Integer>(), 4, null).isEmpty());
    }

    @Test
    public void testRejectsNonPositiveWorkerCount() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ParallelRunner.runInParallel(i -> i, range(2), 0, null));
    }
}
