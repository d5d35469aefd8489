package com.jreinhal.askdocs.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TimeBudgetTest {

    @Test
    void boundClipsStageTimeoutToRemainingBudget() {
        TimeBudget budget = TimeBudget.of(Duration.ofMillis(200));

        assertTrue(budget.bound(Duration.ofSeconds(10)).toMillis() <= 200);
        assertEquals(Duration.ofMillis(50), budget.bound(Duration.ofMillis(50)));
        assertFalse(budget.isExhausted());
    }

    @Test
    void zeroBudgetIsExhaustedImmediately() {
        TimeBudget budget = TimeBudget.of(Duration.ZERO);

        assertTrue(budget.isExhausted());
        assertEquals(Duration.ZERO, budget.remaining());
    }

    @Test
    void unboundedNeverExhausts() {
        TimeBudget budget = TimeBudget.unbounded();

        assertFalse(budget.isExhausted());
        assertEquals(Duration.ofSeconds(3), budget.bound(Duration.ofSeconds(3)));
    }
}
