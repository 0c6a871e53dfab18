package me.christianrobert.cpp2py.core.job.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobProgressTest {

    @Test
    void testPercentageIsClamped() {
        assertEquals(0, new JobProgress(-5, "x").getPercentage());
        assertEquals(100, new JobProgress(150, "x").getPercentage());
    }

    @Test
    void testNullTextBecomesEmpty() {
        JobProgress progress = new JobProgress(10, null, null);

        assertEquals("", progress.getCurrentTask());
        assertEquals("", progress.getDetails());
        assertNotNull(progress.getLastUpdated());
    }

    @Test
    void testPercentageOf() {
        assertEquals(100, JobProgress.percentageOf(0, 0));
        assertEquals(33, JobProgress.percentageOf(1, 3));
        assertEquals(100, JobProgress.percentageOf(3, 3));
    }
}
