package com.tessera.core.engine;

import com.tessera.core.model.GenerationProgress;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ThrottledProgressListenerTest {

    @Test
    void forwardsAtMostOneEventPerInterval() {
        AtomicLong now = new AtomicLong(1_000);
        List<Integer> forwarded = new ArrayList<>();
        ThrottledProgressListener listener = new ThrottledProgressListener(
            p -> forwarded.add(p.percentComplete()), 250, now::get);

        listener.report(10, "Creating Mosaic");
        now.addAndGet(100);
        listener.report(20, "Placing cells");
        now.addAndGet(200);
        listener.report(30, "Placing cells");
        now.addAndGet(10);
        listener.report(40, "Placing cells");

        assertEquals(List.of(10, 30), forwarded);
    }

    @Test
    void repeatsOfTheSamePercentAreDropped() {
        AtomicLong now = new AtomicLong();
        List<GenerationProgress> forwarded = new ArrayList<>();
        ThrottledProgressListener listener = new ThrottledProgressListener(forwarded::add, 0, now::get);

        listener.report(10, "Building Mosaic Plan");
        listener.report(10, "Preparing Primary Image");
        listener.report(11, "Placing cells: 1/90");

        assertEquals(2, forwarded.size());
        assertEquals("Placing cells: 1/90", forwarded.get(1).stage());
    }

    @Test
    void completionAlwaysPassesThrough() {
        AtomicLong now = new AtomicLong();
        List<Integer> forwarded = new ArrayList<>();
        ThrottledProgressListener listener = new ThrottledProgressListener(
            p -> forwarded.add(p.percentComplete()), 10_000, now::get);

        listener.report(95, "Saving Results");
        listener.report(98, "Writing Report");
        listener.report(100, "Complete");

        assertEquals(List.of(95, 100), forwarded);
    }

    @Test
    void percentIsClampedIntoRange() {
        List<Integer> forwarded = new ArrayList<>();
        ProgressListener listener = p -> forwarded.add(p.percentComplete());

        listener.report(-5, "early");
        listener.report(140, "late");

        assertEquals(List.of(0, 100), forwarded);
    }

    @Test
    void interpolationCoversTheStageRange() {
        assertEquals(5, GenerationStage.interpolate(5, 10, 0, 40));
        assertEquals(7, GenerationStage.interpolate(5, 10, 20, 40));
        assertEquals(10, GenerationStage.interpolate(5, 10, 40, 40));
        assertEquals(95, GenerationStage.interpolate(10, 95, 3, 0));
    }
}
