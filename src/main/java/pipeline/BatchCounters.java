package pipeline;

import java.util.concurrent.atomic.AtomicInteger;

/** Per-run tallies. Written by the batch worker, readable from any thread. */
public final class BatchCounters {

    /** Immutable copy of the counters. */
    public record Totals(int processed, int skipped, int failed) {
        public int handled() {
            return processed + skipped + failed;
        }
    }

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    void reset() {
        processed.set(0);
        skipped.set(0);
        failed.set(0);
    }

    void processed() {
        processed.incrementAndGet();
    }

    void skipped() {
        skipped.incrementAndGet();
    }

    void failed() {
        failed.incrementAndGet();
    }

    public Totals snapshot() {
        return new Totals(processed.get(), skipped.get(), failed.get());
    }
}
