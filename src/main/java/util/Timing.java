package util;

/** Wall-clock stopwatch for per-job timings. */
public class Timing {
    long t0 = System.nanoTime();

    /** Milliseconds since construction or the last {@link #restart()}. */
    public double elapsedMs() {
        return (System.nanoTime() - t0) / 1_000_000.0;
    }

    public String format() {
        return String.format("%.0f ms", elapsedMs());
    }

    public void restart() {
        t0 = System.nanoTime();
    }
}
