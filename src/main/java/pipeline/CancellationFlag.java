package pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop request from the caller. Set by the caller only; the batch loop polls it between files.
 */
public final class CancellationFlag {

    private final AtomicBoolean stop = new AtomicBoolean(false);

    public void requestStop() {
        stop.set(true);
    }

    public boolean isStopRequested() {
        return stop.get();
    }
}
