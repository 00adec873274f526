package pipeline;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller's side of a running batch: the event channel, the stop switch and the final state.
 */
public final class BatchHandle {

    private final BlockingQueue<BatchEvent> events;
    private final CancellationFlag flag;
    private final Future<BatchState> done;
    private final BatchOrchestrator orchestrator;

    BatchHandle(BlockingQueue<BatchEvent> events, CancellationFlag flag, Future<BatchState> done,
            BatchOrchestrator orchestrator) {
        this.events = events;
        this.flag = flag;
        this.done = done;
        this.orchestrator = orchestrator;
    }

    public BlockingQueue<BatchEvent> events() {
        return events;
    }

    /** Ask the worker to stop before its next file. */
    public void cancel() {
        flag.requestStop();
    }

    public boolean isCancelRequested() {
        return flag.isStopRequested();
    }

    public boolean isDone() {
        return done.isDone();
    }

    public BatchCounters.Totals totals() {
        return orchestrator.totals();
    }

    /** Blocks until the worker finishes and returns the terminal state. */
    public BatchState await() throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException | CancellationException e) {
            return BatchState.FATAL_ERROR;
        }
    }

    /**
     * Bounded {@link #await()}.
     *
     * @return the terminal state, or the current state if the worker is still busy after the timeout
     */
    public BatchState await(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            return done.get(timeout, unit);
        } catch (TimeoutException e) {
            return orchestrator.state();
        } catch (ExecutionException | CancellationException e) {
            return BatchState.FATAL_ERROR;
        }
    }
}
