package pipeline;

/**
 * Messages from the batch worker to whoever presents the run. {@link Finished}, {@link Cancelled}
 * and {@link Fatal} are terminal: exactly one of them ends every run.
 */
public sealed interface BatchEvent
        permits BatchEvent.Progress, BatchEvent.Log, BatchEvent.Finished, BatchEvent.Cancelled, BatchEvent.Fatal {

    default boolean isTerminal() {
        return false;
    }

    /** Emitted after each file; percent = floor((index + 1) * 100 / total). */
    record Progress(int percent, int index, int total, String fileName) implements BatchEvent {
    }

    enum Kind {
        INFO,
        WARNING,
        PROCESSED,
        SKIPPED,
        FAILED
    }

    record Log(Kind kind, String message) implements BatchEvent {
    }

    record Finished(BatchCounters.Totals totals) implements BatchEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /** Stop was requested; totals cover the files handled before it. */
    record Cancelled(BatchCounters.Totals totals) implements BatchEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Fatal(FatalReason reason, String message) implements BatchEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
