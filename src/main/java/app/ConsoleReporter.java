package app;

import pipeline.BatchCounters;
import pipeline.BatchEvent;
import pipeline.FatalReason;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;

/**
 * Prints batch events as they arrive and a summary at the end.
 */
final class ConsoleReporter {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 2;
    static final int EXIT_CANCELLED = 130;

    private static final String RULE = "=".repeat(60);

    private final PrintStream out;
    private final PrintStream err;
    private final Path outputDir;
    private int lastPrintedDecile = 0;

    ConsoleReporter(PrintStream out, PrintStream err, Path outputDir) {
        this.out = out;
        this.err = err;
        this.outputDir = outputDir;
    }

    /** Drains {@code events} until a terminal event and returns the process exit code for it. */
    int drain(BlockingQueue<BatchEvent> events) throws InterruptedException {
        while (true) {
            BatchEvent e = events.take();
            Integer exit = print(e);
            if (exit != null)
                return exit;
        }
    }

    /** @return exit code when {@code e} is terminal, otherwise null */
    Integer print(BatchEvent e) {
        if (e instanceof BatchEvent.Log log) {
            PrintStream target = log.kind() == BatchEvent.Kind.FAILED ? err : out;
            target.println(log.message());
        } else if (e instanceof BatchEvent.Progress p) {
            int decile = p.percent() / 10;
            if (decile > lastPrintedDecile) {
                lastPrintedDecile = decile;
                out.println("Progress: " + p.percent() + "%");
            }
        } else if (e instanceof BatchEvent.Finished f) {
            summary("PROCESSING RESULTS", f.totals());
            if (f.totals().processed() > 0)
                out.println("Processing completed.");
            else
                out.println("Nothing processed. Check the input directory and settings.");
            return EXIT_OK;
        } else if (e instanceof BatchEvent.Cancelled c) {
            summary("STOPPED BY USER", c.totals());
            return EXIT_CANCELLED;
        } else if (e instanceof BatchEvent.Fatal f) {
            err.println("ERROR: " + f.message());
            if (f.reason() == FatalReason.INPUT_DIRECTORY_NOT_FOUND)
                err.println("Create the folder or pass another one with --input.");
            return EXIT_FATAL;
        }
        return null;
    }

    private void summary(String title, BatchCounters.Totals t) {
        out.println();
        out.println(RULE);
        out.println(title + ":");
        out.println(RULE);
        out.println("Successfully processed: " + t.processed());
        out.println("Skipped (already exist): " + t.skipped());
        out.println("Failed to process:      " + t.failed());
        out.println("Output directory: " + outputDir.toAbsolutePath());
    }
}
