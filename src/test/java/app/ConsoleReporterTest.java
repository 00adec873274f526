package app;

import org.junit.jupiter.api.Test;
import pipeline.BatchCounters;
import pipeline.BatchEvent;
import pipeline.FatalReason;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.concurrent.LinkedBlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final ConsoleReporter reporter = new ConsoleReporter(
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8),
            Paths.get("out"));

    @Test
    void drain_stopsAtTerminalEventWithExitCode() throws InterruptedException {
        LinkedBlockingQueue<BatchEvent> q = new LinkedBlockingQueue<>();
        q.add(new BatchEvent.Log(BatchEvent.Kind.PROCESSED, "[1/2] Processed: a.png (3 ms)"));
        q.add(new BatchEvent.Progress(50, 0, 2, "a.png"));
        q.add(new BatchEvent.Log(BatchEvent.Kind.FAILED, "[2/2] Error: b.png: bad"));
        q.add(new BatchEvent.Progress(100, 1, 2, "b.png"));
        q.add(new BatchEvent.Finished(new BatchCounters.Totals(1, 0, 1)));

        assertEquals(ConsoleReporter.EXIT_OK, reporter.drain(q));

        String out = outBytes.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Processed: a.png"));
        assertTrue(out.contains("Progress: 50%"));
        assertTrue(out.contains("Progress: 100%"));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Error: b.png"));
    }

    @Test
    void cancelledAndFatal_mapToDistinctCodes() {
        assertEquals(ConsoleReporter.EXIT_CANCELLED,
                reporter.print(new BatchEvent.Cancelled(new BatchCounters.Totals(0, 1, 0))));
        assertEquals(ConsoleReporter.EXIT_FATAL,
                reporter.print(new BatchEvent.Fatal(FatalReason.NO_SUPPORTED_IMAGES, "No supported images found")));
        assertNull(reporter.print(new BatchEvent.Log(BatchEvent.Kind.INFO, "hello")));
    }
}
