package pipeline;

import io.CodecRegistry;
import io.ImageLoader;
import util.Timing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs a batch: enumerate, then convert one file at a time in enumeration order.
 * <p>
 * A failing file is counted and logged and the run moves on. Only enumeration problems end a
 * run early ({@link BatchEvent.Fatal}). The {@link CancellationFlag} is checked before each file,
 * so a stop request lets the file in flight finish.
 */
public class BatchOrchestrator {

    private final CodecRegistry registry;
    private final JobPlanner planner;
    private final BatchCounters counters = new BatchCounters();

    private volatile BatchState state = BatchState.IDLE;

    public BatchOrchestrator(CodecRegistry registry) {
        this.registry = registry;
        this.planner = new JobPlanner(registry);
    }

    public BatchState state() {
        return state;
    }

    /** Live counters of the current (or last) run. */
    public BatchCounters.Totals totals() {
        return counters.snapshot();
    }

    /**
     * Starts a run on a dedicated worker thread. Events arrive on {@link BatchHandle#events()}.
     *
     * @throws IllegalStateException if a run is already in progress
     */
    public synchronized BatchHandle start(BatchSettings settings) {
        if (state == BatchState.ENUMERATING || state == BatchState.RUNNING)
            throw new IllegalStateException("A batch is already running");
        state = BatchState.ENUMERATING;

        BlockingQueue<BatchEvent> events = new LinkedBlockingQueue<>();
        CancellationFlag flag = new CancellationFlag();
        ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "batch-worker");
            t.setDaemon(true);
            return t;
        });
        try {
            AtomicBoolean terminalSent = new AtomicBoolean();
            Consumer<BatchEvent> sink = e -> {
                if (e.isTerminal())
                    terminalSent.set(true);
                events.add(e);
            };
            Future<BatchState> done = exec.submit(() -> {
                try {
                    return run(settings, flag, sink);
                } catch (Throwable t) {
                    // a reader blocked on events() must always see a terminal event
                    if (!terminalSent.get()) {
                        state = BatchState.FATAL_ERROR;
                        events.add(new BatchEvent.Fatal(FatalReason.INTERNAL_ERROR, "Batch worker failed: " + t));
                    }
                    throw t;
                }
            });
            return new BatchHandle(events, flag, done, this);
        } finally {
            exec.shutdown();
        }
    }

    /**
     * Runs a whole batch on the calling thread and returns its terminal state. Exactly one terminal
     * event is passed to {@code sink}, last. An unexpected exception or error still ends the run in
     * {@link BatchState#FATAL_ERROR} with an {@link FatalReason#INTERNAL_ERROR} event before it is rethrown.
     */
    public BatchState run(BatchSettings settings, CancellationFlag flag, Consumer<BatchEvent> sink) {
        try {
            return runJobs(settings, flag, sink);
        } catch (RuntimeException | Error e) {
            state = BatchState.FATAL_ERROR;
            sink.accept(new BatchEvent.Fatal(FatalReason.INTERNAL_ERROR, "Batch aborted: " + e));
            throw e;
        }
    }

    private BatchState runJobs(BatchSettings settings, CancellationFlag flag, Consumer<BatchEvent> sink) {
        counters.reset();
        state = BatchState.ENUMERATING;

        List<Job> jobs;
        try {
            jobs = planner.plan(settings);
            prepareOutputDirectory(settings.outputDir());
        } catch (EnumerationException e) {
            state = BatchState.FATAL_ERROR;
            sink.accept(new BatchEvent.Fatal(e.getReason(), e.getMessage()));
            return state;
        }

        state = BatchState.RUNNING;
        announce(settings, jobs.size(), sink);

        ConversionPipeline pipeline = new ConversionPipeline(
                ImageLoader.create(registry, settings.canvas().background()), settings.canvas());
        Set<Path> writtenThisRun = new HashSet<>();
        int total = jobs.size();

        for (int i = 0; i < total; i++) {
            if (flag.isStopRequested()) {
                state = BatchState.CANCELLED;
                sink.accept(new BatchEvent.Cancelled(counters.snapshot()));
                return state;
            }
            Job job = jobs.get(i);
            String tag = "[" + (i + 1) + "/" + total + "] ";

            if (writtenThisRun.contains(job.output())) {
                counters.skipped();
                sink.accept(new BatchEvent.Log(BatchEvent.Kind.SKIPPED, tag + "Skipped (output name already used in this run: "
                        + job.output().getFileName() + "): " + job.fileName()));
            } else if (!settings.overwrite() && Files.exists(job.output())) {
                counters.skipped();
                sink.accept(new BatchEvent.Log(BatchEvent.Kind.SKIPPED, tag + "Skipped (already exists): " + job.fileName()));
            } else {
                Timing timing = new Timing();
                var result = pipeline.convert(job);
                if (result.isOk()) {
                    counters.processed();
                    writtenThisRun.add(job.output());
                    sink.accept(new BatchEvent.Log(BatchEvent.Kind.PROCESSED,
                            tag + "Processed: " + job.fileName() + " (" + timing.format() + ")"));
                } else {
                    counters.failed();
                    sink.accept(new BatchEvent.Log(BatchEvent.Kind.FAILED, tag + "Error: " + result.error()));
                }
            }
            sink.accept(new BatchEvent.Progress(percent(i, total), i, total, job.fileName()));
        }

        state = BatchState.COMPLETED;
        sink.accept(new BatchEvent.Finished(counters.snapshot()));
        return state;
    }

    /** floor((index + 1) * 100 / total) */
    static int percent(int index, int total) {
        return (int) ((index + 1L) * 100 / total);
    }

    private static void prepareOutputDirectory(Path outputDir) throws EnumerationException {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new EnumerationException(FatalReason.OUTPUT_DIRECTORY_UNWRITABLE,
                    "Cannot create output directory " + outputDir + ": " + e.getMessage(), e);
        }
    }

    private void announce(BatchSettings settings, int count, Consumer<BatchEvent> sink) {
        var canvas = settings.canvas();
        sink.accept(new BatchEvent.Log(BatchEvent.Kind.INFO, "Images found: " + count));
        sink.accept(new BatchEvent.Log(BatchEvent.Kind.INFO,
                "Target size: " + canvas.width() + "x" + canvas.height() + " pixels, background "
                        + canvas.background() + ", mode " + canvas.mode().label() + ", quality " + canvas.quality()));
        if (settings.overwrite())
            sink.accept(new BatchEvent.Log(BatchEvent.Kind.WARNING, "Overwrite enabled: existing files will be replaced"));
    }
}
