package pipeline;

import io.CodecRegistry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists the input directory and builds the ordered job list.
 */
public final class JobPlanner {

    /** Case-insensitive name first, exact name as tie-break, so runs are reproducible. */
    static final Comparator<Path> BY_NAME = Comparator
            .comparing((Path p) -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(p -> p.getFileName().toString());

    private final CodecRegistry registry;

    public JobPlanner(CodecRegistry registry) {
        this.registry = registry;
    }

    public List<Job> plan(BatchSettings settings) throws EnumerationException {
        Path inputDir = settings.inputDir();
        if (!Files.isDirectory(inputDir)) {
            throw new EnumerationException(FatalReason.INPUT_DIRECTORY_NOT_FOUND,
                    "Input directory does not exist: " + inputDir);
        }

        List<Path> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(inputDir)) {
            entries.filter(Files::isRegularFile)
                    .filter(registry::isSupported)
                    .sorted(BY_NAME)
                    .forEach(files::add);
        } catch (IOException e) {
            throw new EnumerationException(FatalReason.INPUT_DIRECTORY_NOT_FOUND,
                    "Cannot list input directory " + inputDir + ": " + e.getMessage(), e);
        }
        if (files.isEmpty()) {
            throw new EnumerationException(FatalReason.NO_SUPPORTED_IMAGES,
                    "No supported images found in folder " + inputDir);
        }

        List<Job> jobs = new ArrayList<>(files.size());
        for (Path f : files)
            jobs.add(new Job(f, outputPathFor(f, settings)));
        return List.copyOf(jobs);
    }

    /** {@code <output dir>/<input stem>[_<w>x<h>].jpg} */
    public static Path outputPathFor(Path input, BatchSettings settings) {
        String stem = CodecRegistry.stemOf(input.getFileName().toString());
        if (settings.sizeSuffix())
            stem = stem + "_" + settings.canvas().width() + "x" + settings.canvas().height();
        return settings.outputDir().resolve(stem + ".jpg");
    }
}
