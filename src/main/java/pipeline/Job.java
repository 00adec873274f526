package pipeline;

import java.nio.file.Path;

/** One input file and the JPEG it becomes. */
public record Job(Path input, Path output) {

    public String fileName() {
        return input.getFileName().toString();
    }
}
