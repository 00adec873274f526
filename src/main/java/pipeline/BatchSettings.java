package pipeline;

import stages.CanvasSpec;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a run needs, resolved by the caller before the run starts.
 *
 * @param sizeSuffix append {@code _<w>x<h>} to output file stems
 */
public record BatchSettings(Path inputDir, Path outputDir, CanvasSpec canvas, boolean overwrite, boolean sizeSuffix) {

    public BatchSettings {
        Objects.requireNonNull(inputDir, "inputDir");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(canvas, "canvas");
    }
}
