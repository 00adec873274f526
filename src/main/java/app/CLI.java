package app;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import io.CodecCapabilities;
import io.CodecRegistry;
import pipeline.BatchHandle;
import pipeline.BatchOrchestrator;
import pipeline.BatchSettings;
import stages.CanvasSpec;
import stages.PlacementMode;
import util.Rgb;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry: converts every supported image in a folder to a fixed-size JPEG.
 * Example:
 * # letterbox onto black, 480x800
 * java -jar canvas-converter.jar --input=C:\photos --output=C:\frame
 *
 * # crop when the aspect ratio is close, overwrite existing results
 * java -jar canvas-converter.jar -i photos -d frame --mode=auto --overwrite
 *
 * # RAW support needs a dcraw-compatible decoder on PATH, or:
 * java -DrawDecoder=/opt/libraw/bin/dcraw_emu -jar canvas-converter.jar ...
 */
public final class CLI {

    // -------------------- Args --------------------
    static final class Args {
        @Parameter(names = { "-i", "--input" }, description = "Folder with source images")
        String input = "input";

        @Parameter(names = { "-d", "--output" }, description = "Folder for results (created if missing)")
        String output = "output";

        @Parameter(names = "--width", description = "Target width in pixels", validateWith = ArgConverters.PositiveValidator.class)
        int width = 480;

        @Parameter(names = "--height", description = "Target height in pixels", validateWith = ArgConverters.PositiveValidator.class)
        int height = 800;

        @Parameter(names = "--quality", description = "JPEG quality [1..100]", validateWith = ArgConverters.QualityValidator.class)
        int quality = 95;

        @Parameter(names = "--background", description = "Background color: r,g,b | #rrggbb | black | white",
                converter = ArgConverters.ColorConverter.class)
        Rgb background = Rgb.BLACK;

        @Parameter(names = "--mode", description = "fit | crop | auto", converter = ArgConverters.ModeConverter.class)
        PlacementMode mode = PlacementMode.FIT;

        @Parameter(names = { "-c", "--crop" }, description = "Crop mode (same as --mode=crop)")
        boolean crop = false;

        @Parameter(names = { "-o", "--overwrite" }, description = "Overwrite existing files")
        boolean overwrite = false;

        @Parameter(names = "--suffix", description = "Append _<width>x<height> to output file names")
        boolean suffix = false;

        @Parameter(names = "--raw-decoder", description = "dcraw-compatible executable for RAW files. Also honored via -DrawDecoder=...")
        String rawDecoder;

        @Parameter(names = { "-s", "--settings" }, description = "Show current settings and exit")
        boolean settings = false;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;

        CanvasSpec canvas() {
            return new CanvasSpec(width, height, background, crop ? PlacementMode.CROP : mode, quality);
        }

        BatchSettings batchSettings() {
            return new BatchSettings(Paths.get(input), Paths.get(output), canvas(), overwrite, suffix);
        }

        String rawDecoderCommand() {
            if (rawDecoder != null && !rawDecoder.isBlank())
                return rawDecoder;
            return System.getProperty("rawDecoder", CodecCapabilities.DEFAULT_RAW_DECODER);
        }
    }

    public static void main(String[] argv) {
        int code = run(argv, System.out, System.err);
        if (code != 0)
            System.exit(code);
    }

    static int run(String[] argv, PrintStream out, PrintStream err) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder().addObject(args).programName("canvas-converter").build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            err.println(pe.getMessage());
            jc.usage();
            return 1;
        }
        if (args.help) {
            jc.usage();
            return 0;
        }

        BatchSettings settings = args.batchSettings();

        // Banner
        out.println("== Image Canvas Converter ==");
        CodecCapabilities caps = CodecCapabilities.probe(args.rawDecoderCommand());
        for (String note : caps.notes())
            out.println("Warning: " + note);
        CodecRegistry registry = new CodecRegistry(caps);

        if (args.settings) {
            showSettings(settings, registry, out);
            return 0;
        }

        out.println("Input directory:  " + settings.inputDir().toAbsolutePath());
        out.println("Output directory: " + settings.outputDir().toAbsolutePath());
        out.println("Supported formats: ." + String.join(", .", registry.supportedExtensions()));
        out.println("-".repeat(60));

        BatchOrchestrator orchestrator = new BatchOrchestrator(registry);
        BatchHandle handle = orchestrator.start(settings);

        // Ctrl-C: stop after the file in flight and let it finish writing
        Thread stopHook = new Thread(() -> {
            handle.cancel();
            try {
                handle.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "batch-stop");
        Runtime.getRuntime().addShutdownHook(stopHook);

        ConsoleReporter reporter = new ConsoleReporter(out, err, settings.outputDir());
        try {
            return reporter.drain(handle.events());
        } catch (InterruptedException e) {
            handle.cancel();
            Thread.currentThread().interrupt();
            return ConsoleReporter.EXIT_CANCELLED;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(stopHook);
            } catch (IllegalStateException e) {
                // JVM already shutting down: the hook is running
                err.println("Interrupted by user");
            }
        }
    }

    static void showSettings(BatchSettings s, CodecRegistry registry, PrintStream out) {
        CanvasSpec c = s.canvas();
        out.println();
        out.println("=".repeat(60));
        out.println("CURRENT SETTINGS:");
        out.println("=".repeat(60));
        out.println("Input directory:  " + s.inputDir().toAbsolutePath());
        out.println("Output directory: " + s.outputDir().toAbsolutePath());
        out.println("Target size:      " + c.width() + "x" + c.height());
        out.println("JPEG quality:     " + c.quality() + "%");
        out.println("Background color: " + c.background());
        out.println("Mode:             " + c.mode().label());
        out.println("Overwrite:        " + (s.overwrite() ? "yes" : "no"));
        out.println("Size suffix:      " + (s.sizeSuffix() ? "yes" : "no"));
        CodecCapabilities caps = registry.capabilities();
        out.println("HEIF support:     " + (caps.heifAvailable() ? "yes" : "no (add a HEIF ImageIO plugin)"));
        out.println("RAW support:      " + caps.rawDecoder().map(p -> "yes (" + p + ")")
                .orElse("no (install dcraw or pass --raw-decoder)"));
        out.println("Formats:          ." + String.join(", .", registry.supportedExtensions()));
        out.println("=".repeat(60));
    }
}
