package io;

import javax.imageio.ImageIO;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceConfigurationError;

/**
 * Optional codec families found at startup. Built once by {@link #probe(String)} and handed to
 * {@link CodecRegistry} and {@link ImageLoader}; missing families only shrink the supported set.
 */
public record CodecCapabilities(boolean heifAvailable, Optional<Path> rawDecoder, List<String> notes) {

    public static final String DEFAULT_RAW_DECODER = "dcraw";

    public CodecCapabilities {
        rawDecoder = rawDecoder == null ? Optional.empty() : rawDecoder;
        notes = List.copyOf(notes);
    }

    public boolean rawAvailable() {
        return rawDecoder.isPresent();
    }

    /** Capabilities with neither HEIF nor RAW, e.g. for raster-only runs. */
    public static CodecCapabilities rasterOnly() {
        return new CodecCapabilities(false, Optional.empty(), List.of());
    }

    /**
     * Looks for a HEIF ImageIO reader and for the RAW demosaic executable.
     *
     * @param rawDecoderCommand executable name (searched on PATH) or path; null means {@value #DEFAULT_RAW_DECODER}
     */
    public static CodecCapabilities probe(String rawDecoderCommand) {
        List<String> notes = new ArrayList<>();

        boolean heif;
        try {
            heif = ImageIO.getImageReadersBySuffix("heic").hasNext()
                    || ImageIO.getImageReadersBySuffix("heif").hasNext();
        } catch (RuntimeException | ServiceConfigurationError e) {
            heif = false;
            notes.add("Failed to initialize HEIF support: " + e.getMessage());
        }
        if (!heif && notes.isEmpty())
            notes.add("HEIF/HEIC: NOT SUPPORTED (no ImageIO reader for heic/heif on the classpath)");

        String command = rawDecoderCommand == null || rawDecoderCommand.isBlank()
                ? DEFAULT_RAW_DECODER
                : rawDecoderCommand.trim();
        Optional<Path> raw = resolveExecutable(command, System.getenv("PATH"));
        if (raw.isEmpty())
            notes.add("RAW files (CR2, NEF, etc.): NOT SUPPORTED (executable '" + command + "' not found)");

        return new CodecCapabilities(heif, raw, notes);
    }

    /**
     * Resolves {@code command} to an executable file. Commands containing a path separator are
     * taken as paths; bare names are searched in each {@code pathVariable} entry.
     */
    static Optional<Path> resolveExecutable(String command, String pathVariable) {
        try {
            if (command.contains("/") || command.contains(File.separator)) {
                Path p = Paths.get(command);
                return isExecutable(p) ? Optional.of(p.toAbsolutePath()) : Optional.empty();
            }
            if (pathVariable == null || pathVariable.isBlank())
                return Optional.empty();
            boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
            for (String dir : pathVariable.split(File.pathSeparator)) {
                if (dir.isBlank())
                    continue;
                Path candidate = Paths.get(dir, command);
                if (isExecutable(candidate))
                    return Optional.of(candidate.toAbsolutePath());
                if (windows) {
                    Path exe = Paths.get(dir, command + ".exe");
                    if (isExecutable(exe))
                        return Optional.of(exe.toAbsolutePath());
                }
            }
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static boolean isExecutable(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }
}
