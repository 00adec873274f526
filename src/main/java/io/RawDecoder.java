package io;

import util.PixelBuffer;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Demosaics camera RAW files through a dcraw-compatible executable (dcraw, LibRaw's dcraw_emu).
 * <p>
 * The recipe is fixed: camera white balance, full size, auto brightness, 8 bits per channel,
 * sRGB output, gamma (2.222, 4.5), automatic black point, saturation and scaling, AHD interpolation.
 * The decoder writes a PPM to stdout which is read back into a {@link PixelBuffer}; only the
 * sample bytes its header declares are read, so a runaway decoder cannot flood memory.
 */
public final class RawDecoder {

    private static final List<String> RECIPE = List.of(
            "-c",               // write to stdout
            "-w",               // camera white balance
            "-o", "1",          // sRGB
            "-g", "2.222", "4.5",
            "-q", "3");         // AHD

    private static final int MAX_STDERR_CHARS = 500;

    private final Path executable;

    public RawDecoder(Path executable) {
        this.executable = executable;
    }

    public Path executable() {
        return executable;
    }

    /** Full command line for one file. */
    public List<String> commandFor(Path input) {
        List<String> cmd = new ArrayList<>(RECIPE.size() + 2);
        cmd.add(executable.toString());
        cmd.addAll(RECIPE);
        cmd.add(input.toAbsolutePath().toString());
        return cmd;
    }

    public PixelBuffer decode(Path input) throws DecodeException {
        String name = input.getFileName().toString();
        if (!Files.isRegularFile(input))
            throw new DecodeException(name, "RAW file not found");

        Path errLog = null;
        Process process = null;
        try {
            errLog = Files.createTempFile("raw-decoder-", ".log");
            ProcessBuilder builder = new ProcessBuilder(commandFor(input))
                    .redirectInput(ProcessBuilder.Redirect.PIPE)
                    .redirectError(errLog.toFile());
            process = builder.start();
            process.getOutputStream().close();

            PixelBuffer image = null;
            IOException unreadable = null;
            boolean empty;
            try (InputStream in = new BufferedInputStream(process.getInputStream())) {
                in.mark(1);
                empty = in.read() == -1;
                if (!empty) {
                    in.reset();
                    try {
                        image = PpmReader.read(in);
                    } catch (IOException e) {
                        unreadable = e;
                    }
                }
            }
            int exit = process.waitFor();
            if (exit != 0) {
                throw new DecodeException(name, "RAW decoder exited with status " + exit + stderrSuffix(errLog));
            }
            if (empty) {
                throw new DecodeException(name, "RAW decoder produced no image data" + stderrSuffix(errLog));
            }
            if (unreadable != null) {
                throw new DecodeException(name, "Unreadable RAW decoder output: " + unreadable.getMessage(), unreadable);
            }
            return image;
        } catch (DecodeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecodeException(name, "RAW decoding interrupted", e);
        } catch (IOException e) {
            throw new DecodeException(name, "Failed to run RAW decoder " + executable + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new DecodeException(name, "RAW decoding failed: " + e, e);
        } finally {
            if (process != null && process.isAlive())
                process.destroyForcibly();
            if (errLog != null) {
                try {
                    Files.deleteIfExists(errLog);
                } catch (IOException e) {
                    errLog.toFile().deleteOnExit();
                }
            }
        }
    }

    private static String stderrSuffix(Path errLog) {
        try {
            String err = Files.readString(errLog, StandardCharsets.UTF_8).trim();
            if (err.isEmpty())
                return "";
            if (err.length() > MAX_STDERR_CHARS)
                err = err.substring(0, MAX_STDERR_CHARS) + "...";
            return " (" + err.replace('\n', ' ') + ")";
        } catch (IOException e) {
            return "";
        }
    }
}
