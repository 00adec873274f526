package pipeline;

import io.DecodeException;
import io.ImageLoader;
import io.JpegEncoder;
import stages.CanvasCompositor;
import stages.CanvasSpec;
import util.PixelBuffer;
import util.Result;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Decode, composite, encode and write for a single job. Each step reports failure as a
 * {@link ConversionError} value; nothing is thrown to the batch loop.
 */
public final class ConversionPipeline {

    private final ImageLoader loader;
    private final CanvasSpec canvas;

    public ConversionPipeline(ImageLoader loader, CanvasSpec canvas) {
        this.loader = loader;
        this.canvas = canvas;
    }

    public Result<Path, ConversionError> convert(Job job) {
        return decode(job)
                .flatMap(buffer -> composite(job, buffer))
                .flatMap(buffer -> encode(job, buffer))
                .flatMap(bytes -> write(job, bytes));
    }

    Result<PixelBuffer, ConversionError> decode(Job job) {
        try {
            return Result.ok(loader.load(job.input()));
        } catch (DecodeException e) {
            return Result.failure(new ConversionError(ConversionError.Stage.DECODE, job.fileName(), e.getMessage()));
        } catch (RuntimeException e) {
            return Result.failure(new ConversionError(ConversionError.Stage.DECODE, job.fileName(), "Decoding failed: " + e));
        } catch (OutOfMemoryError e) {
            return Result.failure(outOfMemory(ConversionError.Stage.DECODE, job));
        }
    }

    Result<PixelBuffer, ConversionError> composite(Job job, PixelBuffer buffer) {
        try {
            return Result.ok(CanvasCompositor.composite(buffer, canvas));
        } catch (RuntimeException e) {
            return Result.failure(new ConversionError(ConversionError.Stage.COMPOSITE, job.fileName(),
                    "Placement failed: " + e));
        } catch (OutOfMemoryError e) {
            return Result.failure(outOfMemory(ConversionError.Stage.COMPOSITE, job));
        }
    }

    Result<byte[], ConversionError> encode(Job job, PixelBuffer buffer) {
        try {
            return Result.ok(JpegEncoder.encode(buffer, canvas.quality()));
        } catch (IOException | RuntimeException e) {
            return Result.failure(new ConversionError(ConversionError.Stage.ENCODE, job.fileName(),
                    "JPEG encoding failed: " + e.getMessage()));
        } catch (OutOfMemoryError e) {
            return Result.failure(outOfMemory(ConversionError.Stage.ENCODE, job));
        }
    }

    /** Writes through a temporary sibling so a reader never sees a half-written JPEG. */
    Result<Path, ConversionError> write(Job job, byte[] jpeg) {
        Path target = job.output();
        Path tmp = null;
        try {
            Path dir = target.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            Files.write(tmp, jpeg);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
            return Result.ok(target);
        } catch (IOException e) {
            return Result.failure(new ConversionError(ConversionError.Stage.WRITE, job.fileName(),
                    "Cannot write " + target + ": " + e.getMessage()));
        } finally {
            if (tmp != null)
                deleteQuietly(tmp);
        }
    }

    // the buffers of the failed job are unreachable once this returns, so the batch can go on
    private static ConversionError outOfMemory(ConversionError.Stage stage, Job job) {
        return new ConversionError(stage, job.fileName(), "Not enough memory for this image");
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            p.toFile().deleteOnExit();
        }
    }
}
