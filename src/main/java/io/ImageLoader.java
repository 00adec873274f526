package io;

import util.PixelBuffer;
import util.Rgb;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes a source file into an opaque RGB {@link PixelBuffer}: RAW files go through the
 * {@link RawDecoder}, everything else through ImageIO followed by {@link ColorNormalizer}.
 */
public final class ImageLoader {

    private final CodecRegistry registry;
    private final RawDecoder rawDecoder;
    private final Rgb background;

    /**
     * @param rawDecoder may be null when RAW decoding is unavailable
     * @param background color transparent pixels are flattened onto
     */
    public ImageLoader(CodecRegistry registry, RawDecoder rawDecoder, Rgb background) {
        this.registry = registry;
        this.rawDecoder = rawDecoder;
        this.background = background;
    }

    public static ImageLoader create(CodecRegistry registry, Rgb background) {
        RawDecoder raw = registry.capabilities().rawDecoder().map(RawDecoder::new).orElse(null);
        return new ImageLoader(registry, raw, background);
    }

    public PixelBuffer load(Path input) throws DecodeException {
        String name = input.getFileName().toString();
        DecodeKind kind = registry.decodeKind(CodecRegistry.extensionOf(name));
        if (kind == DecodeKind.RAW && rawDecoder != null)
            return rawDecoder.decode(input);

        try {
            BufferedImage image = ImageIO.read(input.toFile());
            if (image == null)
                throw new DecodeException(name, "no image reader understands this file");
            return ColorNormalizer.toRgb(image, background);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // corrupt streams surface from ImageIO plugins as unchecked exceptions too
            throw new DecodeException(name, describe(e), e);
        } catch (LinkageError e) {
            // native-backed plugins (WebP) fail here when their library cannot load on this platform
            throw new DecodeException(name, "image plugin unavailable: " + e, e);
        }
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank())
            return e.getClass().getSimpleName();
        if (e.getCause() != null && e.getCause().getMessage() != null && !msg.contains(e.getCause().getMessage()))
            return msg + " (" + e.getCause().getMessage() + ")";
        return msg;
    }
}
