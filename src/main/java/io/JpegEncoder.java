package io;

import util.PixelBuffer;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Baseline (non-progressive) JPEG with optimized Huffman tables and the writer's default
 * 4:2:0 chroma subsampling.
 */
public final class JpegEncoder {

    private JpegEncoder() {
    }

    public static byte[] encode(PixelBuffer buffer, int quality) throws IOException {
        if (quality < 1 || quality > 100)
            throw new IllegalArgumentException("JPEG quality must be in [1..100], got " + quality);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext())
            throw new IOException("No JPEG ImageWriter available");
        ImageWriter writer = writers.next();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality / 100.0f);
            param.setProgressiveMode(ImageWriteParam.MODE_DISABLED);
            if (param instanceof JPEGImageWriteParam jpegParam)
                jpegParam.setOptimizeHuffmanTables(true);
            writer.write(null, new IIOImage(buffer.toBufferedImage(), null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
