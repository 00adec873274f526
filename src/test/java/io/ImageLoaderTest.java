package io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import util.PixelBuffer;
import util.Rgb;
import util.SampleImages;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;

import static org.junit.jupiter.api.Assertions.*;

class ImageLoaderTest {

    @TempDir
    Path tmp;

    private final ImageLoader loader = new ImageLoader(
            new CodecRegistry(CodecCapabilities.rasterOnly()), null, new Rgb(0, 255, 0));

    @Test
    void png_keepsSourceSize() throws IOException {
        Path file = SampleImages.writeSolidPng(tmp, "plain.png", 30, 20, 10, 20, 30);

        PixelBuffer buf = loader.load(file);

        assertEquals(30, buf.width());
        assertEquals(20, buf.height());
        assertEquals(0x0A141E, buf.rgb(15, 10));
    }

    @Test
    void transparentPng_isFlattenedOntoBackground() throws IOException {
        BufferedImage img = new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(3, 3, 0xFFFF0000);
        Path file = SampleImages.write(img, "png", tmp.resolve("alpha.png"));

        PixelBuffer buf = loader.load(file);

        assertEquals(0x00FF00, buf.rgb(0, 0));
        assertEquals(0xFF0000, buf.rgb(3, 3));
    }

    @Test
    void grayPng_isReplicated() throws IOException {
        BufferedImage img = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
        img.getRaster().setSample(1, 1, 0, 77);
        Path file = SampleImages.write(img, "png", tmp.resolve("gray.png"));

        PixelBuffer buf = loader.load(file);

        assertEquals(0x4D4D4D, buf.rgb(1, 1));
    }

    @Test
    void bmpAndGif_decode() throws IOException {
        Path bmp = SampleImages.write(SampleImages.solid(5, 6, 200, 0, 0), "bmp", tmp.resolve("a.bmp"));
        Path gif = SampleImages.write(SampleImages.solid(7, 8, 0, 0, 0), "gif", tmp.resolve("b.gif"));

        assertEquals(0xC80000, loader.load(bmp).rgb(2, 2));
        PixelBuffer g = loader.load(gif);
        assertEquals(7, g.width());
        assertEquals(8, g.height());
    }

    @Test
    void webp_decodesThroughPlugin() throws IOException {
        BufferedImage img = SampleImages.solid(10, 6, 255, 0, 0);
        for (int y = 0; y < 6; y++)
            for (int x = 5; x < 10; x++)
                img.setRGB(x, y, 0x0000FF);
        Path file = writeLosslessWebp(img, tmp.resolve("split.webp"));

        PixelBuffer buf = loader.load(file);

        assertEquals(10, buf.width());
        assertEquals(6, buf.height());
        assertColorNear(0xFF0000, buf.rgb(1, 3));
        assertColorNear(0x0000FF, buf.rgb(8, 3));
    }

    private static Path writeLosslessWebp(BufferedImage img, Path file) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("webp");
        assertTrue(writers.hasNext(), "WebP plugin is not on the classpath");
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        String type = Arrays.stream(param.getCompressionTypes())
                .filter(t -> t.equalsIgnoreCase("lossless"))
                .findFirst()
                .orElse(param.getCompressionTypes()[0]);
        param.setCompressionType(type);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(img, null, null), param);
        } finally {
            writer.dispose();
        }
        return file;
    }

    private static void assertColorNear(int expected, int actual) {
        for (int shift = 0; shift <= 16; shift += 8) {
            int e = (expected >> shift) & 0xFF;
            int a = (actual >> shift) & 0xFF;
            assertTrue(Math.abs(e - a) <= 8,
                    "expected ~" + Integer.toHexString(expected) + " got " + Integer.toHexString(actual));
        }
    }

    @Test
    void garbage_failsWithFileName() throws IOException {
        Path file = SampleImages.writeGarbage(tmp, "broken.jpg");

        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(file));

        assertEquals("broken.jpg", e.getFileName());
        assertTrue(e.getMessage().startsWith("broken.jpg"), e.getMessage());
    }

    @Test
    void missingFile_failsWithFileName() {
        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(tmp.resolve("gone.png")));
        assertTrue(e.getMessage().contains("gone.png"));
    }
}
