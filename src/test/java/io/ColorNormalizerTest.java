package io;

import org.junit.jupiter.api.Test;
import util.PixelBuffer;
import util.Rgb;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;

import static org.junit.jupiter.api.Assertions.*;

class ColorNormalizerTest {

    private static final Rgb BLUE_BG = new Rgb(0, 0, 255);

    @Test
    void alpha_fullyTransparentBecomesBackground() {
        BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0x00FF0000);
        img.setRGB(1, 0, 0xFFFF0000);

        PixelBuffer out = ColorNormalizer.toRgb(img, BLUE_BG);

        assertEquals(0x0000FF, out.rgb(0, 0), "transparent pixel should show the background");
        assertEquals(0xFF0000, out.rgb(1, 0), "opaque pixel keeps its color");
    }

    @Test
    void alpha_partialBlendsLinearly() {
        BufferedImage img = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0x80FF0000);

        PixelBuffer out = ColorNormalizer.toRgb(img, Rgb.BLACK);

        assertEquals(128, out.red(0, 0));
        assertEquals(0, out.green(0, 0));
        assertEquals(0, out.blue(0, 0));
    }

    @Test
    void palette_transparentIndexBecomesBackground() {
        byte[] r = { 0, (byte) 200 };
        byte[] g = { 0, 100 };
        byte[] b = { 0, 50 };
        IndexColorModel icm = new IndexColorModel(8, 2, r, g, b, 0);
        BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_INDEXED, icm);
        img.getRaster().setSample(0, 0, 0, 0);
        img.getRaster().setSample(1, 0, 0, 1);

        PixelBuffer out = ColorNormalizer.toRgb(img, new Rgb(9, 9, 9));

        assertEquals(0x090909, out.rgb(0, 0));
        assertEquals(0xC86432, out.rgb(1, 0));
    }

    @Test
    void gray_valueIsReplicatedUnchanged() {
        BufferedImage img = new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_GRAY);
        img.getRaster().setSample(0, 0, 0, 100);

        PixelBuffer out = ColorNormalizer.toRgb(img, BLUE_BG);

        assertEquals(100, out.red(0, 0));
        assertEquals(100, out.green(0, 0));
        assertEquals(100, out.blue(0, 0));
    }

    @Test
    void gray16_keepsHighByte() {
        BufferedImage img = new BufferedImage(1, 1, BufferedImage.TYPE_USHORT_GRAY);
        img.getRaster().setSample(0, 0, 0, 0xABCD);

        PixelBuffer out = ColorNormalizer.toRgb(img, Rgb.BLACK);

        assertEquals(0xABABAB, out.rgb(0, 0));
    }

    @Test
    void rgb_passesThrough() {
        BufferedImage img = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        img.setRGB(1, 1, 0x123456);

        PixelBuffer out = ColorNormalizer.toRgb(img, BLUE_BG);

        assertEquals(2, out.width());
        assertEquals(2, out.height());
        assertEquals(0x123456, out.rgb(1, 1));
        assertEquals(0x000000, out.rgb(0, 0));
    }

    @Test
    void blend_endpointsAreExact() {
        for (int v = 0; v < 256; v += 17) {
            assertEquals(v, ColorNormalizer.blend(v, 77, 255));
            assertEquals(77, ColorNormalizer.blend(v, 77, 0));
        }
    }
}
