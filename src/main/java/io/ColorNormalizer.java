package io;

import util.PixelBuffer;
import util.Rgb;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;

/**
 * Turns any decoded {@link BufferedImage} into an opaque {@link PixelBuffer}.
 * <ul>
 * <li>palette and alpha images are flattened onto the background, alpha used as blend mask</li>
 * <li>grayscale samples are copied into all three channels</li>
 * <li>everything else goes through {@link BufferedImage#getRGB} (sRGB)</li>
 * </ul>
 */
public final class ColorNormalizer {

    private ColorNormalizer() {
    }

    public static PixelBuffer toRgb(BufferedImage src, Rgb background) {
        ColorModel cm = src.getColorModel();
        if (!(cm instanceof IndexColorModel) && cm.getNumColorComponents() == 1)
            return fromGray(src, background);
        if (cm instanceof IndexColorModel || cm.hasAlpha())
            return flatten(src, background);
        return fromRgb(src);
    }

    /** Source over background: out = (src * a + bg * (255 - a)) / 255, rounded. */
    static int blend(int src, int bg, int alpha) {
        return (src * alpha + bg * (255 - alpha) + 127) / 255;
    }

    private static PixelBuffer flatten(BufferedImage src, Rgb bg) {
        int w = src.getWidth(), h = src.getHeight();
        byte[] px = new byte[w * h * 3];
        int[] row = new int[w];
        int o = 0;
        for (int y = 0; y < h; y++) {
            src.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int p = row[x];
                int a = p >>> 24;
                px[o++] = (byte) blend((p >>> 16) & 0xFF, bg.red(), a);
                px[o++] = (byte) blend((p >>> 8) & 0xFF, bg.green(), a);
                px[o++] = (byte) blend(p & 0xFF, bg.blue(), a);
            }
        }
        return new PixelBuffer(w, h, px);
    }

    private static PixelBuffer fromRgb(BufferedImage src) {
        int w = src.getWidth(), h = src.getHeight();
        byte[] px = new byte[w * h * 3];
        int[] row = new int[w];
        int o = 0;
        for (int y = 0; y < h; y++) {
            src.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int p = row[x];
                px[o++] = (byte) (p >>> 16);
                px[o++] = (byte) (p >>> 8);
                px[o++] = (byte) p;
            }
        }
        return new PixelBuffer(w, h, px);
    }

    /**
     * Reads gray (and gray+alpha) rasters sample by sample. getRGB would push the values
     * through the linear gray color space and brighten them.
     */
    private static PixelBuffer fromGray(BufferedImage src, Rgb bg) {
        ColorModel cm = src.getColorModel();
        Raster raster = src.getRaster();
        int w = src.getWidth(), h = src.getHeight();
        int grayBits = cm.getComponentSize(0);
        boolean alpha = cm.hasAlpha() && raster.getNumBands() > 1;
        int alphaBits = alpha ? cm.getComponentSize(1) : 8;

        byte[] px = new byte[w * h * 3];
        int[] gray = new int[w];
        int[] alphas = new int[w];
        int o = 0;
        for (int y = 0; y < h; y++) {
            raster.getSamples(0, y, w, 1, 0, gray);
            if (alpha)
                raster.getSamples(0, y, w, 1, 1, alphas);
            for (int x = 0; x < w; x++) {
                int v = to8Bit(gray[x], grayBits);
                if (alpha) {
                    int a = to8Bit(alphas[x], alphaBits);
                    px[o++] = (byte) blend(v, bg.red(), a);
                    px[o++] = (byte) blend(v, bg.green(), a);
                    px[o++] = (byte) blend(v, bg.blue(), a);
                } else {
                    px[o++] = (byte) v;
                    px[o++] = (byte) v;
                    px[o++] = (byte) v;
                }
            }
        }
        return new PixelBuffer(w, h, px);
    }

    private static int to8Bit(int sample, int bits) {
        if (bits == 8)
            return sample & 0xFF;
        if (bits > 8)
            return (sample >>> (bits - 8)) & 0xFF;
        int max = (1 << bits) - 1;
        return (sample * 255 + max / 2) / max;
    }
}
