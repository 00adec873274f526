package util;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;

/**
 * Opaque 8-bit RGB image, stored as interleaved R, G, B bytes row by row.
 * Length of the backing array is always width * height * 3.
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final byte[] pixels;

    public PixelBuffer(int width, int height, byte[] pixels) {
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Invalid size " + width + "x" + height);
        if (pixels == null || pixels.length != (long) width * height * 3)
            throw new IllegalArgumentException("Pixel array does not match " + width + "x" + height + "x3");
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /** New buffer of the given size, every pixel set to {@code fill}. */
    public static PixelBuffer filled(int width, int height, Rgb fill) {
        byte[] px = new byte[width * height * 3];
        byte r = (byte) fill.red(), g = (byte) fill.green(), b = (byte) fill.blue();
        for (int i = 0; i < px.length; i += 3) {
            px[i] = r;
            px[i + 1] = g;
            px[i + 2] = b;
        }
        return new PixelBuffer(width, height, px);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Backing array; callers that need isolation must copy it. */
    public byte[] pixels() {
        return pixels;
    }

    public int red(int x, int y) {
        return pixels[(y * width + x) * 3] & 0xFF;
    }

    public int green(int x, int y) {
        return pixels[(y * width + x) * 3 + 1] & 0xFF;
    }

    public int blue(int x, int y) {
        return pixels[(y * width + x) * 3 + 2] & 0xFF;
    }

    /** Packed 0xRRGGBB value. */
    public int rgb(int x, int y) {
        int i = (y * width + x) * 3;
        return ((pixels[i] & 0xFF) << 16) | ((pixels[i + 1] & 0xFF) << 8) | (pixels[i + 2] & 0xFF);
    }

    /**
     * Copies {@code src} into this buffer with its top-left corner at (dx, dy).
     * Parts falling outside this buffer are clipped.
     */
    public void paste(PixelBuffer src, int dx, int dy) {
        int x0 = Math.max(0, dx), y0 = Math.max(0, dy);
        int x1 = Math.min(width, dx + src.width), y1 = Math.min(height, dy + src.height);
        if (x0 >= x1 || y0 >= y1)
            return;
        int rowBytes = (x1 - x0) * 3;
        for (int y = y0; y < y1; y++) {
            int from = ((y - dy) * src.width + (x0 - dx)) * 3;
            int to = (y * width + x0) * 3;
            System.arraycopy(src.pixels, from, pixels, to, rowBytes);
        }
    }

    /** Region [left, right) x [top, bottom) as a new buffer. */
    public PixelBuffer crop(int left, int top, int right, int bottom) {
        if (left < 0 || top < 0 || right > width || bottom > height || left >= right || top >= bottom)
            throw new IllegalArgumentException(
                    "Crop box (" + left + ", " + top + ", " + right + ", " + bottom + ") outside " + width + "x" + height);
        int w = right - left, h = bottom - top;
        byte[] out = new byte[w * h * 3];
        for (int y = 0; y < h; y++) {
            System.arraycopy(pixels, ((top + y) * width + left) * 3, out, y * w * 3, w * 3);
        }
        return new PixelBuffer(w, h, out);
    }

    /** TYPE_3BYTE_BGR copy, the layout ImageIO's JPEG writer consumes directly. */
    public BufferedImage toBufferedImage() {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        byte[] dst = ((DataBufferByte) img.getRaster().getDataBuffer()).getData();
        for (int i = 0; i < pixels.length; i += 3) {
            dst[i] = pixels[i + 2];
            dst[i + 1] = pixels[i + 1];
            dst[i + 2] = pixels[i];
        }
        return img;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PixelBuffer other))
            return false;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
