package stages;

import util.PixelBuffer;

import java.util.function.IntToDoubleFunction;

/**
 * Places a decoded image on a canvas of exactly {@link CanvasSpec#width()} x {@link CanvasSpec#height()}.
 */
public final class CanvasCompositor {

    /** Relative aspect-ratio difference below which {@link PlacementMode#AUTO} crops. */
    public static final double AUTO_CROP_THRESHOLD = 0.2;

    private CanvasCompositor() {
    }

    public static PixelBuffer composite(PixelBuffer src, CanvasSpec spec) {
        PlacementMode mode = spec.mode() == PlacementMode.AUTO
                ? chooseMode(src.width(), src.height(), spec.width(), spec.height())
                : spec.mode();
        return mode == PlacementMode.CROP ? crop(src, spec) : fit(src, spec);
    }

    /** CROP when |imageRatio - targetRatio| / targetRatio < 0.2, FIT otherwise. */
    public static PlacementMode chooseMode(int srcW, int srcH, int targetW, int targetH) {
        double targetRatio = (double) targetW / targetH;
        double imageRatio = (double) srcW / srcH;
        return Math.abs(imageRatio - targetRatio) / targetRatio < AUTO_CROP_THRESHOLD
                ? PlacementMode.CROP
                : PlacementMode.FIT;
    }

    /** Shrink into the canvas keeping the aspect ratio, then center on the background. */
    public static PixelBuffer fit(PixelBuffer src, CanvasSpec spec) {
        PixelBuffer scaled = thumbnail(src, spec.width(), spec.height());
        PixelBuffer canvas = PixelBuffer.filled(spec.width(), spec.height(), spec.background());
        canvas.paste(scaled, (spec.width() - scaled.width()) / 2, (spec.height() - scaled.height()) / 2);
        return canvas;
    }

    /**
     * Shrink into twice the canvas, cut the centered canvas-sized window, and resize the cut
     * to the canvas when the source was too small to fill it.
     */
    public static PixelBuffer crop(PixelBuffer src, CanvasSpec spec) {
        int tw = spec.width(), th = spec.height();
        PixelBuffer img = thumbnail(src, tw * 2, th * 2);

        int left = Math.max(0, (img.width() - tw) / 2);
        int top = Math.max(0, (img.height() - th) / 2);
        int right = Math.min(img.width(), left + tw);
        int bottom = Math.min(img.height(), top + th);
        PixelBuffer cut = (left == 0 && top == 0 && right == img.width() && bottom == img.height())
                ? img
                : img.crop(left, top, right, bottom);

        if (cut.width() != tw || cut.height() != th)
            cut = LanczosResampler.resize(cut, tw, th);
        return cut;
    }

    /** Downscale only, never enlarge; returns {@code src} itself when it already fits. */
    static PixelBuffer thumbnail(PixelBuffer src, int boxW, int boxH) {
        Size size = thumbnailSize(src.width(), src.height(), boxW, boxH);
        if (size.width() == src.width() && size.height() == src.height())
            return src;
        return LanczosResampler.resize(src, size.width(), size.height());
    }

    /**
     * Largest size within boxW x boxH with the source aspect ratio, never larger than the source.
     * The free dimension is rounded down or up, whichever keeps the ratio closer.
     */
    public static Size thumbnailSize(int w, int h, int boxW, int boxH) {
        if (boxW >= w && boxH >= h)
            return new Size(w, h);
        double aspect = (double) w / h;
        int x = boxW, y = boxH;
        if ((double) x / y >= aspect) {
            double exact = y * aspect;
            int lo = (int) Math.floor(exact), hi = (int) Math.ceil(exact);
            final int fy = y;
            x = closest(lo, hi, n -> Math.abs(aspect - (double) n / fy));
        } else {
            double exact = x / aspect;
            int lo = (int) Math.floor(exact), hi = (int) Math.ceil(exact);
            final int fx = x;
            y = closest(lo, hi, n -> n == 0 ? 0 : Math.abs(aspect - (double) fx / n));
        }
        return new Size(x, y);
    }

    private static int closest(int lo, int hi, IntToDoubleFunction error) {
        int best = error.applyAsDouble(hi) < error.applyAsDouble(lo) ? hi : lo;
        return Math.max(best, 1);
    }
}
