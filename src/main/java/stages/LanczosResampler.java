package stages;

import util.PixelBuffer;

import java.util.Arrays;

/**
 * Separable Lanczos-3 resampling. When shrinking, the kernel is stretched by the scale
 * factor so every source pixel contributes (antialiasing), which makes it behave like an
 * area filter on large reductions.
 */
public final class LanczosResampler {

    private static final double SUPPORT = 3.0;

    private LanczosResampler() {
    }

    public static PixelBuffer resize(PixelBuffer src, int outW, int outH) {
        if (outW <= 0 || outH <= 0)
            throw new IllegalArgumentException("Invalid output size " + outW + "x" + outH);
        if (outW == src.width() && outH == src.height())
            return new PixelBuffer(outW, outH, src.pixels().clone());

        PixelBuffer tmp = outW == src.width() ? src : horizontal(src, outW);
        return outH == src.height() ? tmp : vertical(tmp, outH);
    }

    // ---------------- Passes ----------------

    private static PixelBuffer horizontal(PixelBuffer src, int outW) {
        int inW = src.width(), h = src.height();
        Coefficients k = Coefficients.compute(inW, outW);
        byte[] in = src.pixels();
        byte[] out = new byte[outW * h * 3];
        for (int y = 0; y < h; y++) {
            int rowIn = y * inW * 3;
            int rowOut = y * outW * 3;
            for (int x = 0; x < outW; x++) {
                int start = k.bounds[x * 2], n = k.bounds[x * 2 + 1];
                int wBase = x * k.kSize;
                double r = 0, g = 0, b = 0;
                for (int i = 0; i < n; i++) {
                    double w = k.weights[wBase + i];
                    int p = rowIn + (start + i) * 3;
                    r += (in[p] & 0xFF) * w;
                    g += (in[p + 1] & 0xFF) * w;
                    b += (in[p + 2] & 0xFF) * w;
                }
                int o = rowOut + x * 3;
                out[o] = clamp8(r);
                out[o + 1] = clamp8(g);
                out[o + 2] = clamp8(b);
            }
        }
        return new PixelBuffer(outW, h, out);
    }

    private static PixelBuffer vertical(PixelBuffer src, int outH) {
        int w = src.width(), inH = src.height();
        Coefficients k = Coefficients.compute(inH, outH);
        byte[] in = src.pixels();
        byte[] out = new byte[w * outH * 3];
        int stride = w * 3;
        double[] acc = new double[stride];
        for (int y = 0; y < outH; y++) {
            int start = k.bounds[y * 2], n = k.bounds[y * 2 + 1];
            int wBase = y * k.kSize;
            Arrays.fill(acc, 0);
            for (int i = 0; i < n; i++) {
                double wt = k.weights[wBase + i];
                int row = (start + i) * stride;
                for (int c = 0; c < stride; c++)
                    acc[c] += (in[row + c] & 0xFF) * wt;
            }
            int rowOut = y * stride;
            for (int c = 0; c < stride; c++)
                out[rowOut + c] = clamp8(acc[c]);
        }
        return new PixelBuffer(w, outH, out);
    }

    // ---------------- Kernel ----------------

    static double lanczos(double x) {
        if (x <= -SUPPORT || x >= SUPPORT)
            return 0.0;
        return sinc(x) * sinc(x / SUPPORT);
    }

    private static double sinc(double x) {
        if (x == 0.0)
            return 1.0;
        double px = Math.PI * x;
        return Math.sin(px) / px;
    }

    private static byte clamp8(double v) {
        long r = Math.round(v);
        return (byte) (r < 0 ? 0 : r > 255 ? 255 : r);
    }

    /**
     * Per output pixel: first contributing input index, number of taps and normalized weights.
     */
    static final class Coefficients {
        final int kSize;
        final int[] bounds;
        final double[] weights;

        private Coefficients(int kSize, int[] bounds, double[] weights) {
            this.kSize = kSize;
            this.bounds = bounds;
            this.weights = weights;
        }

        static Coefficients compute(int inSize, int outSize) {
            double scale = (double) inSize / outSize;
            double filterScale = Math.max(scale, 1.0);
            double support = SUPPORT * filterScale;
            int kSize = (int) Math.ceil(support) * 2 + 1;

            int[] bounds = new int[outSize * 2];
            double[] weights = new double[outSize * kSize];
            for (int xx = 0; xx < outSize; xx++) {
                double center = (xx + 0.5) * scale;
                int xmin = Math.max((int) (center - support + 0.5), 0);
                int xmax = Math.min((int) (center + support + 0.5), inSize) - xmin;
                xmax = Math.min(xmax, kSize);
                double total = 0;
                for (int x = 0; x < xmax; x++) {
                    double w = lanczos((x + xmin - center + 0.5) / filterScale);
                    weights[xx * kSize + x] = w;
                    total += w;
                }
                if (total != 0) {
                    for (int x = 0; x < xmax; x++)
                        weights[xx * kSize + x] /= total;
                }
                bounds[xx * 2] = xmin;
                bounds[xx * 2 + 1] = xmax;
            }
            return new Coefficients(kSize, bounds, weights);
        }
    }
}
