package stages;

import util.Rgb;

import java.util.Objects;

/**
 * Output canvas: exact size, background, placement mode and JPEG quality.
 */
public record CanvasSpec(int width, int height, Rgb background, PlacementMode mode, int quality) {

    public CanvasSpec {
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Target size must be positive, got " + width + "x" + height);
        if (quality < 1 || quality > 100)
            throw new IllegalArgumentException("JPEG quality must be in [1..100], got " + quality);
        Objects.requireNonNull(background, "background");
        Objects.requireNonNull(mode, "mode");
    }

    /** 480x800, black, letterbox, quality 95. */
    public static CanvasSpec defaults() {
        return new CanvasSpec(480, 800, Rgb.BLACK, PlacementMode.FIT, 95);
    }

    public CanvasSpec withMode(PlacementMode newMode) {
        return new CanvasSpec(width, height, background, newMode, quality);
    }
}
