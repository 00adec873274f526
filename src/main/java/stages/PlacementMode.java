package stages;

import java.util.Locale;

/** How a source image is placed on the target canvas. */
public enum PlacementMode {
    /** Letterbox: keep the whole image, pad with background. */
    FIT,
    /** Fill the canvas, trimming what falls outside. */
    CROP,
    /** Crop when the aspect ratios are close, fit otherwise. */
    AUTO;

    public static PlacementMode parse(String text) {
        if (text == null)
            throw new IllegalArgumentException("Mode is required (fit, crop or auto)");
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode '" + text + "' (expected fit, crop or auto)", e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
