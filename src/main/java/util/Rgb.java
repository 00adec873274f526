package util;

import java.util.Locale;

/** An opaque sRGB color, channels in [0..255]. */
public record Rgb(int red, int green, int blue) {

    public static final Rgb BLACK = new Rgb(0, 0, 0);
    public static final Rgb WHITE = new Rgb(255, 255, 255);

    public Rgb {
        check(red, "red");
        check(green, "green");
        check(blue, "blue");
    }

    private static void check(int v, String channel) {
        if (v < 0 || v > 255)
            throw new IllegalArgumentException(channel + " must be in [0..255], got " + v);
    }

    /**
     * Parses {@code r,g,b}, {@code #rrggbb} or the names {@code black} and {@code white}.
     */
    public static Rgb parse(String text) {
        if (text == null || text.isBlank())
            throw new IllegalArgumentException("Empty color");
        String s = text.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "black":
                return BLACK;
            case "white":
                return WHITE;
            default:
                break;
        }
        if (s.startsWith("#")) {
            if (s.length() != 7)
                throw new IllegalArgumentException("Expected #rrggbb, got " + text);
            try {
                int v = Integer.parseInt(s.substring(1), 16);
                return new Rgb((v >>> 16) & 0xFF, (v >>> 8) & 0xFF, v & 0xFF);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected #rrggbb, got " + text, e);
            }
        }
        String[] parts = s.split("\\s*,\\s*");
        if (parts.length != 3)
            throw new IllegalArgumentException("Expected r,g,b, got " + text);
        try {
            return new Rgb(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected r,g,b, got " + text, e);
        }
    }

    @Override
    public String toString() {
        return "RGB(" + red + ", " + green + ", " + blue + ")";
    }
}
