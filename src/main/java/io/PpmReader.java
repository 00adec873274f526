package io;

import util.PixelBuffer;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads binary Netpbm images (P6 color, P5 gray) as written by dcraw-compatible decoders.
 * Samples deeper than 8 bits are scaled down to 8.
 */
final class PpmReader {

    /** Largest array the VM will allocate. */
    private static final long MAX_ARRAY = Integer.MAX_VALUE - 8;

    private PpmReader() {
    }

    static PixelBuffer read(InputStream in) throws IOException {
        String magic = token(in);
        boolean color;
        if ("P6".equals(magic))
            color = true;
        else if ("P5".equals(magic))
            color = false;
        else
            throw new IOException("Not a binary PPM/PGM stream (magic '" + magic + "')");

        int width = number(in, "width");
        int height = number(in, "height");
        int maxval = number(in, "maxval");
        if (width <= 0 || height <= 0)
            throw new IOException("Invalid PPM size " + width + "x" + height);
        if (maxval <= 0 || maxval > 65535)
            throw new IOException("Invalid PPM maxval " + maxval);

        int channels = color ? 3 : 1;
        int bytesPerSample = maxval > 255 ? 2 : 1;
        long count = (long) width * height * channels;
        long dataBytes = count * bytesPerSample;
        if (dataBytes > MAX_ARRAY || (long) width * height * 3 > MAX_ARRAY)
            throw new IOException("PPM image too large: " + width + "x" + height + " (" + dataBytes + " data bytes)");
        // reads only what the header declares, trailing output is left in the stream
        byte[] raw = in.readNBytes((int) dataBytes);
        if (raw.length != dataBytes)
            throw new EOFException("PPM data truncated: expected " + dataBytes + " bytes, got " + raw.length);

        byte[] px = new byte[width * height * 3];
        for (int i = 0; i < width * height; i++) {
            for (int c = 0; c < 3; c++) {
                int s = (color ? i * 3 + c : i) * bytesPerSample;
                int v = bytesPerSample == 2 ? ((raw[s] & 0xFF) << 8) | (raw[s + 1] & 0xFF) : raw[s] & 0xFF;
                if (maxval != 255)
                    v = (v * 255 + maxval / 2) / maxval;
                px[i * 3 + c] = (byte) v;
            }
        }
        return new PixelBuffer(width, height, px);
    }

    private static int number(InputStream in, String field) throws IOException {
        String t = token(in);
        try {
            return Integer.parseInt(t);
        } catch (NumberFormatException e) {
            throw new IOException("Bad PPM " + field + " '" + t + "'", e);
        }
    }

    /** Next whitespace-delimited header token; '#' comments run to end of line. Consumes one trailing whitespace. */
    private static String token(InputStream in) throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = in.read()) != -1) {
            if (c == '#') {
                while (c != -1 && c != '\n' && c != '\r')
                    c = in.read();
                if (sb.length() > 0)
                    break;
                continue;
            }
            if (Character.isWhitespace(c)) {
                if (sb.length() > 0)
                    break;
                continue;
            }
            sb.append((char) c);
            if (sb.length() > 16)
                throw new IOException("PPM header token too long");
        }
        if (sb.length() == 0)
            throw new EOFException("Unexpected end of PPM header");
        return sb.toString();
    }
}
