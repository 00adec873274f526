package io;

/** How a file extension is decoded. */
public enum DecodeKind {
    /** ImageIO raster path (JDK readers plus registered plugins such as WebP and HEIF). */
    RASTER,
    /** External demosaic of sensor data. */
    RAW,
    UNSUPPORTED
}
