package io;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps file extensions to a {@link DecodeKind}. Raster extensions are always present;
 * HEIF and RAW extensions only when the matching capability was found.
 */
public final class CodecRegistry {

    public static final List<String> RASTER_EXTENSIONS =
            List.of("jpg", "jpeg", "png", "bmp", "tiff", "tif", "webp", "gif");
    public static final List<String> HEIF_EXTENSIONS = List.of("heif", "heic", "hif");
    public static final List<String> RAW_EXTENSIONS =
            List.of("cr2", "cr3", "nef", "arw", "dng", "raf", "orf", "rw2");

    private final CodecCapabilities capabilities;
    private final Set<String> supported;

    public CodecRegistry(CodecCapabilities capabilities) {
        this.capabilities = capabilities;
        Set<String> s = new LinkedHashSet<>(RASTER_EXTENSIONS);
        if (capabilities.heifAvailable())
            s.addAll(HEIF_EXTENSIONS);
        if (capabilities.rawAvailable())
            s.addAll(RAW_EXTENSIONS);
        this.supported = Collections.unmodifiableSet(s);
    }

    public CodecCapabilities capabilities() {
        return capabilities;
    }

    /** Lower-case extensions without the dot, in declaration order. */
    public Set<String> supportedExtensions() {
        return supported;
    }

    public DecodeKind decodeKind(String extension) {
        String ext = normalize(extension);
        if (!supported.contains(ext))
            return DecodeKind.UNSUPPORTED;
        return RAW_EXTENSIONS.contains(ext) ? DecodeKind.RAW : DecodeKind.RASTER;
    }

    public boolean isSupported(Path file) {
        return decodeKind(extensionOf(file.getFileName().toString())) != DecodeKind.UNSUPPORTED;
    }

    /** Text after the last dot of {@code fileName}, or "" when there is none. */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        // ".hidden" has no extension
        if (dot <= 0 || dot == fileName.length() - 1)
            return "";
        return fileName.substring(dot + 1);
    }

    /** {@code fileName} without its extension. */
    public static String stemOf(String fileName) {
        String ext = extensionOf(fileName);
        return ext.isEmpty() ? fileName : fileName.substring(0, fileName.length() - ext.length() - 1);
    }

    private static String normalize(String extension) {
        if (extension == null)
            return "";
        String e = extension.trim().toLowerCase(Locale.ROOT);
        return e.startsWith(".") ? e.substring(1) : e;
    }
}
