package io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import util.PixelBuffer;
import util.Rgb;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Uses small shell scripts in place of dcraw, so these run on POSIX systems only.
 */
class RawDecoderTest {

    @TempDir
    Path tmp;

    private Path fixture;
    private Path argsFile;

    @BeforeEach
    void setUp() throws IOException {
        fixture = Files.write(tmp.resolve("out.ppm"), PpmReaderTest.ppm("P6\n2 2\n255\n",
                10, 20, 30, 40, 50, 60, 70, 80, 90, 100, 110, 120));
        argsFile = tmp.resolve("args.txt");
    }

    private Path script(String name, String body) throws IOException {
        assumeTrue(File.separatorChar == '/' && Files.isExecutable(Paths.get("/bin/sh")), "needs a POSIX shell");
        Path p = Files.writeString(tmp.resolve(name), "#!/bin/sh\n" + body + "\n");
        assumeTrue(p.toFile().setExecutable(true), "cannot mark scripts executable");
        return p;
    }

    private Path rawFile(String name) throws IOException {
        return Files.write(tmp.resolve(name), new byte[] { 1, 2, 3 });
    }

    @Test
    void commandLine_followsFixedRecipe() {
        RawDecoder decoder = new RawDecoder(Paths.get("/usr/bin/dcraw"));
        Path input = Paths.get("/photos/IMG_1.CR2");

        List<String> cmd = decoder.commandFor(input);

        assertEquals(List.of(Paths.get("/usr/bin/dcraw").toString(), "-c", "-w", "-o", "1", "-g", "2.222", "4.5",
                "-q", "3", input.toAbsolutePath().toString()), cmd);
    }

    @Test
    void decode_readsPpmFromStdout() throws IOException {
        Path exe = script("fake-dcraw", "printf '%s\\n' \"$@\" > '" + argsFile + "'\ncat '" + fixture + "'");
        Path raw = rawFile("shot.nef");

        PixelBuffer buf = new RawDecoder(exe).decode(raw);

        assertEquals(2, buf.width());
        assertEquals(2, buf.height());
        assertEquals(0x0A141E, buf.rgb(0, 0));
        assertEquals(0x646E78, buf.rgb(1, 1));
        List<String> args = Files.readAllLines(argsFile);
        assertEquals(List.of("-c", "-w", "-o", "1", "-g", "2.222", "4.5", "-q", "3",
                raw.toAbsolutePath().toString()), args);
    }

    @Test
    void decode_nonZeroExitIsWrappedWithFileName() throws IOException {
        Path exe = script("failing-dcraw", "echo 'Cannot decode file' >&2\nexit 3");
        Path raw = rawFile("bad.cr2");

        DecodeException e = assertThrows(DecodeException.class, () -> new RawDecoder(exe).decode(raw));

        assertEquals("bad.cr2", e.getFileName());
        assertTrue(e.getMessage().contains("status 3"), e.getMessage());
        assertTrue(e.getMessage().contains("Cannot decode file"), e.getMessage());
    }

    @Test
    void decode_emptyOutputFails() throws IOException {
        Path exe = script("silent-dcraw", "exit 0");
        Path raw = rawFile("empty.arw");

        DecodeException e = assertThrows(DecodeException.class, () -> new RawDecoder(exe).decode(raw));
        assertTrue(e.getMessage().contains("no image data"), e.getMessage());
    }

    @Test
    void decode_oversizedHeaderIsDecodeExceptionNamingFile() throws IOException {
        Path exe = script("huge-dcraw", "printf 'P6\\n60000 60000\\n255\\n'");
        Path raw = rawFile("giant.nef");

        DecodeException e = assertThrows(DecodeException.class, () -> new RawDecoder(exe).decode(raw));

        assertEquals("giant.nef", e.getFileName());
        assertTrue(e.getMessage().contains("too large"), e.getMessage());
    }

    @Test
    void decode_truncatedOutputFails() throws IOException {
        Path exe = script("short-dcraw", "printf 'P6\\n4 4\\n255\\nabc'");
        Path raw = rawFile("short.orf");

        DecodeException e = assertThrows(DecodeException.class, () -> new RawDecoder(exe).decode(raw));
        assertTrue(e.getMessage().contains("truncated"), e.getMessage());
    }

    @Test
    void decode_missingFileFails() {
        RawDecoder decoder = new RawDecoder(Paths.get("/nonexistent/dcraw"));
        assertThrows(DecodeException.class, () -> decoder.decode(tmp.resolve("absent.dng")));
    }

    @Test
    void imageLoader_routesRawExtensionsToDecoder() throws IOException {
        Path exe = script("fake-dcraw", "cat '" + fixture + "'");
        CodecRegistry registry = new CodecRegistry(new CodecCapabilities(false, Optional.of(exe), List.of()));
        ImageLoader loader = ImageLoader.create(registry, Rgb.BLACK);

        PixelBuffer buf = loader.load(rawFile("IMG_0001.CR2"));

        assertEquals(2, buf.width());
        assertEquals(0x0A141E, buf.rgb(0, 0));
    }
}
