package io;

import java.io.IOException;

/**
 * A source file could not be turned into pixels. The message always starts with the file name.
 */
public class DecodeException extends IOException {

    private final String fileName;

    public DecodeException(String fileName, String message) {
        super(fileName + ": " + message);
        this.fileName = fileName;
    }

    public DecodeException(String fileName, String message, Throwable cause) {
        super(fileName + ": " + message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
