package pipeline;

/**
 * Why one file failed to convert.
 *
 * @param stage   step that failed
 * @param fileName source file name
 * @param message human-readable cause
 */
public record ConversionError(Stage stage, String fileName, String message) {

    public enum Stage {
        DECODE,
        COMPOSITE,
        ENCODE,
        WRITE
    }

    @Override
    public String toString() {
        return message.startsWith(fileName) ? message : fileName + ": " + message;
    }
}
