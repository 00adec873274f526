package pipeline;

/**
 * The job list could not be built; the run ends before any file is touched.
 */
public class EnumerationException extends Exception {

    private final FatalReason reason;

    public EnumerationException(FatalReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EnumerationException(FatalReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FatalReason getReason() {
        return reason;
    }
}
