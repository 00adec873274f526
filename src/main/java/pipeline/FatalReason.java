package pipeline;

/** Why a run stopped before (or instead of) converting files. */
public enum FatalReason {
    INPUT_DIRECTORY_NOT_FOUND,
    NO_SUPPORTED_IMAGES,
    OUTPUT_DIRECTORY_UNWRITABLE,
    /** Unexpected failure of the batch worker itself. */
    INTERNAL_ERROR
}
