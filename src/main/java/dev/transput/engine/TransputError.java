package dev.transput.engine;

/**
 * Conditions that abort a formatted transput statement once the matching event handler has declined them.
 */
public sealed class TransputError extends Exception
        permits TransputError.FormatExhausted,
                TransputError.FormatUndefined,
                TransputError.PatternMismatch,
                TransputError.ValueError,
                TransputError.ReplicatorInvalid,
                TransputError.FileEnded,
                TransputError.PictureCountMismatch {
    TransputError(String message) {
        super(message);
    }

    /** No pattern remains after the format-end handler ran. */
    public static final class FormatExhausted extends TransputError {
        public FormatExhausted(String message) {
            super(message);
        }
    }

    /** A nil format was about to be opened. */
    public static final class FormatUndefined extends TransputError {
        public FormatUndefined(String message) {
            super(message);
        }
    }

    /** The value's mode is incompatible with the selected pattern. */
    public static final class PatternMismatch extends TransputError {
        public PatternMismatch(String message) {
            super(message);
        }
    }

    /** The value does not fit its picture, or the input does not denote a value. */
    public static final class ValueError extends TransputError {
        public ValueError(String message) {
            super(message);
        }
    }

    /** A replicator (or radix) evaluated to an unusable value. */
    public static final class ReplicatorInvalid extends TransputError {
        public ReplicatorInvalid(String message) {
            super(message);
        }
    }

    public static final class FileEnded extends TransputError {
        public FileEnded(String message) {
            super(message);
        }
    }

    /** Pictures were left over when the statement ended. */
    public static final class PictureCountMismatch extends TransputError {
        public PictureCountMismatch(String message) {
            super(message);
        }
    }
}
