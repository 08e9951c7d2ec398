package dev.transput.engine;

import dev.transput.format.Count;
import dev.transput.format.Environment;
import dev.transput.format.Pattern;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared state of one {@link Transput}: collaborators, the output buffer, and the direction and frame stack of the
 * active call. Every error is offered to its event handler here before it is thrown.
 */
final class TransputContext {
    private static final Logger LOGGER = Logger.getLogger(TransputContext.class.getName());

    enum Direction {
        READ,
        WRITE
    }

    /** The value mode and pattern an error is reported against. */
    record Subject(String modeName, Pattern pattern) {}

    final Transput owner;
    final TransputFile file;
    final Evaluator evaluator;
    final TransputEvents events;
    final TransputSettings settings;
    final LongArithmetic arithmetic;
    final OutputBuffer buffer = new OutputBuffer();

    Direction direction = Direction.WRITE;
    FrameStack frames = new FrameStack();

    TransputContext(
            Transput owner,
            TransputFile file,
            Evaluator evaluator,
            TransputEvents events,
            TransputSettings settings,
            LongArithmetic arithmetic) {
        this.owner = owner;
        this.file = file;
        this.evaluator = evaluator;
        this.events = events;
        this.settings = settings;
        this.arithmetic = arithmetic;
    }

    boolean reading() {
        return direction == Direction.READ;
    }

    /** Runs the handler for {@code event}; {@code false} when none is registered. */
    boolean fire(TransputEvent event) throws TransputError {
        EventHandler handler = events.resolve(event);
        return handler != null && handler.handle(owner);
    }

    // ====== errors ======

    void valueError(Subject subject) throws TransputError {
        raiseValueError("error transputting " + subject.modeName() + " value with " + describe(subject.pattern()));
    }

    void signError(Subject subject) throws TransputError {
        raiseValueError(
                "error transputting sign in " + subject.modeName() + " value with " + describe(subject.pattern()));
    }

    void patternMismatch(Subject subject) throws TransputError {
        offerFormatError(new TransputError.PatternMismatch(
                "cannot transput " + subject.modeName() + " value with " + describe(subject.pattern())));
    }

    void offerFormatError(TransputError error) throws TransputError {
        if (fire(TransputEvent.FORMAT_ERROR)) {
            LOGGER.log(Level.FINE, () -> "format error mended by handler: " + error.getMessage());
            return;
        }
        throw error;
    }

    private void raiseValueError(String message) throws TransputError {
        if (reading() && file.atEof()) {
            endOfFile();
            return;
        }
        if (fire(TransputEvent.VALUE_ERROR)) {
            LOGGER.log(Level.FINE, () -> "value error mended by handler: " + message);
            return;
        }
        throw new TransputError.ValueError(message);
    }

    void endOfFile() throws TransputError {
        if (fire(TransputEvent.FILE_END)) {
            LOGGER.log(Level.FINE, "end of file mended by handler");
            return;
        }
        throw new TransputError.FileEnded("end of file reached while reading formatted input");
    }

    private static String describe(Pattern pattern) {
        return pattern == null ? "standard format" : pattern.describe();
    }

    // ====== counts ======

    /** Evaluates a replicator; a negative result is reported and then taken as zero. */
    int count(Count count, Environment env) throws TransputError {
        long n;
        if (count instanceof Count.Static s) {
            n = s.n();
        } else if (count instanceof Count.Dynamic d) {
            n = evaluator.evalInt(d.expr(), env);
        } else {
            throw new IllegalStateException("unknown count " + count);
        }
        if (n < 0) {
            long bad = n;
            offerFormatError(new TransputError.ReplicatorInvalid("negative replicator " + bad));
            return 0;
        }
        if (n > Integer.MAX_VALUE) {
            long bad = n;
            offerFormatError(new TransputError.ReplicatorInvalid("replicator too large " + bad));
            return 0;
        }
        return (int) n;
    }

    /** Evaluates a radix; returns {@code -1} once an invalid radix was reported and mended. */
    int radix(Count count, Environment env) throws TransputError {
        int r = count(count, env);
        if (r < 2 || r > 16) {
            offerFormatError(new TransputError.ReplicatorInvalid("invalid radix " + r));
            return -1;
        }
        return r;
    }

    // ====== input ======

    /** Next input character; at end of file the file-end handler runs and a blank stands in. */
    char readChar() throws TransputError {
        int c = file.nextChar();
        if (c == TransputFile.EOF) {
            endOfFile();
            return ' ';
        }
        return (char) c;
    }
}
