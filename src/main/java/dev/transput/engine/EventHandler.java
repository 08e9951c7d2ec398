package dev.transput.engine;

/**
 * File event handler.
 *
 * <p>Returning {@code true} means the handler dealt with the event: for line and page end the default advance is
 * skipped, for format end the format is not restarted, and for errors transput continues. Returning {@code false}
 * selects the default action, which for errors aborts the statement.</p>
 */
@FunctionalInterface
public interface EventHandler {
    boolean handle(Transput transput) throws TransputError;
}
