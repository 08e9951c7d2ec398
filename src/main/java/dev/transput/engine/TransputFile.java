package dev.transput.engine;

/**
 * Character-level file the engine reads from and writes to.
 */
public interface TransputFile {
    int EOF = -1;

    /** Next character, or {@link #EOF}. */
    int nextChar();

    /** Pushes a character back; characters come back in LIFO order. */
    void pushBack(char ch);

    boolean atEof();

    void put(CharSequence text);

    void newLine();

    void newPage();

    /** Moves the current position by {@code delta} characters (negative moves back). */
    void reposition(int delta);

    /** Zero-based column of the current position within its line. */
    int column();
}
