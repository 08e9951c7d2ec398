package dev.transput.engine;

/**
 * Formatted output of the current line, flushed to the file at line and page breaks and at the end of a statement.
 */
final class OutputBuffer {
    private final StringBuilder text = new StringBuilder();

    void append(char c) {
        text.append(c);
    }

    void append(CharSequence s) {
        text.append(s);
    }

    void blanks(int n) {
        for (int i = 0; i < n; i++) {
            text.append(' ');
        }
    }

    int length() {
        return text.length();
    }

    void flushTo(TransputFile file) {
        if (text.length() > 0) {
            file.put(text);
            text.setLength(0);
        }
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
