package dev.transput.engine;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * In-memory {@link TransputFile}. Writes overwrite existing text at the current position and extend it at the end.
 */
public final class StringTransputFile implements TransputFile {
    private final StringBuilder text;
    private final ArrayDeque<Character> pushed = new ArrayDeque<>();
    private int pos;

    public StringTransputFile() {
        this("");
    }

    public StringTransputFile(String initial) {
        this.text = new StringBuilder(Objects.requireNonNull(initial, "initial"));
        this.pos = 0;
    }

    @Override
    public int nextChar() {
        if (!pushed.isEmpty()) {
            return pushed.pop();
        }
        if (pos >= text.length()) {
            return EOF;
        }
        return text.charAt(pos++);
    }

    @Override
    public void pushBack(char ch) {
        pushed.push(ch);
    }

    @Override
    public boolean atEof() {
        return pushed.isEmpty() && pos >= text.length();
    }

    @Override
    public void put(CharSequence chars) {
        Objects.requireNonNull(chars, "chars");
        settlePushBack();
        for (int i = 0; i < chars.length(); i++) {
            if (pos < text.length()) {
                text.setCharAt(pos, chars.charAt(i));
            } else {
                text.append(chars.charAt(i));
            }
            pos++;
        }
    }

    @Override
    public void newLine() {
        put("\n");
    }

    @Override
    public void newPage() {
        put("\f");
    }

    @Override
    public void reposition(int delta) {
        settlePushBack();
        pos = Math.max(0, Math.min(text.length(), pos + delta));
    }

    @Override
    public int column() {
        int logical = Math.max(0, pos - pushed.size());
        int col = 0;
        for (int i = logical - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\f') {
                break;
            }
            col++;
        }
        return col;
    }

    /** The whole text, independent of the current position. */
    public String contents() {
        return text.toString();
    }

    /** Text from the current position to the end. */
    public String remaining() {
        StringBuilder sb = new StringBuilder();
        for (Character c : pushed) {
            sb.append(c.charValue());
        }
        return sb.append(text, Math.min(pos, text.length()), text.length()).toString();
    }

    private void settlePushBack() {
        // Pushed-back characters normally mirror the text just read, so rewinding keeps positions consistent.
        pos = Math.max(0, pos - pushed.size());
        pushed.clear();
    }

    @Override
    public String toString() {
        return "StringTransputFile[pos=" + pos + ", length=" + text.length() + "]";
    }
}
