package dev.transput.engine;

import dev.transput.format.MouldItem;
import java.util.List;

/**
 * Sign placement for sign moulds. The sign is rendered ahead of the digits and then floats right past the leading
 * zeros of zero-suppressing frames, stopping at a nonzero digit or a mandatory frame.
 */
final class SignHandler {
    private SignHandler() {}

    static boolean isSign(char c) {
        return c == '+' || c == '-';
    }

    /** Character for a value of sign {@code signum} under {@code frame}. */
    static char signChar(int signum, MouldItem.SignFrame frame) {
        if (signum < 0) {
            return '-';
        }
        return frame == MouldItem.SignFrame.PLUS ? '+' : ' ';
    }

    /**
     * Moves the sign at {@code edit[0]} right across leading zeros, one position per {@code z} frame of
     * {@code frames} (the flattened sign mould followed by the flattened digit mould).
     */
    static void shift(char[] edit, List<MouldItem> frames) {
        if (edit.length == 0 || !isSign(edit[0])) {
            return;
        }
        int q = 0;
        for (MouldItem item : frames) {
            if (item == MouldItem.DigitFrame.MANDATORY) {
                return;
            }
            if (item == MouldItem.DigitFrame.ZERO_SUPPRESSING) {
                if (q + 1 < edit.length && edit[q + 1] == '0') {
                    char sign = edit[q];
                    edit[q] = edit[q + 1];
                    edit[q + 1] = sign;
                    q++;
                } else {
                    return;
                }
            }
        }
    }
}
