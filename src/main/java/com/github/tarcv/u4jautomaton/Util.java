package com.github.tarcv.u4jautomaton;

import com.ibm.icu.impl.Utility;
import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.UTF16;
import com.ibm.icu.text.UnicodeSet;

final class Util {
    static final int U_SENTINEL = -1;
    static final int U_PARSE_CONTEXT_LEN = 16;

    private Util() {
    }

    static boolean isScalarValue(final int c) {
        return c >= 0 && c <= UCharacter.MAX_VALUE && !UTF16.isSurrogate(c);
    }

    /**
     * Decode the input into Unicode scalar values. Unpaired surrogates are kept as they are,
     * so they never match anything a pattern can express.
     */
    static int[] toCodePoints(final CharSequence input) {
        if (input == null) {
            throw new IllegalArgumentException("input is null");
        }
        return input.codePoints().toArray();
    }

    static String fromCodePoints(final int[] codePoints, final int start, final int limit) {
        return new String(codePoints, start, limit - start);
    }

    /**
     * Flatten the set into inclusive {@code [lo, hi]} pairs, in ascending order.
     */
    static int[] toRanges(final UnicodeSet set) {
        int count = set.getRangeCount();
        int[] ranges = new int[count * 2];
        for (int i = 0; i < count; i++) {
            ranges[2 * i] = set.getRangeStart(i);
            ranges[2 * i + 1] = set.getRangeEnd(i);
        }
        return ranges;
    }

    static UnicodeSet fromRanges(final int[] ranges) {
        UnicodeSet set = new UnicodeSet();
        for (int i = 0; i < ranges.length; i += 2) {
            set.add(ranges[i], ranges[i + 1]);
        }
        return set;
    }

    public static String safeCodepointToStr(final int codepoint) {
        if (codepoint == U_SENTINEL) {
            return "<U_SENTINEL>";
        } else {
            return Utility.escape(UTF16.valueOf(codepoint));
        }
    }

    static String rangeToStr(final int lo, final int hi) {
        if (lo == hi) {
            return safeCodepointToStr(lo);
        }
        return safeCodepointToStr(lo) + "-" + safeCodepointToStr(hi);
    }
}
