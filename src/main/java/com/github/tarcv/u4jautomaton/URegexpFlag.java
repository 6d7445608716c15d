package com.github.tarcv.u4jautomaton;

import java.util.Collection;

public enum URegexpFlag {
    /**
     * Enable case insensitive matching. Literals and sets are closed over Unicode
     * simple case folding, and backreferences compare case-folded text.
     */
    UREGEX_CASE_INSENSITIVE(2),

    /**
     * If set, '.' does not match line terminators
     * (\\u000a, \\u000b, \\u000c, \\u000d, \\u0085, \\u2028, \\u2029).
     * By default '.' matches every Unicode scalar value.
     */
    UREGEX_DOT_EXCLUDES_LINE_TERMINATORS(32),

    /**
     * Unix-only line endings.
     * When this mode is enabled, only \\u000a is recognized as a line ending
     * in the behavior of '.' under {@link #UREGEX_DOT_EXCLUDES_LINE_TERMINATORS}.
     */
    UREGEX_UNIX_LINES(1);

    final long flag;

    URegexpFlag(final int flag) {
        this.flag = flag;
    }

    static final long ALL_FLAGS = UREGEX_CASE_INSENSITIVE.flag
            | UREGEX_DOT_EXCLUDES_LINE_TERMINATORS.flag
            | UREGEX_UNIX_LINES.flag;

    static long toBits(final Collection<URegexpFlag> flags) {
        long bits = 0;
        for (URegexpFlag f : flags) {
            bits |= f.flag;
        }
        return bits;
    }

    static boolean isSet(final long flags, final URegexpFlag flag) {
        return (flags & flag.flag) != 0;
    }
}
