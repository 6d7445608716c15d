package com.github.tarcv.u4jautomaton;

/**
 * A bounded repetition would unroll into more copies than the configured ceiling allows.
 * Compiling again with a higher limit (see {@link NfaBuilder#setRepeatLimit(int)}) may succeed.
 */
public class RangeOverflowException extends UErrorException {
    private final int requested;
    private final int limit;

    public RangeOverflowException(final int requested, final int limit) {
        super(UErrorCode.U_REGEX_PATTERN_TOO_BIG,
                "Repetition count " + requested + " exceeds the unrolling limit " + limit);
        this.requested = requested;
        this.limit = limit;
    }

    public int getRequested() {
        return requested;
    }

    public int getLimit() {
        return limit;
    }
}
