package com.github.tarcv.u4jautomaton;

/**
 * A backtracking match ran past its time limit. The outcome is unknown: the input
 * may or may not match.
 */
public class BudgetExceededException extends UErrorException {
    private final int timeLimit;

    public BudgetExceededException(final int timeLimit) {
        super(UErrorCode.U_REGEX_TIME_OUT, "Match time limit of " + timeLimit + " exceeded");
        this.timeLimit = timeLimit;
    }

    public int getTimeLimit() {
        return timeLimit;
    }
}
