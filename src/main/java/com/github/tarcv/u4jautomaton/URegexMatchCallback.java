package com.github.tarcv.u4jautomaton;

/**
 * Function to be called periodically during a long running backtracking match.
 * Patterns without backreferences never invoke it.
 */
@FunctionalInterface
public interface URegexMatchCallback {
    /**
     * @param context the context object that was passed to {@link RegexMatcher#setMatchCallback}
     * @param steps   the accumulated processing time, in the units of {@link RegexMatcher#setTimeLimit(int)}
     * @return true to continue the match, false to abort it
     */
    boolean onMatch(Object context, int steps);
}
