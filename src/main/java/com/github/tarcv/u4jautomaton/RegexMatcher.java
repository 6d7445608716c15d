package com.github.tarcv.u4jautomaton;

import java.util.BitSet;

/**
 * Applies a {@link CompiledPattern} to one input, keeping the result of the last match
 * operation and the position where the next {@link #find()} continues.
 * <p>
 * All positions are code point offsets. Matchers are not thread safe; create one per
 * thread from a shared pattern.
 */
public final class RegexMatcher {
    private final CompiledPattern fPattern;
    private int[] fInput;

    // spans of the last successful match, null when there is none
    private int[] fGroups;
    private int fFindFrom;
    private boolean fFindDone;
    // offsets where some match of the pattern begins, computed by the first find on this input
    private BitSet fMatchStarts;

    private int fTimeLimit;
    private URegexMatchCallback fCallbackFn;
    private Object fCallbackContext;

    RegexMatcher(final CompiledPattern pattern, final CharSequence input) {
        fPattern = pattern;
        reset(input);
    }

    /**
     * Forget the previous match, so the next {@link #find()} starts at the beginning of the input.
     *
     * @return this RegexMatcher
     */
    public RegexMatcher reset() {
        fGroups = null;
        fFindFrom = 0;
        fFindDone = false;
        return this;
    }

    /**
     * Reset with a new input.
     *
     * @return this RegexMatcher
     */
    public RegexMatcher reset(final CharSequence input) {
        fInput = Util.toCodePoints(input);
        fMatchStarts = null;
        return reset();
    }

    BitSet getMatchStarts() {
        return fMatchStarts;
    }

    void setMatchStarts(final BitSet matchStarts) {
        fMatchStarts = matchStarts;
    }

    public CompiledPattern pattern() {
        return fPattern;
    }

    /**
     * Number of code points in the input.
     */
    public int inputLength() {
        return fInput.length;
    }

    /**
     * Attempt to match the entire input.
     *
     * @throws BudgetExceededException if the time limit ran out before the outcome was known
     */
    public boolean matches() {
        fGroups = fPattern.search(fInput, 0, CompiledPattern.SearchMode.MATCHES, this);
        return fGroups != null;
    }

    /**
     * Attempt to match a prefix of the input; the longest one is taken.
     */
    public boolean lookingAt() {
        fGroups = fPattern.search(fInput, 0, CompiledPattern.SearchMode.LOOKING_AT, this);
        return fGroups != null;
    }

    /**
     * Find the next match, starting where the previous one ended. After an empty match
     * the search resumes one code point further, so it cannot loop.
     *
     * @return true if a match is found
     */
    public boolean find() {
        if (fFindDone || fFindFrom > fInput.length) {
            fGroups = null;
            fFindDone = true;
            return false;
        }
        fGroups = fPattern.search(fInput, fFindFrom, CompiledPattern.SearchMode.FIND, this);
        if (fGroups == null) {
            fFindDone = true;
            return false;
        }
        fFindFrom = fGroups[1] == fGroups[0] ? fGroups[1] + 1 : fGroups[1];
        return true;
    }

    /**
     * Reset, then find the first match at or after {@code start}.
     *
     * @throws IndexOutOfBoundsException if {@code start} is outside the input
     */
    public boolean find(final int start) {
        if (start < 0 || start > fInput.length) {
            throw new IndexOutOfBoundsException("Start " + start + " outside input of length " + fInput.length);
        }
        reset();
        fFindFrom = start;
        return find();
    }

    private void checkMatch() {
        if (fGroups == null) {
            throw new IllegalStateException("No match");
        }
    }

    private void checkGroup(final int group) {
        checkMatch();
        if (group < 0 || group > groupCount()) {
            throw new IndexOutOfBoundsException("No group " + group);
        }
    }

    public int start() {
        return start(0);
    }

    /**
     * Start of the text captured by {@code group} in the last match, -1 if the group did not
     * take part in it.
     *
     * @throws IllegalStateException     if there is no current match
     * @throws IndexOutOfBoundsException for a bad group number
     */
    public int start(final int group) {
        checkGroup(group);
        return fGroups[2 * group];
    }

    public int end() {
        return end(0);
    }

    public int end(final int group) {
        checkGroup(group);
        return fGroups[2 * group + 1];
    }

    public String group() {
        return group(0);
    }

    /**
     * Text captured by {@code group} in the last match, null if the group did not take part in it.
     */
    public String group(final int group) {
        checkGroup(group);
        int s = fGroups[2 * group];
        return s < 0 ? null : Util.fromCodePoints(fInput, s, fGroups[2 * group + 1]);
    }

    public int groupCount() {
        return fPattern.groupCount();
    }

    /**
     * Immutable copy of the last match, or {@link MatchResult#NO_MATCH}.
     */
    public MatchResult toMatchResult() {
        return CompiledPattern.toResult(fInput, fGroups == null ? null : fGroups.clone());
    }

    /**
     * Limit the time a backtracking match may take, in units of 10000 search steps.
     * Regular patterns are not affected.
     *
     * @param limit the limit, or 0 for no limit
     */
    public void setTimeLimit(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Negative time limit " + limit);
        }
        fTimeLimit = limit;
    }

    public int getTimeLimit() {
        return fTimeLimit;
    }

    /**
     * Set a function called periodically during backtracking matches, giving the application
     * the opportunity to stop a long running match.
     *
     * @param callback a user supplied callback function, or null
     * @param context  passed to the callback each time it is called
     */
    public void setMatchCallback(final URegexMatchCallback callback, final Object context) {
        fCallbackFn = callback;
        fCallbackContext = context;
    }

    public URegexMatchCallback getMatchCallback() {
        return fCallbackFn;
    }

    public Object getMatchCallbackContext() {
        return fCallbackContext;
    }
}
