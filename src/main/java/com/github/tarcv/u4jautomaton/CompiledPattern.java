package com.github.tarcv.u4jautomaton;

import java.util.Collection;
import java.util.logging.Logger;

/**
 * A compiled regular expression. Patterns without backreferences compile to a minimized
 * {@link Dfa} ({@link RegularPattern}); patterns with backreferences are matched by
 * backtracking over their {@link Nfa} ({@link BacktrackingPattern}). The choice is made
 * once, by {@link #compile}.
 * <p>
 * Compiled patterns are immutable and may be shared between threads. All offsets are
 * code point offsets into the input.
 */
public abstract class CompiledPattern {
    private static final Logger LOGGER = Logger.getLogger(CompiledPattern.class.getName());

    enum SearchMode {
        /** The match must span the whole input from the start position. */
        MATCHES,
        /** Longest match at the start position. */
        LOOKING_AT,
        /** Longest match at the first start position, at or after the given one, that has any. */
        FIND
    }

    /**
     * The pattern text, or the rendering of the tree it was compiled from.
     */
    final String fPattern;
    final long fFlags;
    final Nfa fNfa;

    CompiledPattern(final String pattern, final long flags, final Nfa nfa) {
        fPattern = pattern;
        fFlags = flags;
        fNfa = nfa;
    }

    /**
     * Compile the regular expression in string form, with default flags.
     *
     * @throws RegexParseException for a syntax error
     */
    public static CompiledPattern compile(final String regex) {
        return compile(regex, 0);
    }

    public static CompiledPattern compile(final String regex, final Collection<URegexpFlag> flags) {
        return compile(regex, URegexpFlag.toBits(flags));
    }

    /**
     * Compile the regular expression in string form.
     *
     * @param regex the regular expression to be compiled
     * @param flags bit set of {@link URegexpFlag} values
     * @throws RegexParseException     for a syntax error
     * @throws MalformedGroupException if a backreference names a group that does not exist
     * @throws RangeOverflowException  if a repetition is wider than {@link NfaBuilder#DEFAULT_REPEAT_LIMIT}
     */
    public static CompiledPattern compile(final String regex, final long flags) {
        return compile(RegexParser.parse(regex), regex, flags, NfaBuilder.DEFAULT_REPEAT_LIMIT);
    }

    public static CompiledPattern compile(final RegexNode ast) {
        return compile(ast, 0);
    }

    public static CompiledPattern compile(final RegexNode ast, final Collection<URegexpFlag> flags) {
        return compile(ast, URegexpFlag.toBits(flags));
    }

    public static CompiledPattern compile(final RegexNode ast, final long flags) {
        return compile(ast, flags, NfaBuilder.DEFAULT_REPEAT_LIMIT);
    }

    /**
     * Compile a syntax tree.
     *
     * @param ast         the pattern
     * @param flags       bit set of {@link URegexpFlag} values
     * @param repeatLimit the largest count a {@code {min,max}} repetition may unroll to
     * @throws MalformedGroupException if a backreference names a group that does not exist
     * @throws RangeOverflowException  if a repetition is wider than {@code repeatLimit}
     * @throws UErrorException         with {@link UErrorCode#U_REGEX_INVALID_FLAG} for unknown flag bits,
     *                                 or {@link UErrorCode#U_REGEX_PATTERN_TOO_BIG} when an automaton gets too large
     */
    public static CompiledPattern compile(final RegexNode ast, final long flags, final int repeatLimit) {
        return compile(ast, ast.toString(), flags, repeatLimit);
    }

    private static CompiledPattern compile(final RegexNode ast, final String pattern, final long flags,
                                           final int repeatLimit) {
        Nfa nfa = new NfaBuilder(flags).setRepeatLimit(repeatLimit).build(ast);
        if (nfa.hasBackreferences()) {
            LOGGER.finer(() -> "Pattern /" + pattern + "/ has backreferences, matching by backtracking");
            return new BacktrackingPattern(pattern, flags, nfa);
        }
        Dfa dfa = Minimizer.minimize(new SubsetConstructor().determinize(nfa));
        LOGGER.finer(() -> "Pattern /" + pattern + "/ is regular, matching with a " + dfa.getNumStates() + " state DFA");
        return new RegularPattern(pattern, flags, nfa, dfa);
    }

    /**
     * Compile the pattern and test whether it matches the whole input.
     */
    public static boolean matches(final String regex, final CharSequence input) {
        return compile(regex).matches(input).isMatch();
    }

    /**
     * Match the entire input.
     */
    public MatchResult matches(final CharSequence input) {
        return matches(Util.toCodePoints(input));
    }

    /**
     * Match the entire sequence of code points.
     */
    public MatchResult matches(final int[] codePoints) {
        if (codePoints == null) {
            throw new IllegalArgumentException("input is null");
        }
        return toResult(codePoints, search(codePoints, 0, SearchMode.MATCHES, null));
    }

    /**
     * Longest match at the start of the input, which need not extend to its end.
     */
    public MatchResult lookingAt(final CharSequence input) {
        int[] codePoints = Util.toCodePoints(input);
        return toResult(codePoints, search(codePoints, 0, SearchMode.LOOKING_AT, null));
    }

    /**
     * Leftmost match in the input; among matches starting there, the longest.
     */
    public MatchResult find(final CharSequence input) {
        int[] codePoints = Util.toCodePoints(input);
        return toResult(codePoints, search(codePoints, 0, SearchMode.FIND, null));
    }

    static MatchResult toResult(final int[] input, final int[] groups) {
        return groups == null ? MatchResult.NO_MATCH : new MatchResult(input, groups);
    }

    /**
     * Run one search.
     *
     * @param matcher the matcher supplying the time limit and callback, or null for none
     * @return group spans as {@code [start0, end0, start1, end1, ...]}, or null for no match
     */
    abstract int[] search(int[] input, int from, SearchMode mode, RegexMatcher matcher);

    public RegexMatcher matcher(final CharSequence input) {
        return new RegexMatcher(this, input);
    }

    /**
     * Returns the regular expression this pattern was compiled from. For a pattern compiled
     * from a tree, the tree rendered in pattern syntax.
     */
    public String pattern() {
        return fPattern;
    }

    public long flags() {
        return fFlags;
    }

    public Nfa getNfa() {
        return fNfa;
    }

    /**
     * Highest capture group number.
     */
    public int groupCount() {
        return fNfa.getGroupCount();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{/" + fPattern + "/}";
    }
}
