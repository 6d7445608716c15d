package com.github.tarcv.u4jautomaton;

/**
 * A pattern with backreferences, matched by depth first search over its {@link Nfa}.
 * Matching time can grow exponentially with the pattern; use
 * {@link RegexMatcher#setTimeLimit(int)} to bound it.
 */
public final class BacktrackingPattern extends CompiledPattern {

    BacktrackingPattern(final String pattern, final long flags, final Nfa nfa) {
        super(pattern, flags, nfa);
    }

    @Override
    int[] search(final int[] input, final int from, final SearchMode mode, final RegexMatcher matcher) {
        Backtracker backtracker = new Backtracker(fNfa, input, false);
        if (matcher != null) {
            backtracker.setTimeLimit(matcher.getTimeLimit());
            backtracker.setMatchCallback(matcher.getMatchCallback(), matcher.getMatchCallbackContext());
        }
        switch (mode) {
            case MATCHES:
                return backtracker.run(from, input.length);
            case LOOKING_AT:
                return backtracker.run(from, -1);
            case FIND:
                for (int start = from; start <= input.length; start++) {
                    int[] groups = backtracker.run(start, -1);
                    if (groups != null) {
                        return groups;
                    }
                }
                return null;
            default:
                throw new IllegalStateException("Unknown mode " + mode);
        }
    }
}
