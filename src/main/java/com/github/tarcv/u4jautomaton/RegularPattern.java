package com.github.tarcv.u4jautomaton;

import java.util.BitSet;
import java.util.logging.Logger;

/**
 * A pattern without backreferences, matched by walking its minimized {@link Dfa}.
 * Matching time is linear in the input length and is never limited by
 * {@link RegexMatcher#setTimeLimit(int)}. When the pattern has capture groups, their spans
 * are resolved after the overall match is known.
 */
public final class RegularPattern extends CompiledPattern {
    private static final Logger LOGGER = Logger.getLogger(RegularPattern.class.getName());

    private final Dfa fDfa;
    // recognizes the reversed input up to each offset where a match begins, built by the first find
    private volatile Dfa fStartFinder;
    private volatile boolean fNoStartFinder;

    RegularPattern(final String pattern, final long flags, final Nfa nfa, final Dfa dfa) {
        super(pattern, flags, nfa);
        fDfa = dfa;
    }

    /**
     * The minimized automaton.
     */
    public Dfa getDfa() {
        return fDfa;
    }

    /**
     * Test whether the automaton accepts the whole sequence, without computing captures.
     */
    public boolean accepts(final int[] codePoints) {
        int state = fDfa.getStartState();
        for (int c : codePoints) {
            state = fDfa.step(state, c);
            if (state == Dfa.NO_STATE) {
                return false;
            }
        }
        return fDfa.isAccept(state);
    }

    @Override
    int[] search(final int[] input, final int from, final SearchMode mode, final RegexMatcher matcher) {
        int start = from;
        int end;
        switch (mode) {
            case MATCHES:
                end = acceptsFrom(input, from) ? input.length : -1;
                break;
            case LOOKING_AT:
                end = longestAcceptFrom(input, from);
                break;
            case FIND:
                start = findStart(input, from, matcher);
                end = start < 0 ? -1 : longestAcceptFrom(input, start);
                break;
            default:
                throw new IllegalStateException("Unknown mode " + mode);
        }
        if (end < 0) {
            return null;
        }
        if (fNfa.getGroupCount() == 0) {
            return new int[]{start, end};
        }
        int[] groups = new Backtracker(fNfa, input, true).run(start, end);
        if (groups == null) {
            throw new UErrorException(UErrorCode.U_REGEX_INTERNAL_ERROR,
                    "Automata of /" + fPattern + "/ disagree on [" + start + ", " + end + ")");
        }
        return groups;
    }

    /**
     * @return the leftmost offset at or after {@code from} where a match begins, or -1
     */
    private int findStart(final int[] input, final int from, final RegexMatcher matcher) {
        BitSet starts = matcher == null ? null : matcher.getMatchStarts();
        if (starts == null) {
            Dfa finder = getStartFinder();
            if (finder == null) {
                for (int start = from; start <= input.length; start++) {
                    if (longestAcceptFrom(input, start) >= 0) {
                        return start;
                    }
                }
                return -1;
            }
            starts = matchStarts(finder, input);
            if (matcher != null) {
                matcher.setMatchStarts(starts);
            }
        }
        return starts.nextSetBit(from);
    }

    /**
     * One pass from the end of the input to its start. Offset {@code i} is a match start when the
     * reversed suffix from {@code i} is accepted by the start finder.
     */
    private static BitSet matchStarts(final Dfa finder, final int[] input) {
        BitSet starts = new BitSet(input.length + 1);
        int state = finder.getStartState();
        if (finder.isAccept(state)) {
            starts.set(input.length);
        }
        for (int i = input.length - 1; i >= 0; i--) {
            state = finder.step(state, input[i]);
            if (state == Dfa.NO_STATE) {
                // not a code point at all, so no match spans it
                state = finder.getStartState();
            } else if (finder.isAccept(state)) {
                starts.set(i);
            }
        }
        return starts;
    }

    private Dfa getStartFinder() {
        Dfa finder = fStartFinder;
        if (finder == null && !fNoStartFinder) {
            try {
                finder = buildStartFinder(fDfa);
                fStartFinder = finder;
            } catch (UErrorException e) {
                if (e.getErrorCode() != UErrorCode.U_REGEX_PATTERN_TOO_BIG) {
                    throw e;
                }
                LOGGER.fine(() -> "No start finder for /" + fPattern + "/, find tries each offset: " + e.getMessage());
                fNoStartFinder = true;
            }
        }
        return finder;
    }

    /**
     * Minimal automaton for {@code .*} followed by the reverse of the language of {@code dfa}, where
     * {@code .} is any code point.
     */
    static Dfa buildStartFinder(final Dfa dfa) {
        Nfa.Builder b = new Nfa.Builder();
        for (int s = 0; s < dfa.getNumStates(); s++) {
            b.createState();
        }
        int any = b.createState();
        b.setStart(any);
        b.addRange(any, 0, RegexStaticSets.MAX_SCALAR, any);
        for (int s = 0; s < dfa.getNumStates(); s++) {
            if (dfa.isAccept(s)) {
                b.addEpsilon(any, s);
            }
            for (int i = 0; i < dfa.getNumTransitions(s); i++) {
                Dfa.Transition t = dfa.getTransition(s, i);
                b.addRange(t.getTarget(), t.getMin(), t.getMax(), s);
            }
        }
        b.setAccept(dfa.getStartState());
        return Minimizer.minimize(new SubsetConstructor().determinize(b.build()));
    }

    private boolean acceptsFrom(final int[] input, final int from) {
        int state = fDfa.getStartState();
        for (int i = from; i < input.length; i++) {
            state = fDfa.step(state, input[i]);
            if (state == Dfa.NO_STATE) {
                return false;
            }
        }
        return fDfa.isAccept(state);
    }

    /**
     * @return the end of the longest accepted prefix of {@code input[from..]}, or -1
     */
    private int longestAcceptFrom(final int[] input, final int from) {
        int state = fDfa.getStartState();
        int best = fDfa.isAccept(state) ? from : -1;
        for (int i = from; i < input.length; i++) {
            state = fDfa.step(state, input[i]);
            if (state == Dfa.NO_STATE) {
                break;
            }
            if (fDfa.isAccept(state)) {
                best = i + 1;
            }
        }
        return best;
    }

    /**
     * Explain the outcome of matching the whole input.
     */
    public Diagnosis diagnose(final CharSequence input) {
        int[] codePoints = Util.toCodePoints(input);
        int state = fDfa.getStartState();
        for (int i = 0; i < codePoints.length; i++) {
            int next = fDfa.step(state, codePoints[i]);
            if (next == Dfa.NO_STATE) {
                Diagnosis.Kind kind = fDfa.isAccept(state) ? Diagnosis.Kind.TRAILING_INPUT : Diagnosis.Kind.NO_TRANSITION;
                return new Diagnosis(kind, i, codePoints[i]);
            }
            state = next;
        }
        if (fDfa.isAccept(state)) {
            return new Diagnosis(Diagnosis.Kind.ACCEPTED, codePoints.length, Util.U_SENTINEL);
        }
        return new Diagnosis(Diagnosis.Kind.END_OF_INPUT, codePoints.length, Util.U_SENTINEL);
    }

    /**
     * Why a walk of the automaton over the whole input stopped where it did.
     */
    public static final class Diagnosis {
        public enum Kind {
            /** The input matches. */
            ACCEPTED,
            /** No transition for a code point, and the input read before it does not match either. */
            NO_TRANSITION,
            /** The input ended in a non-accepting state. */
            END_OF_INPUT,
            /** The input read so far matches, but the code point after it cannot follow. */
            TRAILING_INPUT
        }

        private final Kind kind;
        private final int offset;
        private final int codePoint;

        Diagnosis(final Kind kind, final int offset, final int codePoint) {
            this.kind = kind;
            this.offset = offset;
            this.codePoint = codePoint;
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * Code point offset where the walk stopped; the input length unless it stopped early.
         */
        public int getOffset() {
            return offset;
        }

        /**
         * The rejected code point, or -1 when the walk reached the end of the input.
         */
        public int getCodePoint() {
            return codePoint;
        }

        @Override
        public String toString() {
            if (codePoint == Util.U_SENTINEL) {
                return kind + " at " + offset;
            }
            return kind + " at " + offset + " (" + Util.safeCodepointToStr(codePoint) + ")";
        }
    }
}
