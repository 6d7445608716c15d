package com.github.tarcv.u4jautomaton;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Subset construction over code point ranges. Each DFA state stands for the epsilon closure
 * of a set of NFA states; the outgoing ranges of its members are swept in ascending order
 * of their end points, so the alphabet is split only where some transition starts or stops.
 */
public final class SubsetConstructor {
    private static final Logger LOGGER = Logger.getLogger(SubsetConstructor.class.getName());

    /**
     * Default ceiling on the number of DFA states.
     */
    public static final int DEFAULT_STATE_LIMIT = 10000;

    private static final long OPEN = 1L << 31;
    private static final long TARGET_MASK = OPEN - 1;

    private int fStateLimit = DEFAULT_STATE_LIMIT;

    /**
     * @param limit largest number of states a determinized automaton may have
     * @return this constructor
     */
    public SubsetConstructor setStateLimit(final int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("State limit must be positive: " + limit);
        }
        fStateLimit = limit;
        return this;
    }

    public int getStateLimit() {
        return fStateLimit;
    }

    /**
     * Build a DFA accepting the same language as {@code nfa}.
     * Group markers are followed like epsilon transitions.
     *
     * @throws IllegalArgumentException if the automaton contains backreferences
     * @throws UErrorException          with {@link UErrorCode#U_REGEX_PATTERN_TOO_BIG} when the state limit is hit
     */
    public Dfa determinize(final Nfa nfa) {
        if (nfa.hasBackreferences()) {
            throw new IllegalArgumentException("Automata with backreferences cannot be determinized");
        }
        Run run = new Run(nfa);
        Dfa dfa = run.execute();
        LOGGER.fine(() -> String.format("Determinized %d NFA states into %d DFA states",
                nfa.getNumStates(), dfa.getNumStates()));
        return dfa;
    }

    private final class Run {
        private final Nfa nfa;
        private final Dfa.Builder b = new Dfa.Builder();
        private final Map<BitSet, Integer> memo = new HashMap<>();
        private final List<BitSet> pending = new ArrayList<>();
        private final BitSet acceptStates;

        Run(final Nfa nfa) {
            this.nfa = nfa;
            this.acceptStates = nfa.getAcceptStates();
        }

        Dfa execute() {
            BitSet initial = new BitSet(nfa.getNumStates());
            initial.set(nfa.getStartState());
            nfa.epsilonClosure(initial);
            b.setStart(stateFor(initial));

            MutableVector64 events = new MutableVector64();
            int[] counts = new int[nfa.getNumStates()];
            BitSet active = new BitSet(nfa.getNumStates());
            // pending grows while it is walked: states are handled in the order they were found
            for (int state = 0; state < pending.size(); state++) {
                BitSet subset = pending.get(state);
                events.removeAllElements();
                for (int s = subset.nextSetBit(0); s >= 0; s = subset.nextSetBit(s + 1)) {
                    for (Nfa.Transition t : nfa.transitionsOf(s)) {
                        if (t.getKind() == Nfa.TransitionKind.RANGE) {
                            events.addElement(((long) t.getMin() << 32) | OPEN | t.getTarget());
                            events.addElement(((long) (t.getMax() + 1) << 32) | t.getTarget());
                        }
                    }
                }
                events.sort();
                sweep(state, events, counts, active);
            }
            return b.build();
        }

        private void sweep(final int state, final MutableVector64 events, final int[] counts, final BitSet active) {
            int i = 0;
            int n = events.size();
            while (i < n) {
                int point = (int) (events.elementAti(i) >>> 32);
                while (i < n && (int) (events.elementAti(i) >>> 32) == point) {
                    long e = events.elementAti(i++);
                    int target = (int) (e & TARGET_MASK);
                    if ((e & OPEN) != 0) {
                        if (counts[target]++ == 0) {
                            active.set(target);
                        }
                    } else if (--counts[target] == 0) {
                        active.clear(target);
                    }
                }
                if (i < n && !active.isEmpty()) {
                    int next = (int) (events.elementAti(i) >>> 32);
                    BitSet successor = (BitSet) active.clone();
                    nfa.epsilonClosure(successor);
                    b.addTransition(state, point, next - 1, stateFor(successor));
                }
            }
        }

        private int stateFor(final BitSet subset) {
            Integer known = memo.get(subset);
            if (known != null) {
                return known;
            }
            if (b.getNumStates() >= fStateLimit) {
                throw new UErrorException(UErrorCode.U_REGEX_PATTERN_TOO_BIG,
                        "Determinized automaton needs more than " + fStateLimit + " states");
            }
            int state = b.createState();
            if (subset.intersects(acceptStates)) {
                b.setAccept(state);
            }
            b.setNfaStates(state, subset);
            memo.put(subset, state);
            pending.add(subset);
            return state;
        }
    }
}
