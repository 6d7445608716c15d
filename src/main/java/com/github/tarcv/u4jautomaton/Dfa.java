package com.github.tarcv.u4jautomaton;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Deterministic automaton over Unicode scalar values. Each state owns a sorted list of
 * disjoint {@code [min, max] -> target} transitions; a code point no transition covers
 * is rejected.
 * <p>
 * Two instances are equal when their numbering, accepting states and transitions coincide.
 * {@link SubsetConstructor} and {@link Minimizer} number states breadth first from the start
 * state, so minimal automata of the same language compare equal.
 */
public final class Dfa implements AutomatonView {
    public static final int NO_STATE = -1;

    public static final class Transition implements Edge {
        private final int min;
        private final int max;
        private final int target;

        Transition(final int min, final int max, final int target) {
            this.min = min;
            this.max = max;
            this.target = target;
        }

        public int getMin() {
            return min;
        }

        public int getMax() {
            return max;
        }

        @Override
        public int getTarget() {
            return target;
        }

        @Override
        public String getLabel() {
            return Util.rangeToStr(min, max);
        }

        @Override
        public String toString() {
            return getLabel() + " -> " + target;
        }
    }

    private final int start;
    private final BitSet accept;
    // per state: parallel arrays sorted by min
    private final int[][] mins;
    private final int[][] maxs;
    private final int[][] targets;
    // NFA states each state stands for, null when not produced by determinization
    private final BitSet[] subsets;

    private Dfa(final Builder b) {
        int n = b.numStates;
        this.start = b.start;
        this.accept = (BitSet) b.accept.clone();
        this.mins = new int[n][];
        this.maxs = new int[n][];
        this.targets = new int[n][];
        for (int s = 0; s < n; s++) {
            MutableVector32 list = b.transitions[s];
            int count = list == null ? 0 : list.size() / 3;
            mins[s] = new int[count];
            maxs[s] = new int[count];
            targets[s] = new int[count];
            for (int i = 0; i < count; i++) {
                mins[s][i] = list.elementAti(3 * i);
                maxs[s][i] = list.elementAti(3 * i + 1);
                targets[s][i] = list.elementAti(3 * i + 2);
                if (i > 0 && mins[s][i] <= maxs[s][i - 1]) {
                    throw new IllegalStateException("Transitions of state " + s + " overlap or are not sorted");
                }
            }
        }
        this.subsets = b.hasSubsets ? Arrays.copyOf(b.subsets, n) : null;
    }

    @Override
    public int getNumStates() {
        return mins.length;
    }

    @Override
    public int getStartState() {
        return start;
    }

    @Override
    public boolean isAccept(final int state) {
        return accept.get(state);
    }

    @Override
    public int getNumTransitions(final int state) {
        return mins[state].length;
    }

    @Override
    public Transition getTransition(final int state, final int index) {
        return new Transition(mins[state][index], maxs[state][index], targets[state][index]);
    }

    int getMin(final int state, final int index) {
        return mins[state][index];
    }

    int getMax(final int state, final int index) {
        return maxs[state][index];
    }

    int getTarget(final int state, final int index) {
        return targets[state][index];
    }

    /**
     * The state reached from {@code state} on {@code c}, or {@link #NO_STATE}.
     */
    public int step(final int state, final int c) {
        int[] lo = mins[state];
        int[] hi = maxs[state];
        int low = 0;
        int high = lo.length - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (c < lo[mid]) {
                high = mid - 1;
            } else if (c > hi[mid]) {
                low = mid + 1;
            } else {
                return targets[state][mid];
            }
        }
        return NO_STATE;
    }

    /**
     * The NFA states this state was built from, or null when unknown.
     */
    public BitSet getNfaStates(final int state) {
        if (subsets == null || subsets[state] == null) {
            return null;
        }
        return (BitSet) subsets[state].clone();
    }

    @Override
    public String getStateLabel(final int state) {
        BitSet nfaStates = subsets == null ? null : subsets[state];
        return nfaStates == null ? Integer.toString(state) : state + " " + nfaStates;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dfa)) {
            return false;
        }
        Dfa other = (Dfa) o;
        return start == other.start
                && accept.equals(other.accept)
                && Arrays.deepEquals(mins, other.mins)
                && Arrays.deepEquals(maxs, other.maxs)
                && Arrays.deepEquals(targets, other.targets);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + accept.hashCode();
        result = 31 * result + Arrays.deepHashCode(mins);
        result = 31 * result + Arrays.deepHashCode(targets);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Dfa{start=").append(start).append(", accept=").append(accept).append('\n');
        for (int s = 0; s < mins.length; s++) {
            for (int i = 0; i < mins[s].length; i++) {
                sb.append("  ").append(s).append(" -[").append(Util.rangeToStr(mins[s][i], maxs[s][i]))
                        .append("]-> ").append(targets[s][i]).append('\n');
            }
        }
        return sb.append('}').toString();
    }

    /**
     * Assembles a {@link Dfa}. Transitions of a state must be added in ascending order.
     */
    static final class Builder {
        private int numStates;
        private int start = NO_STATE;
        private final BitSet accept = new BitSet();
        private MutableVector32[] transitions = new MutableVector32[16];
        private BitSet[] subsets = new BitSet[16];
        private boolean hasSubsets;

        int createState() {
            if (numStates == transitions.length) {
                transitions = Arrays.copyOf(transitions, numStates * 2);
                subsets = Arrays.copyOf(subsets, numStates * 2);
            }
            transitions[numStates] = new MutableVector32(6);
            return numStates++;
        }

        int getNumStates() {
            return numStates;
        }

        void setStart(final int state) {
            checkState(state);
            start = state;
        }

        void setAccept(final int state) {
            checkState(state);
            accept.set(state);
        }

        void setNfaStates(final int state, final BitSet nfaStates) {
            checkState(state);
            subsets[state] = nfaStates;
            hasSubsets = true;
        }

        /**
         * Add a transition, merging it into the previous one when the two are adjacent
         * and lead to the same state.
         */
        void addTransition(final int from, final int min, final int max, final int to) {
            checkState(from);
            checkState(to);
            if (min > max) {
                throw new IllegalArgumentException("Empty range " + min + ".." + max);
            }
            MutableVector32 list = transitions[from];
            int size = list.size();
            if (size > 0 && list.elementAti(size - 1) == to && list.elementAti(size - 2) + 1 == min) {
                list.setElementAt(max, size - 2);
                return;
            }
            list.addElement(min);
            list.addElement(max);
            list.addElement(to);
        }

        private void checkState(final int state) {
            if (state < 0 || state >= numStates) {
                throw new IndexOutOfBoundsException("No state " + state);
            }
        }

        Dfa build() {
            if (start == NO_STATE) {
                throw new IllegalStateException("Start state is not set");
            }
            return new Dfa(this);
        }
    }
}
