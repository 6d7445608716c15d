package com.github.tarcv.u4jautomaton;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Nondeterministic automaton over Unicode scalar values. States are indices into a
 * table owned by this object; transitions of a state are kept in priority order,
 * which is the order the backtracking matcher tries them in.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class Nfa implements AutomatonView {

    public enum TransitionKind {
        /** Taken without consuming input. */
        EPSILON,
        /** Consumes one code point in {@code [min, max]}. */
        RANGE,
        /** Zero-width marker opening a capture group. */
        GROUP_START,
        /** Zero-width marker closing a capture group. */
        GROUP_END,
        /** Consumes the text last captured by a group. */
        BACKREFERENCE
    }

    public static final class Transition implements Edge {
        private final TransitionKind kind;
        private final int min;
        private final int max;
        private final int group;
        private final int target;

        Transition(final TransitionKind kind, final int min, final int max, final int group, final int target) {
            this.kind = kind;
            this.min = min;
            this.max = max;
            this.group = group;
            this.target = target;
        }

        public TransitionKind getKind() {
            return kind;
        }

        public int getMin() {
            return min;
        }

        public int getMax() {
            return max;
        }

        /**
         * Group number of a marker or backreference transition, 0 otherwise.
         */
        public int getGroup() {
            return group;
        }

        @Override
        public int getTarget() {
            return target;
        }

        /**
         * True for transitions that never consume input.
         */
        public boolean isZeroWidth() {
            return kind == TransitionKind.EPSILON
                    || kind == TransitionKind.GROUP_START
                    || kind == TransitionKind.GROUP_END;
        }

        @Override
        public String getLabel() {
            switch (kind) {
                case EPSILON:
                    return "ε";
                case RANGE:
                    return Util.rangeToStr(min, max);
                case GROUP_START:
                    return "(" + group;
                case GROUP_END:
                    return group + ")";
                case BACKREFERENCE:
                    return "\\" + group;
                default:
                    throw new IllegalStateException(kind.name());
            }
        }

        @Override
        public String toString() {
            return getLabel() + " -> " + target;
        }
    }

    private final int start;
    private final BitSet accept;
    private final Transition[][] transitions;
    private final int groupCount;
    private final boolean backreferences;
    private final boolean caseInsensitive;

    private Nfa(final Builder b) {
        this.start = b.start;
        this.accept = (BitSet) b.accept.clone();
        this.transitions = new Transition[b.states.size()][];
        boolean anyBackreference = false;
        for (int s = 0; s < transitions.length; s++) {
            List<Transition> list = b.states.get(s);
            transitions[s] = list.toArray(new Transition[0]);
            for (Transition t : list) {
                anyBackreference |= t.kind == TransitionKind.BACKREFERENCE;
            }
        }
        this.groupCount = b.groupCount;
        this.backreferences = anyBackreference;
        this.caseInsensitive = b.caseInsensitive;
    }

    @Override
    public int getNumStates() {
        return transitions.length;
    }

    @Override
    public int getStartState() {
        return start;
    }

    @Override
    public boolean isAccept(final int state) {
        return accept.get(state);
    }

    BitSet getAcceptStates() {
        return (BitSet) accept.clone();
    }

    @Override
    public int getNumTransitions(final int state) {
        return transitions[state].length;
    }

    @Override
    public Transition getTransition(final int state, final int index) {
        return transitions[state][index];
    }

    Transition[] transitionsOf(final int state) {
        return transitions[state];
    }

    /**
     * Highest capture group number, 0 when the pattern has no groups.
     */
    public int getGroupCount() {
        return groupCount;
    }

    public boolean hasBackreferences() {
        return backreferences;
    }

    /**
     * Whether backreferences compare case-folded text.
     */
    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Add to {@code set} every state reachable from its members through zero-width transitions.
     * Backreferences are not followed.
     */
    void epsilonClosure(final BitSet set) {
        MutableVector32 work = new MutableVector32();
        for (int s = set.nextSetBit(0); s >= 0; s = set.nextSetBit(s + 1)) {
            work.push(s);
        }
        while (!work.isEmpty()) {
            int s = work.popi();
            for (Transition t : transitions[s]) {
                if (t.isZeroWidth() && !set.get(t.target)) {
                    set.set(t.target);
                    work.push(t.target);
                }
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Nfa{start=").append(start).append(", accept=").append(accept).append('\n');
        for (int s = 0; s < transitions.length; s++) {
            for (Transition t : transitions[s]) {
                sb.append("  ").append(s).append(" -[").append(t.getLabel()).append("]-> ").append(t.target).append('\n');
            }
        }
        return sb.append('}').toString();
    }

    /**
     * Assembles an {@link Nfa}. State 0 is not special; the start state must be set explicitly.
     */
    static final class Builder {
        private final List<List<Transition>> states = new ArrayList<>();
        private final BitSet accept = new BitSet();
        private int start = -1;
        private int groupCount;
        private boolean caseInsensitive;

        int createState() {
            states.add(new ArrayList<>(2));
            return states.size() - 1;
        }

        int getNumStates() {
            return states.size();
        }

        void setStart(final int state) {
            checkState(state);
            start = state;
        }

        void setAccept(final int state) {
            checkState(state);
            accept.set(state);
        }

        void setGroupCount(final int groupCount) {
            this.groupCount = groupCount;
        }

        void setCaseInsensitive(final boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
        }

        void addEpsilon(final int from, final int to) {
            add(from, new Transition(TransitionKind.EPSILON, 0, 0, 0, to));
        }

        void addRange(final int from, final int min, final int max, final int to) {
            if (min > max) {
                throw new IllegalArgumentException("Empty range " + min + ".." + max);
            }
            add(from, new Transition(TransitionKind.RANGE, min, max, 0, to));
        }

        void addGroupStart(final int from, final int group, final int to) {
            add(from, new Transition(TransitionKind.GROUP_START, 0, 0, group, to));
        }

        void addGroupEnd(final int from, final int group, final int to) {
            add(from, new Transition(TransitionKind.GROUP_END, 0, 0, group, to));
        }

        void addBackreference(final int from, final int group, final int to) {
            add(from, new Transition(TransitionKind.BACKREFERENCE, 0, 0, group, to));
        }

        private void add(final int from, final Transition t) {
            checkState(from);
            checkState(t.target);
            states.get(from).add(t);
        }

        private void checkState(final int state) {
            if (state < 0 || state >= states.size()) {
                throw new IndexOutOfBoundsException("No state " + state);
            }
        }

        Nfa build() {
            if (start < 0) {
                throw new IllegalStateException("Start state is not set");
            }
            pruneUnreachable();
            return new Nfa(this);
        }

        /**
         * Drop states the start state cannot reach, such as those behind a class that
         * matches nothing. Surviving states keep their relative order.
         */
        private void pruneUnreachable() {
            BitSet reachable = new BitSet(states.size());
            MutableVector32 work = new MutableVector32();
            reachable.set(start);
            work.push(start);
            while (!work.isEmpty()) {
                for (Transition t : states.get(work.popi())) {
                    if (!reachable.get(t.target)) {
                        reachable.set(t.target);
                        work.push(t.target);
                    }
                }
            }
            if (reachable.cardinality() == states.size()) {
                return;
            }
            int[] newIndex = new int[states.size()];
            List<List<Transition>> kept = new ArrayList<>(reachable.cardinality());
            for (int s = 0; s < states.size(); s++) {
                newIndex[s] = reachable.get(s) ? kept.size() : -1;
                if (reachable.get(s)) {
                    kept.add(states.get(s));
                }
            }
            BitSet keptAccept = new BitSet();
            for (int s = accept.nextSetBit(0); s >= 0; s = accept.nextSetBit(s + 1)) {
                if (reachable.get(s)) {
                    keptAccept.set(newIndex[s]);
                }
            }
            states.clear();
            for (List<Transition> list : kept) {
                List<Transition> renumbered = new ArrayList<>(list.size());
                for (Transition t : list) {
                    renumbered.add(new Transition(t.kind, t.min, t.max, t.group, newIndex[t.target]));
                }
                states.add(renumbered);
            }
            accept.clear();
            accept.or(keptAccept);
            start = newIndex[start];
        }
    }
}
