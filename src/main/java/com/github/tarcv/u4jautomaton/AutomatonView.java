package com.github.tarcv.u4jautomaton;

/**
 * Read-only, enumerable view of an automaton: states are the integers
 * {@code 0 .. getNumStates()-1}, transitions of a state are listed in priority order.
 */
public interface AutomatonView {
    int getNumStates();

    int getStartState();

    boolean isAccept(int state);

    int getNumTransitions(int state);

    Edge getTransition(int state, int index);

    /**
     * Human readable description of a state, such as the NFA states a DFA state stands for.
     */
    default String getStateLabel(final int state) {
        return Integer.toString(state);
    }

    interface Edge {
        int getTarget();

        /**
         * Printable label: a code point range, or a marker such as {@code ε} or {@code \1}.
         */
        String getLabel();
    }
}
