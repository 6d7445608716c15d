package com.github.tarcv.u4jautomaton;

/**
 * Renders an automaton in the Graphviz DOT language.
 */
public final class DotExporter {
    private DotExporter() {
    }

    /**
     * Returns the DOT representation of {@code automaton}: accepting states are double circles,
     * an unlabeled arrow marks the start state, and edges carry the transition labels.
     *
     * @param title graph name, quoted as needed
     */
    public static String toDot(final AutomatonView automaton, final String title) {
        StringBuilder b = new StringBuilder();
        b.append("digraph ").append(quote(title)).append(" {\n");
        b.append("  rankdir = LR\n");
        b.append("  node [width=0.2, height=0.2, fontsize=8]\n");
        b.append("  initial [shape=plaintext,label=\"\"]\n");
        b.append("  initial -> ").append(automaton.getStartState()).append('\n');
        for (int state = 0; state < automaton.getNumStates(); state++) {
            b.append("  ").append(state);
            b.append(automaton.isAccept(state) ? " [shape=doublecircle,label=" : " [shape=circle,label=");
            b.append(quote(automaton.getStateLabel(state))).append("]\n");
            for (int i = 0; i < automaton.getNumTransitions(state); i++) {
                AutomatonView.Edge edge = automaton.getTransition(state, i);
                b.append("  ").append(state).append(" -> ").append(edge.getTarget());
                b.append(" [label=").append(quote(edge.getLabel())).append("]\n");
            }
        }
        b.append("}\n");
        return b.toString();
    }

    static String quote(final String text) {
        StringBuilder b = new StringBuilder(text.length() + 2);
        b.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                b.append('\\');
            }
            b.append(c);
        }
        return b.append('"').toString();
    }
}
