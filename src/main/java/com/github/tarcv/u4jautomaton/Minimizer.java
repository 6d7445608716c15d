package com.github.tarcv.u4jautomaton;

import java.util.Arrays;
import java.util.BitSet;
import java.util.logging.Logger;

/**
 * Hopcroft minimization of a {@link Dfa}.
 * <p>
 * The alphabet is the set of intervals between consecutive range boundaries of the input
 * automaton, so the work depends on the number of distinct boundaries and never on the
 * size of the code point space. Missing transitions are routed to an explicit dead state
 * while refining; that state is dropped again from the result.
 */
public final class Minimizer {
    private static final Logger LOGGER = Logger.getLogger(Minimizer.class.getName());

    private Minimizer() {
    }

    /**
     * Build the minimal automaton for the language of {@code dfa}. Unreachable states are
     * discarded, equivalent states are merged, and states are numbered breadth first from
     * the start state.
     */
    public static Dfa minimize(final Dfa dfa) {
        Dfa result = new Refinement(dfa).execute();
        LOGGER.fine(() -> String.format("Minimized %d DFA states into %d", dfa.getNumStates(), result.getNumStates()));
        return result;
    }

    private static final class Refinement {
        private final Dfa dfa;

        // reachable input states, densely renumbered; the dead state is numStates - 1
        private int[] original;
        private int numStates;
        private int dead;

        // letter x is the interval [points[x], points[x + 1] - 1]
        private int[] points;
        private int numLetters;

        private int[] delta;
        private int[] invStart;
        private int[] invList;

        // refinable partition
        private int[] elems;
        private int[] loc;
        private int[] blockOf;
        private int[] first;
        private int[] end;
        private int[] marked;
        private int numBlocks;

        Refinement(final Dfa dfa) {
            this.dfa = dfa;
        }

        Dfa execute() {
            int[] dense = findReachable();
            buildAlphabet();
            buildDelta(dense);
            buildInverse();
            refine();
            return emit();
        }

        private int[] findReachable() {
            int[] dense = new int[dfa.getNumStates()];
            Arrays.fill(dense, -1);
            MutableVector32 order = new MutableVector32();
            dense[dfa.getStartState()] = 0;
            order.addElement(dfa.getStartState());
            for (int i = 0; i < order.size(); i++) {
                int s = order.elementAti(i);
                for (int t = 0; t < dfa.getNumTransitions(s); t++) {
                    int target = dfa.getTarget(s, t);
                    if (dense[target] < 0) {
                        dense[target] = order.size();
                        order.addElement(target);
                    }
                }
            }
            original = order.toArray();
            numStates = original.length + 1;
            dead = numStates - 1;
            return dense;
        }

        private void buildAlphabet() {
            MutableVector32 boundaries = new MutableVector32();
            boundaries.addElement(0);
            for (int s : original) {
                for (int t = 0; t < dfa.getNumTransitions(s); t++) {
                    boundaries.addElement(dfa.getMin(s, t));
                    boundaries.addElement(dfa.getMax(s, t) + 1);
                }
            }
            int[] sorted = boundaries.toArray();
            Arrays.sort(sorted);
            int count = 0;
            for (int i = 0; i < sorted.length; i++) {
                if (sorted[i] <= RegexStaticSets.MAX_SCALAR && (count == 0 || sorted[count - 1] != sorted[i])) {
                    sorted[count++] = sorted[i];
                }
            }
            numLetters = count;
            points = Arrays.copyOf(sorted, count + 1);
            points[count] = RegexStaticSets.MAX_SCALAR + 1;
            if ((long) numStates * numLetters >= Integer.MAX_VALUE) {
                throw new UErrorException(UErrorCode.U_REGEX_PATTERN_TOO_BIG,
                        numStates + " states over " + numLetters + " intervals are too many to minimize");
            }
        }

        private int letterOf(final int c) {
            int x = Arrays.binarySearch(points, 0, numLetters, c);
            return x >= 0 ? x : -x - 2;
        }

        private void buildDelta(final int[] dense) {
            delta = new int[numStates * numLetters];
            Arrays.fill(delta, dead);
            for (int q = 0; q < original.length; q++) {
                int s = original[q];
                for (int t = 0; t < dfa.getNumTransitions(s); t++) {
                    int target = dense[dfa.getTarget(s, t)];
                    int max = dfa.getMax(s, t);
                    for (int x = letterOf(dfa.getMin(s, t)); x < numLetters && points[x] <= max; x++) {
                        delta[q * numLetters + x] = target;
                    }
                }
            }
        }

        private void buildInverse() {
            int size = numStates * numLetters;
            invStart = new int[size + 1];
            for (int q = 0; q < numStates; q++) {
                for (int x = 0; x < numLetters; x++) {
                    invStart[delta[q * numLetters + x] * numLetters + x + 1]++;
                }
            }
            for (int i = 0; i < size; i++) {
                invStart[i + 1] += invStart[i];
            }
            int[] fill = Arrays.copyOf(invStart, size);
            invList = new int[size];
            for (int q = 0; q < numStates; q++) {
                for (int x = 0; x < numLetters; x++) {
                    invList[fill[delta[q * numLetters + x] * numLetters + x]++] = q;
                }
            }
        }

        private boolean isAccept(final int q) {
            return q != dead && dfa.isAccept(original[q]);
        }

        private void refine() {
            elems = new int[numStates];
            loc = new int[numStates];
            blockOf = new int[numStates];
            first = new int[numStates];
            end = new int[numStates];
            marked = new int[numStates];

            // accepting states first, then the rest
            int pos = 0;
            for (int q = 0; q < numStates; q++) {
                if (isAccept(q)) {
                    elems[pos++] = q;
                }
            }
            int acceptCount = pos;
            for (int q = 0; q < numStates; q++) {
                if (!isAccept(q)) {
                    elems[pos++] = q;
                }
            }
            numBlocks = 0;
            if (acceptCount > 0) {
                newBlock(0, acceptCount);
            }
            newBlock(acceptCount, numStates);
            for (int i = 0; i < numStates; i++) {
                loc[elems[i]] = i;
            }

            MutableVector32 worklist = new MutableVector32();
            BitSet pending = new BitSet();
            if (numBlocks == 2) {
                int smaller = size(0) <= size(1) ? 0 : 1;
                for (int x = 0; x < numLetters; x++) {
                    enqueue(worklist, pending, smaller, x);
                }
            }

            MutableVector32 touched = new MutableVector32();
            while (!worklist.isEmpty()) {
                int splitter = worklist.popi();
                pending.clear(splitter);
                int a = splitter / numLetters;
                int x = splitter % numLetters;

                // the members of the splitter block can move while predecessors are marked
                int[] members = Arrays.copyOfRange(elems, first[a], end[a]);
                touched.removeAllElements();
                for (int q : members) {
                    int key = q * numLetters + x;
                    for (int i = invStart[key]; i < invStart[key + 1]; i++) {
                        mark(invList[i], touched);
                    }
                }
                for (int i = 0; i < touched.size(); i++) {
                    int b = touched.elementAti(i);
                    if (marked[b] == size(b)) {
                        marked[b] = 0;
                        continue;
                    }
                    int nb = newBlock(first[b], first[b] + marked[b]);
                    first[b] = end[nb];
                    marked[b] = 0;
                    for (int p = first[nb]; p < end[nb]; p++) {
                        blockOf[elems[p]] = nb;
                    }
                    for (int y = 0; y < numLetters; y++) {
                        if (pending.get(b * numLetters + y)) {
                            enqueue(worklist, pending, nb, y);
                        } else {
                            enqueue(worklist, pending, size(nb) <= size(b) ? nb : b, y);
                        }
                    }
                }
            }
        }

        private int size(final int block) {
            return end[block] - first[block];
        }

        private int newBlock(final int from, final int to) {
            int b = numBlocks++;
            first[b] = from;
            end[b] = to;
            marked[b] = 0;
            for (int p = from; p < to; p++) {
                blockOf[elems[p]] = b;
            }
            return b;
        }

        private void enqueue(final MutableVector32 worklist, final BitSet pending, final int block, final int letter) {
            int key = block * numLetters + letter;
            if (!pending.get(key)) {
                pending.set(key);
                worklist.push(key);
            }
        }

        /**
         * Move {@code q} into the marked prefix of its block.
         */
        private void mark(final int q, final MutableVector32 touched) {
            int b = blockOf[q];
            int boundary = first[b] + marked[b];
            int p = loc[q];
            if (p < boundary) {
                return;
            }
            int other = elems[boundary];
            elems[boundary] = q;
            loc[q] = boundary;
            elems[p] = other;
            loc[other] = p;
            if (marked[b]++ == 0) {
                touched.addElement(b);
            }
        }

        private Dfa emit() {
            Dfa.Builder b = new Dfa.Builder();
            int deadBlock = blockOf[dead];
            int startBlock = blockOf[0];
            if (startBlock == deadBlock) {
                b.setStart(b.createState());
                return b.build();
            }
            int[] stateOf = new int[numBlocks];
            Arrays.fill(stateOf, -1);
            MutableVector32 queue = new MutableVector32();
            stateOf[startBlock] = b.createState();
            queue.addElement(startBlock);
            b.setStart(stateOf[startBlock]);
            for (int i = 0; i < queue.size(); i++) {
                int block = queue.elementAti(i);
                int rep = elems[first[block]];
                if (isAccept(rep)) {
                    b.setAccept(stateOf[block]);
                }
                for (int x = 0; x < numLetters; x++) {
                    int target = blockOf[delta[rep * numLetters + x]];
                    if (target == deadBlock) {
                        continue;
                    }
                    if (stateOf[target] < 0) {
                        stateOf[target] = b.createState();
                        queue.addElement(target);
                    }
                    b.addTransition(stateOf[block], points[x], points[x + 1] - 1, stateOf[target]);
                }
            }
            return b.build();
        }
    }
}
