package com.github.tarcv.u4jautomaton;

import com.ibm.icu.lang.UCharacter;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Depth first interpreter of an {@link Nfa} that records capture groups and resolves
 * backreferences.
 * <p>
 * The search runs on an explicit frame stack. Capture slots are changed only through an
 * undo log, so returning to a frame restores the captures it saw. Transitions are tried in
 * the order the automaton lists them, which makes quantifiers greedy. Along one path a state
 * is never entered twice at the same input position, so empty loops terminate.
 * <p>
 * With {@code memoize} set, every (state, position) pair is explored at most once over the
 * whole search. That is only sound without backreferences, where the outcome from a pair does
 * not depend on the captures, and it makes the search polynomial.
 * <p>
 * Not thread safe; one instance serves one matching operation.
 */
final class Backtracker {
    /**
     * Steps in one tick of the time limit.
     */
    static final int TIMER_INITIAL_VALUE = 10000;

    private static final int FRAME_SIZE = 4;
    private static final int F_STATE = 0;
    private static final int F_POS = 1;
    private static final int F_NEXT = 2;
    private static final int F_UNDO = 3;

    private final Nfa fNfa;
    private final int[] fInput;
    private final boolean fMemoize;

    // [0, 2g+2): start and end of each group; then the open position of each group; then
    // the position at which each state was last entered on the current path
    private final int[] fSlots;
    private final int fOpenBase;
    private final int fPathBase;

    private final MutableVector32 fFrames = new MutableVector32();
    private final MutableVector32 fUndo = new MutableVector32();
    // per state, the positions relative to the search start that memoized search has explored
    private BitSet[] fVisited;
    private int fStart;

    private int fTimeLimit;
    private URegexMatchCallback fCallback;
    private Object fCallbackContext;
    private int fTickCounter = TIMER_INITIAL_VALUE;
    private int fTime;

    Backtracker(final Nfa nfa, final int[] input, final boolean memoize) {
        if (memoize && nfa.hasBackreferences()) {
            throw new IllegalArgumentException("Memoized search cannot resolve backreferences");
        }
        fNfa = nfa;
        fInput = input;
        fMemoize = memoize;
        int groups = nfa.getGroupCount() + 1;
        fOpenBase = 2 * groups;
        fPathBase = fOpenBase + groups;
        fSlots = new int[fPathBase + nfa.getNumStates()];
    }

    void setTimeLimit(final int limit) {
        fTimeLimit = limit;
    }

    void setMatchCallback(final URegexMatchCallback callback, final Object context) {
        fCallback = callback;
        fCallbackContext = context;
    }

    /**
     * Accumulated ticks so far.
     */
    int getTime() {
        return fTime;
    }

    /**
     * Search for a match starting at {@code start}.
     *
     * @param requiredEnd the position the match must end at, or -1 to take the longest match
     * @return group spans as {@code [start0, end0, start1, end1, ...]} with -1 for unset groups,
     * or null when nothing matches
     */
    int[] run(final int start, final int requiredEnd) {
        int limit = requiredEnd >= 0 ? requiredEnd : fInput.length;
        Arrays.fill(fSlots, -1);
        fFrames.removeAllElements();
        fUndo.removeAllElements();
        fStart = start;
        if (fMemoize) {
            fVisited = new BitSet[fNfa.getNumStates()];
        }

        int[] best = null;
        if (enter(fNfa.getStartState(), start, 0)) {
            if (isSuccess(fNfa.getStartState(), start, requiredEnd)) {
                best = snapshot(start, start);
                if (requiredEnd >= 0 || start == limit) {
                    return best;
                }
            }
        }
        while (!fFrames.isEmpty()) {
            int top = fFrames.size() - FRAME_SIZE;
            int state = fFrames.elementAti(top + F_STATE);
            int pos = fFrames.elementAti(top + F_POS);
            int next = fFrames.elementAti(top + F_NEXT);
            Nfa.Transition[] transitions = fNfa.transitionsOf(state);
            if (next >= transitions.length) {
                undoTo(fFrames.elementAti(top + F_UNDO));
                fFrames.setSize(top);
                continue;
            }
            fFrames.setElementAt(next + 1, top + F_NEXT);
            if (!fMemoize) {
                tick();
            }

            Nfa.Transition t = transitions[next];
            int mark = fUndo.size();
            int target = t.getTarget();
            int newPos;
            switch (t.getKind()) {
                case EPSILON:
                    newPos = pos;
                    break;
                case RANGE:
                    if (pos >= limit || fInput[pos] < t.getMin() || fInput[pos] > t.getMax()) {
                        continue;
                    }
                    newPos = pos + 1;
                    break;
                case GROUP_START:
                    set(fOpenBase + t.getGroup(), pos);
                    newPos = pos;
                    break;
                case GROUP_END:
                    set(2 * t.getGroup(), fSlots[fOpenBase + t.getGroup()]);
                    set(2 * t.getGroup() + 1, pos);
                    newPos = pos;
                    break;
                case BACKREFERENCE:
                    newPos = matchBackreference(t.getGroup(), pos, limit);
                    if (newPos < 0) {
                        continue;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown transition kind " + t.getKind());
            }
            if (!enter(target, newPos, mark)) {
                undoTo(mark);
                continue;
            }
            if (isSuccess(target, newPos, requiredEnd)) {
                if (requiredEnd >= 0) {
                    return snapshot(start, newPos);
                }
                if (best == null || newPos > best[1]) {
                    best = snapshot(start, newPos);
                    if (newPos == limit) {
                        return best;
                    }
                }
            }
        }
        return best;
    }

    private boolean isSuccess(final int state, final int pos, final int requiredEnd) {
        return fNfa.isAccept(state) && (requiredEnd < 0 || pos == requiredEnd);
    }

    /**
     * Push a frame for {@code state} at {@code pos}, unless this path or, when memoizing,
     * any earlier path has already been there.
     */
    private boolean enter(final int state, final int pos, final int undoMark) {
        if (fMemoize) {
            BitSet visited = fVisited[state];
            if (visited == null) {
                visited = new BitSet();
                fVisited[state] = visited;
            } else if (visited.get(pos - fStart)) {
                return false;
            }
            visited.set(pos - fStart);
        } else {
            if (fSlots[fPathBase + state] == pos) {
                return false;
            }
            set(fPathBase + state, pos);
        }
        fFrames.addElement(state);
        fFrames.addElement(pos);
        fFrames.addElement(0);
        fFrames.addElement(undoMark);
        return true;
    }

    /**
     * @return the position after the repeated text, or -1 if it does not follow
     */
    private int matchBackreference(final int group, final int pos, final int limit) {
        int groupStart = fSlots[2 * group];
        int groupEnd = fSlots[2 * group + 1];
        if (groupStart < 0 || groupEnd < 0) {
            return -1;
        }
        int length = groupEnd - groupStart;
        if (pos + length > limit) {
            return -1;
        }
        boolean fold = fNfa.isCaseInsensitive();
        for (int i = 0; i < length; i++) {
            int expected = fInput[groupStart + i];
            int actual = fInput[pos + i];
            if (expected != actual && !(fold && UCharacter.foldCase(expected, UCharacter.FOLD_CASE_DEFAULT)
                    == UCharacter.foldCase(actual, UCharacter.FOLD_CASE_DEFAULT))) {
                return -1;
            }
        }
        return pos + length;
    }

    private void set(final int slot, final int value) {
        fUndo.addElement(slot);
        fUndo.addElement(fSlots[slot]);
        fSlots[slot] = value;
    }

    private void undoTo(final int mark) {
        while (fUndo.size() > mark) {
            int old = fUndo.popi();
            int slot = fUndo.popi();
            fSlots[slot] = old;
        }
    }

    private int[] snapshot(final int start, final int end) {
        int[] groups = Arrays.copyOf(fSlots, fOpenBase);
        groups[0] = start;
        groups[1] = end;
        return groups;
    }

    private void tick() {
        if (--fTickCounter > 0) {
            return;
        }
        fTickCounter = TIMER_INITIAL_VALUE;
        fTime++;
        if (fCallback != null && !fCallback.onMatch(fCallbackContext, fTime)) {
            throw new UErrorException(UErrorCode.U_REGEX_STOPPED_BY_CALLER);
        }
        if (fTimeLimit > 0 && fTime >= fTimeLimit) {
            throw new BudgetExceededException(fTimeLimit);
        }
    }
}
