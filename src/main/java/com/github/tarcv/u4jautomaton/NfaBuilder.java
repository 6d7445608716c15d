package com.github.tarcv.u4jautomaton;

import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import static com.github.tarcv.u4jautomaton.URegexpFlag.*;

/**
 * Compiles a {@link RegexNode} tree into an {@link Nfa} by Thompson construction.
 * Every combinator allocates fresh start and accept states and joins its operands with
 * epsilon transitions; operands never share states, so each occurrence of a group
 * inside an unrolled repetition keeps its own markers.
 * <p>
 * A builder may be reused, but is not thread safe.
 */
public final class NfaBuilder {
    private static final Logger LOGGER = Logger.getLogger(NfaBuilder.class.getName());

    /**
     * Default ceiling on the number of copies a bounded repetition may unroll into.
     */
    public static final int DEFAULT_REPEAT_LIMIT = 1000;

    /**
     * Hard ceiling on the size of the automaton, whatever the repetition limit.
     */
    static final int MAX_STATES = 1 << 22;

    private final long fFlags;
    private int fRepeatLimit = DEFAULT_REPEAT_LIMIT;
    private Nfa.Builder b;

    public NfaBuilder() {
        this(0);
    }

    public NfaBuilder(final Collection<URegexpFlag> flags) {
        this(URegexpFlag.toBits(flags));
    }

    /**
     * @param flags a bit set of {@link URegexpFlag} values
     */
    public NfaBuilder(final long flags) {
        if ((flags & ~URegexpFlag.ALL_FLAGS) != 0) {
            throw new UErrorException(UErrorCode.U_REGEX_INVALID_FLAG);
        }
        fFlags = flags;
    }

    /**
     * Set the largest repetition count {@code {min,max}} may unroll to.
     *
     * @param limit the ceiling, which applies to {@code max}, or to {@code min} when there is no maximum
     * @return this builder
     */
    public NfaBuilder setRepeatLimit(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Negative repeat limit " + limit);
        }
        fRepeatLimit = limit;
        return this;
    }

    public int getRepeatLimit() {
        return fRepeatLimit;
    }

    public long flags() {
        return fFlags;
    }

    /**
     * Compile the tree.
     *
     * @throws MalformedGroupException if a backreference names a group that does not exist
     * @throws RangeOverflowException  if a repetition exceeds the repeat limit
     * @throws IllegalArgumentException if two groups of the tree share an index
     */
    public Nfa build(final RegexNode ast) {
        BitSet groups = ast.definedGroups();
        checkGroups(ast, groups);

        b = new Nfa.Builder();
        try {
            Fragment f = compile(ast);
            b.setStart(f.start);
            b.setAccept(f.accept);
            b.setGroupCount(groups.length() == 0 ? 0 : groups.length() - 1);
            b.setCaseInsensitive(isSet(fFlags, UREGEX_CASE_INSENSITIVE));
            Nfa nfa = b.build();
            LOGGER.fine(() -> String.format("NFA for /%s/: %d states, %d groups%s",
                    ast, nfa.getNumStates(), nfa.getGroupCount(),
                    nfa.hasBackreferences() ? ", with backreferences" : ""));
            return nfa;
        } finally {
            b = null;
        }
    }

    private static void checkGroups(final RegexNode ast, final BitSet groups) {
        BitSet seen = new BitSet();
        Deque<RegexNode> work = new ArrayDeque<>();
        work.push(ast);
        while (!work.isEmpty()) {
            RegexNode node = work.pop();
            if (node instanceof RegexNode.Group) {
                int index = ((RegexNode.Group) node).getIndex();
                if (seen.get(index)) {
                    throw new IllegalArgumentException("Group " + index + " is defined more than once");
                }
                seen.set(index);
            }
            if (node instanceof RegexNode.Backreference) {
                int index = ((RegexNode.Backreference) node).getIndex();
                if (!groups.get(index)) {
                    throw new MalformedGroupException(index, groups.length() == 0 ? 0 : groups.length() - 1);
                }
            } else if (node instanceof RegexNode.Binary) {
                work.push(((RegexNode.Binary) node).getRight());
                work.push(((RegexNode.Binary) node).getLeft());
            } else if (node instanceof RegexNode.Unary) {
                work.push(((RegexNode.Unary) node).getInner());
            }
        }
    }

    /**
     * A sub-automaton under construction: entered at {@code start}, left from {@code accept}.
     */
    private static final class Fragment {
        final int start;
        final int accept;

        Fragment(final int start, final int accept) {
            this.start = start;
            this.accept = accept;
        }
    }

    private int newState() {
        if (b.getNumStates() >= MAX_STATES) {
            throw new UErrorException(UErrorCode.U_REGEX_PATTERN_TOO_BIG,
                    "Pattern needs more than " + MAX_STATES + " NFA states");
        }
        return b.createState();
    }

    private Fragment compile(final RegexNode node) {
        switch (node.getKind()) {
            case EMPTY:
                return compileEmpty();
            case LITERAL: {
                int c = ((RegexNode.Literal) node).getCodePoint();
                UnicodeSet set = new UnicodeSet(c, c);
                if (isSet(fFlags, UREGEX_CASE_INSENSITIVE)) {
                    set.closeOver(UnicodeSet.CASE_INSENSITIVE);
                }
                return compileSet(set);
            }
            case WILDCARD:
                return compileSet(wildcardSet());
            case CHAR_CLASS:
                return compileSet(classSet((RegexNode.CharClass) node));
            case CONCAT:
                return compileConcat(node);
            case UNION:
                return compileUnion(node);
            case STAR:
                return compileStar(((RegexNode.Star) node).getInner());
            case PLUS:
                return compilePlus(((RegexNode.Plus) node).getInner());
            case OPTIONAL:
                return compileOptional(((RegexNode.Optional) node).getInner());
            case REPEAT:
                return compileRepeat((RegexNode.Repeat) node);
            case GROUP: {
                RegexNode.Group group = (RegexNode.Group) node;
                int start = newState();
                Fragment inner = compile(group.getInner());
                int accept = newState();
                b.addGroupStart(start, group.getIndex(), inner.start);
                b.addGroupEnd(inner.accept, group.getIndex(), accept);
                return new Fragment(start, accept);
            }
            case BACKREFERENCE: {
                int start = newState();
                int accept = newState();
                b.addBackreference(start, ((RegexNode.Backreference) node).getIndex(), accept);
                return new Fragment(start, accept);
            }
            default:
                throw new IllegalStateException("Unknown node kind " + node.getKind());
        }
    }

    private Fragment compileEmpty() {
        int start = newState();
        int accept = newState();
        b.addEpsilon(start, accept);
        return new Fragment(start, accept);
    }

    /**
     * One range transition per range of the set, all between the same two states.
     * An empty set leaves the accept state unreachable, so the fragment matches nothing.
     */
    private Fragment compileSet(final UnicodeSet set) {
        int start = newState();
        int accept = newState();
        int[] ranges = Util.toRanges(set);
        for (int i = 0; i < ranges.length; i += 2) {
            b.addRange(start, ranges[i], ranges[i + 1], accept);
        }
        return new Fragment(start, accept);
    }

    private UnicodeSet wildcardSet() {
        RegexStaticSets sets = RegexStaticSets.INSTANCE;
        if (!isSet(fFlags, UREGEX_DOT_EXCLUDES_LINE_TERMINATORS)) {
            return sets.fScalarValues;
        }
        UnicodeSet terminators = isSet(fFlags, UREGEX_UNIX_LINES) ? sets.fUnixLineTerminators : sets.fLineTerminators;
        return sets.complementOf(terminators);
    }

    private UnicodeSet classSet(final RegexNode.CharClass cc) {
        RegexStaticSets sets = RegexStaticSets.INSTANCE;
        UnicodeSet listed = Util.fromRanges(cc.getRanges());
        if (isSet(fFlags, UREGEX_CASE_INSENSITIVE)) {
            listed.closeOver(UnicodeSet.CASE_INSENSITIVE);
        }
        listed.retainAll(sets.fScalarValues);
        return cc.isNegated() ? sets.complementOf(listed) : listed;
    }

    /**
     * Flattens a left- or right-nested chain of concatenations so long literal runs do not
     * recurse once per character.
     */
    private Fragment compileConcat(final RegexNode node) {
        List<RegexNode> operands = flatten(node, RegexNode.Kind.CONCAT);
        Fragment first = null;
        Fragment last = null;
        for (RegexNode operand : operands) {
            Fragment f = compile(operand);
            if (first == null) {
                first = f;
            } else {
                b.addEpsilon(last.accept, f.start);
            }
            last = f;
        }
        return new Fragment(first.start, last.accept);
    }

    private Fragment compileUnion(final RegexNode node) {
        List<Fragment> alternatives = new ArrayList<>();
        int start = newState();
        for (RegexNode operand : flatten(node, RegexNode.Kind.UNION)) {
            alternatives.add(compile(operand));
        }
        return joinAlternatives(start, alternatives);
    }

    /**
     * New start with epsilons to every alternative in order, every alternative's accept
     * joined into one new accept state.
     */
    private Fragment joinAlternatives(final int start, final List<Fragment> alternatives) {
        int accept = newState();
        for (Fragment f : alternatives) {
            b.addEpsilon(start, f.start);
        }
        for (Fragment f : alternatives) {
            b.addEpsilon(f.accept, accept);
        }
        return new Fragment(start, accept);
    }

    private static List<RegexNode> flatten(final RegexNode node, final RegexNode.Kind kind) {
        List<RegexNode> operands = new ArrayList<>();
        Deque<RegexNode> work = new ArrayDeque<>();
        work.push(node);
        while (!work.isEmpty()) {
            RegexNode n = work.pop();
            if (n.getKind() == kind) {
                work.push(((RegexNode.Binary) n).getRight());
                work.push(((RegexNode.Binary) n).getLeft());
            } else {
                operands.add(n);
            }
        }
        return operands;
    }

    private Fragment compileStar(final RegexNode inner) {
        int start = newState();
        Fragment a = compile(inner);
        int accept = newState();
        // greedy: entering and repeating come before leaving
        b.addEpsilon(start, a.start);
        b.addEpsilon(start, accept);
        b.addEpsilon(a.accept, a.start);
        b.addEpsilon(a.accept, accept);
        return new Fragment(start, accept);
    }

    private Fragment compilePlus(final RegexNode inner) {
        int start = newState();
        Fragment a = compile(inner);
        int accept = newState();
        b.addEpsilon(start, a.start);
        b.addEpsilon(a.accept, a.start);
        b.addEpsilon(a.accept, accept);
        return new Fragment(start, accept);
    }

    private Fragment compileOptional(final RegexNode inner) {
        int start = newState();
        List<Fragment> alternatives = new ArrayList<>(2);
        alternatives.add(compile(inner));
        alternatives.add(compileEmpty());
        return joinAlternatives(start, alternatives);
    }

    private Fragment compileRepeat(final RegexNode.Repeat repeat) {
        int bound = repeat.isUnbounded() ? repeat.getMin() : repeat.getMax();
        if (bound > fRepeatLimit) {
            throw new RangeOverflowException(bound, fRepeatLimit);
        }
        RegexNode inner = repeat.getInner();
        List<Fragment> parts = new ArrayList<>();
        for (int i = 0; i < repeat.getMin(); i++) {
            parts.add(compile(inner));
        }
        if (repeat.isUnbounded()) {
            parts.add(compileStar(inner));
        } else {
            for (int i = repeat.getMin(); i < repeat.getMax(); i++) {
                parts.add(compileOptional(inner));
            }
        }
        if (parts.isEmpty()) {
            return compileEmpty();
        }
        for (int i = 1; i < parts.size(); i++) {
            b.addEpsilon(parts.get(i - 1).accept, parts.get(i).start);
        }
        return new Fragment(parts.get(0).start, parts.get(parts.size() - 1).accept);
    }
}
