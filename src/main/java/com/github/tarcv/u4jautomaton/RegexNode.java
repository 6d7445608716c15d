package com.github.tarcv.u4jautomaton;

import com.ibm.icu.text.UnicodeSet;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Immutable syntax tree of a regular expression. Trees are usually produced by
 * {@link RegexParser}, but may be assembled directly with the static factories.
 * <p>
 * Capture groups are numbered from 1 in the order of their opening parentheses.
 * A {@link Backreference} may name any group of the tree, including one that
 * appears later; such a reference simply fails to match until the group has captured.
 */
public abstract class RegexNode {
    /**
     * Upper bound of a {@link Repeat} without a maximum.
     */
    public static final int UNBOUNDED = -1;

    public enum Kind {
        EMPTY,
        LITERAL,
        WILDCARD,
        CHAR_CLASS,
        CONCAT,
        UNION,
        STAR,
        PLUS,
        OPTIONAL,
        REPEAT,
        GROUP,
        BACKREFERENCE
    }

    private final Kind kind;

    RegexNode(final Kind kind) {
        this.kind = kind;
    }

    public final Kind getKind() {
        return kind;
    }

    //
    //  Factories
    //

    public static RegexNode empty() {
        return Empty.INSTANCE;
    }

    public static RegexNode literal(final int codePoint) {
        return new Literal(codePoint);
    }

    /**
     * Concatenation of the code points of {@code text}; the empty string gives {@link #empty()}.
     */
    public static RegexNode literal(final String text) {
        RegexNode result = null;
        for (int c : text.codePoints().toArray()) {
            RegexNode next = literal(c);
            result = result == null ? next : concat(result, next);
        }
        return result == null ? empty() : result;
    }

    public static RegexNode wildcard() {
        return Wildcard.INSTANCE;
    }

    /**
     * @param ranges inclusive {@code lo, hi} pairs, sorted and pairwise disjoint
     */
    public static RegexNode charClass(final boolean negated, final int... ranges) {
        return new CharClass(ranges, negated);
    }

    public static RegexNode charClass(final UnicodeSet set, final boolean negated) {
        return new CharClass(Util.toRanges(set), negated);
    }

    public static RegexNode concat(final RegexNode left, final RegexNode right) {
        return new Concat(left, right);
    }

    /**
     * Left-nested concatenation of all nodes.
     */
    public static RegexNode concat(final RegexNode... nodes) {
        if (nodes.length == 0) {
            return empty();
        }
        RegexNode result = nodes[0];
        for (int i = 1; i < nodes.length; i++) {
            result = concat(result, nodes[i]);
        }
        return result;
    }

    public static RegexNode union(final RegexNode left, final RegexNode right) {
        return new Union(left, right);
    }

    public static RegexNode star(final RegexNode inner) {
        return new Star(inner);
    }

    public static RegexNode plus(final RegexNode inner) {
        return new Plus(inner);
    }

    public static RegexNode optional(final RegexNode inner) {
        return new Optional(inner);
    }

    /**
     * @param max maximum number of repetitions, or {@link #UNBOUNDED}
     */
    public static RegexNode repeat(final RegexNode inner, final int min, final int max) {
        return new Repeat(inner, min, max);
    }

    public static RegexNode group(final int index, final RegexNode inner) {
        return new Group(index, inner);
    }

    public static RegexNode backreference(final int index) {
        return new Backreference(index);
    }

    //
    //  Queries
    //

    /**
     * Indices of all capture groups in this tree.
     */
    public final BitSet definedGroups() {
        BitSet groups = new BitSet();
        collectGroups(groups);
        return groups;
    }

    /**
     * The highest group index in this tree, 0 if there are no groups.
     */
    public final int groupCount() {
        int length = definedGroups().length();
        return length == 0 ? 0 : length - 1;
    }

    public abstract boolean hasBackreference();

    void collectGroups(final BitSet groups) {
    }

    /**
     * Binding strength for {@link #toString()}: 0 union, 1 concatenation, 2 quantified, 3 atom.
     */
    abstract int precedence();

    abstract void appendTo(StringBuilder sb);

    final void appendWrapped(final StringBuilder sb, final RegexNode child, final int minPrecedence) {
        if (child.precedence() < minPrecedence) {
            sb.append("(?:");
            child.appendTo(sb);
            sb.append(')');
        } else {
            child.appendTo(sb);
        }
    }

    /**
     * A pattern text equivalent to this tree. Non-capturing parentheses {@code (?:...)}
     * are emitted where needed for grouping; they are for display only.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    static void appendEscaped(final StringBuilder sb, final int c) {
        if ("*?+[](){}^$|\\.-".indexOf(c) >= 0) {
            sb.append('\\').append((char) c);
        } else if (c < 0x20 || c > 0x7e) {
            sb.append(String.format("\\x{%X}", c));
        } else {
            sb.appendCodePoint(c);
        }
    }

    //
    //  Variants
    //

    public static final class Empty extends RegexNode {
        static final Empty INSTANCE = new Empty();

        private Empty() {
            super(Kind.EMPTY);
        }

        @Override
        public boolean hasBackreference() {
            return false;
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            sb.append("(?:)");
        }
    }

    public static final class Literal extends RegexNode {
        private final int codePoint;

        Literal(final int codePoint) {
            super(Kind.LITERAL);
            if (!Util.isScalarValue(codePoint)) {
                throw new IllegalArgumentException("Not a Unicode scalar value: " + Integer.toHexString(codePoint));
            }
            this.codePoint = codePoint;
        }

        public int getCodePoint() {
            return codePoint;
        }

        @Override
        public boolean hasBackreference() {
            return false;
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            appendEscaped(sb, codePoint);
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof Literal && ((Literal) o).codePoint == codePoint;
        }

        @Override
        public int hashCode() {
            return codePoint;
        }
    }

    public static final class Wildcard extends RegexNode {
        static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {
            super(Kind.WILDCARD);
        }

        @Override
        public boolean hasBackreference() {
            return false;
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            sb.append('.');
        }
    }

    public static final class CharClass extends RegexNode {
        private final int[] ranges;
        private final boolean negated;

        CharClass(final int[] ranges, final boolean negated) {
            super(Kind.CHAR_CLASS);
            if (ranges.length % 2 != 0) {
                throw new IllegalArgumentException("Ranges must come in lo, hi pairs");
            }
            for (int i = 0; i < ranges.length; i += 2) {
                if (ranges[i] < 0 || ranges[i] > ranges[i + 1] || ranges[i + 1] > RegexStaticSets.MAX_SCALAR) {
                    throw new IllegalArgumentException("Bad range " + ranges[i] + ".." + ranges[i + 1]);
                }
                if (i > 0 && ranges[i] <= ranges[i - 1]) {
                    throw new IllegalArgumentException("Ranges must be sorted and disjoint");
                }
            }
            this.ranges = ranges.clone();
            this.negated = negated;
        }

        /**
         * Inclusive {@code lo, hi} pairs as listed, before any negation.
         */
        public int[] getRanges() {
            return ranges.clone();
        }

        public boolean isNegated() {
            return negated;
        }

        /**
         * The scalar values this class matches, with negation applied.
         */
        public UnicodeSet toUnicodeSet() {
            UnicodeSet listed = Util.fromRanges(ranges).retainAll(RegexStaticSets.INSTANCE.fScalarValues);
            return negated ? RegexStaticSets.INSTANCE.complementOf(listed) : listed;
        }

        @Override
        public boolean hasBackreference() {
            return false;
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            sb.append('[');
            if (negated) {
                sb.append('^');
            }
            for (int i = 0; i < ranges.length; i += 2) {
                appendEscaped(sb, ranges[i]);
                if (ranges[i + 1] != ranges[i]) {
                    sb.append('-');
                    appendEscaped(sb, ranges[i + 1]);
                }
            }
            sb.append(']');
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof CharClass)) {
                return false;
            }
            CharClass other = (CharClass) o;
            return negated == other.negated && Arrays.equals(ranges, other.ranges);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(ranges) + (negated ? 1 : 0);
        }
    }

    abstract static class Binary extends RegexNode {
        private final RegexNode left;
        private final RegexNode right;

        Binary(final Kind kind, final RegexNode left, final RegexNode right) {
            super(kind);
            this.left = Objects.requireNonNull(left, "left");
            this.right = Objects.requireNonNull(right, "right");
        }

        public RegexNode getLeft() {
            return left;
        }

        public RegexNode getRight() {
            return right;
        }

        @Override
        public boolean hasBackreference() {
            return left.hasBackreference() || right.hasBackreference();
        }

        @Override
        void collectGroups(final BitSet groups) {
            left.collectGroups(groups);
            right.collectGroups(groups);
        }

        @Override
        public boolean equals(final Object o) {
            if (o == null || o.getClass() != getClass()) {
                return false;
            }
            Binary other = (Binary) o;
            return left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), left, right);
        }
    }

    public static final class Concat extends Binary {
        Concat(final RegexNode left, final RegexNode right) {
            super(Kind.CONCAT, left, right);
        }

        @Override
        int precedence() {
            return 1;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            appendWrapped(sb, getLeft(), 1);
            appendWrapped(sb, getRight(), 1);
        }
    }

    public static final class Union extends Binary {
        Union(final RegexNode left, final RegexNode right) {
            super(Kind.UNION, left, right);
        }

        @Override
        int precedence() {
            return 0;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            appendWrapped(sb, getLeft(), 0);
            sb.append('|');
            appendWrapped(sb, getRight(), 0);
        }
    }

    abstract static class Unary extends RegexNode {
        private final RegexNode inner;

        Unary(final Kind kind, final RegexNode inner) {
            super(kind);
            this.inner = Objects.requireNonNull(inner, "inner");
        }

        public RegexNode getInner() {
            return inner;
        }

        @Override
        public boolean hasBackreference() {
            return inner.hasBackreference();
        }

        @Override
        void collectGroups(final BitSet groups) {
            inner.collectGroups(groups);
        }

        @Override
        int precedence() {
            return 2;
        }

        void appendQuantified(final StringBuilder sb, final String quantifier) {
            appendWrapped(sb, inner, 3);
            sb.append(quantifier);
        }

        @Override
        public boolean equals(final Object o) {
            if (o == null || o.getClass() != getClass()) {
                return false;
            }
            return inner.equals(((Unary) o).inner);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), inner);
        }
    }

    public static final class Star extends Unary {
        Star(final RegexNode inner) {
            super(Kind.STAR, inner);
        }

        @Override
        void appendTo(final StringBuilder sb) {
            appendQuantified(sb, "*");
        }
    }

    public static final class Plus extends Unary {
        Plus(final RegexNode inner) {
            super(Kind.PLUS, inner);
        }

        @Override
        void appendTo(final StringBuilder sb) {
            appendQuantified(sb, "+");
        }
    }

    public static final class Optional extends Unary {
        Optional(final RegexNode inner) {
            super(Kind.OPTIONAL, inner);
        }

        @Override
        void appendTo(final StringBuilder sb) {
            appendQuantified(sb, "?");
        }
    }

    public static final class Repeat extends Unary {
        private final int min;
        private final int max;

        Repeat(final RegexNode inner, final int min, final int max) {
            super(Kind.REPEAT, inner);
            if (min < 0 || (max != UNBOUNDED && max < min)) {
                throw new IllegalArgumentException("Bad repetition bounds {" + min + "," + max + "}");
            }
            this.min = min;
            this.max = max;
        }

        public int getMin() {
            return min;
        }

        /**
         * @return the maximum, or {@link #UNBOUNDED}
         */
        public int getMax() {
            return max;
        }

        public boolean isUnbounded() {
            return max == UNBOUNDED;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            if (isUnbounded()) {
                appendQuantified(sb, "{" + min + ",}");
            } else if (min == max) {
                appendQuantified(sb, "{" + min + "}");
            } else {
                appendQuantified(sb, "{" + min + "," + max + "}");
            }
        }

        @Override
        public boolean equals(final Object o) {
            return super.equals(o) && ((Repeat) o).min == min && ((Repeat) o).max == max;
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), min, max);
        }
    }

    public static final class Group extends Unary {
        private final int index;

        Group(final int index, final RegexNode inner) {
            super(Kind.GROUP, inner);
            if (index < 1) {
                throw new IllegalArgumentException("Group numbers start at 1: " + index);
            }
            this.index = index;
        }

        public int getIndex() {
            return index;
        }

        @Override
        void collectGroups(final BitSet groups) {
            groups.set(index);
            super.collectGroups(groups);
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            sb.append('(');
            getInner().appendTo(sb);
            sb.append(')');
        }

        @Override
        public boolean equals(final Object o) {
            return super.equals(o) && ((Group) o).index == index;
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), index);
        }
    }

    public static final class Backreference extends RegexNode {
        private final int index;

        Backreference(final int index) {
            super(Kind.BACKREFERENCE);
            if (index < 1) {
                throw new IllegalArgumentException("Group numbers start at 1: " + index);
            }
            this.index = index;
        }

        public int getIndex() {
            return index;
        }

        @Override
        public boolean hasBackreference() {
            return true;
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        void appendTo(final StringBuilder sb) {
            // (?:) keeps a following digit from joining the group number
            sb.append('\\').append(index).append("(?:)");
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof Backreference && ((Backreference) o).index == index;
        }

        @Override
        public int hashCode() {
            return 7 * index;
        }
    }
}
