package com.github.tarcv.u4jautomaton;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.UnicodeSet;

import static com.github.tarcv.u4jautomaton.RegexNode.UNBOUNDED;
import static com.github.tarcv.u4jautomaton.UErrorCode.*;

/**
 * Recursive descent parser from pattern text to a {@link RegexNode} tree.
 * <pre>
 *   union   := concat ('|' concat)*
 *   concat  := quant*
 *   quant   := atom ( '*' | '+' | '?' | '{' n '}' | '{' n ',}' | '{' n ',' m '}' )?
 *   atom    := literal | '.' | '(' union ')' | '(?:' union ')' | '[' class ']' | '\' escape
 * </pre>
 * Anchors are not part of the syntax: whether a match must span the whole input is
 * decided by the matching call ({@code matches}, {@code lookingAt} or {@code find}).
 */
public final class RegexParser {
    /**
     * Largest number accepted in a {min,max} interval or a backreference.
     */
    static final int MAX_NUMBER = 0xffffff;

    /**
     * Maximum nesting of parentheses.
     */
    static final int MAX_DEPTH = 1000;

    private final int[] fPattern;
    private int fPos;
    private int fGroupCount;
    private int fDepth;

    private RegexParser(final String pattern) {
        fPattern = Util.toCodePoints(pattern);
    }

    /**
     * Parse the pattern.
     *
     * @throws RegexParseException if the pattern is malformed
     */
    public static RegexNode parse(final String pattern) {
        RegexParser parser = new RegexParser(pattern);
        RegexNode tree = parser.parseUnion();
        if (!parser.atEnd()) {
            // the only thing that stops the top level union early is an unbalanced ')'
            throw parser.error(U_REGEX_MISMATCHED_PAREN, parser.fPos);
        }
        return tree;
    }

    private boolean atEnd() {
        return fPos >= fPattern.length;
    }

    private int peek() {
        return atEnd() ? Util.U_SENTINEL : fPattern[fPos];
    }

    private int peekAt(final int offset) {
        int i = fPos + offset;
        return i < fPattern.length ? fPattern[i] : Util.U_SENTINEL;
    }

    private RegexParseException error(final UErrorCode code, final int offset) {
        int at = Math.min(offset, fPattern.length);
        int preStart = Math.max(0, at - Util.U_PARSE_CONTEXT_LEN);
        int postLimit = Math.min(fPattern.length, at + Util.U_PARSE_CONTEXT_LEN);
        return new RegexParseException(code, at,
                Util.fromCodePoints(fPattern, preStart, at),
                Util.fromCodePoints(fPattern, at, postLimit));
    }

    private RegexNode parseUnion() {
        RegexNode result = parseConcat();
        while (peek() == '|') {
            fPos++;
            result = RegexNode.union(result, parseConcat());
        }
        return result;
    }

    private RegexNode parseConcat() {
        RegexNode result = null;
        while (!atEnd() && peek() != '|' && peek() != ')') {
            RegexNode next = parseQuantified();
            result = result == null ? next : RegexNode.concat(result, next);
        }
        return result == null ? RegexNode.empty() : result;
    }

    private static boolean isQuantifierStart(final int c) {
        return c == '*' || c == '+' || c == '?' || c == '{';
    }

    private RegexNode parseQuantified() {
        if (isQuantifierStart(peek())) {
            // Quantifiers are allowed only after something that can be quantified.
            throw error(U_REGEX_RULE_SYNTAX, fPos);
        }
        RegexNode atom = parseAtom();
        if (!isQuantifierStart(peek())) {
            return atom;
        }
        RegexNode quantified;
        int c = fPattern[fPos++];
        switch (c) {
            case '*':
                quantified = RegexNode.star(atom);
                break;
            case '+':
                quantified = RegexNode.plus(atom);
                break;
            case '?':
                quantified = RegexNode.optional(atom);
                break;
            default:
                quantified = parseInterval(atom);
                break;
        }
        if (isQuantifierStart(peek())) {
            // Lazy and possessive forms are not supported; neither is a quantified quantifier.
            throw error(U_REGEX_RULE_SYNTAX, fPos);
        }
        return quantified;
    }

    /**
     * Parse the rest of a {min,max} interval, the opening brace already consumed.
     * Blanks are allowed around the numbers.
     */
    private RegexNode parseInterval(final RegexNode atom) {
        skipBlanks();
        if (!isAsciiDigit(peek())) {
            throw error(U_REGEX_BAD_INTERVAL, fPos);
        }
        int min = parseNumber();
        int max;
        skipBlanks();
        if (peek() == '}') {
            fPos++;
            max = min;
        } else if (peek() == ',') {
            fPos++;
            skipBlanks();
            if (peek() == '}') {
                fPos++;
                max = UNBOUNDED;
            } else if (isAsciiDigit(peek())) {
                max = parseNumber();
                skipBlanks();
                if (peek() != '}') {
                    throw error(U_REGEX_BAD_INTERVAL, fPos);
                }
                fPos++;
                if (max < min) {
                    throw error(U_REGEX_MAX_LT_MIN, fPos);
                }
            } else {
                throw error(U_REGEX_BAD_INTERVAL, fPos);
            }
        } else {
            throw error(U_REGEX_BAD_INTERVAL, fPos);
        }
        return RegexNode.repeat(atom, min, max);
    }

    private void skipBlanks() {
        while (peek() == ' ' || peek() == '\t') {
            fPos++;
        }
    }

    private static boolean isAsciiDigit(final int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(final int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private int parseNumber() {
        long value = 0;
        while (isAsciiDigit(peek())) {
            value = value * 10 + (fPattern[fPos++] - '0');
            if (value > MAX_NUMBER) {
                while (isAsciiDigit(peek())) {
                    fPos++;
                }
                throw error(U_REGEX_NUMBER_TOO_BIG, fPos);
            }
        }
        return (int) value;
    }

    private RegexNode parseAtom() {
        int start = fPos;
        int c = fPattern[fPos++];
        switch (c) {
            case '(':
                return parseGroup(start);
            case '[':
                return parseClass(start);
            case '.':
                return RegexNode.wildcard();
            case '\\':
                return parseEscape();
            case '^':
            case '$':
                throw error(U_REGEX_UNIMPLEMENTED, start);
            default:
                if (!Util.isScalarValue(c)) {
                    throw error(U_REGEX_RULE_SYNTAX, start);
                }
                return RegexNode.literal(c);
        }
    }

    private RegexNode parseGroup(final int start) {
        if (++fDepth > MAX_DEPTH) {
            throw error(U_REGEX_PATTERN_TOO_BIG, start);
        }
        boolean capturing = true;
        if (peek() == '?') {
            if (peekAt(1) != ':') {
                throw error(U_REGEX_RULE_SYNTAX, fPos);
            }
            fPos += 2;
            capturing = false;
        }
        // numbered by the opening paren, before anything nested inside
        int index = capturing ? ++fGroupCount : 0;
        RegexNode inner = parseUnion();
        if (peek() != ')') {
            throw error(U_REGEX_MISMATCHED_PAREN, fPos);
        }
        fPos++;
        fDepth--;
        return capturing ? RegexNode.group(index, inner) : inner;
    }

    private RegexNode parseEscape() {
        if (atEnd()) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, fPos - 1);
        }
        int c = peek();
        if (c >= '1' && c <= '9') {
            // Backreference; all following digits belong to the group number.
            return RegexNode.backreference(parseNumber());
        }
        UnicodeSet named = namedSet(c);
        if (named != null) {
            fPos++;
            return RegexNode.charClass(named, false);
        }
        return RegexNode.literal(parseEscapedCodePoint());
    }

    /**
     * The set for \w, \d, \s and their negations, or null if {@code c} names none of them.
     */
    private static UnicodeSet namedSet(final int c) {
        RegexStaticSets sets = RegexStaticSets.INSTANCE;
        switch (c) {
            case 'w':
                return sets.fWordSet;
            case 'd':
                return sets.fDigitSet;
            case 's':
                return sets.fSpaceSet;
            case 'W':
                return sets.complementOf(sets.fWordSet);
            case 'D':
                return sets.complementOf(sets.fDigitSet);
            case 'S':
                return sets.complementOf(sets.fSpaceSet);
            default:
                return null;
        }
    }

    /**
     * Decode the escape sequence starting right after a backslash.
     */
    private int parseEscapedCodePoint() {
        int start = fPos - 1;
        int c = fPattern[fPos++];
        int result;
        switch (c) {
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 'f':
                return '\f';
            case 'e':
                return 0x1b;
            case 'a':
                return 0x07;
            case 'x':
                if (peek() == '{') {
                    fPos++;
                    result = parseHex(start, 1, 6);
                    if (peek() != '}') {
                        throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, start);
                    }
                    fPos++;
                } else {
                    result = parseHex(start, 2, 2);
                }
                break;
            case 'u':
                result = parseHex(start, 4, 4);
                break;
            case 'U':
                result = parseHex(start, 8, 8);
                break;
            default:
                if (isAsciiLetter(c) || isAsciiDigit(c)) {
                    throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, start);
                }
                return c;
        }
        if (!Util.isScalarValue(result)) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, start);
        }
        return result;
    }

    private int parseHex(final int escapeStart, final int minDigits, final int maxDigits) {
        long value = 0;
        int digits = 0;
        while (digits < maxDigits && !atEnd()) {
            int d = UCharacter.digit(peek(), 16);
            if (d < 0 || peek() > 0x7f) {
                break;
            }
            value = value * 16 + d;
            digits++;
            fPos++;
        }
        if (digits < minDigits || value > Integer.MAX_VALUE) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
        }
        return (int) value;
    }

    /**
     * Parse a bracket expression, the opening bracket already consumed.
     * A ']' right after the opening bracket (or after '^') is a literal, and so is
     * a '-' that cannot form a range.
     */
    private RegexNode parseClass(final int start) {
        boolean negated = false;
        if (peek() == '^') {
            negated = true;
            fPos++;
        }
        UnicodeSet set = new UnicodeSet();
        boolean first = true;
        while (true) {
            if (atEnd()) {
                throw error(U_REGEX_MISSING_CLOSE_BRACKET, start);
            }
            if (peek() == ']' && !first) {
                fPos++;
                break;
            }
            first = false;
            int atomStart = fPos;
            UnicodeSet named = parseClassNamedSet();
            if (named != null) {
                set.addAll(named);
                continue;
            }
            int lo = parseClassCodePoint();
            if (peek() == '-' && peekAt(1) != ']' && peekAt(1) != Util.U_SENTINEL) {
                fPos++;
                if (parseClassNamedSet() != null) {
                    throw error(U_REGEX_INVALID_RANGE, atomStart);
                }
                int hi = parseClassCodePoint();
                if (hi < lo) {
                    throw error(U_REGEX_INVALID_RANGE, atomStart);
                }
                set.add(lo, hi);
            } else {
                set.add(lo);
            }
        }
        return RegexNode.charClass(set, negated);
    }

    private UnicodeSet parseClassNamedSet() {
        if (peek() == '\\') {
            UnicodeSet named = namedSet(peekAt(1));
            if (named != null) {
                fPos += 2;
                return named;
            }
        }
        return null;
    }

    private int parseClassCodePoint() {
        int c = fPattern[fPos++];
        if (c == '\\') {
            if (atEnd()) {
                throw error(U_REGEX_MISSING_CLOSE_BRACKET, fPos);
            }
            return parseEscapedCodePoint();
        }
        return c;
    }
}
