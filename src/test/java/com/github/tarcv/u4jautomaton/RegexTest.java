// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
/* ******************************************************************
 * COPYRIGHT:
 * Copyright (c) 2002-2016, International Business Machines Corporation and
 * others. All Rights Reserved.
 ********************************************************************/
package com.github.tarcv.u4jautomaton;

import com.ibm.icu.impl.Utility;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

import static com.github.tarcv.u4jautomaton.UErrorCode.*;
import static com.github.tarcv.u4jautomaton.URegexpFlag.*;

/**
 * Regular expression matching tests, in the manner of the ICU regex test suite.
 */
public class RegexTest {

//---------------------------------------------------------------------------
//
//   Error Checking / Reporting helpers used in all of the tests.
//
//---------------------------------------------------------------------------

    static void REGEX_ASSERT(final boolean expr) {
        Assert.assertTrue(expr);
    }

    static void REGEX_ASSERT_FAIL(final Runnable expr, final UErrorCode errcode) {
        UErrorCode status = U_ZERO_ERROR;
        try {
            expr.run();
        } catch (final UErrorException e) {
            status = e.getErrorCode();
        } catch (final IllegalArgumentException e) {
            status = U_ILLEGAL_ARGUMENT_ERROR;
        }
        Assert.assertEquals(errcode, status);
    }

//---------------------------------------------------------------------------
//
//    REGEX_TESTLM       Helper to simplify writing quick tests
//                       for the lookingAt() and matches() functions.
//
//       usage:
//          REGEX_TESTLM("pattern",  "input text",  lookingAt expected, matches expected);
//
//          The expected results are boolean - true or false.
//          The input text is unescaped.  The pattern is not.
//
//---------------------------------------------------------------------------

    static void REGEX_TESTLM(final String pat, final String text, final boolean looking, final boolean match) {
        CompiledPattern REPattern = CompiledPattern.compile(pat);
        RegexMatcher REMatcher = REPattern.matcher(Utility.unescape(text));

        boolean actualmatch;
        actualmatch = REMatcher.lookingAt();
        Assert.assertEquals("RegexTest: wrong return from lookingAt() for /" + pat + "/", looking, actualmatch);
        actualmatch = REMatcher.matches();
        Assert.assertEquals("RegexTest: wrong return from matches() for /" + pat + "/", match, actualmatch);

        // the one-shot API must agree with the matcher
        Assert.assertEquals(match, REPattern.matches(Utility.unescape(text)).isMatch());
    }

//---------------------------------------------------------------------------
//
//    regex_err       Helper to simplify writing tests for incorrect patterns
//
//       usage:
//          regex_err("pattern",   expected error offset, expected status);
//
//---------------------------------------------------------------------------

    static void regex_err(final String patStr, final int errOffset, final UErrorCode expectedStatus) {
        try {
            CompiledPattern.compile(patStr);
        } catch (RegexParseException e) {
            Assert.assertEquals("status for /" + patStr + "/", expectedStatus, e.getErrorCode());
            Assert.assertEquals("offset for /" + patStr + "/", errOffset, e.getOffset());
            return;
        }
        Assert.fail("Expected " + expectedStatus + " compiling /" + patStr + "/");
    }

//---------------------------------------------------------------------------
//
//      Basic      Check for basic functionality of regex pattern matching.
//
//---------------------------------------------------------------------------

    @Test
    public void Basic() {
        //
        // Pattern with parentheses
        //
        REGEX_TESTLM("st(abc)ring", "stabcring thing", true, false);
        REGEX_TESTLM("st(abc)ring", "stabcring", true, true);
        REGEX_TESTLM("st(abc)ring", "stabcrung", false, false);

        //
        // Patterns with *
        //
        REGEX_TESTLM("st(abc)*ring", "string", true, true);
        REGEX_TESTLM("st(abc)*ring", "stabcring", true, true);
        REGEX_TESTLM("st(abc)*ring", "stabcabcring", true, true);
        REGEX_TESTLM("st(abc)*ring", "stabcabcdring", false, false);
        REGEX_TESTLM("st(abc)*ring", "stabcabcabcring etc.", true, false);

        REGEX_TESTLM("a*", "", true, true);
        REGEX_TESTLM("a*", "b", true, false);

        //
        //  Patterns with "."
        //
        REGEX_TESTLM(".", "abc", true, false);
        REGEX_TESTLM("...", "abc", true, true);
        REGEX_TESTLM("....", "abc", false, false);
        REGEX_TESTLM(".*", "abcxyz123", true, true);
        REGEX_TESTLM("ab.*xyz", "abcdefghij", false, false);
        REGEX_TESTLM("ab.*xyz", "abcdefg...wxyz", true, true);
        REGEX_TESTLM("ab.*xyz", "abcde...wxyz...abc..xyz", true, true);
        REGEX_TESTLM("ab.*xyz", "abcde...wxyz...abc..xyz...", true, false);
        REGEX_TESTLM("a.b", "a\\nb", true, true);

        //
        //  Patterns with * applied to chars at end of literal string
        //
        REGEX_TESTLM("abc*", "ab", true, true);
        REGEX_TESTLM("abc*", "abccccc", true, true);

        //
        //  Supplemental chars match as single chars, not a pair of surrogates.
        //
        REGEX_TESTLM(".", "\\U00011000", true, true);
        REGEX_TESTLM("...", "\\U00011000x\\U00012002", true, true);
        REGEX_TESTLM("...", "\\U00011000x\\U00012002y", true, false);

        //
        //  UnicodeSets in the pattern
        //
        REGEX_TESTLM("[1-6]", "1", true, true);
        REGEX_TESTLM("[1-6]", "3", true, true);
        REGEX_TESTLM("[1-6]", "7", false, false);
        REGEX_TESTLM("a[1-6]", "a3", true, true);
        REGEX_TESTLM("a[1-6]b", "a3b", true, true);

        REGEX_TESTLM("a[0-9]*b", "a123b", true, true);
        REGEX_TESTLM("a[0-9]*b", "abc", true, false);
        REGEX_TESTLM("[\\d]*", "123456", true, true);
        REGEX_TESTLM("[\\d]*", "a123456", true, false);   // note that * matches 0 occurrences.
        REGEX_TESTLM("[a][b][\\s]*", "ab   ", true, true);
        REGEX_TESTLM("\\d+", "\\u0661\\u0662", true, true);   // Arabic-Indic digits
        REGEX_TESTLM("\\w+\\W\\w+", "h\\u00e9llo w\\u00f6rld", true, true);
        REGEX_TESTLM("[^a-c]+", "xyz", true, true);
        REGEX_TESTLM("[^a-c]+", "xbz", true, false);
        REGEX_TESTLM("[]a]+", "]a]", true, true);
        REGEX_TESTLM("[a-]+", "-a-", true, true);

        //
        //   OR operator in patterns
        //
        REGEX_TESTLM("(a|b)", "a", true, true);
        REGEX_TESTLM("(a|b)", "b", true, true);
        REGEX_TESTLM("(a|b)", "c", false, false);
        REGEX_TESTLM("a|b", "b", true, true);

        REGEX_TESTLM("(a|b|c)*", "aabcaaccbcabc", true, true);
        REGEX_TESTLM("(a|b|c)*", "aabcaaccbcabdc", true, false);
        REGEX_TESTLM("(a(b|c|d)(x|y|z)*|123)", "ac", true, true);
        REGEX_TESTLM("(a(b|c|d)(x|y|z)*|123)", "123", true, true);
        REGEX_TESTLM("(a|(1|2)*)(b|c|d)(x|y|z)*|123", "123", true, true);
        REGEX_TESTLM("(a|(1|2)*)(b|c|d)(x|y|z)*|123", "222211111czzzzw", true, false);

        //
        //  +
        //
        REGEX_TESTLM("ab+", "abbc", true, false);
        REGEX_TESTLM("ab+c", "ac", false, false);
        REGEX_TESTLM("b+", "", false, false);
        REGEX_TESTLM("(abc|def)+", "defabc", true, true);
        REGEX_TESTLM(".+y", "zippity dooy dah ", true, false);
        REGEX_TESTLM(".+y", "zippity dooy", true, true);

        //
        //   ?
        //
        REGEX_TESTLM("ab?", "ab", true, true);
        REGEX_TESTLM("ab?", "a", true, true);
        REGEX_TESTLM("ab?", "ac", true, false);
        REGEX_TESTLM("ab?", "abb", true, false);
        REGEX_TESTLM("a(b|c)?d", "abd", true, true);
        REGEX_TESTLM("a(b|c)?d", "acd", true, true);
        REGEX_TESTLM("a(b|c)?d", "ad", true, true);
        REGEX_TESTLM("a(b|c)?d", "abcd", false, false);
        REGEX_TESTLM("a(b|c)?d", "ab", false, false);

        //
        //  {min,max}
        //
        REGEX_TESTLM("a{3}", "aaa", true, true);
        REGEX_TESTLM("a{3}", "aaaa", true, false);
        REGEX_TESTLM("a{3, 5}", "aaaaa", true, true);
        REGEX_TESTLM("a{3, 5}", "aa", false, false);
        REGEX_TESTLM("a{2,}", "aaaaaaaa", true, true);
        REGEX_TESTLM("(ab){0,2}c", "ababc", true, true);
        REGEX_TESTLM("(ab){0,2}c", "abababc", false, false);

        //
        //  Escape sequences that become single literal chars, handled internally
        //   by ICU's Unescape.
        //
        REGEX_TESTLM("\\a", "\\u0007", true, true);        // BEL
        REGEX_TESTLM("\\e", "\\u001b", true, true);        // Escape
        REGEX_TESTLM("\\f", "\\u000c", true, true);        // Form Feed
        REGEX_TESTLM("\\n", "\\u000a", true, true);        // new line
        REGEX_TESTLM("\\r", "\\u000d", true, true);        //  CR
        REGEX_TESTLM("\\t", "\\u0009", true, true);        // Tab
        REGEX_TESTLM("\\u1234", "\\u1234", true, true);
        REGEX_TESTLM("\\U00001234", "\\u1234", true, true);
        REGEX_TESTLM("\\x41\\x{1F600}", "A\\U0001F600", true, true);

        //
        // Escape of special chars in patterns
        //
        REGEX_TESTLM("\\\\\\|\\(\\)\\[\\{\\~\\$\\*\\+\\?\\.", "\\\\|()[{~$*+?.", true, true);

        //
        // Backreferences
        //
        REGEX_TESTLM("(a)\\1", "aa", true, true);
        REGEX_TESTLM("(a)\\1", "ab", false, false);
        REGEX_TESTLM("(a+)b\\1", "aabaa", true, true);
        REGEX_TESTLM("(a+)b\\1", "aaba", false, false);
        REGEX_TESTLM("(a|b)*\\1", "abb", true, true);
        REGEX_TESTLM("(ab+)12\\1*", "abb12abbabb", true, true);
        REGEX_TESTLM("\\1(a)", "aa", false, false);   // group 1 has not captured when the reference is tried
    }

    //---------------------------------------------------------------------------
//
//      Scenarios     The behaviour documented for the public compile/matches API.
//
//---------------------------------------------------------------------------
    @Test
    public void Scenarios() {
        CompiledPattern alternation = CompiledPattern.compile("ab(34)+|12(34)*");
        REGEX_ASSERT(alternation instanceof RegularPattern);

        MatchResult result = alternation.matches("ab343434");
        REGEX_ASSERT(result.isMatch());
        Assert.assertEquals(0, result.start());
        Assert.assertEquals(8, result.end());
        Assert.assertEquals("34", result.group(1));
        Assert.assertEquals(6, result.start(1));
        Assert.assertEquals(8, result.end(1));
        Assert.assertNull(result.group(2));
        Assert.assertEquals(-1, result.start(2));

        result = alternation.matches("12");
        REGEX_ASSERT(result.isMatch());
        Assert.assertNull(result.group(1));
        Assert.assertNull(result.group(2));

        Assert.assertFalse(alternation.matches("ab").isMatch());
        Assert.assertSame(MatchResult.NO_MATCH, alternation.matches("ab"));

        CompiledPattern backref = CompiledPattern.compile("(a)\\1");
        REGEX_ASSERT(backref instanceof BacktrackingPattern);
        result = backref.matches("aa");
        REGEX_ASSERT(result.isMatch());
        Assert.assertEquals("a", result.group(1));
        Assert.assertFalse(backref.matches("ab").isMatch());

        CompiledPattern interval = CompiledPattern.compile("a{2,4}");
        Assert.assertFalse(interval.matches("a").isMatch());
        REGEX_ASSERT(interval.matches("aa").isMatch());
        REGEX_ASSERT(interval.matches("aaaa").isMatch());
        Assert.assertFalse(interval.matches("aaaaa").isMatch());

        result = CompiledPattern.compile("[0-9]+").find("abc123");
        REGEX_ASSERT(result.isMatch());
        Assert.assertEquals(3, result.start());
        Assert.assertEquals(6, result.end());
        Assert.assertEquals("123", result.group());

        REGEX_ASSERT(CompiledPattern.matches("[0-9]+", "2024"));
        Assert.assertFalse(CompiledPattern.matches("[0-9]+", "20x4"));
    }

    @Test
    public void CompileFromTree() {
        // ab(34)+|12(34)* assembled by hand
        RegexNode tree = RegexNode.union(
                RegexNode.concat(RegexNode.literal("ab"), RegexNode.plus(RegexNode.group(1, RegexNode.literal("34")))),
                RegexNode.concat(RegexNode.literal("12"), RegexNode.star(RegexNode.group(2, RegexNode.literal("34")))));
        CompiledPattern pattern = CompiledPattern.compile(tree);
        Assert.assertEquals(2, pattern.groupCount());
        REGEX_ASSERT(pattern.matches("ab3434").isMatch());
        REGEX_ASSERT(pattern.matches("123434").isMatch());
        Assert.assertFalse(pattern.matches("ab").isMatch());
        Assert.assertEquals(2, CompiledPattern.compile(pattern.pattern()).groupCount());

        // a code point sequence is matched as is
        int[] input = {'a', 'b', '3', '4'};
        REGEX_ASSERT(pattern.matches(input).isMatch());
        REGEX_ASSERT_FAIL(() -> pattern.matches((int[]) null), U_ILLEGAL_ARGUMENT_ERROR);

        // a repetition above the default ceiling compiles with a higher one
        RegexNode wide = RegexNode.repeat(RegexNode.literal('a'), 0, 1500);
        REGEX_ASSERT_FAIL(() -> CompiledPattern.compile(wide), U_REGEX_PATTERN_TOO_BIG);
        CompiledPattern widePattern = CompiledPattern.compile(wide, 0, 2000);
        REGEX_ASSERT(widePattern.matches(new String(new char[1500]).replace('\0', 'a')).isMatch());
        Assert.assertFalse(widePattern.matches(new String(new char[1501]).replace('\0', 'a')).isMatch());
    }

    //---------------------------------------------------------------------------
//
//      API_Match   Test that the API for class RegexMatcher
//                  is present and nominally working, but excluding functions
//                  implementing replace operations.
//
//---------------------------------------------------------------------------
    @Test
    public void API_Match() {
        //
        // Simple pattern compilation
        //
        {
            CompiledPattern pat2 = CompiledPattern.compile("abc");
            Assert.assertEquals("abc", pat2.pattern());
            Assert.assertEquals(0, pat2.flags());
            Assert.assertEquals(0, pat2.groupCount());

            String inStr1 = "abcdef this is a test";
            String instr2 = "not abc";
            String empty = "";

            //
            // Matcher creation and reset.
            //
            RegexMatcher m1 = pat2.matcher(inStr1);
            Assert.assertSame(pat2, m1.pattern());
            REGEX_ASSERT(m1.lookingAt());
            Assert.assertFalse(m1.matches());
            m1.reset(instr2);
            Assert.assertFalse(m1.lookingAt());
            m1.reset(inStr1);
            REGEX_ASSERT(m1.lookingAt());
            m1.reset(empty);
            Assert.assertFalse(m1.lookingAt());
            Assert.assertEquals(0, m1.inputLength());
        }

        //
        // Capture Group.
        //     RegexMatcher.start();
        //     RegexMatcher.end();
        //     RegexMatcher.groupCount();
        //
        {
            CompiledPattern pat = CompiledPattern.compile("01(23(45)67)(.*)");
            RegexMatcher matcher = pat.matcher("0123456789");
            REGEX_ASSERT(matcher.lookingAt());
            final int[] matchStarts = {0, 2, 4, 8};
            final int[] matchEnds = {10, 8, 6, 10};
            for (int i = 0; i < 4; i++) {
                Assert.assertEquals(matchStarts[i], matcher.start(i));
                Assert.assertEquals(matchEnds[i], matcher.end(i));
            }
            Assert.assertEquals(3, matcher.groupCount());
            Assert.assertEquals(0, matcher.start());
            Assert.assertEquals(10, matcher.end());
            Assert.assertEquals("0123456789", matcher.group());
            Assert.assertEquals("2345", matcher.group(1).substring(0, 4));
            Assert.assertEquals("89", matcher.group(3));

            try {
                matcher.start(4);
                Assert.fail("Expected IndexOutOfBoundsException");
            } catch (IndexOutOfBoundsException expected) {
                // expected
            }
            try {
                matcher.group(-1);
                Assert.fail("Expected IndexOutOfBoundsException");
            } catch (IndexOutOfBoundsException expected) {
                // expected
            }

            matcher.reset();
            try {
                matcher.start(0);
                Assert.fail("Expected IllegalStateException");
            } catch (IllegalStateException expected) {
                // expected
            }
        }

        //
        //  find
        //
        {
            CompiledPattern pat = CompiledPattern.compile("abc");
            RegexMatcher matcher = pat.matcher(".abc..abc...abc..");
            //                                012345678901234567
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(1, matcher.start());
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(6, matcher.start());
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(12, matcher.start());
            Assert.assertFalse(matcher.find());
            Assert.assertFalse(matcher.find());

            matcher.reset();
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(1, matcher.start());

            REGEX_ASSERT(matcher.find(0));
            Assert.assertEquals(1, matcher.start());
            REGEX_ASSERT(matcher.find(1));
            Assert.assertEquals(1, matcher.start());
            REGEX_ASSERT(matcher.find(2));
            Assert.assertEquals(6, matcher.start());
            REGEX_ASSERT(matcher.find(12));
            Assert.assertEquals(12, matcher.start());
            Assert.assertFalse(matcher.find(13));
            Assert.assertFalse(matcher.find(17));
            try {
                matcher.find(18);
                Assert.fail("Expected IndexOutOfBoundsException");
            } catch (IndexOutOfBoundsException expected) {
                // expected
            }
            try {
                matcher.find(-1);
                Assert.fail("Expected IndexOutOfBoundsException");
            } catch (IndexOutOfBoundsException expected) {
                // expected
            }
        }

        //
        //  find with empty matches: the search moves on by one code point.
        //
        {
            CompiledPattern pat = CompiledPattern.compile("x*");
            RegexMatcher matcher = pat.matcher("ab");
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(0, matcher.start());
            Assert.assertEquals(0, matcher.end());
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(1, matcher.start());
            Assert.assertEquals(1, matcher.end());
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(2, matcher.start());
            Assert.assertEquals(2, matcher.end());
            Assert.assertFalse(matcher.find());
        }

        //
        //  find with supplementary chars: offsets count code points.
        //
        {
            CompiledPattern pat = CompiledPattern.compile("b+");
            RegexMatcher matcher = pat.matcher(Utility.unescape("\\U00010000\\U00010001bb\\U00010002b"));
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(2, matcher.start());
            Assert.assertEquals(4, matcher.end());
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(5, matcher.start());
            Assert.assertEquals("b", matcher.group());
            Assert.assertFalse(matcher.find());
        }

        //
        //  Leftmost, then longest.
        //
        {
            RegexMatcher matcher = CompiledPattern.compile("a|ab|abc").matcher("xxabcd");
            REGEX_ASSERT(matcher.find());
            Assert.assertEquals(2, matcher.start());
            Assert.assertEquals(5, matcher.end());
            REGEX_ASSERT(CompiledPattern.compile("a|ab").matcher("abab").lookingAt());
        }

        //
        //  Groups that do not participate in the match
        //
        {
            CompiledPattern pat = CompiledPattern.compile("(a)(b)?c");
            RegexMatcher matcher = pat.matcher("ac");
            REGEX_ASSERT(matcher.matches());
            Assert.assertEquals("a", matcher.group(1));
            Assert.assertNull(matcher.group(2));
            Assert.assertEquals(-1, matcher.start(2));
            Assert.assertEquals(-1, matcher.end(2));

            MatchResult result = matcher.toMatchResult();
            REGEX_ASSERT(result.isMatch());
            Assert.assertEquals(2, result.groupCount());
            Assert.assertEquals("ac", result.group());
            Assert.assertNull(result.group(2));
            Assert.assertEquals(pat.matches("ac"), result);
            Assert.assertEquals(pat.matches("ac").hashCode(), result.hashCode());

            // the result does not change when the matcher moves on
            Assert.assertFalse(matcher.matches());
            Assert.assertEquals("a", result.group(1));
            Assert.assertSame(MatchResult.NO_MATCH, matcher.toMatchResult());
            try {
                MatchResult.NO_MATCH.start();
                Assert.fail("Expected IllegalStateException");
            } catch (IllegalStateException expected) {
                // expected
            }
        }

        //
        //  Time limits and callbacks, getters and setters.
        //
        {
            RegexMatcher matcher = CompiledPattern.compile("(a)\\1").matcher("aa");
            Assert.assertEquals(0, matcher.getTimeLimit());
            matcher.setTimeLimit(10);
            Assert.assertEquals(10, matcher.getTimeLimit());
            REGEX_ASSERT_FAIL(() -> matcher.setTimeLimit(-1), U_ILLEGAL_ARGUMENT_ERROR);
            Assert.assertEquals(10, matcher.getTimeLimit());
            REGEX_ASSERT(matcher.matches());
        }
    }

    //---------------------------------------------------------------------------
//
//      Errors     Check for error handling in patterns.
//
//---------------------------------------------------------------------------
    @Test
    public void Errors() {
        Assert.assertEquals(0x10300, U_REGEX_INTERNAL_ERROR.getIndex());
        // same numbers as ICU4C's utypes.h
        Assert.assertEquals(0x10301, U_REGEX_RULE_SYNTAX.getIndex());
        Assert.assertEquals(0x1030a, U_REGEX_INVALID_BACK_REF.getIndex());
        Assert.assertEquals(0x10312, U_REGEX_TIME_OUT.getIndex());
        Assert.assertEquals(0x10314, U_REGEX_PATTERN_TOO_BIG.getIndex());
        Assert.assertEquals(1, U_ILLEGAL_ARGUMENT_ERROR.getIndex());

        // Missing close parentheses
        regex_err("Capturing Parenthesis(...", 25, U_REGEX_MISMATCHED_PAREN);
        regex_err("Grouping only parens (?: blah blah", 34, U_REGEX_MISMATCHED_PAREN);

        // Extra close paren
        regex_err("Grouping only parens (?: blah)) blah", 30, U_REGEX_MISMATCHED_PAREN);
        regex_err(")))))))", 0, U_REGEX_MISMATCHED_PAREN);
        regex_err("(((((((", 7, U_REGEX_MISMATCHED_PAREN);

        // Look-ahead, Look-behind, and other (? constructs are not supported
        regex_err("abc(?<@xyz).*", 4, U_REGEX_RULE_SYNTAX);
        regex_err("(?=a)", 1, U_REGEX_RULE_SYNTAX);

        // Quantifiers are allowed only after something that can be quantified.
        regex_err("+", 0, U_REGEX_RULE_SYNTAX);
        regex_err("abc**", 4, U_REGEX_RULE_SYNTAX);
        regex_err("a|*", 2, U_REGEX_RULE_SYNTAX);
        regex_err("(*)", 1, U_REGEX_RULE_SYNTAX);

        // Lazy and possessive quantifiers
        regex_err("a*?", 2, U_REGEX_RULE_SYNTAX);
        regex_err("a++", 2, U_REGEX_RULE_SYNTAX);

        // Mal-formed {min,max} quantifiers
        regex_err("abc{a,2}", 4, U_REGEX_BAD_INTERVAL);
        regex_err("abc{4,2}", 8, U_REGEX_MAX_LT_MIN);
        regex_err("abc{1,b}", 6, U_REGEX_BAD_INTERVAL);
        regex_err("abc{1,,2}", 6, U_REGEX_BAD_INTERVAL);
        regex_err("abc{1,2a}", 7, U_REGEX_BAD_INTERVAL);
        regex_err("abc{222222222222222222222}", 25, U_REGEX_NUMBER_TOO_BIG);
        regex_err("xyz{1", 5, U_REGEX_BAD_INTERVAL);
        regex_err("{1}", 0, U_REGEX_RULE_SYNTAX);

        // Bracket expressions
        regex_err("[abc", 0, U_REGEX_MISSING_CLOSE_BRACKET);
        regex_err("x[]", 1, U_REGEX_MISSING_CLOSE_BRACKET);
        regex_err("[z-a]", 1, U_REGEX_INVALID_RANGE);
        regex_err("[a-\\d]", 1, U_REGEX_INVALID_RANGE);

        // Escapes
        regex_err("\\0", 0, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("ab\\q", 2, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\x4", 0, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\x{110000}", 0, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\uD800", 0, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("a\\", 1, U_REGEX_BAD_ESCAPE_SEQUENCE);

        // Anchors
        regex_err("^abc", 0, U_REGEX_UNIMPLEMENTED);
        regex_err("abc$", 3, U_REGEX_UNIMPLEMENTED);

        // Context around the error
        try {
            CompiledPattern.compile("abc)def");
            Assert.fail("Expected RegexParseException");
        } catch (RegexParseException e) {
            Assert.assertEquals("abc", e.getPreContext());
            Assert.assertEquals(")def", e.getPostContext());
        }

        // Backreference to a group that does not exist
        try {
            CompiledPattern.compile("(a)(b)\\3");
            Assert.fail("Expected MalformedGroupException");
        } catch (MalformedGroupException e) {
            Assert.assertEquals(U_REGEX_INVALID_BACK_REF, e.getErrorCode());
            Assert.assertEquals(3, e.getGroupNumber());
            Assert.assertEquals(2, e.getGroupCount());
        }
        REGEX_ASSERT_FAIL(() -> CompiledPattern.compile("\\1"), U_REGEX_INVALID_BACK_REF);

        // Repetitions wider than the unrolling ceiling
        try {
            CompiledPattern.compile("a{1001}");
            Assert.fail("Expected RangeOverflowException");
        } catch (RangeOverflowException e) {
            Assert.assertEquals(U_REGEX_PATTERN_TOO_BIG, e.getErrorCode());
            Assert.assertEquals(1001, e.getRequested());
            Assert.assertEquals(NfaBuilder.DEFAULT_REPEAT_LIMIT, e.getLimit());
        }
        REGEX_ASSERT_FAIL(() -> CompiledPattern.compile("a{2,1001}"), U_REGEX_PATTERN_TOO_BIG);
        REGEX_ASSERT_FAIL(() -> CompiledPattern.compile("a{1001,}"), U_REGEX_PATTERN_TOO_BIG);
        REGEX_ASSERT(CompiledPattern.compile("a{1000,}") instanceof RegularPattern);

        // Unknown flags
        REGEX_ASSERT_FAIL(() -> CompiledPattern.compile("abc", 1L << 40), U_REGEX_INVALID_FLAG);
    }

    //---------------------------------------------------------------------------
//
//      Flags     Case insensitive matching and line terminators.
//
//---------------------------------------------------------------------------
    @Test
    public void Flags() {
        CompiledPattern ci = CompiledPattern.compile("abc", EnumSet.of(UREGEX_CASE_INSENSITIVE));
        Assert.assertEquals(UREGEX_CASE_INSENSITIVE.flag, ci.flags());
        REGEX_ASSERT(ci.matches("ABC").isMatch());
        REGEX_ASSERT(ci.matches("aBc").isMatch());
        REGEX_ASSERT(CompiledPattern.compile("[a-c]+", EnumSet.of(UREGEX_CASE_INSENSITIVE)).matches("CbA").isMatch());
        // Kelvin sign folds to k
        REGEX_ASSERT(CompiledPattern.compile("k", EnumSet.of(UREGEX_CASE_INSENSITIVE)).matches("\u212a").isMatch());
        REGEX_ASSERT(CompiledPattern.compile("(ab)\\1", EnumSet.of(UREGEX_CASE_INSENSITIVE)).matches("abAB").isMatch());
        Assert.assertFalse(CompiledPattern.compile("(ab)\\1").matches("abAB").isMatch());

        CompiledPattern dot = CompiledPattern.compile("a.b", EnumSet.of(UREGEX_DOT_EXCLUDES_LINE_TERMINATORS));
        Assert.assertFalse(dot.matches("a\nb").isMatch());
        Assert.assertFalse(dot.matches("a\rb").isMatch());
        Assert.assertFalse(dot.matches("a\u2028b").isMatch());
        REGEX_ASSERT(dot.matches("a-b").isMatch());

        CompiledPattern unixDot = CompiledPattern.compile("a.b",
                EnumSet.of(UREGEX_DOT_EXCLUDES_LINE_TERMINATORS, UREGEX_UNIX_LINES));
        Assert.assertFalse(unixDot.matches("a\nb").isMatch());
        REGEX_ASSERT(unixDot.matches("a\rb").isMatch());

        // Without the exclusion flag, unix lines changes nothing
        REGEX_ASSERT(CompiledPattern.compile("a.b", EnumSet.of(UREGEX_UNIX_LINES)).matches("a\nb").isMatch());
    }

//
//  Callbacks()    Test the callback function.
//                 When set, callbacks occur periodically during matching operations,
//                 giving the application code the ability to abort the operation
//                 before it's normal completion.
//

    static class callBackContext {
        int maxCalls;
        int numCalls;
        int lastSteps;

        void reset(final int max) {
            maxCalls = max;
            numCalls = 0;
            lastSteps = 0;
        }
    }

    // call-back function for regex matches.
    // Return true to continue the match, false to stop it.
    static final URegexMatchCallback testCallBackFn = (final Object context, final int steps) -> {
        callBackContext info = (callBackContext) context;
        Assert.assertEquals(info.lastSteps + 1, steps);
        info.lastSteps = steps;
        info.numCalls++;
        return (info.numCalls < info.maxCalls);
    };

    // 40 a's and a b: the pattern below fails on it only after an exponential search
    private static final String LONG_FAILURE = new String(new char[40]).replace('\0', 'a') + "b";

    @Test
    public void Callbacks() {
        {
            // Getter returns NULLs if no callback has been set
            RegexMatcher matcher = CompiledPattern.compile("x").matcher("");
            Assert.assertNull(matcher.getMatchCallback());
            Assert.assertNull(matcher.getMatchCallbackContext());
        }

        {
            // Set and Get work
            callBackContext cbInfo = new callBackContext();
            RegexMatcher matcher = CompiledPattern.compile("((.)+\\2)+x").matcher("");  // A pattern that can run long.
            matcher.setMatchCallback(testCallBackFn, cbInfo);
            Assert.assertEquals(testCallBackFn, matcher.getMatchCallback());
            Assert.assertEquals(cbInfo, matcher.getMatchCallbackContext());

            // A short-running match shouldn't invoke the callback

            cbInfo.reset(1);
            matcher.reset("xxx");
            REGEX_ASSERT(matcher.matches());
            Assert.assertEquals(0, cbInfo.numCalls);

            // A long running match that the callback function will abort.

            cbInfo.reset(4);
            matcher.reset(LONG_FAILURE);
            REGEX_ASSERT_FAIL(() -> matcher.matches(), U_REGEX_STOPPED_BY_CALLER);
            Assert.assertEquals(4, cbInfo.numCalls);

            // A long running find that the callback function will abort.

            cbInfo.reset(4);
            matcher.reset(LONG_FAILURE);
            REGEX_ASSERT_FAIL(() -> matcher.find(), U_REGEX_STOPPED_BY_CALLER);
            Assert.assertEquals(4, cbInfo.numCalls);
        }

        {
            // Regular patterns never call back
            callBackContext cbInfo = new callBackContext();
            cbInfo.reset(1);
            RegexMatcher matcher = CompiledPattern.compile("(a+)+b").matcher(LONG_FAILURE.replace('b', 'c'));
            matcher.setMatchCallback(testCallBackFn, cbInfo);
            Assert.assertFalse(matcher.matches());
            Assert.assertEquals(0, cbInfo.numCalls);
        }
    }

    @Test
    public void TimeLimit() {
        RegexMatcher matcher = CompiledPattern.compile("((.)+\\2)+x").matcher(LONG_FAILURE);
        matcher.setTimeLimit(5);
        try {
            matcher.matches();
            Assert.fail("Expected BudgetExceededException");
        } catch (BudgetExceededException e) {
            Assert.assertEquals(U_REGEX_TIME_OUT, e.getErrorCode());
            Assert.assertEquals(5, e.getTimeLimit());
        }
        REGEX_ASSERT_FAIL(() -> matcher.find(), U_REGEX_TIME_OUT);

        // A short match completes within the limit
        matcher.reset("aax");
        REGEX_ASSERT(matcher.matches());

        // The limit does not apply to regular patterns
        RegexMatcher regular = CompiledPattern.compile("(a+)+b").matcher(LONG_FAILURE.replace('b', 'c'));
        regular.setTimeLimit(1);
        Assert.assertFalse(regular.matches());
    }

    //---------------------------------------------------------------------------
//
//      Extended       A more thorough check for features of regex patterns
//                     The test cases are in a separate data file,
//                       src/test/resources/automatontst.txt
//                     A description of the test data format is included in that file.
//
//---------------------------------------------------------------------------

    static String ReadAndConvertFile(final String fileName) throws IOException {
        InputStream stream = RegexTest.class.getResourceAsStream("/" + fileName);
        Assert.assertNotNull("Missing test data " + fileName, stream);
        StringBuilder result = new StringBuilder();
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            char[] buffer = new char[4096];
            int read;
            while ((read = reader.read(buffer)) >= 0) {
                result.append(buffer, 0, read);
            }
        }
        return result.toString();
    }

    @Test
    public void Extended() throws IOException {
        String testString = ReadAndConvertFile("automatontst.txt");

        //
        //  Regex to find lines in the test data file, and to split them into fields
        //
        RegexMatcher lineMat = CompiledPattern.compile("[^\\n]*\\n").matcher(testString);
        RegexMatcher commentMat = CompiledPattern.compile("\\s*(#.*)?").matcher("");
        RegexMatcher fieldsMat = CompiledPattern.compile(
                "\\s*\"([^\"]*)\"\\s*([a-zA-Z]*)\\s*\"([^\"]*)\"\\s*(#.*)?").matcher("");

        int lineNum = 0;
        int testCount = 0;
        while (lineMat.find()) {
            lineNum++;
            String testLine = lineMat.group();
            testLine = testLine.substring(0, testLine.length() - 1);
            if (testLine.endsWith("\r")) {
                testLine = testLine.substring(0, testLine.length() - 1);
            }

            //
            //  Skip blank and comment lines
            //
            if (commentMat.reset(testLine).matches()) {
                continue;
            }

            //
            //  Parse the test line into fields
            //
            fieldsMat.reset(testLine);
            if (!fieldsMat.matches()) {
                Assert.fail("Badly formed test at line " + lineNum + ": " + testLine);
            }
            regex_find(fieldsMat.group(1), fieldsMat.group(2), fieldsMat.group(3), lineNum);
            testCount++;
        }
        REGEX_ASSERT(testCount > 20);
    }

    //---------------------------------------------------------------------------
//
//    regex_find(pattern, flags, inputString, lineNumber)
//
//         Function to run a single test from the Extended test file.
//         The input string is unescaped, then scanned for <n> and </n> tags, which mark
//         the expected spans of the groups. The tags are removed before matching.
//         Without a <0> tag no match is expected.
//
//         Flags:  i  case insensitive        d  dot excludes line terminators
//                 u  unix lines              M  use matches()
//                 L  use lookingAt()         (default is find())
//                 G  check only group 0      E  compiling the pattern must fail
//
//---------------------------------------------------------------------------
    void regex_find(final String pattern, final String flags, final String inputString, final int line) {
        long bits = 0;
        boolean useMatches = false;
        boolean useLookingAt = false;
        boolean groupZeroOnly = false;
        boolean expectCompileError = false;
        for (int i = 0; i < flags.length(); i++) {
            switch (flags.charAt(i)) {
                case 'i':
                    bits |= UREGEX_CASE_INSENSITIVE.flag;
                    break;
                case 'd':
                    bits |= UREGEX_DOT_EXCLUDES_LINE_TERMINATORS.flag;
                    break;
                case 'u':
                    bits |= UREGEX_UNIX_LINES.flag;
                    break;
                case 'M':
                    useMatches = true;
                    break;
                case 'L':
                    useLookingAt = true;
                    break;
                case 'G':
                    groupZeroOnly = true;
                    break;
                case 'E':
                    expectCompileError = true;
                    break;
                default:
                    Assert.fail("Unknown flag '" + flags.charAt(i) + "' at line " + line);
            }
        }
        final String where = "automatontst.txt line " + line + ": /" + pattern + "/ " + flags;

        if (expectCompileError) {
            try {
                CompiledPattern.compile(pattern, bits);
            } catch (UErrorException e) {
                return;
            }
            Assert.fail("Expected a compile error at " + where);
        }

        //
        //  Remove the group tags from the input, noting their positions in code points.
        //
        int[] input = Util.toCodePoints(Utility.unescape(inputString));
        RegexMatcher tagMat = CompiledPattern.compile("<(/?)([0-9]+)>").matcher(Util.fromCodePoints(input, 0, input.length));
        MutableVector32 groupStarts = new MutableVector32();
        MutableVector32 groupEnds = new MutableVector32();
        StringBuilder deTagged = new StringBuilder();
        int copied = 0;
        int deTaggedLength = 0;
        while (tagMat.find()) {
            deTagged.append(Util.fromCodePoints(input, copied, tagMat.start()));
            deTaggedLength += tagMat.start() - copied;
            copied = tagMat.end();
            int groupNum = Integer.parseInt(tagMat.group(2));
            setInt(tagMat.group(1).isEmpty() ? groupStarts : groupEnds, deTaggedLength, groupNum);
        }
        deTagged.append(Util.fromCodePoints(input, copied, input.length));

        CompiledPattern callerPattern = CompiledPattern.compile(pattern, bits);
        LambdaAssert.assertTrue(() -> "Tags for missing groups at " + where,
                groupStarts.size() <= callerPattern.groupCount() + 1);
        RegexMatcher matcher = callerPattern.matcher(deTagged);
        boolean isMatch;
        if (useMatches) {
            isMatch = matcher.matches();
        } else if (useLookingAt) {
            isMatch = matcher.lookingAt();
        } else {
            isMatch = matcher.find();
        }
        boolean expectMatch = groupStarts.size() > 0;
        LambdaAssert.assertEquals(() -> "Match result at " + where, expectMatch, isMatch);
        if (useMatches && callerPattern instanceof RegularPattern) {
            LambdaAssert.assertEquals(() -> "DFA acceptance at " + where, expectMatch,
                    ((RegularPattern) callerPattern).accepts(Util.toCodePoints(deTagged)));
        }
        if (!isMatch) {
            return;
        }

        int lastGroup = groupZeroOnly ? 0 : matcher.groupCount();
        for (int i = 0; i <= lastGroup; i++) {
            final int group = i;
            int expectedStart = i < groupStarts.size() ? groupStarts.elementAti(i) : -1;
            int expectedEnd = i < groupEnds.size() ? groupEnds.elementAti(i) : -1;
            LambdaAssert.assertEquals(() -> "Start of group " + group + " at " + where, expectedStart, matcher.start(i));
            LambdaAssert.assertEquals(() -> "End of group " + group + " at " + where, expectedEnd, matcher.end(i));
        }
    }

    /**
     * Set {@code vec[idx] = val}, growing the vector with -1 entries as needed.
     */
    static void setInt(final MutableVector32 vec, final int val, final int idx) {
        while (vec.size() <= idx) {
            vec.addElement(-1);
        }
        vec.setElementAt(val, idx);
    }
}
