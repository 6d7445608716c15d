package com.github.tarcv.u4jautomaton;

import com.ibm.icu.text.UnicodeSet;

enum RegexStaticSets { // 'enum' here implements the singleton pattern
    INSTANCE;

    /**
     * Highest Unicode scalar value.
     */
    static final int MAX_SCALAR = 0x10ffff;

    //
    //  Unicode Set pattern for Regular Expression  \w
    //
    static final String gIsWordPattern = "[\\p{Alphabetic}\\p{M}\\p{Nd}\\p{Pc}\\u200c\\u200d]";

    //
    //  Unicode Set Definitions for Regular Expression  \s
    //
    static final String gIsSpacePattern = "[\\p{WhiteSpace}]";

    //
    //  Unicode Set Definitions for Regular Expression  \d
    //
    static final String gIsDigitPattern = "[\\p{Nd}]";

    static final String gLineTerminatorPattern = "[\\u000a\\u000b\\u000c\\u000d\\u0085\\u2028\\u2029]";

    /**
     * Every Unicode scalar value: all code points except the surrogates.
     */
    final UnicodeSet fScalarValues;
    final UnicodeSet fWordSet;
    final UnicodeSet fSpaceSet;
    final UnicodeSet fDigitSet;
    final UnicodeSet fLineTerminators;
    final UnicodeSet fUnixLineTerminators;

    RegexStaticSets() {
        fScalarValues = new UnicodeSet(0, MAX_SCALAR).remove(0xd800, 0xdfff).freeze();
        fWordSet = new UnicodeSet().applyPattern(gIsWordPattern).freeze();
        fSpaceSet = new UnicodeSet().applyPattern(gIsSpacePattern).freeze();
        fDigitSet = new UnicodeSet().applyPattern(gIsDigitPattern).freeze();
        fLineTerminators = new UnicodeSet().applyPattern(gLineTerminatorPattern).freeze();
        fUnixLineTerminators = new UnicodeSet().add('\n').freeze();
    }

    /**
     * Complement of the given set within the scalar value space.
     */
    UnicodeSet complementOf(final UnicodeSet set) {
        return new UnicodeSet(fScalarValues).removeAll(set);
    }
}
