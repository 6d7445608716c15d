package com.github.tarcv.u4jautomaton;

/**
 * The subset of ICU's error codes this library reports. {@link #getIndex()} returns ICU's own numeric value.
 */
public enum UErrorCode {
    U_ZERO_ERROR(0),
    U_ILLEGAL_ARGUMENT_ERROR(1),
    /*
     * Error codes in the range 0x10300-0x103ff are reserved for regular expression related errors.
     */
    U_REGEX_INTERNAL_ERROR(0x10300),       /**< An internal error (bug) was detected.              */
    U_REGEX_RULE_SYNTAX(0x10301),          /**< Syntax error in regexp pattern.                    */
    U_REGEX_BAD_ESCAPE_SEQUENCE(0x10303),  /**< Unrecognized backslash escape sequence in pattern  */
    U_REGEX_UNIMPLEMENTED(0x10305),        /**< Use of regexp feature that is not implemented.     */
    U_REGEX_MISMATCHED_PAREN(0x10306),     /**< Incorrectly nested parentheses in regexp pattern.  */
    U_REGEX_NUMBER_TOO_BIG(0x10307),       /**< Decimal number is too large.                       */
    U_REGEX_BAD_INTERVAL(0x10308),         /**< Error in {min,max} interval                        */
    U_REGEX_MAX_LT_MIN(0x10309),           /**< In {min,max}, max is less than min.                */
    U_REGEX_INVALID_BACK_REF(0x1030a),     /**< Back-reference to a non-existent capture group.    */
    U_REGEX_INVALID_FLAG(0x1030b),         /**< Invalid value for match mode flags.                */
    U_REGEX_MISSING_CLOSE_BRACKET(0x1030f), /**< Missing closing bracket on a bracket expression.  */
    U_REGEX_INVALID_RANGE(0x10310),        /**< In a character range [x-y], x is greater than y.   */
    U_REGEX_TIME_OUT(0x10312),             /**< Maximum allowed match time exceeded                */
    U_REGEX_STOPPED_BY_CALLER(0x10313),    /**< Matching operation aborted by user callback fn.    */
    U_REGEX_PATTERN_TOO_BIG(0x10314),      /**< Pattern exceeds limits on size or complexity.      */
    ;

    private final int index;

    UErrorCode(final int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public boolean isFailure() {
        return this != U_ZERO_ERROR;
    }
}
