package com.github.tarcv.u4jautomaton;

/**
 * A backreference names a capture group that the pattern does not define.
 */
public class MalformedGroupException extends UErrorException {
    private final int groupNumber;
    private final int groupCount;

    public MalformedGroupException(final int groupNumber, final int groupCount) {
        super(UErrorCode.U_REGEX_INVALID_BACK_REF,
                "Backreference \\" + groupNumber + " but the pattern defines " + groupCount + " group(s)");
        this.groupNumber = groupNumber;
        this.groupCount = groupCount;
    }

    public int getGroupNumber() {
        return groupNumber;
    }

    public int getGroupCount() {
        return groupCount;
    }
}
