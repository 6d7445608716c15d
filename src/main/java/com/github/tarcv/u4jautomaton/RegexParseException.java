package com.github.tarcv.u4jautomaton;

public class RegexParseException extends UErrorException {
    private final int offset;
    private final String preContext;
    private final String postContext;

    public RegexParseException(final UErrorCode errorCode, final int offset,
                               final String preContext, final String postContext) {
        super(errorCode, errorCode + " at offset " + offset + ": \"" + preContext + "\" <-- HERE \"" + postContext + '"');
        this.offset = offset;
        this.preContext = preContext;
        this.postContext = postContext;
    }

    /**
     * Code point offset in the pattern where the error was detected.
     */
    public int getOffset() {
        return offset;
    }

    public String getPreContext() {
        return preContext;
    }

    public String getPostContext() {
        return postContext;
    }
}
