package com.github.tarcv.u4jautomaton;

/**
 * Base of all failures reported by pattern compilation and matching.
 * Callers that only need to know what went wrong can branch on {@link #getErrorCode()};
 * the subclasses carry the details of the more interesting cases.
 */
public class UErrorException extends RuntimeException {
    private final UErrorCode status;

    public UErrorException(final UErrorCode status) {
        super(status.name());
        this.status = status;
    }

    public UErrorException(final UErrorCode status, final String message) {
        super(message);
        this.status = status;
    }

    public UErrorException(final UErrorCode status, final Throwable cause) {
        super(status.name(), cause);
        this.status = status;
    }

    public UErrorCode getErrorCode() {
        return status;
    }

    @Override
    public String toString() {
        return "UErrorException{" +
                "status=" + status +
                ", message=" + getMessage() +
                '}';
    }
}
