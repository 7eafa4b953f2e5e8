package com.kconfig.semantics.expr;

public final class LexException extends ExpressionException {
    private final String remainder;
    private final int offset;

    public LexException(String remainder, int offset, Throwable cause) {
        super("Unknown symbol: " + remainder, cause);
        this.remainder = remainder;
        this.offset = offset;
    }

    public LexException(String message, String remainder, int offset) {
        super(message);
        this.remainder = remainder;
        this.offset = offset;
    }

    /** The unconsumed input starting at the first character no token rule matched. */
    public String getRemainder() {
        return remainder;
    }

    public int getOffset() {
        return offset;
    }
}
