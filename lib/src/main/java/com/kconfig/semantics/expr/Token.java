package com.kconfig.semantics.expr;

import java.util.Objects;

public final class Token {
    private final TokenKind kind;
    private final String value;
    private final int offset;

    public Token(TokenKind kind, String value, int offset) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.offset = offset;
    }

    public static Token of(TokenKind kind, String value) {
        return new Token(kind, value, -1);
    }

    public TokenKind getKind() {
        return kind;
    }

    /** Token text; for strings this is the text between the quotes. */
    public String getValue() {
        return value;
    }

    /** Character offset in the tokenized input, or -1 for synthesized tokens. */
    public int getOffset() {
        return offset;
    }

    /** Renders the token back to expression source. */
    public String render() {
        if (kind == TokenKind.STRING) {
            return "\"" + value + "\"";
        }
        return kind.getOperatorText() != null ? kind.getOperatorText() : value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Token)) {
            return false;
        }
        Token other = (Token) obj;
        // Offsets are positional metadata and do not take part in equality.
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
