package domain.token;

import java.util.Objects;

/**
 * A classified lexical unit.
 *
 * <p>{@code offset} is the position in the normalized text (see {@link TextNormalizer}),
 * not in the raw user input.</p>
 */
public final class Token {

    private final TokenKind kind;
    private final String lexeme;
    private final int offset;

    public Token(TokenKind kind, String lexeme, int offset) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lexeme = lexeme == null ? "" : lexeme;
        this.offset = offset;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return offset == other.offset && kind == other.kind && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, lexeme, offset);
    }

    @Override
    public String toString() {
        return String.format("Token{%s, '%s', offset=%d}", kind, lexeme, offset);
    }
}
