package domain.parse;

import domain.token.Token;
import domain.token.TokenKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Why a parse stopped: what the grammar expected at that point and what it found.
 *
 * <p>Value object; produced by {@link Parser}, carried by {@link ParseResult}.</p>
 */
public final class ParseError {

    private final Set<TokenKind> expected;
    private final TokenKind actual;
    private final String lexeme;
    private final int offset;
    private final String message;

    public ParseError(Set<TokenKind> expected, Token found, String message) {
        this.expected = (expected == null || expected.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(expected));
        this.actual = found == null ? TokenKind.EOF : found.getKind();
        this.lexeme = found == null ? "" : found.getLexeme();
        this.offset = found == null ? -1 : found.getOffset();
        this.message = message == null ? "" : message;
    }

    public static ParseError expected(TokenKind expected, Token found) {
        return new ParseError(EnumSet.of(expected), found,
                "Expected " + expected + ", got " + describe(found));
    }

    public static ParseError unexpected(Token found) {
        return new ParseError(Collections.emptySet(), found, "Unexpected token: " + describe(found));
    }

    static String describe(Token t) {
        if (t == null) return TokenKind.EOF.name();
        if (t.is(TokenKind.EOF)) return "EOF";
        return t.getKind() + " '" + t.getLexeme() + "'";
    }

    /** Empty when the failure is not tied to one specific kind (e.g. an unknown statement start). */
    public Set<TokenKind> getExpected() {
        return expected;
    }

    public TokenKind getActual() {
        return actual;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** Offset in the normalized text, -1 when unknown. */
    public int getOffset() {
        return offset;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return offset >= 0 ? "at " + offset + ": " + message : message;
    }
}
