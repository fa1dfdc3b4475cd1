package domain.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A value appearing in a condition, IN list or INSERT list.
 *
 * <p>Numbers keep their parsed value; strings keep the unquoted contents; a bare word
 * (identifier) is kept as written.</p>
 */
public final class Literal {

    public enum Kind {
        INTEGER,
        DECIMAL,
        STRING,
        IDENTIFIER
    }

    private final Kind kind;
    private final Object value;

    private Literal(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Classifies a NUMBER lexeme: decimal when it contains a point, integer otherwise.
     * Integers that do not fit a {@code long} are kept as {@link BigInteger}.
     */
    public static Literal number(String lexeme) {
        if (lexeme == null || lexeme.isBlank()) {
            throw new IllegalArgumentException("number lexeme is blank");
        }
        String t = lexeme.trim();
        if (t.indexOf('.') >= 0) {
            return new Literal(Kind.DECIMAL, Double.parseDouble(t));
        }
        try {
            return new Literal(Kind.INTEGER, Long.parseLong(t));
        } catch (NumberFormatException overflow) {
            return new Literal(Kind.INTEGER, new BigInteger(t));
        }
    }

    public static Literal of(long v) {
        return new Literal(Kind.INTEGER, v);
    }

    public static Literal of(double v) {
        return new Literal(Kind.DECIMAL, v);
    }

    public static Literal string(String s) {
        return new Literal(Kind.STRING, s == null ? "" : s);
    }

    public static Literal identifier(String word) {
        return new Literal(Kind.IDENTIFIER, word == null ? "" : word);
    }

    public Kind getKind() {
        return kind;
    }

    /** {@link Long}, {@link BigInteger}, {@link Double} or {@link String}, depending on {@link #getKind()}. */
    public Object getValue() {
        return value;
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.DECIMAL;
    }

    /** Canonical text: {@code 25}, {@code 10.5}, {@code John}. */
    public String text() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal other = (Literal) o;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + text();
    }
}
