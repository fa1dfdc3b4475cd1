package domain.model;

import domain.token.Token;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Reporting view of a token: kind name and lexeme. */
public final class TokenView {

    private final String type;
    private final String value;

    public TokenView(String type, String value) {
        this.type = type == null ? "" : type;
        this.value = value == null ? "" : value;
    }

    public static TokenView of(Token token) {
        return new TokenView(token.getKind().name(), token.getLexeme());
    }

    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        m.put("value", value);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenView)) return false;
        TokenView t = (TokenView) o;
        return type.equals(t.type) && value.equals(t.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + "(" + value + ")";
    }
}
