package domain.ast;

import java.util.Objects;

/** {@code column LIKE pattern}; the pattern is stored as written, wildcards are added at generation time. */
public final class LikeCondition implements ConditionNode {

    private final String column;
    private final String pattern;

    public LikeCondition(String column, String pattern) {
        this.column = Objects.requireNonNull(column, "column");
        this.pattern = pattern == null ? "" : pattern;
    }

    public String getColumn() {
        return column;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLike(this);
    }

    @Override
    public String getType() {
        return "LIKE";
    }

    @Override
    public String toString() {
        return column + " LIKE " + pattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LikeCondition)) return false;
        LikeCondition c = (LikeCondition) o;
        return column.equals(c.column) && pattern.equals(c.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, pattern);
    }
}
