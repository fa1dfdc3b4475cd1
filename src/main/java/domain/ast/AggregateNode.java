package domain.ast;

import java.util.Objects;

/** COUNT/SUM projection. A null column means {@code *}. */
public final class AggregateNode implements AstNode {

    private final AggregateFunction function;
    private final String column;

    public AggregateNode(AggregateFunction function, String column) {
        this.function = Objects.requireNonNull(function, "function");
        this.column = (column == null || column.isBlank()) ? null : column;
    }

    public AggregateFunction getFunction() {
        return function;
    }

    /** @return the aggregated column, or null for {@code *} */
    public String getColumn() {
        return column;
    }

    /** {@code COUNT(*)}, {@code SUM(salary)}. */
    public String render() {
        return function.name() + "(" + (column == null ? "*" : column) + ")";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String getType() {
        return "AGGREGATE";
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateNode)) return false;
        AggregateNode a = (AggregateNode) o;
        return function == a.function && Objects.equals(column, a.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, column);
    }
}
