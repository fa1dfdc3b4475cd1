package domain.ast;

import java.util.Objects;

public final class BetweenCondition implements ConditionNode {

    private final String column;
    private final Literal low;
    private final Literal high;

    public BetweenCondition(String column, Literal low, Literal high) {
        this.column = Objects.requireNonNull(column, "column");
        this.low = Objects.requireNonNull(low, "low");
        this.high = Objects.requireNonNull(high, "high");
    }

    public String getColumn() {
        return column;
    }

    public Literal getLow() {
        return low;
    }

    public Literal getHigh() {
        return high;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBetween(this);
    }

    @Override
    public String getType() {
        return "BETWEEN";
    }

    @Override
    public String toString() {
        return column + " BETWEEN " + low + " AND " + high;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BetweenCondition)) return false;
        BetweenCondition b = (BetweenCondition) o;
        return column.equals(b.column) && low.equals(b.low) && high.equals(b.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, low, high);
    }
}
