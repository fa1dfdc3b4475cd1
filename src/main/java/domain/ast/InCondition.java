package domain.ast;

import java.util.List;
import java.util.Objects;

/** {@code column IN (v1, v2, ...)}; values keep input order and may mix literal kinds. */
public final class InCondition implements ConditionNode {

    private final String column;
    private final List<Literal> values;

    public InCondition(String column, List<Literal> values) {
        this.column = Objects.requireNonNull(column, "column");
        this.values = List.copyOf(values);
    }

    public String getColumn() {
        return column;
    }

    public List<Literal> getValues() {
        return values;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIn(this);
    }

    @Override
    public String getType() {
        return "IN";
    }

    @Override
    public String toString() {
        return column + " IN " + values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InCondition)) return false;
        InCondition c = (InCondition) o;
        return column.equals(c.column) && values.equals(c.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, values);
    }
}
