package domain.ast;

import java.util.Objects;

/** {@code column operator value}; operator is one of {@code = != > < >= <=}. */
public final class SimpleCondition implements ConditionNode {

    private final String column;
    private final String operator;
    private final Literal value;

    public SimpleCondition(String column, String operator, Literal value) {
        this.column = Objects.requireNonNull(column, "column");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getColumn() {
        return column;
    }

    public String getOperator() {
        return operator;
    }

    public Literal getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSimpleCondition(this);
    }

    @Override
    public String getType() {
        return "CONDITION";
    }

    @Override
    public String toString() {
        return column + " " + operator + " " + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleCondition)) return false;
        SimpleCondition c = (SimpleCondition) o;
        return column.equals(c.column) && operator.equals(c.operator) && value.equals(c.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, value);
    }
}
