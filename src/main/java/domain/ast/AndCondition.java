package domain.ast;

import java.util.Objects;

/** {@code left AND right}. Chains are built left to right, without precedence over OR. */
public final class AndCondition implements ConditionNode {

    private final ConditionNode left;
    private final ConditionNode right;

    public AndCondition(ConditionNode left, ConditionNode right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public ConditionNode getLeft() {
        return left;
    }

    public ConditionNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String getType() {
        return "AND";
    }

    @Override
    public String toString() {
        return "AND(" + left + ", " + right + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AndCondition)) return false;
        AndCondition c = (AndCondition) o;
        return left.equals(c.left) && right.equals(c.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), left, right);
    }
}
