package domain.ast;

import java.util.Objects;

public final class OrCondition implements ConditionNode {

    private final ConditionNode left;
    private final ConditionNode right;

    public OrCondition(ConditionNode left, ConditionNode right) {
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
        return visitor.visitOr(this);
    }

    @Override
    public String getType() {
        return "OR";
    }

    @Override
    public String toString() {
        return "OR(" + left + ", " + right + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrCondition)) return false;
        OrCondition c = (OrCondition) o;
        return left.equals(c.left) && right.equals(c.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), left, right);
    }
}
