package domain.ast;

import java.util.Objects;

public final class WhereNode implements AstNode {

    private final ConditionNode condition;

    public WhereNode(ConditionNode condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public ConditionNode getCondition() {
        return condition;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhere(this);
    }

    @Override
    public String getType() {
        return "WHERE";
    }

    @Override
    public String toString() {
        return "Where{" + condition + "}";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WhereNode && condition.equals(((WhereNode) o).condition);
    }

    @Override
    public int hashCode() {
        return condition.hashCode();
    }
}
