package domain.ast;

import java.util.Objects;

public final class GroupByNode implements AstNode {

    private final String column;

    public GroupByNode(String column) {
        this.column = Objects.requireNonNull(column, "column");
    }

    public String getColumn() {
        return column;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGroupBy(this);
    }

    @Override
    public String getType() {
        return "GROUP_BY";
    }

    @Override
    public String toString() {
        return "GroupBy{" + column + "}";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GroupByNode && column.equals(((GroupByNode) o).column);
    }

    @Override
    public int hashCode() {
        return column.hashCode();
    }
}
