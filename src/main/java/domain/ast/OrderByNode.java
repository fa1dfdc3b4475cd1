package domain.ast;

import java.util.Objects;

public final class OrderByNode implements AstNode {

    public static final String DEFAULT_COLUMN = "id";

    private final String column;
    private final SortDirection direction;

    public OrderByNode(String column, SortDirection direction) {
        this.column = (column == null || column.isBlank()) ? DEFAULT_COLUMN : column;
        this.direction = direction == null ? SortDirection.ASC : direction;
    }

    public String getColumn() {
        return column;
    }

    public SortDirection getDirection() {
        return direction;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitOrderBy(this);
    }

    @Override
    public String getType() {
        return "ORDER_BY";
    }

    @Override
    public String toString() {
        return "OrderBy{" + column + " " + direction + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderByNode)) return false;
        OrderByNode n = (OrderByNode) o;
        return column.equals(n.column) && direction == n.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, direction);
    }
}
