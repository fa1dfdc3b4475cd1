package domain.ast;

import java.util.Objects;

public final class DeleteNode implements Statement {

    private final String table;
    private final WhereNode where;

    public DeleteNode(String table, WhereNode where) {
        this.table = Objects.requireNonNull(table, "table");
        this.where = where;
    }

    public String getTable() {
        return table;
    }

    /** @return the WHERE clause, or null for an unconditional delete */
    public WhereNode getWhere() {
        return where;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDelete(this);
    }

    @Override
    public String getType() {
        return "DELETE";
    }

    @Override
    public String toString() {
        return "Delete{" + table + ", where=" + where + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeleteNode)) return false;
        DeleteNode n = (DeleteNode) o;
        return table.equals(n.table) && Objects.equals(where, n.where);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, where);
    }
}
