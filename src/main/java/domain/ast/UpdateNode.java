package domain.ast;

import java.util.Objects;

/** {@code UPDATE table SET setColumn = setValue [WHERE ...]}; where may be null. */
public final class UpdateNode implements Statement {

    private final String table;
    private final String setColumn;
    private final Literal setValue;
    private final WhereNode where;

    public UpdateNode(String table, String setColumn, Literal setValue, WhereNode where) {
        this.table = Objects.requireNonNull(table, "table");
        this.setColumn = Objects.requireNonNull(setColumn, "setColumn");
        this.setValue = Objects.requireNonNull(setValue, "setValue");
        this.where = where;
    }

    public String getTable() {
        return table;
    }

    public String getSetColumn() {
        return setColumn;
    }

    public Literal getSetValue() {
        return setValue;
    }

    public WhereNode getWhere() {
        return where;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUpdate(this);
    }

    @Override
    public String getType() {
        return "UPDATE";
    }

    @Override
    public String toString() {
        return "Update{" + table + ", " + setColumn + "=" + setValue + ", where=" + where + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpdateNode)) return false;
        UpdateNode n = (UpdateNode) o;
        return table.equals(n.table) && setColumn.equals(n.setColumn)
                && setValue.equals(n.setValue) && Objects.equals(where, n.where);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, setColumn, setValue, where);
    }
}
