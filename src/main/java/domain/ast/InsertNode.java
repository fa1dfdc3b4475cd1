package domain.ast;

import java.util.List;
import java.util.Objects;

public final class InsertNode implements Statement {

    private final String table;
    private final List<Literal> values;

    public InsertNode(String table, List<Literal> values) {
        this.table = Objects.requireNonNull(table, "table");
        this.values = List.copyOf(values);
    }

    public String getTable() {
        return table;
    }

    public List<Literal> getValues() {
        return values;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInsert(this);
    }

    @Override
    public String getType() {
        return "INSERT";
    }

    @Override
    public String toString() {
        return "Insert{" + table + ", " + values + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InsertNode)) return false;
        InsertNode n = (InsertNode) o;
        return table.equals(n.table) && values.equals(n.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, values);
    }
}
