package domain.ast;

import java.util.List;
import java.util.Objects;

public final class AlterTableNode implements Statement {

    private final String table;
    private final AlterAction action;
    private final List<String> columns;

    public AlterTableNode(String table, AlterAction action, List<String> columns) {
        this.table = Objects.requireNonNull(table, "table");
        this.action = Objects.requireNonNull(action, "action");
        this.columns = List.copyOf(columns);
    }

    public static AlterTableNode dropColumns(String table, List<String> columns) {
        return new AlterTableNode(table, AlterAction.DROP_COLUMN, columns);
    }

    public String getTable() {
        return table;
    }

    public AlterAction getAction() {
        return action;
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAlterTable(this);
    }

    @Override
    public String getType() {
        return "ALTER_TABLE";
    }

    @Override
    public String toString() {
        return "AlterTable{" + table + ", " + action.getSql() + " " + columns + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlterTableNode)) return false;
        AlterTableNode n = (AlterTableNode) o;
        return table.equals(n.table) && action == n.action && columns.equals(n.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, action, columns);
    }
}
