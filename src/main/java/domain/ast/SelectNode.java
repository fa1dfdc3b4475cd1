package domain.ast;

import java.util.List;
import java.util.Objects;

/**
 * SELECT statement.
 *
 * <p>{@code columns} is never empty ({@code ["*"]} when no projection was given) and
 * {@code table} is never blank. COUNT/SUM/FIND queries are represented as a SELECT with an
 * {@link AggregateNode} or a plain projection.</p>
 */
public final class SelectNode implements Statement {

    private final List<String> columns;
    private final String table;
    private final WhereNode where;
    private final OrderByNode orderBy;
    private final GroupByNode groupBy;
    private final AggregateNode aggregate;
    private final boolean distinct;

    public SelectNode(
            List<String> columns,
            String table,
            WhereNode where,
            OrderByNode orderBy,
            GroupByNode groupBy,
            AggregateNode aggregate,
            boolean distinct
    ) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("select table is blank");
        }
        this.columns = (columns == null || columns.isEmpty()) ? List.of("*") : List.copyOf(columns);
        this.table = table;
        this.where = where;
        this.orderBy = orderBy;
        this.groupBy = groupBy;
        this.aggregate = aggregate;
        this.distinct = distinct;
    }

    public static SelectNode all(String table, WhereNode where) {
        return new SelectNode(List.of("*"), table, where, null, null, null, false);
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getTable() {
        return table;
    }

    public WhereNode getWhere() {
        return where;
    }

    public OrderByNode getOrderBy() {
        return orderBy;
    }

    public GroupByNode getGroupBy() {
        return groupBy;
    }

    public AggregateNode getAggregate() {
        return aggregate;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }

    @Override
    public String getType() {
        return "SELECT";
    }

    @Override
    public String toString() {
        return "Select{columns=" + columns + ", table=" + table
                + ", where=" + where + ", orderBy=" + orderBy + ", groupBy=" + groupBy
                + ", aggregate=" + aggregate + ", distinct=" + distinct + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectNode)) return false;
        SelectNode s = (SelectNode) o;
        return distinct == s.distinct
                && columns.equals(s.columns)
                && table.equals(s.table)
                && Objects.equals(where, s.where)
                && Objects.equals(orderBy, s.orderBy)
                && Objects.equals(groupBy, s.groupBy)
                && Objects.equals(aggregate, s.aggregate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, table, where, orderBy, groupBy, aggregate, distinct);
    }
}
