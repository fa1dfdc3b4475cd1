package domain.convert;

import domain.ast.AggregateNode;
import domain.ast.AlterTableNode;
import domain.ast.AndCondition;
import domain.ast.AstVisitor;
import domain.ast.BetweenCondition;
import domain.ast.DeleteNode;
import domain.ast.GroupByNode;
import domain.ast.InCondition;
import domain.ast.InsertNode;
import domain.ast.LikeCondition;
import domain.ast.OrCondition;
import domain.ast.OrderByNode;
import domain.ast.SelectNode;
import domain.ast.SimpleCondition;
import domain.ast.Statement;
import domain.ast.UpdateNode;
import domain.ast.WhereNode;

import java.util.stream.Collectors;

/**
 * AST to SQL text.
 *
 * <p>Every statement ends with {@code ;}. SELECT clauses are emitted in the order
 * WHERE, ORDER BY, GROUP BY. Only OR is parenthesized; AND is emitted bare.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class SqlGenerator implements AstVisitor<String> {

    public String generate(Statement statement) {
        if (statement == null) {
            throw new IllegalStateException("No statement to generate SQL from");
        }
        return statement.accept(this);
    }

    // ------------------------------------------------------------
    // statements
    // ------------------------------------------------------------

    @Override
    public String visitSelect(SelectNode node) {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (node.isDistinct()) sb.append("DISTINCT ");

        if (node.getAggregate() != null) {
            sb.append(node.getAggregate().accept(this));
        } else {
            sb.append(String.join(", ", node.getColumns()));
        }
        sb.append(" FROM ").append(node.getTable());

        if (node.getWhere() != null) sb.append(" WHERE ").append(node.getWhere().accept(this));
        if (node.getOrderBy() != null) sb.append(' ').append(node.getOrderBy().accept(this));
        if (node.getGroupBy() != null) sb.append(' ').append(node.getGroupBy().accept(this));

        return sb.append(';').toString();
    }

    @Override
    public String visitInsert(InsertNode node) {
        String values = node.getValues().stream()
                .map(SqlValueFormatter::format)
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + node.getTable() + " VALUES (" + values + ");";
    }

    @Override
    public String visitUpdate(UpdateNode node) {
        StringBuilder sb = new StringBuilder("UPDATE ")
                .append(node.getTable())
                .append(" SET ")
                .append(node.getSetColumn())
                .append(" = ")
                .append(SqlValueFormatter.format(node.getSetValue()));
        if (node.getWhere() != null) sb.append(" WHERE ").append(node.getWhere().accept(this));
        return sb.append(';').toString();
    }

    @Override
    public String visitDelete(DeleteNode node) {
        StringBuilder sb = new StringBuilder("DELETE FROM ").append(node.getTable());
        if (node.getWhere() != null) sb.append(" WHERE ").append(node.getWhere().accept(this));
        return sb.append(';').toString();
    }

    @Override
    public String visitAlterTable(AlterTableNode node) {
        return "ALTER TABLE " + node.getTable() + " "
                + node.getAction().getSql() + " "
                + String.join(", ", node.getColumns()) + ";";
    }

    // ------------------------------------------------------------
    // clauses
    // ------------------------------------------------------------

    /** Condition text only; callers add the WHERE keyword. */
    @Override
    public String visitWhere(WhereNode node) {
        return node.getCondition().accept(this);
    }

    @Override
    public String visitSimpleCondition(SimpleCondition node) {
        return node.getColumn() + " " + node.getOperator() + " " + SqlValueFormatter.format(node.getValue());
    }

    @Override
    public String visitAnd(AndCondition node) {
        return node.getLeft().accept(this) + " AND " + node.getRight().accept(this);
    }

    @Override
    public String visitOr(OrCondition node) {
        return "(" + node.getLeft().accept(this) + " OR " + node.getRight().accept(this) + ")";
    }

    @Override
    public String visitBetween(BetweenCondition node) {
        return node.getColumn() + " BETWEEN " + node.getLow().text() + " AND " + node.getHigh().text();
    }

    @Override
    public String visitIn(InCondition node) {
        String values = node.getValues().stream()
                .map(SqlValueFormatter::format)
                .collect(Collectors.joining(", "));
        return node.getColumn() + " IN (" + values + ")";
    }

    @Override
    public String visitLike(LikeCondition node) {
        String pattern = node.getPattern();
        if (pattern.indexOf('%') < 0) {
            pattern = "%" + pattern + "%";
        }
        return node.getColumn() + " LIKE " + SqlValueFormatter.quote(pattern);
    }

    @Override
    public String visitOrderBy(OrderByNode node) {
        return "ORDER BY " + node.getColumn() + " " + node.getDirection().name();
    }

    @Override
    public String visitGroupBy(GroupByNode node) {
        return "GROUP BY " + node.getColumn();
    }

    @Override
    public String visitAggregate(AggregateNode node) {
        return node.render();
    }
}
