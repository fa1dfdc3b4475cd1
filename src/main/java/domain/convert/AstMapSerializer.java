package domain.convert;

import domain.ast.AggregateNode;
import domain.ast.AlterTableNode;
import domain.ast.AndCondition;
import domain.ast.AstNode;
import domain.ast.AstVisitor;
import domain.ast.BetweenCondition;
import domain.ast.DeleteNode;
import domain.ast.GroupByNode;
import domain.ast.InCondition;
import domain.ast.InsertNode;
import domain.ast.LikeCondition;
import domain.ast.Literal;
import domain.ast.OrCondition;
import domain.ast.OrderByNode;
import domain.ast.SelectNode;
import domain.ast.SimpleCondition;
import domain.ast.UpdateNode;
import domain.ast.WhereNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AST to nested maps, for reporting and for {@code TranslationResult#toMap()}.
 *
 * <p>Each node becomes a {@link LinkedHashMap} whose first key is {@code type}
 * (see {@link AstNode#getType()}). Absent optional children are kept as {@code null} values.
 * Literals become their number or string value.</p>
 */
public final class AstMapSerializer implements AstVisitor<Map<String, Object>> {

    public Map<String, Object> toMap(AstNode node) {
        return node == null ? null : node.accept(this);
    }

    private static Map<String, Object> node(AstNode n) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", n.getType());
        return m;
    }

    private static Object value(Literal v) {
        return v == null ? null : v.getValue();
    }

    private static List<Object> values(List<Literal> vs) {
        List<Object> out = new ArrayList<>(vs.size());
        for (Literal v : vs) out.add(value(v));
        return out;
    }

    @Override
    public Map<String, Object> visitSelect(SelectNode n) {
        Map<String, Object> m = node(n);
        m.put("columns", new ArrayList<>(n.getColumns()));
        m.put("table", n.getTable());
        m.put("distinct", n.isDistinct());
        m.put("where", toMap(n.getWhere()));
        m.put("order_by", toMap(n.getOrderBy()));
        m.put("group_by", toMap(n.getGroupBy()));
        m.put("aggregate", toMap(n.getAggregate()));
        return m;
    }

    @Override
    public Map<String, Object> visitWhere(WhereNode n) {
        Map<String, Object> m = node(n);
        m.put("condition", toMap(n.getCondition()));
        return m;
    }

    @Override
    public Map<String, Object> visitSimpleCondition(SimpleCondition n) {
        Map<String, Object> m = node(n);
        m.put("column", n.getColumn());
        m.put("operator", n.getOperator());
        m.put("value", value(n.getValue()));
        return m;
    }

    @Override
    public Map<String, Object> visitAnd(AndCondition n) {
        Map<String, Object> m = node(n);
        m.put("left", toMap(n.getLeft()));
        m.put("right", toMap(n.getRight()));
        return m;
    }

    @Override
    public Map<String, Object> visitOr(OrCondition n) {
        Map<String, Object> m = node(n);
        m.put("left", toMap(n.getLeft()));
        m.put("right", toMap(n.getRight()));
        return m;
    }

    @Override
    public Map<String, Object> visitBetween(BetweenCondition n) {
        Map<String, Object> m = node(n);
        m.put("column", n.getColumn());
        m.put("low", value(n.getLow()));
        m.put("high", value(n.getHigh()));
        return m;
    }

    @Override
    public Map<String, Object> visitIn(InCondition n) {
        Map<String, Object> m = node(n);
        m.put("column", n.getColumn());
        m.put("values", values(n.getValues()));
        return m;
    }

    @Override
    public Map<String, Object> visitLike(LikeCondition n) {
        Map<String, Object> m = node(n);
        m.put("column", n.getColumn());
        m.put("pattern", n.getPattern());
        return m;
    }

    @Override
    public Map<String, Object> visitOrderBy(OrderByNode n) {
        Map<String, Object> m = node(n);
        m.put("column", n.getColumn());
        m.put("direction", n.getDirection().name());
        return m;
    }

    @Override
    public Map<String, Object> visitGroupBy(GroupByNode n) {
        Map<String, Object> m = node(n);
        m.put("column", n.getColumn());
        return m;
    }

    @Override
    public Map<String, Object> visitAggregate(AggregateNode n) {
        Map<String, Object> m = node(n);
        m.put("function", n.getFunction().name());
        m.put("column", n.getColumn());
        return m;
    }

    @Override
    public Map<String, Object> visitInsert(InsertNode n) {
        Map<String, Object> m = node(n);
        m.put("table", n.getTable());
        m.put("values", values(n.getValues()));
        return m;
    }

    @Override
    public Map<String, Object> visitUpdate(UpdateNode n) {
        Map<String, Object> m = node(n);
        m.put("table", n.getTable());
        m.put("set_column", n.getSetColumn());
        m.put("set_value", value(n.getSetValue()));
        m.put("where", toMap(n.getWhere()));
        return m;
    }

    @Override
    public Map<String, Object> visitDelete(DeleteNode n) {
        Map<String, Object> m = node(n);
        m.put("table", n.getTable());
        m.put("where", toMap(n.getWhere()));
        return m;
    }

    @Override
    public Map<String, Object> visitAlterTable(AlterTableNode n) {
        Map<String, Object> m = node(n);
        m.put("table", n.getTable());
        m.put("action", n.getAction().name());
        m.put("columns", new ArrayList<>(n.getColumns()));
        return m;
    }
}
