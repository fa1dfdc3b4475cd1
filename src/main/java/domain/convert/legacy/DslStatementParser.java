package domain.convert.legacy;

import domain.ast.AggregateFunction;
import domain.ast.AggregateNode;
import domain.ast.AlterTableNode;
import domain.ast.AndCondition;
import domain.ast.BetweenCondition;
import domain.ast.ConditionNode;
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
import domain.ast.SortDirection;
import domain.ast.Statement;
import domain.ast.UpdateNode;
import domain.ast.WhereNode;
import domain.convert.SqlValueFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DSL text (as produced by {@link LegacyDslTranslator}) back to the statement AST.
 *
 * <p>Recognizes INSERT, UPDATE, DELETE, ALTER TABLE ... DROP COLUMN, and SELECT with DISTINCT,
 * COUNT/SUM, and one WHERE shape (two-condition AND/OR, LIKE, IN, BETWEEN or a single
 * comparison), plus ORDER BY and GROUP BY.</p>
 */
public final class DslStatementParser {

    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final String OP = "(>=|<=|!=|=|>|<)";

    private static final Pattern INSERT = Pattern.compile("INSERT INTO (\\w+) VALUES \\((.+)\\)", CI);
    private static final Pattern UPDATE = Pattern.compile(
            "UPDATE (\\w+) SET (\\w+)\\s*=\\s*(.+?) WHERE (\\w+)\\s*=\\s*(.+)", CI);
    private static final Pattern DELETE = Pattern.compile("DELETE FROM (\\w+) WHERE (\\w+)\\s*" + OP + "\\s*(.+)", CI);
    private static final Pattern DROP_COLUMN = Pattern.compile("ALTER TABLE (\\w+) (DROP COLUMN .+)", CI);
    private static final Pattern DISTINCT = Pattern.compile("SELECT DISTINCT (\\w+) FROM (\\w+)", CI);
    private static final Pattern AGGREGATE = Pattern.compile("SELECT (COUNT|SUM)\\((\\w+|\\*)\\) FROM (\\w+)", CI);
    private static final Pattern SELECT = Pattern.compile("SELECT (.+?) FROM (\\w+)", CI);

    private static final Pattern WHERE_AND_OR = Pattern.compile(
            "WHERE (\\w+) " + OP + " (\\w+) (AND|OR) (\\w+) " + OP + " (\\w+)", CI);
    private static final Pattern WHERE_LIKE = Pattern.compile("WHERE (\\w+) LIKE '(.+)'", CI);
    private static final Pattern WHERE_IN = Pattern.compile("WHERE (\\w+) IN \\((.+)\\)", CI);
    private static final Pattern WHERE_BETWEEN = Pattern.compile("WHERE (\\w+) BETWEEN (\\d+) AND (\\d+)", CI);
    private static final Pattern WHERE_SIMPLE = Pattern.compile(
            "WHERE (\\w+)\\s*" + OP + "\\s*(.+?)(?:\\s+ORDER|\\s+GROUP|$)", CI);

    private static final Pattern ORDER_BY = Pattern.compile("ORDER BY (\\w+)(?: (ASC|DESC))?", CI);
    private static final Pattern GROUP_BY = Pattern.compile("GROUP BY (\\w+)", CI);

    /**
     * @return the statement, or empty when the DSL has none of the recognized shapes
     *         (including {@link LegacyDslTranslator#NO_MATCH})
     */
    public Optional<Statement> parse(String dsl) {
        if (dsl == null) return Optional.empty();
        String t = dsl.trim();
        if (t.isEmpty()) return Optional.empty();

        Matcher m = INSERT.matcher(t);
        if (m.lookingAt()) {
            return Optional.of(new InsertNode(m.group(1), literals(m.group(2))));
        }

        m = UPDATE.matcher(t);
        if (m.lookingAt()) {
            WhereNode where = new WhereNode(new SimpleCondition(m.group(4), "=", literal(m.group(5))));
            return Optional.of(new UpdateNode(m.group(1), m.group(2), literal(m.group(3)), where));
        }

        m = DELETE.matcher(t);
        if (m.lookingAt()) {
            WhereNode where = new WhereNode(new SimpleCondition(m.group(2), m.group(3), literal(m.group(4))));
            return Optional.of(new DeleteNode(m.group(1), where));
        }

        m = DROP_COLUMN.matcher(t);
        if (m.lookingAt()) {
            List<String> columns = new ArrayList<>();
            for (String part : m.group(2).split(",")) {
                String c = part.trim().replaceFirst("(?i)^DROP COLUMN\\s+", "").trim();
                if (!c.isEmpty()) columns.add(c);
            }
            return Optional.of(AlterTableNode.dropColumns(m.group(1), columns));
        }

        m = DISTINCT.matcher(t);
        if (m.lookingAt()) {
            return Optional.of(new SelectNode(List.of(m.group(1)), m.group(2), where(t), null, null, null, true));
        }

        m = AGGREGATE.matcher(t);
        if (m.lookingAt()) {
            AggregateFunction fn = AggregateFunction.valueOf(m.group(1).toUpperCase(Locale.ROOT));
            String column = "*".equals(m.group(2)) ? null : m.group(2);
            AggregateNode aggregate = new AggregateNode(fn, column);
            return Optional.of(new SelectNode(List.of(aggregate.render()), m.group(3),
                    where(t), orderBy(t), groupBy(t), aggregate, false));
        }

        m = SELECT.matcher(t);
        if (!m.lookingAt()) return Optional.empty();

        String rawColumns = m.group(1).trim();
        List<String> columns = new ArrayList<>();
        if ("*".equals(rawColumns)) {
            columns.add("*");
        } else {
            for (String c : rawColumns.split(",")) {
                if (!c.trim().isEmpty()) columns.add(c.trim());
            }
        }
        return Optional.of(new SelectNode(columns, m.group(2), where(t), orderBy(t), groupBy(t), null, false));
    }

    private static WhereNode where(String t) {
        ConditionNode condition = condition(t);
        return condition == null ? null : new WhereNode(condition);
    }

    private static ConditionNode condition(String t) {
        Matcher m = WHERE_AND_OR.matcher(t);
        if (m.find()) {
            ConditionNode left = new SimpleCondition(m.group(1), m.group(2), literal(m.group(3)));
            ConditionNode right = new SimpleCondition(m.group(5), m.group(6), literal(m.group(7)));
            return "AND".equalsIgnoreCase(m.group(4)) ? new AndCondition(left, right) : new OrCondition(left, right);
        }

        m = WHERE_LIKE.matcher(t);
        if (m.find()) return new LikeCondition(m.group(1), m.group(2));

        m = WHERE_IN.matcher(t);
        if (m.find()) return new InCondition(m.group(1), literals(m.group(2)));

        m = WHERE_BETWEEN.matcher(t);
        if (m.find()) {
            return new BetweenCondition(m.group(1), Literal.number(m.group(2)), Literal.number(m.group(3)));
        }

        m = WHERE_SIMPLE.matcher(t);
        if (m.find()) return new SimpleCondition(m.group(1), m.group(2), literal(m.group(3).trim()));

        return null;
    }

    private static OrderByNode orderBy(String t) {
        Matcher m = ORDER_BY.matcher(t);
        if (!m.find()) return null;
        SortDirection dir = "DESC".equalsIgnoreCase(m.group(2)) ? SortDirection.DESC : SortDirection.ASC;
        return new OrderByNode(m.group(1), dir);
    }

    private static GroupByNode groupBy(String t) {
        Matcher m = GROUP_BY.matcher(t);
        return m.find() ? new GroupByNode(m.group(1)) : null;
    }

    private static List<Literal> literals(String csv) {
        List<Literal> out = new ArrayList<>();
        for (String v : csv.split(",")) {
            if (!v.trim().isEmpty()) out.add(literal(v));
        }
        return out;
    }

    /** {@code 'text'} is a string, numeric text a number, anything else a bare word. */
    static Literal literal(String raw) {
        String v = raw == null ? "" : raw.trim();
        if (v.length() >= 2 && v.startsWith("'") && v.endsWith("'")) {
            return Literal.string(v.substring(1, v.length() - 1));
        }
        if (SqlValueFormatter.isNumeric(v)) {
            return Literal.number(v);
        }
        return Literal.identifier(v);
    }
}
