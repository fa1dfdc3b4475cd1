package domain.convert.legacy;

import domain.token.TextNormalizer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * English to DSL by ordered regex rules. Used when the grammar parser rejects the input.
 *
 * <p>The DSL is SQL-shaped text without the trailing semicolon, e.g.
 * {@code SELECT * FROM users WHERE age > 20}. Rules are tried top to bottom and anchored at the
 * start of the normalized text; the first match wins and anything after the matched prefix is
 * ignored. When nothing matches, {@link #NO_MATCH} is returned.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class LegacyDslTranslator {

    public static final String NO_MATCH = "No matching rule found";

    private static final String OP = "(>=|<=|!=|=|>|<)";

    private record Rule(String name, Pattern pattern, Function<Matcher, String> build) {
    }

    private static final List<Rule> RULES = List.of(
            rule("select-all",
                    "(?:select|show|list) all(?: (\\w+))? (?:of|from) (\\w+)(?:\\s+where\\s+(\\w+)\\s*" + OP + "\\s*(\\d+))?",
                    m -> {
                        String q = "SELECT " + (m.group(1) == null ? "*" : m.group(1)) + " FROM " + m.group(2);
                        if (m.group(3) != null) q += " WHERE " + m.group(3) + " " + m.group(4) + " " + m.group(5);
                        return q;
                    }),

            rule("select-column-where",
                    "(?:select|show|list) (?:all\\s+)?(\\w+) from (\\w+) where (\\w+) (>|<|=) (\\d+)",
                    m -> "SELECT " + m.group(1) + " FROM " + m.group(2)
                            + " WHERE " + m.group(3) + " " + m.group(4) + " " + m.group(5)),

            rule("count",
                    "(?:count|how many)\\s+(\\w+)(?:\\s+from\\s+(\\w+))?(?:\\s+where\\s+(\\w+)\\s*(=|>|<)\\s*(\\d+))?",
                    m -> {
                        String col = m.group(1);
                        String table = m.group(2);
                        if (table == null) {
                            table = col;
                            col = null;
                        }
                        String q = "SELECT COUNT(" + (col == null ? "*" : col) + ") FROM " + table;
                        if (m.group(3) != null) q += " WHERE " + m.group(3) + " " + m.group(4) + " " + m.group(5);
                        return q;
                    }),

            rule("sum",
                    "(?:sum|total)(?: (\\w+))? from (\\w+)(?: where (\\w+)\\s*=\\s*(\\w+))?",
                    m -> {
                        String q = "SELECT SUM(" + (m.group(1) == null ? "*" : m.group(1)) + ") FROM " + m.group(2);
                        if (m.group(3) != null) q += " WHERE " + m.group(3) + " = " + m.group(4);
                        return q;
                    }),

            rule("order-by-where",
                    "(?:select|show) all (\\w+) where (\\w+) " + OP + " (\\w+) order by(?: (\\w+))?(?: (asc|desc))?",
                    m -> ("SELECT * FROM " + m.group(1)
                            + " WHERE " + m.group(2) + " " + m.group(3) + " " + m.group(4)
                            + " ORDER BY " + orDefault(m.group(5), "id") + " " + upper(m.group(6))).trim()),

            rule("order-by",
                    "(?:select|show) all (\\w+) order by(?: (\\w+))?(?: (asc|desc))?",
                    m -> ("SELECT * FROM " + m.group(1)
                            + " ORDER BY " + orDefault(m.group(2), "id") + " " + upper(m.group(3))).trim()),

            rule("group-by",
                    "(?:select|show) (\\w+(?:, \\w+)*) from (\\w+) group by (\\w+)",
                    m -> "SELECT " + splitJoin(m.group(1), ", ") + " FROM " + m.group(2) + " GROUP BY " + m.group(3)),

            rule("two-conditions",
                    "(?:select|show|display)(?:\\s+(all))?(?:\\s+([\\w, ]+?))?(?:\\s+from)?\\s+(\\w+)\\s+where\\s+"
                            + "(\\w+)\\s*(>|<|=)\\s*(\\d+)\\s+(and|or)\\s+(\\w+)\\s*(>|<|=)\\s*(\\d+)",
                    m -> {
                        String select = (m.group(1) != null || m.group(2) == null)
                                ? "SELECT *"
                                : "SELECT " + splitJoin(m.group(2), ", ");
                        return select + " FROM " + m.group(3)
                                + " WHERE " + m.group(4) + " " + m.group(5) + " " + m.group(6)
                                + " " + m.group(7).toUpperCase(Locale.ROOT) + " "
                                + m.group(8) + " " + m.group(9) + " " + m.group(10);
                    }),

            rule("insert",
                    "(?:insert into|add new row into)\\s+(\\w+)\\s+values\\s+(.+)",
                    m -> "INSERT INTO " + m.group(1) + " VALUES (" + unwrapParens(m.group(2)) + ")"),

            rule("update",
                    "(?:update|change)\\s+(\\w+)\\s+set\\s+(\\w+)\\s*=\\s*([\\w' ]+?)\\s+where\\s+(\\w+)\\s*=\\s*([\\w' ]+)",
                    m -> "UPDATE " + m.group(1) + " SET " + m.group(2) + " = " + m.group(3).trim()
                            + " WHERE " + m.group(4) + " = " + m.group(5).trim()),

            rule("delete",
                    "(?:delete from|remove from)\\s+(\\w+)\\s+where\\s+(\\w+)\\s*(=|>|<)\\s*([\\w' ]+)",
                    m -> "DELETE FROM " + m.group(1) + " WHERE " + m.group(2) + " " + m.group(3) + " " + m.group(4).trim()),

            rule("drop-column",
                    "(?:delete|remove)\\s+(?:columns|column|col)\\s+([\\w, ]+?)\\s+from\\s+(\\w+)",
                    m -> "ALTER TABLE " + m.group(2) + " " + split(m.group(1)).stream()
                            .map(c -> "DROP COLUMN " + c)
                            .collect(Collectors.joining(", "))),

            rule("contains",
                    "(?:find|search)\\s+(\\w+)\\s+where\\s+(\\w+)\\s+(?:contains|like)\\s+'(.+)'",
                    m -> "SELECT * FROM " + m.group(1) + " WHERE " + m.group(2) + " LIKE '%" + m.group(3) + "%'"),

            rule("between",
                    "select\\s+(\\w+)\\s+where\\s+(\\w+)\\s+between\\s+(\\d+)\\s+and\\s+(\\d+)",
                    m -> "SELECT * FROM " + m.group(1) + " WHERE " + m.group(2)
                            + " BETWEEN " + m.group(3) + " AND " + m.group(4)),

            rule("in",
                    "select\\s+(\\w+)\\s+where\\s+(\\w+)\\s+in\\s+(.+)",
                    m -> "SELECT * FROM " + m.group(1) + " WHERE " + m.group(2)
                            + " IN (" + splitJoin(unwrapParens(m.group(3)), ",") + ")"),

            rule("distinct",
                    "select\\s+(?:distinct|unique)\\s+(\\w+)\\s+from\\s+(\\w+)",
                    m -> "SELECT DISTINCT " + m.group(1) + " FROM " + m.group(2)),

            rule("show-me",
                    "(?:show|give|display|get)\\s+me\\s+(?:all\\s+)?(\\w+)",
                    m -> "SELECT * FROM " + m.group(1)),

            rule("get-all",
                    "get\\s+all\\s+(\\w+)",
                    m -> "SELECT * FROM " + m.group(1))
    );

    private static Rule rule(String name, String regex, Function<Matcher, String> build) {
        return new Rule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), build);
    }

    /**
     * Translates {@code text} to DSL, or returns {@link #NO_MATCH}.
     */
    public String toDsl(String text) {
        String t = TextNormalizer.normalize(text);
        if (t.isEmpty()) return NO_MATCH;

        for (Rule r : RULES) {
            Matcher m = r.pattern().matcher(t);
            if (m.lookingAt()) {
                return r.build().apply(m);
            }
        }
        return NO_MATCH;
    }

    /** Name of the first rule that matches, or null. For diagnostics. */
    public String matchingRule(String text) {
        String t = TextNormalizer.normalize(text);
        for (Rule r : RULES) {
            if (r.pattern().matcher(t).lookingAt()) return r.name();
        }
        return null;
    }

    public static boolean isNoMatch(String dsl) {
        return dsl == null || NO_MATCH.equals(dsl);
    }

    private static String orDefault(String s, String def) {
        return s == null ? def : s;
    }

    private static String upper(String s) {
        return s == null ? "" : s.toUpperCase(Locale.ROOT);
    }

    private static List<String> split(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String splitJoin(String csv, String sep) {
        return String.join(sep, split(csv));
    }

    private static String unwrapParens(String s) {
        String t = s.trim();
        if (t.startsWith("(")) t = t.substring(1);
        if (t.endsWith(")")) t = t.substring(0, t.length() - 1);
        return t.trim();
    }
}
