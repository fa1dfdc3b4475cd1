package domain.token;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Static keyword / synonym table.
 *
 * <p>Built once at class-init time and never mutated. Lookup keys are lowercase.</p>
 */
public final class KeywordTable {

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
            // commands
            entry("select", TokenKind.SELECT),
            entry("show", TokenKind.SELECT),
            entry("list", TokenKind.SELECT),
            entry("get", TokenKind.SELECT),
            entry("find", TokenKind.FIND),
            entry("count", TokenKind.COUNT),
            entry("sum", TokenKind.SUM),
            entry("insert", TokenKind.INSERT),
            entry("update", TokenKind.UPDATE),
            entry("delete", TokenKind.DELETE),
            entry("remove", TokenKind.DELETE),

            // clauses
            entry("from", TokenKind.FROM),
            entry("of", TokenKind.FROM),
            entry("where", TokenKind.WHERE),
            entry("and", TokenKind.AND),
            entry("or", TokenKind.OR),
            entry("order", TokenKind.ORDER),
            entry("by", TokenKind.BY),
            entry("group", TokenKind.GROUP),
            entry("into", TokenKind.INTO),
            entry("set", TokenKind.SET),
            entry("values", TokenKind.VALUES),

            // modifiers
            entry("all", TokenKind.ALL),
            entry("distinct", TokenKind.DISTINCT),
            entry("unique", TokenKind.DISTINCT),
            entry("asc", TokenKind.ASC),
            entry("ascending", TokenKind.ASC),
            entry("desc", TokenKind.DESC),
            entry("descending", TokenKind.DESC),

            // conditions
            entry("between", TokenKind.BETWEEN),
            entry("in", TokenKind.IN),
            entry("like", TokenKind.LIKE),
            entry("contains", TokenKind.CONTAINS),

            // aggregates
            entry("how", TokenKind.HOW),
            entry("many", TokenKind.MANY),
            entry("total", TokenKind.TOTAL),

            // table operations
            entry("alter", TokenKind.ALTER),
            entry("table", TokenKind.TABLE),
            entry("drop", TokenKind.DROP),
            entry("column", TokenKind.COLUMN),
            entry("columns", TokenKind.COLUMN),
            entry("col", TokenKind.COLUMN)
    );

    private KeywordTable() {
    }

    /**
     * @return the keyword kind for {@code word} (case-insensitive), or {@link TokenKind#IDENTIFIER}
     */
    public static TokenKind lookup(String word) {
        if (word == null || word.isEmpty()) return TokenKind.IDENTIFIER;
        return KEYWORDS.getOrDefault(word.toLowerCase(Locale.ROOT), TokenKind.IDENTIFIER);
    }
}
