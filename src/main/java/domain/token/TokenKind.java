package domain.token;

/**
 * Closed set of token kinds produced by {@link Tokenizer}.
 *
 * <p>Several surface words map onto one kind (e.g. show/list/get are all {@link #SELECT});
 * see {@link KeywordTable}.</p>
 */
public enum TokenKind {

    // commands
    SELECT,
    FIND,
    COUNT,
    SUM,
    INSERT,
    UPDATE,
    DELETE,

    // clauses
    FROM,
    WHERE,
    AND,
    OR,
    ORDER,
    BY,
    GROUP,
    INTO,
    SET,
    VALUES,

    // modifiers
    ALL,
    DISTINCT,
    ASC,
    DESC,

    // conditions
    BETWEEN,
    IN,
    LIKE,
    CONTAINS,

    // aggregate phrasing ("how many", "total")
    HOW,
    MANY,
    TOTAL,

    // table operations
    ALTER,
    TABLE,
    DROP,
    COLUMN,

    // comparison operators
    EQUALS,       // =
    NOT_EQUALS,   // !=
    GREATER,      // >
    LESS,         // <
    GREATER_EQ,   // >=
    LESS_EQ,      // <=

    // literals
    NUMBER,
    STRING,
    IDENTIFIER,

    // punctuation
    COMMA,
    LPAREN,
    RPAREN,
    STAR,

    EOF;

    public boolean isComparison() {
        return this == EQUALS || this == NOT_EQUALS
                || this == GREATER || this == LESS
                || this == GREATER_EQ || this == LESS_EQ;
    }
}
