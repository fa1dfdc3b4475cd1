package domain.model;

/**
 * Standard warning codes for translation/reporting.
 *
 * <p>Keep the set small and stable.</p>
 */
public enum WarningCode {

    /**
     * Query text is blank and the row is skipped.
     */
    EMPTY_INPUT,

    /**
     * The grammar parser rejected the query (detail carries the parse error).
     */
    PARSE_FAILED,

    /**
     * SQL was produced by the regex fallback instead of the grammar parser.
     */
    FALLBACK_USED,

    /**
     * No fallback rule matched the query.
     */
    NO_MATCHING_RULE,

    /**
     * A fallback rule matched but its DSL could not be turned into a statement.
     */
    DSL_PARSE_FAILED,

    /**
     * Translation failed with an exception.
     */
    TRANSLATE_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_QUERY
}
