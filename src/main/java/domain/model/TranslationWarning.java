package domain.model;

/**
 * A single warning emitted while translating a query.
 *
 * <p>Warnings are not fatal; the query still gets a result row.</p>
 */
public final class TranslationWarning {

    private final WarningCode code;
    private final String queryId;
    private final String query;
    private final String message;
    private final String detail;

    public TranslationWarning(WarningCode code, String queryId, String query, String message, String detail) {
        this.code = code == null ? WarningCode.TRANSLATE_ERROR : code;
        this.queryId = nullToEmpty(queryId);
        this.query = nullToEmpty(query);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static TranslationWarning of(WarningCode code, String queryId, String query, String message) {
        return new TranslationWarning(code, queryId, query, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getQueryId() {
        return queryId;
    }

    public String getQuery() {
        return query;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " [" + queryId + "] " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
