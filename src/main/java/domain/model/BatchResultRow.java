package domain.model;

/**
 * A single translation outcome row for reporting.
 *
 * <p>Plain value object, shared by the CLI and the XLSX writer.</p>
 */
public final class BatchResultRow {

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FALLBACK = "FALLBACK";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_SKIP = "SKIP";

    private final String status;
    private final String queryId;
    private final String query;
    private final String sql;

    /**
     * method label, empty for skipped rows
     */
    private final String method;

    /**
     * DSL text when the fallback ran
     */
    private final String dsl;

    private final long elapsedMs;

    /**
     * optional reason (skip cause, parse error, exception class)
     */
    private final String message;

    public BatchResultRow(
            String status,
            String queryId,
            String query,
            String sql,
            String method,
            String dsl,
            long elapsedMs,
            String message
    ) {
        this.status = nullToEmpty(status);
        this.queryId = nullToEmpty(queryId);
        this.query = nullToEmpty(query);
        this.sql = nullToEmpty(sql);
        this.method = nullToEmpty(method);
        this.dsl = nullToEmpty(dsl);
        this.elapsedMs = Math.max(0L, elapsedMs);
        this.message = nullToEmpty(message);
    }

    public static BatchResultRow skip(String queryId, String query, String message) {
        return new BatchResultRow(STATUS_SKIP, queryId, query, "", "", "", 0L, message);
    }

    /** Maps a translation to SUCCESS, FALLBACK or FAILED. */
    public static BatchResultRow of(String queryId, TranslationResult r, long elapsedMs, String message) {
        String status;
        if (!r.isSuccess()) {
            status = STATUS_FAILED;
        } else if (r.getMethod() == TranslationMethod.LEGACY_DSL) {
            status = STATUS_FALLBACK;
        } else {
            status = STATUS_SUCCESS;
        }
        return new BatchResultRow(status, queryId, r.getInput(), r.getSql(),
                r.getMethod().getLabel(), r.getDsl(), elapsedMs, message);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
    }

    public String getQueryId() {
        return queryId;
    }

    public String getQuery() {
        return query;
    }

    public String getSql() {
        return sql;
    }

    public String getMethod() {
        return method;
    }

    public String getDsl() {
        return dsl;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getMessage() {
        return message;
    }
}
