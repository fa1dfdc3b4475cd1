package domain.ast;

public enum AlterAction {

    DROP_COLUMN("DROP COLUMN");

    private final String sql;

    AlterAction(String sql) {
        this.sql = sql;
    }

    /** SQL keyword text, e.g. {@code DROP COLUMN}. */
    public String getSql() {
        return sql;
    }
}
