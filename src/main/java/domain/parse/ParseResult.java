package domain.parse;

import domain.ast.Statement;

import java.util.Objects;

/**
 * Outcome of {@link Parser#parse}: exactly one of a statement or an error.
 */
public final class ParseResult {

    private final Statement statement;
    private final ParseError error;

    private ParseResult(Statement statement, ParseError error) {
        this.statement = statement;
        this.error = error;
    }

    public static ParseResult success(Statement statement) {
        return new ParseResult(Objects.requireNonNull(statement, "statement"), null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return statement != null;
    }

    /** @return the statement, or null on failure */
    public Statement getStatement() {
        return statement;
    }

    /** @return the error, or null on success */
    public ParseError getError() {
        return error;
    }

    public Statement orElseThrow() {
        if (statement == null) throw new ParseException(error);
        return statement;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult{ok " + statement + "}" : "ParseResult{error " + error + "}";
    }
}
