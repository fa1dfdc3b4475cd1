package domain.convert;

import domain.ast.Statement;
import domain.token.Token;

import java.util.List;
import java.util.Objects;

/** Everything one successful {@link NlSqlPipeline#process} run produced, stage by stage. */
public final class PipelineResult {

    private final String input;
    private final List<Token> tokens;
    private final Statement statement;
    private final String sql;

    public PipelineResult(String input, List<Token> tokens, Statement statement, String sql) {
        this.input = input == null ? "" : input;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.statement = Objects.requireNonNull(statement, "statement");
        this.sql = sql == null ? "" : sql;
    }

    public String getInput() {
        return input;
    }

    /** Includes the trailing EOF token. */
    public List<Token> getTokens() {
        return tokens;
    }

    public Statement getStatement() {
        return statement;
    }

    public String getSql() {
        return sql;
    }

    @Override
    public String toString() {
        return "PipelineResult{input='" + input + "', sql='" + sql + "'}";
    }
}
