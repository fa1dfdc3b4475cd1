package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of translating one natural-language query.
 *
 * <p>Always produced, even for unparseable input: then {@link #isSuccess()} is false and
 * {@link #getSql()} holds an SQL comment ({@code -- Error: ...}).</p>
 */
public final class TranslationResult {

    private final String input;
    private final String sql;
    private final Map<String, Object> ast;
    private final List<TokenView> tokens;
    private final TranslationMethod method;
    private final String explanation;
    private final String dsl;
    private final boolean success;

    public TranslationResult(
            String input,
            String sql,
            Map<String, Object> ast,
            List<TokenView> tokens,
            TranslationMethod method,
            String explanation,
            String dsl,
            boolean success
    ) {
        this.input = nullToEmpty(input);
        this.sql = nullToEmpty(sql);
        this.ast = ast == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(ast));
        this.tokens = tokens == null ? null : List.copyOf(tokens);
        this.method = method == null ? TranslationMethod.PIPELINE : method;
        this.explanation = nullToEmpty(explanation);
        this.dsl = dsl;
        this.success = success;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getInput() {
        return input;
    }

    public String getSql() {
        return sql;
    }

    /** Nested node maps tagged by {@code type}; null when no statement was built. */
    public Map<String, Object> getAst() {
        return ast;
    }

    /** Tokens without EOF; null on the fallback path. */
    public List<TokenView> getTokens() {
        return tokens;
    }

    public TranslationMethod getMethod() {
        return method;
    }

    public String getExplanation() {
        return explanation;
    }

    /** Intermediate DSL; null unless {@link #getMethod()} is {@link TranslationMethod#LEGACY_DSL}. */
    public String getDsl() {
        return dsl;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Report shape: {@code input, method, tokens, ast, sql, explanation}, plus {@code dsl} on the
     * fallback path. {@code tokens} is omitted when absent.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("input", input);
        m.put("method", method.getLabel());
        if (tokens != null) {
            List<Map<String, Object>> ts = new ArrayList<>(tokens.size());
            for (TokenView t : tokens) ts.add(t.toMap());
            m.put("tokens", ts);
        }
        if (dsl != null) m.put("dsl", dsl);
        m.put("ast", ast);
        m.put("sql", sql);
        m.put("explanation", explanation);
        return m;
    }

    @Override
    public String toString() {
        return "TranslationResult{method=" + method + ", sql='" + sql + "'}";
    }
}
