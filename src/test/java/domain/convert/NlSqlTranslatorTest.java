package domain.convert;

import domain.model.ListTranslationWarningSink;
import domain.model.TokenView;
import domain.model.TranslationMethod;
import domain.model.TranslationResult;
import domain.model.TranslationWarning;
import domain.model.WarningCode;
import domain.convert.legacy.DslStatementParser;
import domain.convert.legacy.LegacyDslTranslator;
import domain.parse.ParseResult;
import domain.parse.Parser;
import domain.token.Token;
import domain.token.Tokenizer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NlSqlTranslatorTest {

    private final List<TranslationWarning> warnings = new ArrayList<>();
    private final ListTranslationWarningSink sink = new ListTranslationWarningSink(warnings);

    private List<WarningCode> codes() {
        return warnings.stream().map(TranslationWarning::getCode).toList();
    }

    @Test
    void pipeline_result_has_tokens_and_ast() {
        TranslationResult r = new NlSqlTranslator().translate("count users", "q1", sink);

        assertTrue(r.isSuccess());
        assertEquals(TranslationMethod.PIPELINE, r.getMethod());
        assertEquals("SELECT COUNT(*) FROM users;", r.getSql());
        assertEquals(List.of(new TokenView("COUNT", "count"), new TokenView("IDENTIFIER", "users")), r.getTokens());
        assertEquals("SELECT", r.getAst().get("type"));
        assertNull(r.getDsl());
        assertEquals(NlSqlTranslator.PIPELINE_EXPLANATION, r.getExplanation());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void falls_back_to_regex_rules() {
        TranslationResult r = new NlSqlTranslator().translate("display me all users", "q2", sink);

        assertTrue(r.isSuccess());
        assertEquals(TranslationMethod.LEGACY_DSL, r.getMethod());
        assertEquals("SELECT * FROM users", r.getDsl());
        assertEquals("SELECT * FROM users;", r.getSql());
        assertNull(r.getTokens());
        assertEquals(NlSqlTranslator.LEGACY_EXPLANATION, r.getExplanation());
        assertEquals(List.of(WarningCode.PARSE_FAILED, WarningCode.FALLBACK_USED), codes());
        assertEquals("q2", warnings.get(1).getQueryId());
        assertEquals("SELECT * FROM users", warnings.get(1).getDetail());
    }

    @Test
    void no_matching_rule_yields_error_sql() {
        TranslationResult r = new NlSqlTranslator().translate("hello world", "q3", sink);

        assertFalse(r.isSuccess());
        assertEquals(NlSqlTranslator.DSL_ERROR_SQL, r.getSql());
        assertEquals(LegacyDslTranslator.NO_MATCH, r.getDsl());
        assertNull(r.getAst());
        assertEquals(List.of(WarningCode.PARSE_FAILED, WarningCode.NO_MATCHING_RULE), codes());
    }

    @Test
    void disabled_fallback_returns_parse_error() {
        TranslationResult r = new NlSqlTranslator(false).translate("hello world", "q4", sink);

        assertFalse(r.isSuccess());
        assertEquals(TranslationMethod.PIPELINE, r.getMethod());
        assertTrue(r.getSql().startsWith("-- Error: Unexpected token"), r.getSql());
        assertEquals(2, r.getTokens().size());
        assertNull(r.getDsl());
        assertEquals(List.of(WarningCode.PARSE_FAILED), codes());
    }

    @Test
    void blank_input_is_reported_not_thrown() {
        TranslationResult r = new NlSqlTranslator().translate("   ", "q5", sink);

        assertFalse(r.isSuccess());
        assertEquals("-- Error: Empty input", r.getSql());
        assertEquals(List.of(WarningCode.EMPTY_INPUT), codes());

        assertFalse(new NlSqlTranslator().translate(null).isSuccess());
    }

    @Test
    void report_map_shape() {
        Map<String, Object> pipelineMap = new NlSqlTranslator().translate("count users").toMap();
        assertEquals(List.of("input", "method", "tokens", "ast", "sql", "explanation"),
                new ArrayList<>(pipelineMap.keySet()));
        assertEquals(TranslationMethod.PIPELINE.getLabel(), pipelineMap.get("method"));

        Map<String, Object> legacyMap = new NlSqlTranslator().translate("display me all users").toMap();
        assertEquals(List.of("input", "method", "dsl", "ast", "sql", "explanation"),
                new ArrayList<>(legacyMap.keySet()));
    }

    private static NlSqlTranslator withBrokenParser(boolean fallback) {
        Parser broken = new Parser() {
            @Override
            public ParseResult parse(List<Token> tokens) {
                throw new IllegalStateException("boom");
            }
        };
        NlSqlPipeline pipeline = new NlSqlPipeline(new Tokenizer(), broken, new SqlGenerator());
        return new NlSqlTranslator(pipeline, new LegacyDslTranslator(), new DslStatementParser(), fallback);
    }

    @Test
    void stage_exception_is_retried_through_fallback() {
        TranslationResult r = withBrokenParser(true).translate("select all from users", "q6", sink);

        assertTrue(r.isSuccess());
        assertEquals(TranslationMethod.LEGACY_DSL, r.getMethod());
        assertEquals("SELECT * FROM users;", r.getSql());
        assertEquals(List.of(WarningCode.TRANSLATE_ERROR, WarningCode.FALLBACK_USED), codes());
        assertEquals("IllegalStateException: boom", warnings.get(0).getDetail());
    }

    @Test
    void stage_exception_without_fallback_is_an_error_result() {
        TranslationResult r = withBrokenParser(false).translate("select all from users", "q7", sink);

        assertFalse(r.isSuccess());
        assertEquals(TranslationMethod.PIPELINE, r.getMethod());
        assertEquals("-- Error: IllegalStateException", r.getSql());
        assertEquals(List.of(WarningCode.TRANSLATE_ERROR), codes());
    }
}
