package domain.convert;

import domain.ast.Statement;
import domain.convert.legacy.DslStatementParser;
import domain.convert.legacy.LegacyDslTranslator;
import domain.model.TokenView;
import domain.model.TranslationMethod;
import domain.model.TranslationResult;
import domain.model.TranslationWarning;
import domain.model.TranslationWarningSink;
import domain.model.WarningCode;
import domain.parse.ParseError;
import domain.token.Token;
import domain.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for callers that want a result for any input.
 *
 * <p>Runs {@link NlSqlPipeline} first. When the grammar rejects the query or a stage throws, and
 * the fallback is enabled, the regex translator ({@link LegacyDslTranslator} then {@link DslStatementParser})
 * gets a try. Nothing is thrown: failures come back as a {@link TranslationResult} whose SQL is an
 * {@code -- Error: ...} comment, plus warnings on the sink.</p>
 *
 * <p>Thread-safe; warning sinks are per caller.</p>
 */
public class NlSqlTranslator {

    public static final String DSL_ERROR_SQL = "-- Error: Could not parse DSL";

    static final String PIPELINE_EXPLANATION = "Successfully parsed using Lexer-Parser pipeline";
    static final String LEGACY_EXPLANATION = "Converted natural language to SQL (legacy regex method)";

    private final NlSqlPipeline pipeline;
    private final LegacyDslTranslator legacyTranslator;
    private final DslStatementParser dslParser;
    private final AstMapSerializer astSerializer = new AstMapSerializer();
    private final boolean fallbackEnabled;

    public NlSqlTranslator() {
        this(true);
    }

    public NlSqlTranslator(boolean fallbackEnabled) {
        this(new NlSqlPipeline(), new LegacyDslTranslator(), new DslStatementParser(), fallbackEnabled);
    }

    public NlSqlTranslator(
            NlSqlPipeline pipeline,
            LegacyDslTranslator legacyTranslator,
            DslStatementParser dslParser,
            boolean fallbackEnabled
    ) {
        this.pipeline = pipeline;
        this.legacyTranslator = legacyTranslator;
        this.dslParser = dslParser;
        this.fallbackEnabled = fallbackEnabled;
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    public TranslationResult translate(String text) {
        return translate(text, "", TranslationWarningSink.none());
    }

    /**
     * Extended API for CLI/reporting to collect warnings attributed to {@code queryId}.
     */
    public TranslationResult translate(String text, String queryId, TranslationWarningSink sink) {
        TranslationWarningSink warnings = sink == null ? TranslationWarningSink.none() : sink;
        String input = text == null ? "" : text;

        if (input.isBlank()) {
            warnings.warn(TranslationWarning.of(WarningCode.EMPTY_INPUT, queryId, input, "query text is empty"));
            return new TranslationResult(input, "-- Error: Empty input", null, List.of(),
                    TranslationMethod.PIPELINE, "Could not parse: " + input, null, false);
        }

        PipelineOutcome outcome;
        try {
            outcome = pipeline.tryProcess(input);
        } catch (RuntimeException e) {
            warnings.warn(new TranslationWarning(WarningCode.TRANSLATE_ERROR, queryId, input,
                    "pipeline failed", describe(e)));
            return fallbackEnabled ? guardedFallback(input, queryId, warnings) : errorResult(input, e, TranslationMethod.PIPELINE);
        }

        if (outcome.isSuccess()) {
            PipelineResult r = outcome.getResult();
            return new TranslationResult(input, r.getSql(), astSerializer.toMap(r.getStatement()),
                    views(r.getTokens()), TranslationMethod.PIPELINE, PIPELINE_EXPLANATION, null, true);
        }

        ParseError error = outcome.getError();
        warnings.warn(new TranslationWarning(WarningCode.PARSE_FAILED, queryId, input,
                "grammar parser rejected query", error.toString()));

        if (!fallbackEnabled) {
            return new TranslationResult(input, "-- Error: " + error.getMessage(), null,
                    views(outcome.getTokens()), TranslationMethod.PIPELINE,
                    "Could not parse: " + input, null, false);
        }
        return guardedFallback(input, queryId, warnings);
    }

    private TranslationResult guardedFallback(String input, String queryId, TranslationWarningSink warnings) {
        try {
            return fallback(input, queryId, warnings);
        } catch (RuntimeException e) {
            warnings.warn(new TranslationWarning(WarningCode.TRANSLATE_ERROR, queryId, input,
                    "fallback failed", describe(e)));
            return errorResult(input, e, TranslationMethod.LEGACY_DSL);
        }
    }

    private static TranslationResult errorResult(String input, RuntimeException e, TranslationMethod method) {
        return new TranslationResult(input, "-- Error: " + e.getClass().getSimpleName(), null, null,
                method, "Could not parse: " + input, null, false);
    }

    private static String describe(RuntimeException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private TranslationResult fallback(String input, String queryId, TranslationWarningSink warnings) {
        String dsl = legacyTranslator.toDsl(input);
        if (LegacyDslTranslator.isNoMatch(dsl)) {
            warnings.warn(TranslationWarning.of(WarningCode.NO_MATCHING_RULE, queryId, input,
                    "no fallback rule matched"));
        }

        Optional<Statement> statement = dslParser.parse(dsl);
        if (statement.isEmpty()) {
            if (!LegacyDslTranslator.isNoMatch(dsl)) {
                warnings.warn(new TranslationWarning(WarningCode.DSL_PARSE_FAILED, queryId, input,
                        "fallback DSL could not be parsed", dsl));
            }
            return new TranslationResult(input, DSL_ERROR_SQL, null, null,
                    TranslationMethod.LEGACY_DSL, "Could not parse: " + input, dsl, false);
        }

        warnings.warn(new TranslationWarning(WarningCode.FALLBACK_USED, queryId, input,
                "SQL produced by regex fallback", dsl));
        Statement s = statement.get();
        return new TranslationResult(input, pipeline.generate(s), astSerializer.toMap(s), null,
                TranslationMethod.LEGACY_DSL, LEGACY_EXPLANATION, dsl, true);
    }

    private static List<TokenView> views(List<Token> tokens) {
        List<TokenView> out = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            if (t.is(TokenKind.EOF)) continue;
            out.add(TokenView.of(t));
        }
        return out;
    }
}
