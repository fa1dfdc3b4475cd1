package domain.convert;

import domain.ast.Statement;
import domain.parse.ParseResult;
import domain.parse.Parser;
import domain.token.Token;
import domain.token.Tokenizer;

import java.util.List;

/**
 * Tokenize, parse, generate.
 *
 * <p>Each stage is callable on its own. {@link #process} runs all three and throws
 * {@link domain.parse.ParseException} when the text is not a supported statement;
 * {@link #tryProcess} reports the same failure as a value.</p>
 *
 * <p>Holds no per-call state, so one instance may serve many threads. Use
 * {@link PipelineResultCache} to keep the last result around.</p>
 */
public final class NlSqlPipeline {

    private final Tokenizer tokenizer;
    private final Parser parser;
    private final SqlGenerator generator;

    public NlSqlPipeline() {
        this(new Tokenizer(), new Parser(), new SqlGenerator());
    }

    public NlSqlPipeline(Tokenizer tokenizer, Parser parser, SqlGenerator generator) {
        this.tokenizer = tokenizer;
        this.parser = parser;
        this.generator = generator;
    }

    public List<Token> tokenize(String text) {
        return tokenizer.tokenize(text);
    }

    public ParseResult parse(List<Token> tokens) {
        return parser.parse(tokens);
    }

    public ParseResult parse(String text) {
        return parser.parse(tokenize(text));
    }

    public String generate(Statement statement) {
        return generator.generate(statement);
    }

    public PipelineResult process(String text) {
        List<Token> tokens = tokenize(text);
        Statement statement = parser.parse(tokens).orElseThrow();
        return new PipelineResult(text, tokens, statement, generator.generate(statement));
    }

    public PipelineOutcome tryProcess(String text) {
        List<Token> tokens = tokenize(text);
        ParseResult parsed = parser.parse(tokens);
        if (!parsed.isSuccess()) {
            return PipelineOutcome.failure(text, tokens, parsed.getError());
        }
        Statement statement = parsed.getStatement();
        return PipelineOutcome.success(new PipelineResult(text, tokens, statement, generator.generate(statement)));
    }

    /** Shortcut for {@code process(text).getSql()}. */
    public String toSql(String text) {
        return process(text).getSql();
    }
}
