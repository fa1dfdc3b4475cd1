package domain.convert;

import domain.parse.ParseError;
import domain.token.Token;

import java.util.List;
import java.util.Objects;

/**
 * Non-throwing result of {@link NlSqlPipeline#tryProcess}.
 *
 * <p>On failure the tokens are still available, since tokenization never fails.</p>
 */
public final class PipelineOutcome {

    private final String input;
    private final List<Token> tokens;
    private final PipelineResult result;
    private final ParseError error;

    private PipelineOutcome(String input, List<Token> tokens, PipelineResult result, ParseError error) {
        this.input = input == null ? "" : input;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.result = result;
        this.error = error;
    }

    static PipelineOutcome success(PipelineResult result) {
        Objects.requireNonNull(result, "result");
        return new PipelineOutcome(result.getInput(), result.getTokens(), result, null);
    }

    static PipelineOutcome failure(String input, List<Token> tokens, ParseError error) {
        return new PipelineOutcome(input, tokens, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return result != null;
    }

    public String getInput() {
        return input;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /** @return the result, or null on failure */
    public PipelineResult getResult() {
        return result;
    }

    /** @return the parse error, or null on success */
    public ParseError getError() {
        return error;
    }
}
