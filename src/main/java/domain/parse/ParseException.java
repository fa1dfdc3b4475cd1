package domain.parse;

/**
 * Exception view of a {@link ParseError}, for callers that prefer throwing over
 * inspecting a {@link ParseResult}.
 */
public class ParseException extends IllegalArgumentException {

    private final transient ParseError error;

    public ParseException(ParseError error) {
        super(error == null ? "parse failed" : error.toString());
        this.error = error;
    }

    public ParseError getError() {
        return error;
    }
}
