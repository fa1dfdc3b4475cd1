package domain.model;

/** Which path produced a {@link TranslationResult}. */
public enum TranslationMethod {

    PIPELINE("Lexer → Parser → AST → SQL"),
    LEGACY_DSL("English → DSL → AST → SQL (regex)");

    private final String label;

    TranslationMethod(String label) {
        this.label = label;
    }

    /** Human-readable pipeline description, as shown in reports. */
    public String getLabel() {
        return label;
    }
}
