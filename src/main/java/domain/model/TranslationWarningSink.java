package domain.model;

/**
 * Sink for translation warnings.
 *
 * <p>Lets the translator report problems without knowing about the CLI or the XLSX writer.</p>
 */
public interface TranslationWarningSink {

    static TranslationWarningSink none() {
        return NullTranslationWarningSink.INSTANCE;
    }

    void warn(TranslationWarning warning);
}
