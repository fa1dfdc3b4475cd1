package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with de-duplication on (code|queryId|message|detail).
 *
 * <p>Not thread-safe; use one per batch.</p>
 */
public final class ListTranslationWarningSink implements TranslationWarningSink {

    private final List<TranslationWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListTranslationWarningSink(List<TranslationWarning> target) {
        this.target = target;
    }

    private static String key(TranslationWarning w) {
        return w.getCode().name() + "|"
                + w.getQueryId() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(TranslationWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
