package infra.output;

import domain.model.BatchResultRow;
import domain.model.TranslationWarning;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle: --noResult).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<BatchResultRow> results, List<TranslationWarning> warnings) {
        // intentionally no-op
    }
}
