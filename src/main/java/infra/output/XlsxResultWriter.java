package infra.output;

import domain.model.BatchResultRow;
import domain.model.TranslationWarning;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/** {@link ResultWriter} backed by {@link TranslationResultXlsxWriter}. */
public final class XlsxResultWriter implements ResultWriter {

    private final TranslationResultXlsxWriter delegate;

    public XlsxResultWriter(TranslationResultXlsxWriter delegate) {
        this.delegate = delegate == null ? new TranslationResultXlsxWriter() : delegate;
    }

    @Override
    public void write(Path resultXlsx, List<BatchResultRow> results, List<TranslationWarning> warnings) {
        delegate.write(resultXlsx, results, warnings);
    }
}
