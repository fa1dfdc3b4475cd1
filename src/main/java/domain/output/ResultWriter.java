package domain.output;

import domain.model.BatchResultRow;
import domain.model.TranslationWarning;

import java.nio.file.Path;
import java.util.List;

/** Saves the batch report. */
public interface ResultWriter {

    void write(Path resultXlsx, List<BatchResultRow> results, List<TranslationWarning> warnings);
}
