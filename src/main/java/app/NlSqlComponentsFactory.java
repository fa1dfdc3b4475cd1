package app;

import domain.convert.NlSqlTranslator;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.text.NlQuerySource;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.TranslationResultXlsxWriter;
import infra.output.XlsxResultWriter;
import infra.text.NlQueryFileLoader;

/**
 * Object-assembly factory for {@link NlSqlCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; creation and feature toggles live here.
 */
final class NlSqlComponentsFactory {

    NlSqlTranslator createTranslator(boolean fallbackEnabled) {
        return new NlSqlTranslator(fallbackEnabled);
    }

    NlQuerySource createQuerySource() {
        return new NlQueryFileLoader();
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new TranslationResultXlsxWriter());
    }
}
