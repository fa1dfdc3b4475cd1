package infra.output;

import domain.output.SqlOutputWriter;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle: --noSqlOut).
 */
public final class NullSqlOutputWriter implements SqlOutputWriter {
    @Override
    public void write(Path outDir, String queryId, String query, String sqlText) {
        // intentionally no-op
    }
}
