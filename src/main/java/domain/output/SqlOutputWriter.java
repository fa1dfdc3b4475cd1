package domain.output;

import java.nio.file.Path;

/** Exports translated SQL, one file per query. */
public interface SqlOutputWriter {
    void write(Path outDir, String queryId, String query, String sqlText);
}
