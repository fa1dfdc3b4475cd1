package infra.output;

import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores generated SQL into files.
 * <p>
 * Output layout: {@code <outDir>/<queryId>.sql}, UTF-8. The first line is the source query as
 * an SQL comment.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    static String render(String query, String sqlText) {
        StringBuilder sb = new StringBuilder();
        String q = query == null ? "" : query.replace('\r', ' ').replace('\n', ' ').trim();
        if (!q.isEmpty()) sb.append("-- ").append(q).append('\n');
        sb.append(sqlText == null ? "" : sqlText).append('\n');
        return sb.toString();
    }

    @Override
    public void write(Path outDir, String queryId, String query, String sqlText) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outDir, e);
        }

        Path target = outDir.resolve(SqlFileNamePolicy.build(queryId));
        try {
            Files.writeString(target, render(query, sqlText), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write sql file: " + target, e);
        }
    }
}
