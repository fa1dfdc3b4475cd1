package infra.text;

import domain.model.NlQuery;
import domain.output.SqlFileNamePolicy;
import domain.text.NlQuerySource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Query file loader.
 *
 * <p>Supported formats:
 * <ul>
 *   <li>{@code *.csv}: first row is the header. The query column is found by name
 *       (query, question, text, input, nl_query), the id column likewise (id, query_id, qid, no).
 *       Header names are compared ignoring case, spaces and punctuation.</li>
 *   <li>anything else: one query per line; blank lines and lines starting with {@code #} or
 *       {@code --} are skipped.</li>
 * </ul>
 *
 * <p>Rows without an id get {@link SqlFileNamePolicy#defaultId(int)} by position. Rows whose cells are
 * all blank are dropped; rows with an id but a blank query are kept (reported as skipped later).</p>
 *
 * <p>{@code location} is a file path, a {@code file:} URI or {@code classpath:/...}.</p>
 */
public class NlQueryFileLoader implements NlQuerySource {

    private static final String[] QUERY_HEADERS = {"query", "question", "text", "input", "nl_query", "nlquery"};
    private static final String[] ID_HEADERS = {"id", "query_id", "queryid", "qid", "no"};

    @Override
    public List<NlQuery> load(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("query file location is blank");
        }

        boolean csv = location.trim().toLowerCase(Locale.ROOT).endsWith(".csv");
        try (InputStream is = openStream(location);
             Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {

            List<NlQuery> out = csv ? loadCsv(reader) : loadLines(reader);
            System.out.println("[LOAD] " + (csv ? "csv" : "text") + " loaded=" + out.size());
            return out;

        } catch (IOException e) {
            throw new IllegalStateException("Failed to load queries: " + location, e);
        }
    }

    // ------------------------------------------------------------
    // CSV
    // ------------------------------------------------------------

    private static List<NlQuery> loadCsv(Reader reader) throws IOException {
        try (CSVParser parser = CSVFormat.DEFAULT
                .builder()
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build()
                .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            // header row read by hand so blank/odd header cells survive
            CSVRecord headerRec = it.next();
            Map<String, Integer> headerIndex = new LinkedHashMap<>();
            for (int i = 0; i < headerRec.size(); i++) {
                headerIndex.putIfAbsent(norm(headerRec.get(i)), i);
            }

            Integer queryIdx = findIndex(headerIndex, QUERY_HEADERS);
            if (queryIdx == null) {
                throw new IllegalArgumentException("No query column in csv header: " + headerRec.toList());
            }
            Integer idIdx = findIndex(headerIndex, ID_HEADERS);

            List<NlQuery> out = new ArrayList<>(256);
            int rowNo = 0;
            while (it.hasNext()) {
                CSVRecord r = it.next();
                String query = cell(r, queryIdx);
                String id = cell(r, idIdx);
                if (query.isBlank() && id.isBlank()) continue;

                rowNo++;
                out.add(new NlQuery(id.isBlank() ? SqlFileNamePolicy.defaultId(rowNo) : id, query));
            }
            return out;
        }
    }

    private static String cell(CSVRecord r, Integer idx) {
        if (idx == null || idx < 0 || idx >= r.size()) return "";
        String v = r.get(idx);
        return v == null ? "" : v.trim();
    }

    private static Integer findIndex(Map<String, Integer> headerIndex, String... candidates) {
        for (String c : candidates) {
            Integer i = headerIndex.get(norm(c));
            if (i != null) return i;
        }
        return null;
    }

    private static String norm(String s) {
        String t = stripBom(s == null ? "" : s).trim().toLowerCase(Locale.ROOT);
        return t.replaceAll("[^\\p{L}\\p{Nd}]+", "");
    }

    private static String stripBom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    // ------------------------------------------------------------
    // plain text
    // ------------------------------------------------------------

    private static List<NlQuery> loadLines(Reader reader) throws IOException {
        List<NlQuery> out = new ArrayList<>(256);
        BufferedReader br = new BufferedReader(reader);
        String line;
        boolean first = true;
        while ((line = br.readLine()) != null) {
            if (first) {
                line = stripBom(line);
                first = false;
            }
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#") || t.startsWith("--")) continue;
            out.add(new NlQuery(SqlFileNamePolicy.defaultId(out.size() + 1), t));
        }
        return out;
    }

    // ------------------------------------------------------------
    // IO
    // ------------------------------------------------------------

    private InputStream openStream(String location) throws IOException {
        String s = location.trim();

        if (s.startsWith("classpath:")) {
            String cp = s.substring("classpath:".length());
            InputStream is = NlQueryFileLoader.class.getResourceAsStream(cp.startsWith("/") ? cp : ("/" + cp));
            if (is == null) throw new IOException("classpath resource not found: " + s);
            return new BufferedInputStream(is);
        }

        Path p = s.startsWith("file:") ? Path.of(URI.create(s)) : Path.of(s);
        if (!Files.isRegularFile(p)) {
            throw new IllegalArgumentException("query file not found: " + p);
        }
        return new BufferedInputStream(Files.newInputStream(p));
    }
}
