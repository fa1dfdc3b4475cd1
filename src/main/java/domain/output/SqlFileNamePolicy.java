package domain.output;

import java.util.Locale;

/**
 * File naming policy for generated SQL: {@code <queryId>.sql}.
 *
 * <p>Characters outside {@code [a-zA-Z0-9._-]} become {@code _}; a leading dot and Windows
 * device names (CON, PRN, COM1, ...) are prefixed with {@code _}.</p>
 */
public final class SqlFileNamePolicy {

    static final int MAX_ID_LENGTH = 180;

    private SqlFileNamePolicy() {
    }

    public static String build(String queryId) {
        String id = safePart(queryId, "unknownId");
        return limit(id, MAX_ID_LENGTH) + ".sql";
    }

    /** Id for rows that have none: {@code q0001}, {@code q0002}, ... */
    public static String defaultId(int rowNo) {
        return String.format(Locale.ROOT, "q%04d", Math.max(0, rowNo));
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        if (s.startsWith(".")) s = "_" + s.substring(1);

        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
