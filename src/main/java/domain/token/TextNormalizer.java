package domain.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pre-tokenization text normalization.
 *
 * <ul>
 *   <li>lowercase</li>
 *   <li>natural-language operator phrases to symbols ("greater than" to {@code >})</li>
 *   <li>whitespace runs collapsed to one space, ends trimmed</li>
 * </ul>
 *
 * <p>Quoted segments ({@code '...'} / {@code "..."}) are copied verbatim. A quote that is never
 * closed extends its segment to the end of the input.</p>
 */
public final class TextNormalizer {

    private static final Map<String, String> OPERATOR_PHRASES = buildPhraseTable();

    /** Single alternation, longest phrase first, so "greater than or equal to" wins over "greater than". */
    private static final Pattern PHRASE_PATTERN = buildPhrasePattern(OPERATOR_PHRASES);

    private static final Pattern WS = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    private static Map<String, String> buildPhraseTable() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("greater than or equal to", ">=");
        m.put("less than or equal to", "<=");
        m.put("greater than", ">");
        m.put("more than", ">");
        m.put("less than", "<");
        m.put("is equal to", "=");
        m.put("equal to", "=");
        m.put("equals", "=");
        m.put("equal", "=");
        m.put("same as", "=");
        m.put("not equal to", "!=");
        m.put("not equal", "!=");
        m.put("different from", "!=");
        return m;
    }

    private static Pattern buildPhrasePattern(Map<String, String> phrases) {
        List<String> ordered = new ArrayList<>(phrases.keySet());
        ordered.sort(Comparator.comparingInt(String::length).reversed());

        StringBuilder sb = new StringBuilder("\\b(?:");
        for (int i = 0; i < ordered.size(); i++) {
            if (i > 0) sb.append('|');
            sb.append(Pattern.quote(ordered.get(i)).replace(" ", "\\E\\s+\\Q"));
        }
        sb.append(")\\b");
        return Pattern.compile(sb.toString());
    }

    /**
     * Normalizes {@code text}. {@code null} yields an empty string. Normalizing already normalized
     * text returns it unchanged.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                int close = text.indexOf(c, i + 1);
                int end = close < 0 ? n : close + 1;
                out.append(text, i, end);
                i = end;
                continue;
            }

            int next = nextQuote(text, i);
            out.append(normalizePlain(text.substring(i, next)));
            i = next;
        }
        return out.toString().trim();
    }

    private static int nextQuote(String s, int from) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') return i;
        }
        return s.length();
    }

    private static String normalizePlain(String segment) {
        String t = segment.toLowerCase(Locale.ROOT);

        Matcher m = PHRASE_PATTERN.matcher(t);
        StringBuilder sb = new StringBuilder(t.length());
        while (m.find()) {
            String key = WS.matcher(m.group()).replaceAll(" ");
            m.appendReplacement(sb, Matcher.quoteReplacement(" " + OPERATOR_PHRASES.get(key) + " "));
        }
        m.appendTail(sb);

        return WS.matcher(sb).replaceAll(" ");
    }

    /** Read-only view of the phrase table, in declaration order. */
    public static Map<String, String> operatorPhrases() {
        return Collections.unmodifiableMap(OPERATOR_PHRASES);
    }
}
