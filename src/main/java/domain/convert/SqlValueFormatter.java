package domain.convert;

import domain.ast.Literal;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Renders a literal as a SQL value.
 *
 * <p>Numbers, and text that reads as a number ({@code 25}, {@code -3}, {@code 10.5}), are emitted
 * bare. Everything else is single-quoted with embedded quotes doubled.</p>
 */
public final class SqlValueFormatter {

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");

    private SqlValueFormatter() {
    }

    public static String format(Literal value) {
        if (value == null) return "NULL";
        if (value.isNumeric()) return numberText(value.getValue());
        return format(value.text());
    }

    public static String format(String text) {
        if (text == null) return "NULL";
        if (isNumeric(text)) return text;
        return quote(text);
    }

    public static boolean isNumeric(String text) {
        return text != null && NUMERIC.matcher(text).matches();
    }

    public static String quote(String text) {
        return "'" + (text == null ? "" : text.replace("'", "''")) + "'";
    }

    private static String numberText(Object n) {
        if (n instanceof Double) {
            // avoid exponent notation for large/small doubles
            return BigDecimal.valueOf((Double) n).toPlainString();
        }
        return String.valueOf(n);
    }
}
