package domain.convert;

import domain.ast.Literal;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlValueFormatterTest {

    @Test
    void numbers_are_bare() {
        assertEquals("25", SqlValueFormatter.format(Literal.of(25)));
        assertEquals("10.5", SqlValueFormatter.format(Literal.number("10.5")));
        assertEquals("100000000000000000000", SqlValueFormatter.format(Literal.of(1e20)));
    }

    @Test
    void numeric_text_is_bare() {
        assertEquals("-3", SqlValueFormatter.format("-3"));
        assertEquals("+7", SqlValueFormatter.format("+7"));
        assertEquals("0.25", SqlValueFormatter.format(Literal.string("0.25")));
    }

    @Test
    void other_text_is_quoted_with_doubled_quotes() {
        assertEquals("'John'", SqlValueFormatter.format(Literal.string("John")));
        assertEquals("'active'", SqlValueFormatter.format(Literal.identifier("active")));
        assertEquals("'O''Brien'", SqlValueFormatter.format("O'Brien"));
        assertEquals("'12abc'", SqlValueFormatter.format("12abc"));
        assertEquals("''", SqlValueFormatter.format(""));
    }

    @Test
    void null_is_sql_null() {
        assertEquals("NULL", SqlValueFormatter.format((Literal) null));
        assertEquals("NULL", SqlValueFormatter.format((String) null));
    }
}
