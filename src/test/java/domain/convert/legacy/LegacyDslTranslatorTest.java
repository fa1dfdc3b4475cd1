package domain.convert.legacy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LegacyDslTranslatorTest {

    private final LegacyDslTranslator translator = new LegacyDslTranslator();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', textBlock = """
            select all from users where age > 20             | SELECT * FROM users WHERE age > 20
            show all name of users                           | SELECT name FROM users
            how many orders                                  | SELECT COUNT(*) FROM orders
            count id from orders where status = 1            | SELECT COUNT(id) FROM orders WHERE status = 1
            total salary from employees                      | SELECT SUM(salary) FROM employees
            show all users order by age desc                 | SELECT * FROM users ORDER BY age DESC
            show all users order by                          | SELECT * FROM users ORDER BY id
            select name, city from users group by city       | SELECT name, city FROM users GROUP BY city
            insert into users values (1, 'John', 25)         | INSERT INTO users VALUES (1, 'John', 25)
            update users set name = 'Bob' where id = 5       | UPDATE users SET name = 'Bob' WHERE id = 5
            remove column age, email from users              | ALTER TABLE users DROP COLUMN age, DROP COLUMN email
            search users where name like 'jo'                | SELECT * FROM users WHERE name LIKE '%jo%'
            select users where age between 20 and 30         | SELECT * FROM users WHERE age BETWEEN 20 AND 30
            select users where id in (1, 2, 3)               | SELECT * FROM users WHERE id IN (1,2,3)
            select distinct city from users                  | SELECT DISTINCT city FROM users
            display me all users                             | SELECT * FROM users
            get all orders                                   | SELECT * FROM orders
            """)
    void translates_english_to_dsl(String text, String dsl) {
        assertEquals(dsl, translator.toDsl(text));
    }

    @Test
    void matching_is_case_insensitive() {
        assertEquals("SELECT DISTINCT city FROM users", translator.toDsl("SELECT DISTINCT City FROM Users"));
    }

    @Test
    void unmatched_text_yields_sentinel() {
        assertEquals(LegacyDslTranslator.NO_MATCH, translator.toDsl("hello world"));
        assertEquals(LegacyDslTranslator.NO_MATCH, translator.toDsl(""));
        assertEquals(LegacyDslTranslator.NO_MATCH, translator.toDsl(null));
        assertTrue(LegacyDslTranslator.isNoMatch(translator.toDsl("hello world")));
        assertFalse(LegacyDslTranslator.isNoMatch("SELECT * FROM users"));
    }

    @Test
    void reports_first_matching_rule() {
        assertEquals("get-all", translator.matchingRule("get all orders"));
        assertEquals("show-me", translator.matchingRule("give me users"));
        assertNull(translator.matchingRule("hello world"));
    }
}
