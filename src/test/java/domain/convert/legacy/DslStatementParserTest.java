package domain.convert.legacy;

import domain.ast.AggregateFunction;
import domain.ast.Literal;
import domain.ast.SelectNode;
import domain.ast.SimpleCondition;
import domain.ast.Statement;
import domain.ast.WhereNode;
import domain.convert.SqlGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DslStatementParserTest {

    private final DslStatementParser parser = new DslStatementParser();
    private final SqlGenerator generator = new SqlGenerator();

    @Test
    void simple_where_builds_select_node() {
        Optional<Statement> s = parser.parse("SELECT * FROM users WHERE age > 20");

        assertEquals(Optional.of(SelectNode.all("users",
                new WhereNode(new SimpleCondition("age", ">", Literal.of(20))))), s);
    }

    @Test
    void aggregate_keeps_function_and_column() {
        SelectNode s = (SelectNode) parser.parse("SELECT COUNT(*) FROM orders").orElseThrow();
        assertEquals(AggregateFunction.COUNT, s.getAggregate().getFunction());
        assertNull(s.getAggregate().getColumn());

        SelectNode sum = (SelectNode) parser.parse("SELECT SUM(salary) FROM employees WHERE dept = 3").orElseThrow();
        assertEquals("salary", sum.getAggregate().getColumn());
        assertNotNull(sum.getWhere());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', textBlock = """
            SELECT * FROM users WHERE age > 20 AND salary < 5000     | SELECT * FROM users WHERE age > 20 AND salary < 5000;
            SELECT * FROM users WHERE age > 20 OR salary < 5000      | SELECT * FROM users WHERE (age > 20 OR salary < 5000);
            SELECT * FROM users WHERE name LIKE '%jo%'               | SELECT * FROM users WHERE name LIKE '%jo%';
            SELECT * FROM users WHERE id IN (1,2,3)                  | SELECT * FROM users WHERE id IN (1, 2, 3);
            SELECT * FROM users WHERE age BETWEEN 20 AND 30          | SELECT * FROM users WHERE age BETWEEN 20 AND 30;
            SELECT * FROM users ORDER BY age DESC                    | SELECT * FROM users ORDER BY age DESC;
            SELECT name, city FROM users GROUP BY city               | SELECT name, city FROM users GROUP BY city;
            SELECT DISTINCT city FROM users                          | SELECT DISTINCT city FROM users;
            SELECT COUNT(id) FROM orders WHERE status = 1            | SELECT COUNT(id) FROM orders WHERE status = 1;
            INSERT INTO users VALUES (1, 'John', 25)                 | INSERT INTO users VALUES (1, 'John', 25);
            UPDATE users SET name = 'Bob' WHERE id = 5               | UPDATE users SET name = 'Bob' WHERE id = 5;
            DELETE FROM users WHERE id = 3                           | DELETE FROM users WHERE id = 3;
            ALTER TABLE users DROP COLUMN age, DROP COLUMN email     | ALTER TABLE users DROP COLUMN age, email;
            """)
    void parsed_dsl_renders_as_sql(String dsl, String sql) {
        assertEquals(sql, generator.generate(parser.parse(dsl).orElseThrow()));
    }

    @Test
    void unknown_shapes_are_empty() {
        assertTrue(parser.parse(LegacyDslTranslator.NO_MATCH).isEmpty());
        assertTrue(parser.parse("garbage").isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    void literal_classification() {
        assertEquals(Literal.string("Bob"), DslStatementParser.literal("'Bob'"));
        assertEquals(Literal.of(5), DslStatementParser.literal(" 5 "));
        assertEquals(Literal.number("2.5"), DslStatementParser.literal("2.5"));
        assertEquals(Literal.identifier("active"), DslStatementParser.literal("active"));
    }
}
