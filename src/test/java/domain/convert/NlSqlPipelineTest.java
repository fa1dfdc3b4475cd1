package domain.convert;

import domain.ast.SelectNode;
import domain.parse.ParseException;
import domain.token.TokenKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NlSqlPipelineTest {

    private final NlSqlPipeline pipeline = new NlSqlPipeline();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', textBlock = """
            select all from users                          | SELECT * FROM users;
            show all products where price > 100            | SELECT * FROM products WHERE price > 100;
            count users                                    | SELECT COUNT(*) FROM users;
            count email from users                         | SELECT COUNT(*) FROM users;
            insert into users values 1, 'John', 25         | INSERT INTO users VALUES (1, 'John', 25);
            select users where age > 20 and salary < 5000  | SELECT * FROM users WHERE age > 20 AND salary < 5000;
            find users where name contains 'an'            | SELECT * FROM users WHERE name LIKE '%an%';
            show all employees where salary greater than 50000 | SELECT * FROM employees WHERE salary > 50000;
            """)
    void translates_supported_queries(String query, String expectedSql) {
        assertEquals(expectedSql, pipeline.toSql(query));
    }

    @Test
    void process_keeps_every_stage() {
        PipelineResult r = pipeline.process("count users");

        assertEquals("count users", r.getInput());
        assertEquals(3, r.getTokens().size());
        assertEquals(TokenKind.COUNT, r.getTokens().get(0).getKind());
        assertEquals(TokenKind.EOF, r.getTokens().get(2).getKind());
        assertTrue(r.getStatement() instanceof SelectNode);
        assertEquals("SELECT COUNT(*) FROM users;", r.getSql());
    }

    @Test
    void process_throws_on_unsupported_text() {
        ParseException e = assertThrows(ParseException.class, () -> pipeline.process("hello world"));
        assertEquals(TokenKind.IDENTIFIER, e.getError().getActual());
        assertEquals("hello", e.getError().getLexeme());
    }

    @Test
    void try_process_reports_failure_as_value() {
        PipelineOutcome bad = pipeline.tryProcess("hello world");
        assertFalse(bad.isSuccess());
        assertNull(bad.getResult());
        assertNotNull(bad.getError());
        assertEquals(3, bad.getTokens().size());

        PipelineOutcome ok = pipeline.tryProcess("select all from users");
        assertTrue(ok.isSuccess());
        assertNull(ok.getError());
        assertEquals("SELECT * FROM users;", ok.getResult().getSql());
    }

    @Test
    void stages_can_run_separately() {
        var tokens = pipeline.tokenize("select all from users");
        var parsed = pipeline.parse(tokens);
        assertTrue(parsed.isSuccess());
        assertEquals("SELECT * FROM users;", pipeline.generate(parsed.getStatement()));
        assertEquals(parsed.getStatement(), pipeline.parse("select all from users").getStatement());
    }

    @Test
    void result_cache_is_owned_by_caller() {
        PipelineResultCache cache = new PipelineResultCache();
        assertNull(cache.last());

        PipelineResult first = cache.remember(pipeline.process("count users"));
        assertSame(first, cache.last());

        PipelineResult second = cache.remember(pipeline.process("select all from users"));
        assertSame(second, cache.last());

        cache.clear();
        assertNull(cache.last());
    }
}
