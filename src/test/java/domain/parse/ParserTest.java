package domain.parse;

import domain.ast.AggregateFunction;
import domain.ast.AlterTableNode;
import domain.ast.AndCondition;
import domain.ast.BetweenCondition;
import domain.ast.DeleteNode;
import domain.ast.InCondition;
import domain.ast.InsertNode;
import domain.ast.LikeCondition;
import domain.ast.Literal;
import domain.ast.OrCondition;
import domain.ast.SelectNode;
import domain.ast.SimpleCondition;
import domain.ast.SortDirection;
import domain.ast.Statement;
import domain.ast.UpdateNode;
import domain.token.TokenKind;
import domain.token.Tokenizer;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final Parser parser = new Parser();

    private ParseResult parse(String text) {
        return parser.parse(tokenizer.tokenize(text));
    }

    private Statement ok(String text) {
        ParseResult r = parse(text);
        assertTrue(r.isSuccess(), () -> text + " => " + r);
        return r.getStatement();
    }

    private ParseError fail(String text) {
        ParseResult r = parse(text);
        assertFalse(r.isSuccess(), () -> text + " => " + r);
        return r.getError();
    }

    // ------------------------------------------------------------
    // SELECT shapes
    // ------------------------------------------------------------

    @Test
    void select_all_from_table() {
        SelectNode s = (SelectNode) ok("select all from users");
        assertEquals(List.of("*"), s.getColumns());
        assertEquals("users", s.getTable());
        assertNull(s.getWhere());
        assertFalse(s.isDistinct());
    }

    @Test
    void select_all_without_from_keyword() {
        SelectNode s = (SelectNode) ok("show all products where price > 100");
        assertEquals("products", s.getTable());
        assertEquals(new SimpleCondition("price", ">", Literal.of(100)), s.getWhere().getCondition());
    }

    @Test
    void select_star() {
        SelectNode s = (SelectNode) ok("select * from orders");
        assertEquals(List.of("*"), s.getColumns());
        assertEquals("orders", s.getTable());
    }

    @Test
    void select_column_list() {
        SelectNode s = (SelectNode) ok("select name, age from users");
        assertEquals(List.of("name", "age"), s.getColumns());
        assertEquals("users", s.getTable());
    }

    @Test
    void select_single_column() {
        SelectNode s = (SelectNode) ok("get email of customers");
        assertEquals(List.of("email"), s.getColumns());
        assertEquals("customers", s.getTable());
    }

    @Test
    void bare_word_after_select_is_the_table() {
        SelectNode s = (SelectNode) ok("select users where age > 20");
        assertEquals(List.of("*"), s.getColumns());
        assertEquals("users", s.getTable());

        SelectNode plain = (SelectNode) ok("list employees");
        assertEquals("employees", plain.getTable());
    }

    @Test
    void select_distinct() {
        SelectNode s = (SelectNode) ok("select distinct city from users");
        assertTrue(s.isDistinct());
        assertEquals(List.of("city"), s.getColumns());
    }

    @Test
    void order_by_then_group_by() {
        SelectNode s = (SelectNode) ok("select all from users order by age desc group by city");
        assertEquals("age", s.getOrderBy().getColumn());
        assertEquals(SortDirection.DESC, s.getOrderBy().getDirection());
        assertEquals("city", s.getGroupBy().getColumn());
    }

    @Test
    void order_by_defaults_to_id_ascending() {
        SelectNode s = (SelectNode) ok("select all from users order by");
        assertEquals("id", s.getOrderBy().getColumn());
        assertEquals(SortDirection.ASC, s.getOrderBy().getDirection());
    }

    @Test
    void group_by_requires_column() {
        ParseError e = fail("select all from users group by");
        assertTrue(e.getExpected().contains(TokenKind.IDENTIFIER), e.toString());
    }

    // ------------------------------------------------------------
    // sugared forms
    // ------------------------------------------------------------

    @Test
    void count_table() {
        SelectNode s = (SelectNode) ok("count users");
        assertEquals("users", s.getTable());
        assertEquals(AggregateFunction.COUNT, s.getAggregate().getFunction());
        assertNull(s.getAggregate().getColumn());
        assertEquals(List.of("COUNT(*)"), s.getColumns());
    }

    @Test
    void how_many_table() {
        SelectNode s = (SelectNode) ok("how many products where price < 10");
        assertEquals("products", s.getTable());
        assertEquals(AggregateFunction.COUNT, s.getAggregate().getFunction());
        assertNotNull(s.getWhere());
    }

    @Test
    void count_word_from_table_counts_rows() {
        SelectNode s = (SelectNode) ok("count email from users");
        assertEquals("users", s.getTable());
        assertNull(s.getAggregate().getColumn());
        assertEquals(List.of("COUNT(*)"), s.getColumns());
    }

    @Test
    void sum_column_from_table() {
        SelectNode s = (SelectNode) ok("total salary of employees");
        assertEquals("employees", s.getTable());
        assertEquals(AggregateFunction.SUM, s.getAggregate().getFunction());
        assertEquals("salary", s.getAggregate().getColumn());
        assertEquals(List.of("SUM(salary)"), s.getColumns());
    }

    @Test
    void find_with_contains() {
        SelectNode s = (SelectNode) ok("find users where name contains 'an'");
        assertEquals("users", s.getTable());
        assertEquals(new LikeCondition("name", "an"), s.getWhere().getCondition());
    }

    // ------------------------------------------------------------
    // conditions
    // ------------------------------------------------------------

    @Test
    void and_or_fold_left_to_right() {
        SelectNode s = (SelectNode) ok("select users where a = 1 and b = 2 or c = 3");
        OrCondition or = assertInstanceOf(OrCondition.class, s.getWhere().getCondition());
        AndCondition and = assertInstanceOf(AndCondition.class, or.getLeft());
        assertEquals(new SimpleCondition("a", "=", Literal.of(1)), and.getLeft());
        assertEquals(new SimpleCondition("b", "=", Literal.of(2)), and.getRight());
        assertEquals(new SimpleCondition("c", "=", Literal.of(3)), or.getRight());
    }

    @Test
    void between_consumes_its_own_and() {
        SelectNode s = (SelectNode) ok("select users where age between 20 and 30 and active = 1");
        AndCondition and = assertInstanceOf(AndCondition.class, s.getWhere().getCondition());
        assertEquals(new BetweenCondition("age", Literal.of(20), Literal.of(30)), and.getLeft());
    }

    @Test
    void in_list_with_parentheses() {
        SelectNode s = (SelectNode) ok("select users where city in ('Paris', 'Rome')");
        assertEquals(new InCondition("city", List.of(Literal.string("Paris"), Literal.string("Rome"))),
                s.getWhere().getCondition());
    }

    @Test
    void integer_and_decimal_literals_are_distinguished() {
        SelectNode s = (SelectNode) ok("select products where price = 10.5 or qty = 3");
        OrCondition or = (OrCondition) s.getWhere().getCondition();
        Literal price = ((SimpleCondition) or.getLeft()).getValue();
        Literal qty = ((SimpleCondition) or.getRight()).getValue();
        assertEquals(Literal.Kind.DECIMAL, price.getKind());
        assertEquals(10.5, price.getValue());
        assertEquals(Literal.Kind.INTEGER, qty.getKind());
        assertEquals(3L, qty.getValue());
    }

    @Test
    void huge_integer_is_kept_exactly() {
        SelectNode s = (SelectNode) ok("select t where id = 123456789012345678901234567890");
        Literal v = ((SimpleCondition) s.getWhere().getCondition()).getValue();
        assertEquals(new BigInteger("123456789012345678901234567890"), v.getValue());
    }

    @Test
    void missing_operator_is_reported() {
        ParseError e = fail("select users where age 20");
        assertTrue(e.getExpected().contains(TokenKind.GREATER), e.toString());
        assertEquals(TokenKind.NUMBER, e.getActual());
    }

    @Test
    void missing_value_is_reported() {
        ParseError e = fail("select users where age >");
        assertTrue(e.getExpected().contains(TokenKind.NUMBER));
        assertEquals(TokenKind.EOF, e.getActual());
    }

    // ------------------------------------------------------------
    // DML / DDL
    // ------------------------------------------------------------

    @Test
    void insert_values() {
        InsertNode s = (InsertNode) ok("insert into users values 1, 'John', 25");
        assertEquals("users", s.getTable());
        assertEquals(List.of(Literal.of(1), Literal.string("John"), Literal.of(25)), s.getValues());
    }

    @Test
    void insert_requires_into() {
        ParseError e = fail("insert users values 1");
        assertEquals(Set.of(TokenKind.INTO), e.getExpected());
    }

    @Test
    void update_with_where() {
        UpdateNode s = (UpdateNode) ok("update users set age = 30 where name = 'Bob'");
        assertEquals("users", s.getTable());
        assertEquals("age", s.getSetColumn());
        assertEquals(Literal.of(30), s.getSetValue());
        assertEquals(new SimpleCondition("name", "=", Literal.string("Bob")), s.getWhere().getCondition());
    }

    @Test
    void delete_requires_from() {
        DeleteNode s = (DeleteNode) ok("delete from users where id = 5");
        assertEquals("users", s.getTable());

        ParseError e = fail("delete users where id = 5");
        assertEquals(Set.of(TokenKind.FROM), e.getExpected());
    }

    @Test
    void delete_column_is_a_column_drop() {
        AlterTableNode s = (AlterTableNode) ok("remove columns age, email from users");
        assertEquals("users", s.getTable());
        assertEquals(List.of("age", "email"), s.getColumns());
    }

    @Test
    void alter_table_drop_column() {
        AlterTableNode s = (AlterTableNode) ok("alter table users drop column age");
        assertEquals("users", s.getTable());
        assertEquals(List.of("age"), s.getColumns());
    }

    // ------------------------------------------------------------
    // failures
    // ------------------------------------------------------------

    @Test
    void unknown_statement_start_fails() {
        ParseError e = fail("hello world");
        assertTrue(e.getExpected().isEmpty());
        assertEquals(TokenKind.IDENTIFIER, e.getActual());
        assertEquals("hello", e.getLexeme());
        assertEquals(0, e.getOffset());
    }

    @Test
    void empty_input_fails_at_eof() {
        assertEquals(TokenKind.EOF, fail("").getActual());
        assertFalse(parser.parse(List.of()).isSuccess());
        assertFalse(parser.parse(null).isSuccess());
    }

    @Test
    void select_without_table_fails() {
        ParseError e = fail("select all");
        assertTrue(e.getExpected().contains(TokenKind.IDENTIFIER));
    }

    @Test
    void trailing_tokens_are_ignored() {
        SelectNode s = (SelectNode) ok("select all from users please now");
        assertEquals("users", s.getTable());
    }

    @Test
    void or_else_throw_raises_parse_exception() {
        ParseException ex = assertThrows(ParseException.class, () -> parse("drop everything").orElseThrow());
        assertNotNull(ex.getError());
        assertTrue(ex.getMessage().contains("Unexpected token"), ex.getMessage());
    }

    @Test
    void non_ascii_digits_parse_as_numbers() {
        SelectNode s = (SelectNode) ok("select users where price > \u0661.\u0665 and qty = \u0664\u0662");
        AndCondition and = (AndCondition) s.getWhere().getCondition();
        assertEquals(Literal.number("1.5"), ((SimpleCondition) and.getLeft()).getValue());
        assertEquals(Literal.of(42), ((SimpleCondition) and.getRight()).getValue());
    }
}
