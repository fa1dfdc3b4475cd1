package domain.parse;

import domain.ast.AggregateFunction;
import domain.ast.AggregateNode;
import domain.ast.AlterTableNode;
import domain.ast.AndCondition;
import domain.ast.BetweenCondition;
import domain.ast.ConditionNode;
import domain.ast.DeleteNode;
import domain.ast.GroupByNode;
import domain.ast.InCondition;
import domain.ast.InsertNode;
import domain.ast.LikeCondition;
import domain.ast.Literal;
import domain.ast.OrCondition;
import domain.ast.OrderByNode;
import domain.ast.SelectNode;
import domain.ast.SimpleCondition;
import domain.ast.SortDirection;
import domain.ast.Statement;
import domain.ast.UpdateNode;
import domain.ast.WhereNode;
import domain.token.Token;
import domain.token.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser: token sequence to one {@link Statement}.
 *
 * <p>Statement forms, selected by the leading token:
 * <ul>
 *   <li>SELECT (show/list/get): {@code select [distinct] (all | * | cols from | table) [where] [order by] [group by]}</li>
 *   <li>COUNT / HOW MANY, SUM / TOTAL, FIND: sugared SELECT variants</li>
 *   <li>INSERT INTO t VALUES v, ...</li>
 *   <li>UPDATE t SET c = v [where]</li>
 *   <li>DELETE FROM t [where], or DELETE COLUMN a, b FROM t (column drop)</li>
 *   <li>ALTER TABLE t DROP COLUMN a[, b]</li>
 * </ul>
 *
 * <p>The first grammar violation stops the parse; there is no recovery. Tokens left after a
 * complete statement are ignored.</p>
 *
 * <p>Stateless; each {@link #parse} call uses its own cursor.</p>
 */
public class Parser {

    private static final Set<TokenKind> VALUE_KINDS =
            EnumSet.of(TokenKind.NUMBER, TokenKind.STRING, TokenKind.IDENTIFIER);

    private static final Set<TokenKind> COMPARISON_KINDS = EnumSet.of(
            TokenKind.EQUALS, TokenKind.NOT_EQUALS,
            TokenKind.GREATER, TokenKind.LESS,
            TokenKind.GREATER_EQ, TokenKind.LESS_EQ);

    public ParseResult parse(List<Token> tokens) {
        try {
            return ParseResult.success(new Cursor(tokens).statement());
        } catch (ParseException e) {
            return ParseResult.failure(e.getError());
        }
    }

    private static final class Cursor {

        private final List<Token> tokens;
        private final Token eof;
        private int pos = 0;

        Cursor(List<Token> tokens) {
            this.tokens = tokens == null ? List.of() : tokens;
            int end = this.tokens.isEmpty() ? 0 : this.tokens.get(this.tokens.size() - 1).getOffset();
            this.eof = new Token(TokenKind.EOF, "", end);
        }

        // ------------------------------------------------------------
        // token access
        // ------------------------------------------------------------

        private Token current() {
            return pos < tokens.size() ? tokens.get(pos) : eof;
        }

        private Token peek(int ahead) {
            int i = pos + ahead;
            return i < tokens.size() ? tokens.get(i) : eof;
        }

        private boolean at(TokenKind kind) {
            return current().is(kind);
        }

        private boolean atAny(TokenKind... kinds) {
            TokenKind k = current().getKind();
            for (TokenKind c : kinds) {
                if (c == k) return true;
            }
            return false;
        }

        private Token advance() {
            Token t = current();
            if (pos < tokens.size()) pos++;
            return t;
        }

        private boolean consumeIf(TokenKind kind) {
            if (!at(kind)) return false;
            advance();
            return true;
        }

        private Token expect(TokenKind kind) {
            if (!at(kind)) throw new ParseException(ParseError.expected(kind, current()));
            return advance();
        }

        private String expectIdentifier(String what) {
            if (!at(TokenKind.IDENTIFIER)) {
                throw new ParseException(new ParseError(EnumSet.of(TokenKind.IDENTIFIER), current(),
                        "Expected " + what + ", got " + ParseError.describe(current())));
            }
            return advance().getLexeme();
        }

        private String optionalIdentifier() {
            return at(TokenKind.IDENTIFIER) ? advance().getLexeme() : null;
        }

        // ------------------------------------------------------------
        // statements
        // ------------------------------------------------------------

        Statement statement() {
            return switch (current().getKind()) {
                case SELECT -> select();
                case COUNT, HOW -> count();
                case SUM, TOTAL -> sum();
                case FIND -> find();
                case INSERT -> insert();
                case UPDATE -> update();
                case DELETE -> delete();
                case ALTER -> alter();
                default -> throw new ParseException(ParseError.unexpected(current()));
            };
        }

        private SelectNode select() {
            advance(); // SELECT
            boolean distinct = consumeIf(TokenKind.DISTINCT);

            List<String> columns;
            String table;

            if (atAny(TokenKind.ALL, TokenKind.STAR)) {
                advance();
                columns = List.of("*");
                table = tableReference();
            } else {
                String first = optionalIdentifier();

                if (at(TokenKind.COMMA)) {
                    // "select name, age from users"
                    if (first == null) throw new ParseException(ParseError.expected(TokenKind.IDENTIFIER, current()));
                    columns = new ArrayList<>();
                    columns.add(first);
                    while (consumeIf(TokenKind.COMMA)) {
                        columns.add(expectIdentifier("column name"));
                    }
                    table = tableReference();
                } else if (at(TokenKind.FROM)) {
                    // "select name from users"
                    columns = first == null ? List.of("*") : List.of(first);
                    table = tableReference();
                } else if (atAny(TokenKind.WHERE, TokenKind.ORDER, TokenKind.GROUP, TokenKind.EOF)) {
                    // "select users where ..." : the word is the table
                    if (first == null) expectIdentifier("table name");
                    columns = List.of("*");
                    table = first;
                } else {
                    String second = tableReferenceOrNull();
                    if (second == null) {
                        if (first == null) expectIdentifier("table name");
                        columns = List.of("*");
                        table = first;
                    } else {
                        columns = first == null ? List.of("*") : List.of(first);
                        table = second;
                    }
                }
            }

            return selectTail(columns, table, null, distinct);
        }

        /** WHERE / ORDER BY / GROUP BY, each optional, in that order. */
        private SelectNode selectTail(List<String> columns, String table, AggregateNode aggregate, boolean distinct) {
            WhereNode where = at(TokenKind.WHERE) ? where() : null;
            OrderByNode orderBy = at(TokenKind.ORDER) ? orderBy() : null;
            GroupByNode groupBy = at(TokenKind.GROUP) ? groupBy() : null;
            return new SelectNode(columns, table, where, orderBy, groupBy, aggregate, distinct);
        }

        /** {@code [FROM] table}: the keyword may be omitted, the table may not. */
        private String tableReference() {
            if (consumeIf(TokenKind.FROM)) {
                return expectIdentifier("table name after FROM");
            }
            if (!at(TokenKind.IDENTIFIER)) {
                throw new ParseException(new ParseError(EnumSet.of(TokenKind.FROM, TokenKind.IDENTIFIER), current(),
                        "Expected FROM or table name, got " + ParseError.describe(current())));
            }
            return advance().getLexeme();
        }

        private String tableReferenceOrNull() {
            if (consumeIf(TokenKind.FROM)) {
                return expectIdentifier("table name after FROM");
            }
            return optionalIdentifier();
        }

        /** "count users", "how many products", "count email from users where ..." */
        private SelectNode count() {
            Token lead = advance(); // COUNT | HOW
            if (lead.is(TokenKind.HOW)) {
                expect(TokenKind.MANY);
            } else {
                consumeIf(TokenKind.MANY);
            }

            // "count email from users" still counts rows: the word before FROM is not the aggregate column
            String table = optionalIdentifier();
            if (consumeIf(TokenKind.FROM)) {
                table = expectIdentifier("table name after FROM");
            }
            if (table == null) expectIdentifier("table name");

            AggregateNode aggregate = new AggregateNode(AggregateFunction.COUNT, null);
            return selectTail(List.of(aggregate.render()), table, aggregate, false);
        }

        /** "sum salary from employees", "total amount of orders" */
        private SelectNode sum() {
            advance(); // SUM | TOTAL

            String column = optionalIdentifier();
            String table = column;
            if (consumeIf(TokenKind.FROM)) {
                table = expectIdentifier("table name after FROM");
            }
            if (table == null) expectIdentifier("table name");

            AggregateNode aggregate = new AggregateNode(AggregateFunction.SUM, column);
            return selectTail(List.of(aggregate.render()), table, aggregate, false);
        }

        /** "find users where name contains 'an'" */
        private SelectNode find() {
            advance(); // FIND
            String table = expectIdentifier("table name after FIND");
            return selectTail(List.of("*"), table, null, false);
        }

        private InsertNode insert() {
            advance(); // INSERT
            expect(TokenKind.INTO);
            String table = expectIdentifier("table name after INSERT INTO");
            expect(TokenKind.VALUES);
            return new InsertNode(table, valueList());
        }

        private UpdateNode update() {
            advance(); // UPDATE
            String table = expectIdentifier("table name after UPDATE");
            expect(TokenKind.SET);
            String column = expectIdentifier("column name after SET");
            expect(TokenKind.EQUALS);
            Literal value = value();
            WhereNode where = at(TokenKind.WHERE) ? where() : null;
            return new UpdateNode(table, column, value, where);
        }

        private Statement delete() {
            advance(); // DELETE | REMOVE
            if (at(TokenKind.COLUMN)) {
                return dropColumnShorthand();
            }
            expect(TokenKind.FROM);
            String table = expectIdentifier("table name after DELETE FROM");
            WhereNode where = at(TokenKind.WHERE) ? where() : null;
            return new DeleteNode(table, where);
        }

        /** "delete column age, email from users" */
        private AlterTableNode dropColumnShorthand() {
            advance(); // COLUMN
            List<String> columns = columnList();
            expect(TokenKind.FROM);
            String table = expectIdentifier("table name after FROM");
            return AlterTableNode.dropColumns(table, columns);
        }

        /** "alter table users drop column age" */
        private AlterTableNode alter() {
            advance(); // ALTER
            expect(TokenKind.TABLE);
            String table = expectIdentifier("table name after ALTER TABLE");
            expect(TokenKind.DROP);
            expect(TokenKind.COLUMN);
            return AlterTableNode.dropColumns(table, columnList());
        }

        private List<String> columnList() {
            List<String> columns = new ArrayList<>();
            columns.add(expectIdentifier("column name"));
            while (consumeIf(TokenKind.COMMA)) {
                columns.add(expectIdentifier("column name"));
            }
            return columns;
        }

        // ------------------------------------------------------------
        // clauses
        // ------------------------------------------------------------

        private WhereNode where() {
            advance(); // WHERE
            return new WhereNode(condition());
        }

        /** AND/OR fold strictly left to right: a AND b OR c == (a AND b) OR c. */
        private ConditionNode condition() {
            ConditionNode left = simpleCondition();
            while (atAny(TokenKind.AND, TokenKind.OR)) {
                Token op = advance();
                ConditionNode right = simpleCondition();
                left = op.is(TokenKind.AND) ? new AndCondition(left, right) : new OrCondition(left, right);
            }
            return left;
        }

        private ConditionNode simpleCondition() {
            String column = expectIdentifier("column name in condition");

            if (consumeIf(TokenKind.BETWEEN)) {
                Literal low = value();
                expect(TokenKind.AND);
                Literal high = value();
                return new BetweenCondition(column, low, high);
            }

            if (consumeIf(TokenKind.IN)) {
                return new InCondition(column, valueList());
            }

            if (atAny(TokenKind.LIKE, TokenKind.CONTAINS)) {
                advance();
                return new LikeCondition(column, value().text());
            }

            if (!current().getKind().isComparison()) {
                throw new ParseException(new ParseError(COMPARISON_KINDS, current(),
                        "Expected operator, got " + ParseError.describe(current())));
            }
            String operator = advance().getLexeme();
            return new SimpleCondition(column, operator, value());
        }

        private OrderByNode orderBy() {
            advance(); // ORDER
            expect(TokenKind.BY);
            String column = optionalIdentifier();

            SortDirection direction = SortDirection.ASC;
            if (consumeIf(TokenKind.DESC)) {
                direction = SortDirection.DESC;
            } else {
                consumeIf(TokenKind.ASC);
            }
            return new OrderByNode(column == null ? OrderByNode.DEFAULT_COLUMN : column, direction);
        }

        private GroupByNode groupBy() {
            advance(); // GROUP
            expect(TokenKind.BY);
            return new GroupByNode(expectIdentifier("column name after GROUP BY"));
        }

        // ------------------------------------------------------------
        // values
        // ------------------------------------------------------------

        private Literal value() {
            Token t = current();
            switch (t.getKind()) {
                case NUMBER:
                    advance();
                    return Literal.number(t.getLexeme());
                case STRING:
                    advance();
                    return Literal.string(t.getLexeme());
                case IDENTIFIER:
                    advance();
                    return Literal.identifier(t.getLexeme());
                default:
                    throw new ParseException(new ParseError(VALUE_KINDS, t,
                            "Expected value, got " + ParseError.describe(t)));
            }
        }

        /** {@code v1, v2, ...} with optional surrounding parentheses; a missing ')' is tolerated. */
        private List<Literal> valueList() {
            boolean paren = consumeIf(TokenKind.LPAREN);
            List<Literal> values = new ArrayList<>();
            values.add(value());
            while (consumeIf(TokenKind.COMMA)) {
                values.add(value());
            }
            if (paren) consumeIf(TokenKind.RPAREN);
            return values;
        }
    }
}
