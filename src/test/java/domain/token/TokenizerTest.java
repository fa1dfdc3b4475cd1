package domain.token;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    private List<TokenKind> kinds(String text) {
        return tokenizer.tokenize(text).stream().map(Token::getKind).collect(Collectors.toList());
    }

    @Test
    void tokenizes_simple_select() {
        List<Token> tokens = tokenizer.tokenize("select all from users");

        assertEquals(List.of(TokenKind.SELECT, TokenKind.ALL, TokenKind.FROM, TokenKind.IDENTIFIER, TokenKind.EOF),
                tokens.stream().map(Token::getKind).collect(Collectors.toList()));
        assertEquals("users", tokens.get(3).getLexeme());
        assertEquals(7, tokens.get(1).getOffset());
    }

    @Test
    void always_ends_with_single_eof() {
        List<Token> empty = tokenizer.tokenize("");
        assertEquals(1, empty.size());
        assertTrue(empty.get(0).is(TokenKind.EOF));

        List<Token> tokens = tokenizer.tokenize("count users");
        assertEquals(1, tokens.stream().filter(t -> t.is(TokenKind.EOF)).count());
        assertTrue(tokens.get(tokens.size() - 1).is(TokenKind.EOF));
    }

    @Test
    void two_char_operators_take_priority() {
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.GREATER_EQ, TokenKind.NUMBER, TokenKind.EOF), kinds("a >= 1"));
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.LESS_EQ, TokenKind.NUMBER, TokenKind.EOF), kinds("a<=1"));
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.NOT_EQUALS, TokenKind.NUMBER, TokenKind.EOF), kinds("a != 1"));
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.GREATER, TokenKind.EQUALS, TokenKind.NUMBER, TokenKind.EOF),
                kinds("a > = 1"));
    }

    @Test
    void numbers_keep_at_most_one_fraction() {
        List<Token> tokens = tokenizer.tokenize("10.5 7 3.");
        assertEquals("10.5", tokens.get(0).getLexeme());
        assertEquals("7", tokens.get(1).getLexeme());
        assertEquals("3", tokens.get(2).getLexeme());
        assertTrue(tokens.get(3).is(TokenKind.EOF));
    }

    @Test
    void keywords_are_case_insensitive_and_synonym_aware() {
        assertEquals(kinds("select all from users"), kinds("SHOW ALL OF users"));
        assertEquals(kinds("select all from users"), kinds("List all from users"));
        assertEquals(TokenKind.DELETE, tokenizer.tokenize("Remove").get(0).getKind());
        assertEquals(TokenKind.DISTINCT, tokenizer.tokenize("unique").get(0).getKind());
        assertEquals(TokenKind.DESC, tokenizer.tokenize("descending").get(0).getKind());
        assertEquals(TokenKind.COLUMN, tokenizer.tokenize("columns").get(0).getKind());
    }

    @Test
    void strings_keep_case_and_drop_quotes() {
        List<Token> tokens = tokenizer.tokenize("name = 'John Smith'");
        Token s = tokens.get(2);
        assertEquals(TokenKind.STRING, s.getKind());
        assertEquals("John Smith", s.getLexeme());

        Token dq = tokenizer.tokenize("\"Ann\"").get(0);
        assertEquals(TokenKind.STRING, dq.getKind());
        assertEquals("Ann", dq.getLexeme());
    }

    @Test
    void unterminated_string_runs_to_end() {
        List<Token> tokens = tokenizer.tokenize("name = 'abc def");
        assertEquals(TokenKind.STRING, tokens.get(2).getKind());
        assertEquals("abc def", tokens.get(2).getLexeme());
        assertTrue(tokens.get(3).is(TokenKind.EOF));
    }

    @Test
    void unknown_characters_are_dropped() {
        assertEquals(List.of(TokenKind.COUNT, TokenKind.IDENTIFIER, TokenKind.EOF), kinds("count users; @#"));
    }

    @Test
    void operator_phrases_become_operators() {
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.GREATER_EQ, TokenKind.NUMBER, TokenKind.EOF),
                kinds("age greater than or equal to 18"));
    }

    @Test
    void tokenizing_normalized_text_gives_same_tokens() {
        String raw = "Show ALL products WHERE price Greater Than 100";
        assertEquals(tokenizer.tokenize(raw), tokenizer.tokenize(TextNormalizer.normalize(raw)));
    }

    @Test
    void result_is_unmodifiable() {
        List<Token> tokens = tokenizer.tokenize("count users");
        assertThrows(UnsupportedOperationException.class, () -> tokens.add(new Token(TokenKind.EOF, "", 0)));
    }

    @Test
    void non_ascii_digits_read_as_ascii_numbers() {
        List<Token> tokens = tokenizer.tokenize("price > \u0661.\u0665");

        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.GREATER, TokenKind.NUMBER, TokenKind.EOF),
                tokens.stream().map(Token::getKind).collect(Collectors.toList()));
        assertEquals("1.5", tokens.get(2).getLexeme());
        assertEquals(8, tokens.get(2).getOffset());
    }
}
