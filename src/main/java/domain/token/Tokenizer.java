package domain.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lexical analysis: normalized text to a typed token sequence.
 *
 * <p>Never fails. Characters that start no token are dropped, and an unterminated quoted string
 * runs to the end of the input. The returned list always ends with exactly one
 * {@link TokenKind#EOF} token.</p>
 *
 * <p>Stateless; one instance may be shared across threads.</p>
 */
public final class Tokenizer {

    public List<Token> tokenize(String text) {
        String normalized = TextNormalizer.normalize(text);
        return Collections.unmodifiableList(new Scan(normalized).run());
    }

    /** Per-call cursor. */
    private static final class Scan {

        private final String input;
        private final List<Token> tokens = new ArrayList<>();
        private int pos = 0;

        Scan(String input) {
            this.input = input;
        }

        List<Token> run() {
            while (pos < input.length()) {
                char current = input.charAt(pos);

                if (Character.isWhitespace(current)) {
                    pos++;
                    continue;
                }

                if (Character.isDigit(current)) {
                    tokens.add(readNumber());
                } else if (current == '\'' || current == '"') {
                    tokens.add(readString(current));
                } else if (Character.isLetter(current) || current == '_') {
                    tokens.add(readWord());
                } else {
                    Token op = readOperator();
                    if (op != null) tokens.add(op);
                }
            }

            tokens.add(new Token(TokenKind.EOF, "", input.length()));
            return tokens;
        }

        /** Any Unicode decimal digit is accepted; the lexeme holds the ASCII equivalents ("١.٥" reads as "1.5"). */
        private Token readNumber() {
            int start = pos;
            StringBuilder digits = new StringBuilder();
            readDigits(digits);
            // one fractional part at most; "5." leaves the dot behind
            if (pos + 1 < input.length()
                    && input.charAt(pos) == '.'
                    && Character.isDigit(input.charAt(pos + 1))) {
                digits.append('.');
                pos++;
                readDigits(digits);
            }
            return new Token(TokenKind.NUMBER, digits.toString(), start);
        }

        private void readDigits(StringBuilder out) {
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                out.append((char) ('0' + Character.digit(input.charAt(pos), 10)));
                pos++;
            }
        }

        private Token readString(char quote) {
            int start = pos;
            pos++; // opening quote
            int close = input.indexOf(quote, pos);
            String body;
            if (close < 0) {
                body = input.substring(pos);
                pos = input.length();
            } else {
                body = input.substring(pos, close);
                pos = close + 1;
            }
            return new Token(TokenKind.STRING, body, start);
        }

        private Token readWord() {
            int start = pos;
            while (pos < input.length()
                    && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                pos++;
            }
            String word = input.substring(start, pos);
            return new Token(KeywordTable.lookup(word), word, start);
        }

        /** Two-character operators are tried before single characters. Returns null for unknown characters. */
        private Token readOperator() {
            int start = pos;
            char c = input.charAt(pos);
            char next = pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';

            if (next == '=') {
                TokenKind two = switch (c) {
                    case '>' -> TokenKind.GREATER_EQ;
                    case '<' -> TokenKind.LESS_EQ;
                    case '!' -> TokenKind.NOT_EQUALS;
                    default -> null;
                };
                if (two != null) {
                    pos += 2;
                    return new Token(two, input.substring(start, pos), start);
                }
            }

            TokenKind one = switch (c) {
                case '=' -> TokenKind.EQUALS;
                case '>' -> TokenKind.GREATER;
                case '<' -> TokenKind.LESS;
                case ',' -> TokenKind.COMMA;
                case '(' -> TokenKind.LPAREN;
                case ')' -> TokenKind.RPAREN;
                case '*' -> TokenKind.STAR;
                default -> null;
            };
            pos++;
            return one == null ? null : new Token(one, String.valueOf(c), start);
        }
    }
}
