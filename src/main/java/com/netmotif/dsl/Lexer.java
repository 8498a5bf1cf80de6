package com.netmotif.dsl;

import com.netmotif.error.LexException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Converts program text into tokens.
 *
 * <p>
 * A {@code Lexer} is an {@link Iterable}: each call to {@link #iterator()}
 * starts a fresh scan from the first character, and tokens are produced one
 * at a time as the caller asks for them. Every scan ends with exactly one
 * {@link TokenType#EOF} token.
 *
 * <p>
 * Skipped input:
 * <ul>
 * <li>Whitespace: space, tab, carriage return, newline.</li>
 * <li>Comments: {@code #} or {@code //} up to the end of the line.</li>
 * </ul>
 * Any other character that starts no token fails the scan with a
 * {@link LexException} at its line and column.
 */
public final class Lexer implements Iterable<Token> {
    private final String source;

    public Lexer(String source) {
        this.source = source;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Cursor(source);
    }

    /** Scans the whole source eagerly. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token t : this)
            tokens.add(t);
        return tokens;
    }

    /** One pass over the source. */
    private static final class Cursor implements Iterator<Token> {
        private final String input;
        private int pos;
        private int line = 1;
        private int column = 1;
        private boolean done;

        Cursor(String input) {
            this.input = input;
        }

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done)
                throw new NoSuchElementException("Token stream exhausted");
            skipBlank();
            SourcePosition start = new SourcePosition(line, column);
            if (pos >= input.length()) {
                done = true;
                return new Token(TokenType.EOF, "", 0, start);
            }
            char c = input.charAt(pos);
            if (isIdentStart(c))
                return word(start);
            if (c >= '0' && c <= '9')
                return number(start);
            return punctuation(c, start);
        }

        private Token word(SourcePosition start) {
            int s = pos;
            while (pos < input.length() && isIdentPart(input.charAt(pos)))
                advance();
            String lexeme = input.substring(s, pos);
            return new Token(TokenType.forWord(lexeme), lexeme, 0, start);
        }

        private Token number(SourcePosition start) {
            int s = pos;
            while (pos < input.length() && input.charAt(pos) >= '0' && input.charAt(pos) <= '9')
                advance();
            String lexeme = input.substring(s, pos);
            int value;
            try {
                value = Integer.parseInt(lexeme);
            } catch (NumberFormatException e) {
                throw new LexException("Integer literal " + lexeme + " is out of range", start);
            }
            return new Token(TokenType.INT, lexeme, value, start);
        }

        private Token punctuation(char c, SourcePosition start) {
            TokenType type = switch (c) {
                case '(' -> TokenType.LPAREN;
                case ')' -> TokenType.RPAREN;
                case '{' -> TokenType.LBRACE;
                case '}' -> TokenType.RBRACE;
                case ',' -> TokenType.COMMA;
                case ':' -> TokenType.COLON;
                case '.' -> TokenType.DOT;
                case '=' -> TokenType.EQUAL;
                case '<' -> peekAt(1) == '=' ? TokenType.LESS_EQUAL : TokenType.LESS;
                case '>' -> peekAt(1) == '=' ? TokenType.GREATER_EQUAL : TokenType.GREATER;
                default -> throw new LexException("Unexpected character '" + c + "'", start);
            };
            for (int i = 0; i < type.text().length(); i++)
                advance();
            return new Token(type, type.text(), 0, start);
        }

        private void skipBlank() {
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                    advance();
                } else if (c == '#' || (c == '/' && peekAt(1) == '/')) {
                    while (pos < input.length() && input.charAt(pos) != '\n')
                        advance();
                } else {
                    break;
                }
            }
        }

        private char peekAt(int ahead) {
            int p = pos + ahead;
            return p < input.length() ? input.charAt(p) : '\0';
        }

        private void advance() {
            if (input.charAt(pos++) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }

        private static boolean isIdentStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isIdentPart(char c) {
            return isIdentStart(c) || (c >= '0' && c <= '9');
        }
    }
}
