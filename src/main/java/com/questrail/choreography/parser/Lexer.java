package com.questrail.choreography.parser;

import com.questrail.choreography.model.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hand-written lexer for the protocol language.
 *
 * <p>
 * Skips whitespace, {@code //} line comments and {@code /* *}{@code /} block
 * comments, recognizes keywords, identifiers, string literals and
 * punctuation, and produces
 * the token list consumed by {@link ProtocolParser}. The list always ends with
 * an {@link TokenType#EOF} token.
 * </p>
 */
public final class Lexer
{
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("protocol", TokenType.PROTOCOL),
            Map.entry("global", TokenType.GLOBAL),
            Map.entry("role", TokenType.ROLE),
            Map.entry("choice", TokenType.CHOICE),
            Map.entry("at", TokenType.AT),
            Map.entry("or", TokenType.OR),
            Map.entry("par", TokenType.PAR),
            Map.entry("and", TokenType.AND),
            Map.entry("rec", TokenType.REC),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("from", TokenType.FROM),
            Map.entry("to", TokenType.TO),
            Map.entry("type", TokenType.TYPE),
            Map.entry("as", TokenType.AS),
            Map.entry("import", TokenType.IMPORT)
    );

    private final String input;
    private final int length;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String input) {
        this.input = Objects.requireNonNull(input, "input");
        this.length = input.length();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            SourcePosition start = here();

            if (c == '/' && peekNext() == '/') {
                skipLineComment();
                continue;
            }
            if (c == '/' && peekNext() == '*') {
                skipBlockComment(start);
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                String word = readIdentifier();
                tokens.add(new Token(KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER), word, start));
                continue;
            }

            if (c == '"') {
                tokens.add(new Token(TokenType.STRING, readString(start), start));
                continue;
            }

            switch (c) {
                case '(' -> tokens.add(single(TokenType.LPAREN, start));
                case ')' -> tokens.add(single(TokenType.RPAREN, start));
                case '{' -> tokens.add(single(TokenType.LBRACE, start));
                case '}' -> tokens.add(single(TokenType.RBRACE, start));
                case '<' -> tokens.add(single(TokenType.LANGLE, start));
                case '>' -> tokens.add(single(TokenType.RANGLE, start));
                case ',' -> tokens.add(single(TokenType.COMMA, start));
                case ':' -> tokens.add(single(TokenType.COLON, start));
                case ';' -> tokens.add(single(TokenType.SEMICOLON, start));
                case '-' -> {
                    advance();
                    if (isAtEnd() || peek() != '>') {
                        throw new ParseException("Expected '>' after '-'", start);
                    }
                    advance();
                    tokens.add(new Token(TokenType.ARROW, "->", start));
                }
                default -> throw new ParseException("Unexpected character '" + c + "'", start);
            }
        }

        tokens.add(new Token(TokenType.EOF, "", here()));
        return tokens;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Token single(TokenType type, SourcePosition start) {
        char c = advance();
        return new Token(type, String.valueOf(c), start);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < length ? input.charAt(pos + 1) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourcePosition here() {
        return SourcePosition.of(line, column, pos);
    }

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void skipBlockComment(SourcePosition start) {
        advance(); // '/'
        advance(); // '*'
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw new ParseException("Unterminated block comment", start);
    }

    private String readString(SourcePosition start) {
        advance(); // opening quote
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') {
            char c = advance();
            if (c == '"') {
                return value.toString();
            }
            if (c == '\\') {
                if (isAtEnd()) {
                    break;
                }
                c = advance();
            }
            value.append(c);
        }
        throw new ParseException("Unterminated string literal", start);
    }

    private String readIdentifier() {
        int begin = pos;
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            advance();
        }
        return input.substring(begin, pos);
    }
}
